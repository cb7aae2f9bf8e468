package com.cyclo.analyzer.template;

import java.util.List;

/**
 * A recognised tag whose control flow is not modelled: template inheritance,
 * includes, imports, macros, call blocks and loop controls.
 * Block-style tags keep their body so the rest of the template still parses.
 */
public record UnmodeledTag(String tag, String arguments, List<TemplateNode> body, int line)
        implements TemplateNode {

    public UnmodeledTag {
        body = List.copyOf(body);
    }

    @Override
    public String describe() {
        return "Unmodeled(" + tag + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitUnmodeled(this);
    }
}
