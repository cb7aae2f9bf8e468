package com.cyclo.analyzer.template;

import java.util.List;

/**
 * Top of the tree: the whole template body.
 */
public record TemplateRoot(String name, List<TemplateNode> body) implements TemplateNode {

    public TemplateRoot {
        body = List.copyOf(body);
    }

    @Override
    public int line() {
        return 1;
    }

    @Override
    public String describe() {
        return "Template(name=" + Snippets.quote(name) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitRoot(this);
    }
}
