package com.cyclo.analyzer.template;

import java.util.List;

/**
 * A tag that wraps a body without branching: {@code with}, {@code filter} and
 * {@code autoescape}.
 */
public record ScopedBlockNode(String tag, String arguments, List<TemplateNode> body, int line)
        implements TemplateNode {

    public ScopedBlockNode {
        body = List.copyOf(body);
    }

    @Override
    public String describe() {
        if (arguments.isEmpty())
            return "Scoped(" + tag + ")";
        return "Scoped(" + tag + " " + Snippets.quote(arguments) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitScopedBlock(this);
    }
}
