package com.cyclo.analyzer.template;

import java.util.List;

/**
 * Block assignment: {@code {% set target %}...{% endset %}}.
 */
public record SetBlockNode(String target, List<TemplateNode> body, int line) implements TemplateNode {

    public SetBlockNode {
        body = List.copyOf(body);
    }

    @Override
    public String describe() {
        return "AssignBlock(target=" + Snippets.quote(target) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSetBlock(this);
    }
}
