package com.cyclo.analyzer.template;

import java.util.List;

/**
 * A run of consecutive literal text and {@code {{ ... }}} expressions.
 */
public record Output(List<TemplateNode> items, int line) implements TemplateNode {

    public Output {
        items = List.copyOf(items);
    }

    @Override
    public String describe() {
        return "Output(items=" + items.size() + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitOutput(this);
    }
}
