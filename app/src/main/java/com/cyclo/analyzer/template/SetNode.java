package com.cyclo.analyzer.template;

/**
 * Inline assignment: {@code {% set target = value %}}.
 */
public record SetNode(String target, String value, int line) implements TemplateNode {

    @Override
    public String describe() {
        return "Assign(target=" + Snippets.quote(target) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitSet(this);
    }
}
