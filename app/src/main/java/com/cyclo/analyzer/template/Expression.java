package com.cyclo.analyzer.template;

/**
 * The source of a {@code {{ ... }}} expression. Expressions are not parsed further.
 */
public record Expression(String source, int line) implements TemplateNode {

    @Override
    public String describe() {
        return "Expression(" + Snippets.quote(source) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitExpression(this);
    }
}
