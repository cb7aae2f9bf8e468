package com.cyclo.analyzer.template;

public record TemplateData(String text, int line) implements TemplateNode {

    @Override
    public String describe() {
        return "TemplateData(data=" + Snippets.quote(text) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitData(this);
    }
}
