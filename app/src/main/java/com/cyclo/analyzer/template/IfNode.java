package com.cyclo.analyzer.template;

import java.util.List;
import java.util.Optional;

/**
 * {@code {% if %}} with its {@code elif} branches and optional {@code else} body.
 * Each elif is itself an IfNode without elifs or else of its own.
 */
public record IfNode(
        String test,
        List<TemplateNode> body,
        List<IfNode> elifs,
        List<TemplateNode> elseBody,
        int line) implements TemplateNode {

    public IfNode {
        body = List.copyOf(body);
        elifs = List.copyOf(elifs);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public static IfNode branch(String test, List<TemplateNode> body, int line) {
        return new IfNode(test, body, List.of(), null, line);
    }

    public Optional<List<TemplateNode>> elseBranch() {
        return Optional.ofNullable(elseBody);
    }

    @Override
    public String describe() {
        return "If(test=" + Snippets.quote(test) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitIf(this);
    }
}
