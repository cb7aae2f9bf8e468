package com.cyclo.analyzer.template;

import java.util.List;
import java.util.Optional;

/**
 * {@code {% for target in iterable %}} with an optional {@code else} body that
 * renders when the iterable is empty.
 * <p>
 * {@code filter} holds the condition of {@code for x in y if z}, {@code recursive}
 * marks {@code for ... recursive}; both are parsed but not modelled as control flow.
 */
public record ForNode(
        String target,
        String iterable,
        List<TemplateNode> body,
        List<TemplateNode> elseBody,
        String filter,
        boolean recursive,
        int line) implements TemplateNode {

    public ForNode {
        body = List.copyOf(body);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public Optional<List<TemplateNode>> elseBranch() {
        return Optional.ofNullable(elseBody);
    }

    public Optional<String> loopFilter() {
        return Optional.ofNullable(filter);
    }

    @Override
    public String describe() {
        return "For(target=" + Snippets.quote(target) + ", iter=" + Snippets.quote(iterable) + ")";
    }

    @Override
    public <R, X extends Exception> R accept(TemplateNodeVisitor<R, X> visitor) throws X {
        return visitor.visitFor(this);
    }
}
