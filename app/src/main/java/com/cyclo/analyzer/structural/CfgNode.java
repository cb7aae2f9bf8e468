package com.cyclo.analyzer.structural;

import java.util.Optional;

/**
 * A graph node. {@code origin} is null only for the synthetic terminal node.
 */
public record CfgNode<N>(int id, N origin) {

    public Optional<N> syntaxNode() {
        return Optional.ofNullable(origin);
    }

    public boolean isTerminal() {
        return origin == null;
    }
}
