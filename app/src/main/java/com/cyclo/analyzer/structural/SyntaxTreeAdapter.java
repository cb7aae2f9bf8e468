package com.cyclo.analyzer.structural;

import com.cyclo.analyzer.core.UnsupportedConstructException;

/**
 * Exposes a syntax tree to the {@link CfgBuilder}.
 *
 * @param <N> syntax node type
 */
public interface SyntaxTreeAdapter<N> {

    /**
     * Classify a node. Children lists must follow source order.
     *
     * @throws UnsupportedConstructException if the node's control flow is not modelled
     */
    NodeShape<N> classify(N node) throws UnsupportedConstructException;

    /**
     * One-line representation of the node for diagnostics.
     */
    String describe(N node);

    /**
     * 1-based source line of the node, or 0 when unknown.
     */
    default int lineOf(N node) {
        return 0;
    }
}
