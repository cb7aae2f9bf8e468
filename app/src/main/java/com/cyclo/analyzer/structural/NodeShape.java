package com.cyclo.analyzer.structural;

import java.util.List;
import java.util.Optional;

/**
 * Control-flow classification of a syntax node. The set of shapes is closed:
 * every node is exactly one of {@link Simple}, {@link Conditional} or {@link Loop}.
 *
 * @param <N> syntax node type
 */
public interface NodeShape<N> {

    <R, X extends Exception> R accept(Visitor<N, R, X> visitor) throws X;

    interface Visitor<N, R, X extends Exception> {

        R visitSimple(Simple<N> shape) throws X;

        R visitConditional(Conditional<N> shape) throws X;

        R visitLoop(Loop<N> shape) throws X;
    }

    /**
     * A node that runs its children in order.
     */
    record Simple<N>(List<N> children) implements NodeShape<N> {

        public Simple {
            children = List.copyOf(children);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<N, R, X> visitor) throws X {
            return visitor.visitSimple(this);
        }
    }

    /**
     * A branch: the main body, alternative conditionals visited as nodes of their
     * own (elif chains), and an optional default body.
     */
    record Conditional<N>(List<N> body, List<N> alternatives, Optional<List<N>> defaultBody)
            implements NodeShape<N> {

        public Conditional {
            body = List.copyOf(body);
            alternatives = List.copyOf(alternatives);
            defaultBody = defaultBody.map(List::copyOf);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<N, R, X> visitor) throws X {
            return visitor.visitConditional(this);
        }
    }

    /**
     * A loop body plus an optional body taken when there is nothing to iterate.
     */
    record Loop<N>(List<N> body, Optional<List<N>> emptyBody) implements NodeShape<N> {

        public Loop {
            body = List.copyOf(body);
            emptyBody = emptyBody.map(List::copyOf);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<N, R, X> visitor) throws X {
            return visitor.visitLoop(this);
        }
    }
}
