package com.cyclo.analyzer.structural;

import com.cyclo.analyzer.core.NestingTooDeepException;
import com.cyclo.analyzer.core.TemplateAnalysisException;
import com.cyclo.analyzer.core.UnsupportedConstructException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a control-flow graph from a syntax tree.
 * <p>
 * Every syntax node becomes one graph node. Each visit returns the node's head
 * and its tails, the nodes still waiting for a successor; the caller links those
 * tails to whatever comes next. After the root is visited the remaining tails are
 * joined to a synthetic terminal node.
 *
 * @param <N> syntax node type
 */
public class CfgBuilder<N> {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private final SyntaxTreeAdapter<N> adapter;
    private final int maxDepth;
    private final boolean implicitElse;

    /**
     * @param adapter      syntax tree access
     * @param maxDepth     deepest syntax tree level accepted before failing; the root
     *                     is level 1 and every node, leaves and alternatives included,
     *                     is one level below its parent
     * @param implicitElse when true a conditional without a default body also
     *                     falls through from its last test
     */
    public CfgBuilder(SyntaxTreeAdapter<N> adapter, int maxDepth, boolean implicitElse) {
        this.adapter = adapter;
        this.maxDepth = maxDepth;
        this.implicitElse = implicitElse;
    }

    public CfgBuilder(SyntaxTreeAdapter<N> adapter, int maxDepth) {
        this(adapter, maxDepth, false);
    }

    /**
     * Build the graph for the tree under {@code root}. Nothing is returned unless the
     * whole tree was traversed.
     */
    public ControlFlowGraph<N> build(N root) throws TemplateAnalysisException {
        GraphStore<N> store = new GraphStore<>();
        Traversal traversal = new Traversal(store);

        Visit visit = traversal.visit(root, 1);

        int end = store.createNode(null);
        for (int tail : visit.tails()) {
            store.createEdge(tail, end);
        }

        log.debug("Built control-flow graph: {} nodes, {} edges", store.nodeCount(), store.edgeCount());
        return store.snapshot(visit.head(), end);
    }

    private record Visit(int head, List<Integer> tails) {
    }

    private final class Traversal {

        private final GraphStore<N> store;

        Traversal(GraphStore<N> store) {
            this.store = store;
        }

        Visit visit(N node, int depth) throws TemplateAnalysisException {
            return visit(node, depth, false);
        }

        /**
         * @param alternative true when the node is an alternative branch of an enclosing
         *                    conditional, which then owns the implicit fall-through
         */
        Visit visit(N node, int depth, boolean alternative) throws TemplateAnalysisException {
            if (depth > maxDepth) {
                throw new NestingTooDeepException(maxDepth, adapter.lineOf(node));
            }
            int head = store.createNode(node);
            NodeShape<N> shape = adapter.classify(node);
            if (shape == null) {
                throw new UnsupportedConstructException(adapter.describe(node), adapter.lineOf(node));
            }
            List<Integer> tails = shape.accept(new Dispatch(head, depth, alternative));
            return new Visit(head, tails);
        }

        /**
         * Visits {@code children} in order, linking {@code from} to the first child and
         * each child's tails to the next child's head. Returns the last tails, or
         * {@code from} itself when there are no children.
         */
        List<Integer> chain(List<N> children, int from, int depth) throws TemplateAnalysisException {
            List<Integer> tails = List.of(from);
            for (N child : children) {
                Visit visit = visit(child, depth + 1);
                for (int tail : tails) {
                    store.createEdge(tail, visit.head());
                }
                tails = visit.tails();
            }
            return new ArrayList<>(tails);
        }

        private final class Dispatch implements NodeShape.Visitor<N, List<Integer>, TemplateAnalysisException> {

            private final int head;
            private final int depth;
            private final boolean alternative;

            Dispatch(int head, int depth, boolean alternative) {
                this.head = head;
                this.depth = depth;
                this.alternative = alternative;
            }

            @Override
            public List<Integer> visitSimple(NodeShape.Simple<N> shape) throws TemplateAnalysisException {
                return chain(shape.children(), head, depth);
            }

            @Override
            public List<Integer> visitConditional(NodeShape.Conditional<N> shape) throws TemplateAnalysisException {
                List<Integer> tails = chain(shape.body(), head, depth);

                // alternatives are visited as nodes of their own, entered from this head
                int lastTest = head;
                for (N branch : shape.alternatives()) {
                    Visit visit = visit(branch, depth + 1, true);
                    store.createEdge(head, visit.head());
                    tails.addAll(visit.tails());
                    lastTest = visit.head();
                }

                if (shape.defaultBody().isPresent()) {
                    tails.addAll(chain(shape.defaultBody().get(), head, depth));
                } else if (implicitElse && !alternative) {
                    // the last test in the chain falls through when every condition is false
                    tails.add(lastTest);
                }
                return tails;
            }

            @Override
            public List<Integer> visitLoop(NodeShape.Loop<N> shape) throws TemplateAnalysisException {
                List<Integer> bodyTails = chain(shape.body(), head, depth);
                for (int tail : bodyTails) {
                    store.createEdge(tail, head);
                }

                // body tails both repeat and continue past the loop
                List<Integer> tails = new ArrayList<>(bodyTails);
                if (shape.emptyBody().isPresent()) {
                    tails.addAll(chain(shape.emptyBody().get(), head, depth));
                }
                return tails;
            }
        }
    }
}
