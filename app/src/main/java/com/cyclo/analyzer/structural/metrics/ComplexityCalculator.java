package com.cyclo.analyzer.structural.metrics;

import com.cyclo.analyzer.structural.ControlFlowGraph;

public class ComplexityCalculator {

    public static int calculate(ControlFlowGraph<?> graph) {
        // McCabe: E - N + 2P, with a single connected component (P = 1)
        return graph.edgeCount() - graph.nodeCount() + 2;
    }
}
