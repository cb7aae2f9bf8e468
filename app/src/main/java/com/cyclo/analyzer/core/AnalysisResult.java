package com.cyclo.analyzer.core;

import com.cyclo.analyzer.structural.ControlFlowGraph;
import com.cyclo.analyzer.template.TemplateNode;

/**
 * Outcome of analysing one template.
 */
public record AnalysisResult(
        /** Template path or name as given to the analyzer */
        String templateName,

        /** The finished control-flow graph */
        ControlFlowGraph<TemplateNode> graph,

        /** Cyclomatic complexity of the graph */
        int complexity) {

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return graph.edgeCount();
    }
}
