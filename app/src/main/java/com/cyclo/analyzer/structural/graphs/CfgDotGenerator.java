package com.cyclo.analyzer.structural.graphs;

import com.cyclo.analyzer.structural.CfgEdge;
import com.cyclo.analyzer.structural.CfgNode;
import com.cyclo.analyzer.structural.ControlFlowGraph;

import java.util.function.Function;

/**
 * Renders a control-flow graph as Graphviz DOT.
 */
public class CfgDotGenerator {

    public <N> String generateDot(String name, ControlFlowGraph<N> graph, Function<N, String> labeler) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(name)).append("\" {\n");
        dot.append("  node [shape=box];\n");

        int startId = graph.start().id();
        for (CfgNode<N> node : graph.nodes()) {
            dot.append("  n").append(node.id());
            if (node.isTerminal()) {
                dot.append(" [label=\"end\", shape=doublecircle];\n");
                continue;
            }
            String label = node.id() + ": " + labeler.apply(node.origin());
            dot.append(" [label=\"").append(escape(label)).append("\"");
            if (node.id() == startId) {
                dot.append(", style=bold");
            }
            dot.append("];\n");
        }

        for (CfgEdge edge : graph.edges()) {
            dot.append("  n").append(edge.from()).append(" -> n").append(edge.to());
            if (edge.isBackEdge()) {
                dot.append(" [style=dashed, color=blue, label=\"repeat\"]");
            }
            dot.append(";\n");
        }

        dot.append("}\n");
        return dot.toString();
    }

    private String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
