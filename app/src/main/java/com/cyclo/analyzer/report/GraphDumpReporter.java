package com.cyclo.analyzer.report;

import com.cyclo.analyzer.core.AnalysisResult;
import com.cyclo.analyzer.structural.CfgEdge;
import com.cyclo.analyzer.structural.CfgNode;
import com.cyclo.analyzer.template.TemplateNode;

import java.io.PrintStream;

/**
 * Prints the graph in creation order followed by the complexity score.
 */
public class GraphDumpReporter {

    static final String TERMINAL_LABEL = "<end>";

    public void report(AnalysisResult result, PrintStream out, boolean dumpGraph) {
        if (dumpGraph) {
            out.println("Nodes:");
            for (CfgNode<TemplateNode> node : result.graph().nodes()) {
                String origin = node.syntaxNode().map(TemplateNode::describe).orElse(TERMINAL_LABEL);
                out.println("Node " + node.id() + ": " + origin);
            }

            out.println("Edges:");
            for (CfgEdge edge : result.graph().edges()) {
                out.println("Edge " + edge.id() + ": " + edge.from() + " -> " + edge.to());
            }
        }
        out.println(result.complexity());
    }
}
