package com.cyclo.analyzer.structural;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable control-flow graph with a designated start and terminal node.
 */
public class ControlFlowGraph<N> {

    private final List<CfgNode<N>> nodes;
    private final List<CfgEdge> edges;
    private final int startId;
    private final int endId;
    private final Map<Integer, List<CfgEdge>> outgoing = new HashMap<>();

    ControlFlowGraph(List<CfgNode<N>> nodes, List<CfgEdge> edges, int startId, int endId) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.startId = startId;
        this.endId = endId;
        for (CfgEdge edge : this.edges) {
            outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }
    }

    /**
     * Nodes in creation order.
     */
    public List<CfgNode<N>> nodes() {
        return nodes;
    }

    /**
     * Edges in creation order.
     */
    public List<CfgEdge> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public CfgNode<N> node(int id) {
        if (id < 1 || id > nodes.size()) {
            throw new IllegalArgumentException("Unknown node id " + id);
        }
        return nodes.get(id - 1);
    }

    public CfgNode<N> start() {
        return node(startId);
    }

    public CfgNode<N> end() {
        return node(endId);
    }

    public List<CfgEdge> outgoing(int nodeId) {
        return List.copyOf(outgoing.getOrDefault(nodeId, List.of()));
    }
}
