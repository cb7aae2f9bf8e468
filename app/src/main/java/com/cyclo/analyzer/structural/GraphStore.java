package com.cyclo.analyzer.structural;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only arena of nodes and edges for one graph under construction.
 * Ids start at 1 and follow creation order.
 */
public class GraphStore<N> {

    private final List<CfgNode<N>> nodes = new ArrayList<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private int nextNodeId = 1;
    private int nextEdgeId = 1;

    public int createNode(N origin) {
        int id = nextNodeId++;
        nodes.add(new CfgNode<>(id, origin));
        return id;
    }

    public int createEdge(int from, int to) {
        requireNode(from);
        requireNode(to);
        int id = nextEdgeId++;
        edges.add(new CfgEdge(id, from, to));
        return id;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Freeze the current contents into an immutable graph.
     */
    public ControlFlowGraph<N> snapshot(int startId, int endId) {
        requireNode(startId);
        requireNode(endId);
        return new ControlFlowGraph<>(nodes, edges, startId, endId);
    }

    private void requireNode(int id) {
        if (id < 1 || id >= nextNodeId) {
            throw new IllegalArgumentException("Unknown node id " + id + " (graph has " + nodes.size() + " nodes)");
        }
    }
}
