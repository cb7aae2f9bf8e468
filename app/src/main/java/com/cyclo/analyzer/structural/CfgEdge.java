package com.cyclo.analyzer.structural;

/**
 * A directed edge between two node ids.
 */
public record CfgEdge(int id, int from, int to) {

    /**
     * True for loop back-edges. Loop heads are always created before their body,
     * so an edge pointing to an earlier (or the same) node closes a cycle.
     */
    public boolean isBackEdge() {
        return to <= from;
    }
}
