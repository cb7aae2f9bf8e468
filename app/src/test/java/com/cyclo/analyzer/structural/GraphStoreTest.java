package com.cyclo.analyzer.structural;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphStoreTest {

    @Test
    void testIdsFollowCreationOrder() {
        GraphStore<String> store = new GraphStore<>();
        assertEquals(1, store.createNode("a"));
        assertEquals(2, store.createNode("b"));
        assertEquals(3, store.createNode(null));

        assertEquals(1, store.createEdge(1, 2));
        assertEquals(2, store.createEdge(2, 3));
        assertEquals(3, store.nodeCount());
        assertEquals(2, store.edgeCount());
    }

    @Test
    void testDuplicateAndCyclicEdgesAreKept() {
        GraphStore<String> store = new GraphStore<>();
        int a = store.createNode("a");
        int b = store.createNode("b");
        store.createEdge(a, b);
        store.createEdge(a, b);
        store.createEdge(b, a);
        store.createEdge(b, b);

        assertEquals(4, store.edgeCount(), "Edges are never deduplicated");
    }

    @Test
    void testEdgeToUnknownNodeIsRejected() {
        GraphStore<String> store = new GraphStore<>();
        int a = store.createNode("a");

        assertThrows(IllegalArgumentException.class, () -> store.createEdge(a, 2));
        assertThrows(IllegalArgumentException.class, () -> store.createEdge(0, a));
        assertEquals(0, store.edgeCount());
    }

    @Test
    void testSnapshotIsDetachedFromStore() {
        GraphStore<String> store = new GraphStore<>();
        int a = store.createNode("a");
        int end = store.createNode(null);
        store.createEdge(a, end);

        ControlFlowGraph<String> graph = store.snapshot(a, end);
        store.createNode("late");
        store.createEdge(a, 3);

        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertEquals("a", graph.start().origin());
        assertTrue(graph.end().isTerminal());
        assertEquals(1, graph.outgoing(a).size());
        assertTrue(graph.outgoing(end).isEmpty());
    }

    @Test
    void testSeparateStoresDoNotShareCounters() {
        GraphStore<String> first = new GraphStore<>();
        GraphStore<String> second = new GraphStore<>();
        first.createNode("x");
        first.createNode("y");

        assertEquals(1, second.createNode("z"));
    }
}
