package pl.marcinmilkowski.drama_network.graph;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InteractionGraphTest {

    @Test
    @DisplayName("Each undirected edge is listed once")
    void testEdges() {
        InteractionGraph g = InteractionGraph.builder()
            .addEdge("A", "B", 2)
            .addEdge("B", "C", 1)
            .build();

        List<InteractionGraph.Edge> edges = g.edges();
        assertEquals(2, edges.size());
        assertEquals(new InteractionGraph.Edge("A", "B", 2), edges.get(0));
        assertEquals(new InteractionGraph.Edge("B", "C", 1), edges.get(1));
    }

    @Test
    @DisplayName("Adding an edge twice increases its weight")
    void testMergeWeight() {
        InteractionGraph g = InteractionGraph.builder()
            .addEdge("A", "B", 1)
            .addEdge("B", "A", 2)
            .build();

        assertEquals(1, g.edgeCount());
        assertEquals(3, g.weight("A", "B"));
    }

    @Test
    @DisplayName("Self-loops and non-positive weights are rejected")
    void testInvalidEdges() {
        InteractionGraph.Builder b = InteractionGraph.builder();
        assertThrows(IllegalArgumentException.class, () -> b.addEdge("A", "A", 1));
        assertThrows(IllegalArgumentException.class, () -> b.addEdge("A", "B", 0));
    }

    @Test
    @DisplayName("Subgraph keeps only edges inside the node set")
    void testSubgraph() {
        InteractionGraph g = InteractionGraph.builder()
            .addEdge("A", "B", 1)
            .addEdge("B", "C", 1)
            .addNode("D")
            .build();

        InteractionGraph sub = g.subgraph(Set.of("A", "B", "D"));
        assertEquals(Set.of("A", "B", "D"), sub.nodes());
        assertEquals(1, sub.edgeCount());
        assertFalse(sub.hasEdge("B", "C"));
    }

    @Test
    @DisplayName("Built graphs cannot be modified")
    void testImmutable() {
        InteractionGraph g = InteractionGraph.builder().addEdge("A", "B", 1).build();
        assertThrows(UnsupportedOperationException.class, () -> g.nodes().add("C"));
        assertThrows(UnsupportedOperationException.class, () -> g.neighbors("A").add("C"));
    }

    @Test
    @DisplayName("JGraphT view carries weights and is read-only")
    void testGraphView() {
        InteractionGraph g = InteractionGraph.builder().addEdge("A", "B", 4).build();
        Graph<String, DefaultWeightedEdge> view = g.asGraph();

        assertEquals(4.0, view.getEdgeWeight(view.getEdge("A", "B")), 1e-12);
        assertThrows(UnsupportedOperationException.class, () -> view.addVertex("C"));
        assertThrows(UnsupportedOperationException.class, () -> view.removeVertex("A"));
    }

    @Test
    @DisplayName("A builder hands out its graph only once")
    void testBuildOnce() {
        InteractionGraph.Builder b = InteractionGraph.builder().addEdge("A", "B", 1);
        InteractionGraph g = b.build();

        assertThrows(IllegalStateException.class, () -> b.addEdge("B", "C", 1));
        assertThrows(IllegalStateException.class, b::build);
        assertEquals(2, g.nodeCount());
    }

    @Test
    @DisplayName("Lookups of unknown characters are empty rather than errors")
    void testUnknownNode() {
        InteractionGraph g = InteractionGraph.builder().addEdge("A", "B", 1).build();

        assertEquals(0, g.degree("Z"));
        assertEquals(0, g.weight("A", "Z"));
        assertTrue(g.neighbors("Z").isEmpty());
    }
}
