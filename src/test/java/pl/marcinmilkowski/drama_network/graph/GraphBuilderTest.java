package pl.marcinmilkowski.drama_network.graph;

import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static pl.marcinmilkowski.drama_network.TestPlays.seg;
import static pl.marcinmilkowski.drama_network.TestPlays.triangleSegments;

/**
 * Unit tests for GraphBuilder.
 */
class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder();

    @Test
    @DisplayName("Pairwise meetings give a triangle with unit weights")
    void testTriangle() {
        InteractionGraph g = builder.build(triangleSegments());

        assertEquals(Set.of("A", "B", "C"), g.nodes());
        assertEquals(3, g.edgeCount());
        assertEquals(1, g.weight("A", "B"));
        assertEquals(1, g.weight("B", "C"));
        assertEquals(1, g.weight("A", "C"));
    }

    @Test
    @DisplayName("Edge weight counts the segments shared by both characters")
    void testWeights() {
        InteractionGraph g = builder.build(List.of(
            seg("A", "B", "C"),
            seg("A", "B"),
            seg("B", "C"),
            seg("A", "B", "D")));

        assertEquals(3, g.weight("A", "B"));
        assertEquals(3, g.weight("B", "A"));
        assertEquals(2, g.weight("B", "C"));
        assertEquals(1, g.weight("A", "C"));
        assertEquals(1, g.weight("A", "D"));
        assertEquals(0, g.weight("C", "D"));
        assertEquals(5, g.edgeCount());
    }

    @Test
    @DisplayName("Characters speaking alone are nodes without edges")
    void testSoliloquy() {
        InteractionGraph g = builder.build(List.of(seg("A"), seg("A", "B"), seg("C")));

        assertEquals(Set.of("A", "B", "C"), g.nodes());
        assertEquals(1, g.edgeCount());
        assertEquals(0, g.degree("C"));
    }

    @Test
    @DisplayName("Only characters that speak become nodes")
    void testOnlySpeakers() {
        InteractionGraph g = builder.build(List.of(seg("A", "B")));

        assertFalse(g.containsNode("Z"));
        assertEquals(2, g.nodeCount());
    }

    @Test
    @DisplayName("Empty segments give an empty graph")
    void testEmpty() {
        InteractionGraph g = builder.build(List.of(seg(), seg()));

        assertTrue(g.isEmpty());
        assertEquals(0, g.edgeCount());
    }

    @Test
    @DisplayName("Nodes are ordered by first appearance")
    void testNodeOrder() {
        InteractionGraph g = builder.build(List.of(seg("B", "A"), seg("C", "A")));
        assertEquals(List.of("B", "A", "C"), List.copyOf(g.nodes()));
    }

    @Test
    @DisplayName("Bipartite graph links each segment to its characters")
    void testBipartite() {
        GraphBuilder.BipartiteGraph b = GraphBuilder.toBipartite(List.of(seg("A", "B"), seg(), seg("B")));

        assertEquals(3, b.charactersBySegment.size());
        assertTrue(b.charactersBySegment.get(1).isEmpty());
        assertEquals(Set.of(0, 2), b.segmentsByCharacter.get("B"));
        assertEquals(Set.of(0), b.segmentsByCharacter.get("A"));
    }
}
