package pl.marcinmilkowski.drama_network.analysis;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.drama_network.TestPlays;
import pl.marcinmilkowski.drama_network.graph.GraphBuilder;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphMetricsEngine.
 */
class GraphMetricsEngineTest {

    private final GraphMetricsEngine engine = new GraphMetricsEngine();
    private final GraphBuilder builder = new GraphBuilder();

    @Test
    @DisplayName("Triangle play has complete, fully clustered graph")
    void testTriangle() {
        GraphMetrics m = engine.compute("triangle", builder.build(TestPlays.triangleSegments()));

        assertEquals(3, m.charcount());
        assertEquals(3, m.edgecount());
        assertEquals(2.0, m.maxdegree().value(), 1e-12);
        assertEquals("2", m.maxdegree().toString());
        assertEquals(2.0, m.avgdegree().value(), 1e-12);
        assertEquals(1.0, m.density().value(), 1e-12);
        assertEquals(1.0, m.avgpathlength().value(), 1e-12);
        assertEquals(1.0, m.clusteringCoefficient().value(), 1e-12);
        assertEquals(1, m.connectedComponents());
        assertFalse(m.largestComponentFallback());
    }

    @Test
    @DisplayName("Disconnected graph measures path length on the largest component")
    void testDisconnected() {
        GraphMetrics m = engine.compute("disconnected", builder.build(TestPlays.disconnected().segments()));

        assertTrue(m.largestComponentFallback());
        assertEquals(1.0, m.avgpathlength().value(), 1e-12);
        assertEquals(2, m.connectedComponents());
        assertEquals(1.0 / 3.0, m.density().value(), 1e-12);
        assertEquals(0.0, m.clusteringCoefficient().value(), 1e-12);
    }

    @Test
    @DisplayName("Empty graph: every undefined metric is reported, the others still computed")
    void testEmptyGraph() {
        GraphMetrics m = engine.compute("empty", InteractionGraph.empty());

        assertEquals(0, m.charcount());
        assertEquals(0, m.edgecount());
        assertFalse(m.maxdegree().isDefined());
        assertFalse(m.avgdegree().isDefined());
        assertFalse(m.avgpathlength().isDefined());
        assertFalse(m.clusteringCoefficient().isDefined());
        assertTrue(m.density().isDefined());
        assertEquals(0, m.connectedComponents());
        assertFalse(m.largestComponentFallback());
    }

    @Test
    @DisplayName("Edgeless graph falls back to a single node component without path length")
    void testEdgeless() {
        InteractionGraph g = InteractionGraph.builder().addNode("A").addNode("B").build();
        GraphMetrics m = engine.compute("edgeless", g);

        assertTrue(m.largestComponentFallback());
        assertFalse(m.avgpathlength().isDefined());
        assertEquals(0.0, m.maxdegree().value(), 1e-12);
        assertEquals(2, m.connectedComponents());
    }
}
