package pl.marcinmilkowski.drama_network.viz;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;

import static org.junit.jupiter.api.Assertions.*;

class NetworkLayoutTest {

    private static InteractionGraph sample() {
        InteractionGraph.Builder builder = InteractionGraph.builder();
        builder.addEdge("Nathan", "Daja", 3);
        builder.addEdge("Nathan", "Recha", 1);
        builder.addNode("Al-Hafi");
        return builder.build();
    }

    @Test
    void testToSVG_BasicStructure() {
        NetworkLayout layout = new NetworkLayout(sample(), 800, 600);
        layout.compute(50);
        String svg = layout.toSVG();

        assertTrue(svg.contains("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"), "Missing XML declaration");
        assertTrue(svg.contains("<svg xmlns=\"http://www.w3.org/2000/svg\""), "Missing SVG namespace");
        assertTrue(svg.contains("width=\"800\" height=\"600\""), "Wrong dimensions");
        assertTrue(svg.contains(">Nathan</text>"), "Missing Nathan label");
        assertTrue(svg.contains(">Al-Hafi</text>"), "Missing isolated node label");
        assertEquals(2, count(svg, "<line class=\"edge\""), "One line per edge");
        assertEquals(4, count(svg, "<circle class=\"node\""), "One circle per node");
    }

    @Test
    void testEdgeWidthFollowsWeight() {
        String svg = new NetworkLayout(sample(), 400, 400).toSVG();
        assertTrue(svg.contains("stroke-width=\"1.73\""), "sqrt(3) stroke for weight 3");
        assertTrue(svg.contains("stroke-width=\"1.00\""), "unit stroke for weight 1");
    }

    @Test
    void testPositionsStayInsideMargins() {
        NetworkLayout layout = new NetworkLayout(sample(), 300, 200);
        layout.compute(100);
        for (String name : new String[] {"Nathan", "Daja", "Recha", "Al-Hafi"}) {
            double[] p = layout.position(name);
            assertNotNull(p);
            assertTrue(p[0] >= 50 && p[0] <= 250, name + " x out of bounds: " + p[0]);
            assertTrue(p[1] >= 50 && p[1] <= 150, name + " y out of bounds: " + p[1]);
        }
        assertNull(layout.position("Saladin"));
    }

    @Test
    void testLabelsAreEscaped() {
        InteractionGraph.Builder builder = InteractionGraph.builder();
        builder.addEdge("Tom & Jerry", "<Narrator>", 1);
        String svg = new NetworkLayout(builder.build(), 400, 400).toSVG();

        assertTrue(svg.contains("Tom &amp; Jerry"));
        assertTrue(svg.contains("&lt;Narrator&gt;"));
    }

    @Test
    void testEmptyGraph() {
        NetworkLayout layout = new NetworkLayout(InteractionGraph.empty(), 400, 400);
        layout.compute(10);
        String svg = layout.toSVG();
        assertTrue(svg.endsWith("</svg>"));
        assertEquals(0, count(svg, "<circle"));
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            n++;
        }
        return n;
    }
}
