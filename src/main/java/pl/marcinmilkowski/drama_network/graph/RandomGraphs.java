package pl.marcinmilkowski.drama_network.graph;

import org.jgrapht.generate.CompleteGraphGenerator;
import org.jgrapht.generate.GnmRandomGraphGenerator;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleWeightedGraph;
import org.jgrapht.util.SupplierUtil;

import java.util.Random;

/**
 * Random graph generators used for null-model baselines.
 */
public final class RandomGraphs {

    private RandomGraphs() {
    }

    /**
     * Uniformly random simple graph G(n, m) with nodes "0".."n-1" and exactly
     * m edges. Requests for more edges than possible yield the complete graph.
     */
    public static InteractionGraph gnm(int n, int m, Random random) {
        if (n < 0 || m < 0) {
            throw new IllegalArgumentException("Node and edge counts must be >= 0, got n=" + n + ", m=" + m);
        }
        SimpleWeightedGraph<String, DefaultWeightedEdge> target = new SimpleWeightedGraph<>(
            SupplierUtil.createStringSupplier(), SupplierUtil.createDefaultWeightedEdgeSupplier());
        if (n < 2) {
            for (int i = 0; i < n; i++) {
                target.addVertex();
            }
            return InteractionGraph.of(target);
        }

        long maxEdges = (long) n * (n - 1) / 2;
        if (m >= maxEdges) {
            new CompleteGraphGenerator<String, DefaultWeightedEdge>(n).generateGraph(target);
        } else {
            new GnmRandomGraphGenerator<String, DefaultWeightedEdge>(n, m, random, false, false)
                .generateGraph(target);
        }
        return InteractionGraph.of(target);
    }
}
