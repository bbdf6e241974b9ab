package pl.marcinmilkowski.drama_network.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.graph.GraphAlgorithms;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;
import pl.marcinmilkowski.drama_network.model.MetricValue;

/**
 * Computes whole-graph statistics of an interaction graph.
 *
 * <p>Each statistic is computed on its own; an undefined one is logged with the
 * play id and reported as {@link MetricValue#undefined}, without affecting the
 * others.</p>
 *
 * <p>When the graph is disconnected, the average path length is measured on the
 * largest connected component instead, and {@link GraphMetrics#largestComponentFallback()}
 * is set. The caller uses that flag to shrink the random baseline.</p>
 */
public class GraphMetricsEngine {

    private static final Logger logger = LoggerFactory.getLogger(GraphMetricsEngine.class);

    public GraphMetrics compute(String playId, InteractionGraph graph) {
        int charcount = graph.nodeCount();
        int edgecount = graph.edgeCount();

        MetricValue maxdegree = maxDegree(playId, graph);
        MetricValue avgdegree = averageDegree(playId, graph);
        MetricValue density = MetricValue.of(GraphAlgorithms.density(graph));

        boolean fallback = false;
        MetricValue avgpathlength;
        if (graph.isEmpty()) {
            logger.warn("ID {}: average path length undefined, connectivity is undefined for the null graph", playId);
            avgpathlength = MetricValue.undefined("null graph");
        } else if (!GraphAlgorithms.isConnected(graph)) {
            logger.warn("ID {}: graph is not connected, using largest component for average path length", playId);
            fallback = true;
            InteractionGraph giant = graph.subgraph(GraphAlgorithms.largestComponent(graph));
            avgpathlength = GraphAlgorithms.averageShortestPathLength(giant);
            if (!avgpathlength.isDefined()) {
                logger.warn("ID {}: average path length of largest component undefined: {}",
                    playId, avgpathlength.undefinedReason());
            }
        } else {
            avgpathlength = GraphAlgorithms.averageShortestPathLength(graph);
            if (!avgpathlength.isDefined()) {
                logger.warn("ID {}: average path length undefined: {}", playId, avgpathlength.undefinedReason());
            }
        }

        MetricValue clustering = GraphAlgorithms.averageClustering(graph);
        if (!clustering.isDefined()) {
            logger.warn("ID {}: clustering coefficient undefined: {}", playId, clustering.undefinedReason());
        }

        int components = GraphAlgorithms.connectedComponents(graph).size();

        return new GraphMetrics(charcount, edgecount, maxdegree, avgdegree, density,
            avgpathlength, clustering, components, fallback);
    }

    private MetricValue maxDegree(String playId, InteractionGraph graph) {
        if (graph.isEmpty()) {
            logger.warn("ID {}: max degree undefined, graph has no nodes", playId);
            return MetricValue.undefined("max() of an empty sequence");
        }
        int max = 0;
        for (String node : graph.nodes()) {
            max = Math.max(max, graph.degree(node));
        }
        return MetricValue.ofCount(max);
    }

    private MetricValue averageDegree(String playId, InteractionGraph graph) {
        if (graph.isEmpty()) {
            logger.warn("ID {}: average degree undefined, division by zero", playId);
            return MetricValue.undefined("division by zero: graph has no nodes");
        }
        long sum = 0;
        for (String node : graph.nodes()) {
            sum += graph.degree(node);
        }
        return MetricValue.of(sum / (double) graph.nodeCount());
    }
}
