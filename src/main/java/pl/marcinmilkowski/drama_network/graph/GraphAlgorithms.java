package pl.marcinmilkowski.drama_network.graph;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.interfaces.ShortestPathAlgorithm.SingleSourcePaths;
import org.jgrapht.alg.scoring.ClusteringCoefficient;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.AsUnweightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;
import pl.marcinmilkowski.drama_network.model.MetricValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unweighted graph statistics shared by the observed-graph metrics and the
 * random baseline, computed with JGraphT. Edge weights are ignored throughout.
 */
public final class GraphAlgorithms {

    private GraphAlgorithms() {
    }

    /**
     * The graph with every edge weight read as 1, for hop-count algorithms.
     */
    public static Graph<String, DefaultWeightedEdge> unweighted(InteractionGraph graph) {
        return new AsUnweightedGraph<>(graph.asGraph());
    }

    /**
     * Hop distances from source to every node reachable from it (source included, at 0),
     * in node order.
     */
    public static Map<String, Integer> distancesFrom(InteractionGraph graph, String source) {
        SingleSourcePaths<String, DefaultWeightedEdge> paths =
            new BFSShortestPath<>(unweighted(graph)).getPaths(source);
        Map<String, Integer> distances = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            double d = paths.getWeight(node);
            if (!Double.isInfinite(d)) {
                distances.put(node, (int) d);
            }
        }
        return distances;
    }

    /**
     * Connected components in order of discovery, each in node order.
     */
    public static List<Set<String>> connectedComponents(InteractionGraph graph) {
        List<Set<String>> components = new ArrayList<>();
        for (Set<String> found : new ConnectivityInspector<>(graph.asGraph()).connectedSets()) {
            Set<String> component = new LinkedHashSet<>();
            for (String node : graph.nodes()) {
                if (found.contains(node)) {
                    component.add(node);
                }
            }
            components.add(component);
        }
        return components;
    }

    /**
     * Largest connected component; the first discovered one wins on equal size.
     * Empty for the empty graph.
     */
    public static Set<String> largestComponent(InteractionGraph graph) {
        Set<String> largest = Set.of();
        for (Set<String> component : connectedComponents(graph)) {
            if (component.size() > largest.size()) {
                largest = component;
            }
        }
        return largest;
    }

    /**
     * Whether the graph is connected. The empty graph has no defined connectivity and yields false.
     */
    public static boolean isConnected(InteractionGraph graph) {
        if (graph.isEmpty()) return false;
        return new ConnectivityInspector<>(graph.asGraph()).isConnected();
    }

    /**
     * Mean hop distance over all ordered pairs of distinct nodes.
     *
     * Undefined for the empty graph, for a disconnected graph and for a
     * single node (no pairs to average over).
     */
    public static MetricValue averageShortestPathLength(InteractionGraph graph) {
        int n = graph.nodeCount();
        if (n == 0) {
            return MetricValue.undefined("connectivity is undefined for the null graph");
        }
        if (!isConnected(graph)) {
            return MetricValue.undefined("graph is not connected");
        }
        if (n == 1) {
            return MetricValue.undefined("division by zero: single node graph");
        }
        BFSShortestPath<String, DefaultWeightedEdge> bfs = new BFSShortestPath<>(unweighted(graph));
        double total = 0;
        for (String source : graph.nodes()) {
            SingleSourcePaths<String, DefaultWeightedEdge> paths = bfs.getPaths(source);
            for (String target : graph.nodes()) {
                total += paths.getWeight(target);
            }
        }
        return MetricValue.of(total / ((double) n * (n - 1)));
    }

    /**
     * Fraction of pairs of neighbors that are themselves linked; 0 below degree 2.
     */
    public static double localClustering(InteractionGraph graph, String node) {
        return new ClusteringCoefficient<>(graph.asGraph()).getVertexScore(node);
    }

    /**
     * Mean local clustering over all nodes, zeros included.
     */
    public static MetricValue averageClustering(InteractionGraph graph) {
        if (graph.isEmpty()) {
            return MetricValue.undefined("division by zero: graph has no nodes");
        }
        return MetricValue.of(new ClusteringCoefficient<>(graph.asGraph()).getAverageClusteringCoefficient());
    }

    /**
     * 2e / (n(n-1)); 0 for graphs with fewer than two nodes.
     */
    public static double density(InteractionGraph graph) {
        int n = graph.nodeCount();
        if (n <= 1 || graph.edgeCount() == 0) return 0.0;
        return 2.0 * graph.edgeCount() / ((double) n * (n - 1));
    }
}
