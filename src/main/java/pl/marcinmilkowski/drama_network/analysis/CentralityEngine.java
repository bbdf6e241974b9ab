package pl.marcinmilkowski.drama_network.analysis;

import org.jgrapht.alg.scoring.BetweennessCentrality;
import pl.marcinmilkowski.drama_network.graph.GraphAlgorithms;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-character network statistics: degree, betweenness, closeness, plus the raw
 * number of segments each character speaks in.
 *
 * Path-based measures use hop counts; edge weights are ignored.
 */
public class CentralityEngine {

    public CharacterMetricsTable compute(InteractionGraph graph, List<Set<String>> segments) {
        Map<String, Double> betweenness = betweenness(graph);
        Map<String, Double> closeness = closeness(graph);
        Map<String, Integer> frequencies = frequencies(segments);

        List<CharacterMetrics> rows = new ArrayList<>(graph.nodeCount());
        for (String character : graph.nodes()) {
            rows.add(new CharacterMetrics(
                character,
                frequencies.getOrDefault(character, 0),
                graph.degree(character),
                betweenness.getOrDefault(character, 0.0),
                closeness.getOrDefault(character, 0.0),
                null));
        }
        return new CharacterMetricsTable(rows);
    }

    /**
     * Number of segments each character occurs in.
     */
    public static Map<String, Integer> frequencies(List<Set<String>> segments) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Set<String> segment : segments) {
            for (String character : segment) {
                counts.merge(character, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Brandes' betweenness on hop counts (JGraphT), normalized by 2/((n-1)(n-2))
     * over unordered pairs. Graphs with two nodes or fewer are left unnormalized
     * (all zeros).
     */
    public static Map<String, Double> betweenness(InteractionGraph graph) {
        Map<String, Double> scores = new BetweennessCentrality<>(GraphAlgorithms.unweighted(graph), false).getScores();
        int n = graph.nodeCount();
        double scale = n > 2 ? 2.0 / ((double) (n - 1) * (n - 2)) : 1.0;

        Map<String, Double> centrality = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            centrality.put(node, scores.getOrDefault(node, 0.0) * scale);
        }
        return centrality;
    }

    /**
     * Closeness (r-1)/sum(d) over the r nodes reachable from each node, scaled by
     * (r-1)/(n-1) so that nodes in small components are not favoured. Isolated
     * nodes get 0.
     */
    public static Map<String, Double> closeness(InteractionGraph graph) {
        Map<String, Double> centrality = new LinkedHashMap<>();
        int n = graph.nodeCount();
        for (String node : graph.nodes()) {
            Map<String, Integer> distances = GraphAlgorithms.distancesFrom(graph, node);
            long total = 0;
            for (int d : distances.values()) {
                total += d;
            }
            int reachable = distances.size();
            double value = 0.0;
            if (total > 0 && n > 1) {
                value = (reachable - 1) / (double) total;
                value *= (reachable - 1) / (double) (n - 1);
            }
            centrality.put(node, value);
        }
        return centrality;
    }
}
