package pl.marcinmilkowski.drama_network.analysis;

import pl.marcinmilkowski.drama_network.model.CharacterSelection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns raw character metrics into dense ranks and picks central characters.
 *
 * <p>Dense ranking: the highest value gets rank 1, equal values share a rank, and
 * each next distinct value gets the previous rank + 1, regardless of how many
 * characters shared it.</p>
 */
public class RankAggregator {

    public static final String CENTRAL = "central";

    /**
     * Dense descending ranks of the given values.
     */
    public static <K> Map<K, Integer> denseRank(Map<K, Double> values) {
        TreeSet<Double> distinct = new TreeSet<>(values.values());
        Map<Double, Integer> rankOfValue = new HashMap<>();
        int rank = 1;
        for (Double value : distinct.descendingSet()) {
            rankOfValue.put(value, rank++);
        }
        Map<K, Integer> ranks = new LinkedHashMap<>();
        for (Map.Entry<K, Double> entry : values.entrySet()) {
            ranks.put(entry.getKey(), rankOfValue.get(entry.getValue()));
        }
        return ranks;
    }

    /**
     * Attach dense ranks for degree, closeness, betweenness and frequency to every row.
     */
    public CharacterMetricsTable rank(CharacterMetricsTable table) {
        Map<CentralityMetric, Map<String, Integer>> ranksByMetric = new EnumMap<>(CentralityMetric.class);
        for (CentralityMetric metric : CentralityMetric.values()) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (CharacterMetrics row : table.rows()) {
                values.put(row.character(), metric.valueOf(row));
            }
            ranksByMetric.put(metric, denseRank(values));
        }

        return table.map(row -> row.withRanks(new CharacterMetrics.Ranks(
            ranksByMetric.get(CentralityMetric.DEGREE).get(row.character()),
            ranksByMetric.get(CentralityMetric.CLOSENESS).get(row.character()),
            ranksByMetric.get(CentralityMetric.BETWEENNESS).get(row.character()),
            ranksByMetric.get(CentralityMetric.FREQUENCY).get(row.character()))));
    }

    /**
     * Average of every rank column per character: the four metric ranks plus
     * avg_centrality_rank. The structural ranks therefore weigh in twice.
     */
    public static double averageOfRankColumns(CharacterMetrics.Ranks ranks) {
        double sum = ranks.degree() + ranks.closeness() + ranks.betweenness() + ranks.frequency()
            + ranks.avgCentrality();
        return sum / 5.0;
    }

    /**
     * The character with the lowest average over all rank columns, or a tie.
     */
    public CharacterSelection centralCharacter(CharacterMetricsTable ranked) {
        requireRanked(ranked);
        if (ranked.isEmpty()) {
            return CharacterSelection.none();
        }
        double min = Double.MAX_VALUE;
        Map<String, Double> averages = new LinkedHashMap<>();
        for (CharacterMetrics row : ranked.rows()) {
            double avg = averageOfRankColumns(row.ranks());
            averages.put(row.character(), avg);
            min = Math.min(min, avg);
        }
        List<String> central = new ArrayList<>();
        for (Map.Entry<String, Double> entry : averages.entrySet()) {
            if (entry.getValue() == min) {
                central.add(entry.getKey());
            }
        }
        return CharacterSelection.fromCandidates(central);
    }

    /**
     * Top character per metric, plus the central character under {@value #CENTRAL}.
     *
     * <p>For every metric the maximum of that metric's values is looked up among the
     * characters' <em>closeness</em> values, so only characters whose closeness
     * equals the metric's maximum qualify. Anything but exactly one match is
     * reported as a tie.</p>
     */
    // FIXME: look the maximum up among the metric's own values, not closeness
    public Map<String, CharacterSelection> topRankedCharacters(CharacterMetricsTable ranked) {
        Map<String, CharacterSelection> top = new LinkedHashMap<>();
        for (CentralityMetric metric : CentralityMetric.values()) {
            if (ranked.isEmpty()) {
                top.put(metric.columnName(), CharacterSelection.none());
                continue;
            }
            double max = -Double.MAX_VALUE;
            for (CharacterMetrics row : ranked.rows()) {
                max = Math.max(max, metric.valueOf(row));
            }
            List<String> matches = new ArrayList<>();
            for (CharacterMetrics row : ranked.rows()) {
                if (row.closeness() == max) {
                    matches.add(row.character());
                }
            }
            top.put(metric.columnName(), CharacterSelection.fromCandidates(matches));
        }
        top.put(CENTRAL, centralCharacter(ranked));
        return top;
    }

    private static void requireRanked(CharacterMetricsTable table) {
        if (!table.isEmpty() && !table.isRanked()) {
            throw new IllegalStateException("Character table has not been ranked");
        }
    }
}
