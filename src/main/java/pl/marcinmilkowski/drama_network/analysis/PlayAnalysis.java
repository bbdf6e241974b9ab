package pl.marcinmilkowski.drama_network.analysis;

import pl.marcinmilkowski.drama_network.graph.InteractionGraph;
import pl.marcinmilkowski.drama_network.model.CharacterSelection;
import pl.marcinmilkowski.drama_network.model.PlayRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything derived from one play.
 */
public record PlayAnalysis(
    PlayRecord play,
    InteractionGraph graph,
    CharacterMetricsTable characters,
    GraphMetricsSummary summary,
    List<Double> changeRates,
    RandomBaseline baseline,
    Map<String, CharacterSelection> topRanked   // per metric column name, plus "central"
) {

    public PlayAnalysis {
        changeRates = List.copyOf(changeRates);
        topRanked = Collections.unmodifiableMap(new LinkedHashMap<>(topRanked));
    }

    public String id() {
        return play.id();
    }
}
