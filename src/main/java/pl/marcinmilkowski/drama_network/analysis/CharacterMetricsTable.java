package pl.marcinmilkowski.drama_network.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per-character metrics of a play, one row per node of the interaction graph,
 * keyed by character and kept in graph node order. Immutable.
 */
public final class CharacterMetricsTable {

    private final Map<String, CharacterMetrics> rows;

    public CharacterMetricsTable(Collection<CharacterMetrics> rows) {
        Map<String, CharacterMetrics> byCharacter = new LinkedHashMap<>();
        for (CharacterMetrics row : rows) {
            if (byCharacter.put(row.character(), row) != null) {
                throw new IllegalArgumentException("Duplicate row for character: " + row.character());
            }
        }
        this.rows = Collections.unmodifiableMap(byCharacter);
    }

    public List<CharacterMetrics> rows() {
        return new ArrayList<>(rows.values());
    }

    public Optional<CharacterMetrics> get(String character) {
        return Optional.ofNullable(rows.get(character));
    }

    public List<String> characters() {
        return new ArrayList<>(rows.keySet());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean isRanked() {
        return !rows.isEmpty() && rows.values().stream().allMatch(CharacterMetrics::isRanked);
    }

    /**
     * New table with every row replaced by {@code mapper}'s result.
     */
    public CharacterMetricsTable map(UnaryOperator<CharacterMetrics> mapper) {
        List<CharacterMetrics> mapped = new ArrayList<>(rows.size());
        for (CharacterMetrics row : rows.values()) {
            mapped.add(mapper.apply(row));
        }
        return new CharacterMetricsTable(mapped);
    }

    @Override
    public String toString() {
        return String.format("CharacterMetricsTable[%d characters]", rows.size());
    }
}
