package pl.marcinmilkowski.drama_network.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.model.CharacterSelection;
import pl.marcinmilkowski.drama_network.model.MetricValue;
import pl.marcinmilkowski.drama_network.model.PlayRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Measures how the cast develops over the segment sequence of a play.
 *
 * Positions are 1-based and normalized by the number of segments.
 */
public class TemporalDynamicsAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(TemporalDynamicsAnalyzer.class);

    public TemporalMetrics analyze(PlayRecord play, CharacterSelection centralCharacter) {
        List<Set<String>> segments = play.segments();
        List<Double> changeRates = changeRates(segments);

        MetricValue mean = mean(changeRates);
        MetricValue std = standardDeviation(changeRates);
        if (!mean.isDefined()) {
            logger.warn("ID {}: change rate undefined, play has a single segment", play.id());
        }

        MetricValue allIn = allInIndex(segments, play.universe().size());
        if (!allIn.isDefined()) {
            logger.warn("ID {}: all-in index undefined: {}", play.id(), allIn.undefinedReason());
        }

        MetricValue finalSize = finalSceneSizeIndex(segments, play.universe().size());
        if (!finalSize.isDefined()) {
            logger.warn("ID {}: final scene size index undefined: {}", play.id(), finalSize.undefinedReason());
        }

        MetricValue entry = entryIndex(segments, centralCharacter);

        return new TemporalMetrics(changeRates, mean, std, allIn, finalSize, entry,
            charactersLastIn(segments));
    }

    /**
     * Jaccard distance |S xor T| / |S u T|. Two empty segments are identical (0).
     */
    public static double changeRate(Set<String> s, Set<String> t) {
        Set<String> union = new HashSet<>(s);
        union.addAll(t);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(s);
        intersection.retainAll(t);
        return (union.size() - intersection.size()) / (double) union.size();
    }

    public static List<Double> changeRates(List<Set<String>> segments) {
        List<Double> rates = new ArrayList<>(Math.max(0, segments.size() - 1));
        for (int i = 1; i < segments.size(); i++) {
            rates.add(changeRate(segments.get(i - 1), segments.get(i)));
        }
        return rates;
    }

    static MetricValue mean(List<Double> values) {
        if (values.isEmpty()) {
            return MetricValue.undefined("mean of an empty sequence");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return MetricValue.of(sum / values.size());
    }

    /**
     * Population standard deviation.
     */
    static MetricValue standardDeviation(List<Double> values) {
        MetricValue mean = mean(values);
        if (!mean.isDefined()) {
            return MetricValue.undefined("standard deviation of an empty sequence");
        }
        double squares = 0.0;
        for (double v : values) {
            double diff = v - mean.value();
            squares += diff * diff;
        }
        return MetricValue.of(Math.sqrt(squares / values.size()));
    }

    /**
     * Position of the first segment by which as many distinct characters have
     * appeared as the universe holds.
     */
    public static MetricValue allInIndex(List<Set<String>> segments, int universeSize) {
        Set<String> appeared = new HashSet<>();
        for (int i = 0; i < segments.size(); i++) {
            appeared.addAll(segments.get(i));
            if (appeared.size() >= universeSize) {
                return MetricValue.of((i + 1) / (double) segments.size());
            }
        }
        return MetricValue.undefined(appeared.size() + " of " + universeSize + " characters ever appear");
    }

    public static MetricValue finalSceneSizeIndex(List<Set<String>> segments, int universeSize) {
        if (universeSize == 0) {
            return MetricValue.undefined("division by zero: empty character universe");
        }
        return MetricValue.of(segments.get(segments.size() - 1).size() / (double) universeSize);
    }

    public static MetricValue entryIndex(List<Set<String>> segments, CharacterSelection central) {
        Optional<String> character = central.character();
        if (character.isEmpty()) {
            return MetricValue.undefined("no single central character (" + central + ")");
        }
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).contains(character.get())) {
                return MetricValue.of((i + 1) / (double) segments.size());
            }
        }
        return MetricValue.undefined(character.get() + " never appears");
    }

    public static String charactersLastIn(List<Set<String>> segments) {
        return String.join(",", segments.get(segments.size() - 1));
    }
}
