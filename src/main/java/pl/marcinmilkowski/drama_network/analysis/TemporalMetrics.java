package pl.marcinmilkowski.drama_network.analysis;

import pl.marcinmilkowski.drama_network.model.MetricValue;

import java.util.List;

/**
 * Statistics over the order of segments: cast turnover and entry/exit timing.
 */
public record TemporalMetrics(
    List<Double> changeRates,                // One per pair of consecutive segments
    MetricValue changeRateMean,
    MetricValue changeRateStd,
    MetricValue allInIndex,
    MetricValue finalSceneSizeIndex,
    MetricValue centralCharacterEntryIndex,
    String charactersLastIn
) {

    public TemporalMetrics {
        changeRates = List.copyOf(changeRates);
    }
}
