package pl.marcinmilkowski.drama_network.analysis;

import pl.marcinmilkowski.drama_network.model.MetricValue;

/**
 * Expected clustering and path length of random graphs of a given size.
 */
public record RandomBaseline(
    MetricValue avgPathLength,     // randavgpathl
    MetricValue clustering,        // randcluster
    int iterations,
    int pathLengthSamples,         // Iterations that produced a path length
    int clusteringSamples          // Iterations that produced a clustering coefficient
) {
}
