package pl.marcinmilkowski.drama_network.analysis;

import pl.marcinmilkowski.drama_network.model.MetricValue;

/**
 * Whole-graph statistics of an interaction graph.
 */
public record GraphMetrics(
    int charcount,
    int edgecount,
    MetricValue maxdegree,
    MetricValue avgdegree,
    MetricValue density,
    MetricValue avgpathlength,
    MetricValue clusteringCoefficient,
    int connectedComponents,
    boolean largestComponentFallback   // avgpathlength was taken from the largest component
) {
}
