package pl.marcinmilkowski.drama_network.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.graph.GraphAlgorithms;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;
import pl.marcinmilkowski.drama_network.graph.RandomGraphs;
import pl.marcinmilkowski.drama_network.model.MetricValue;

import java.util.Random;

/**
 * Samples G(n, m) random graphs with the node and edge count of a play's
 * interaction graph to obtain baseline clustering and path length values
 * (small-world comparison).
 *
 * <p>Per iteration, one random graph yields a clustering sample. Path length needs a
 * connected graph, so fresh graphs are drawn until one is connected or the attempt
 * budget is used up; an exhausted budget contributes nothing. The two averages are
 * taken over their own success counts.</p>
 */
public class NullModelSampler {

    private static final Logger logger = LoggerFactory.getLogger(NullModelSampler.class);

    public static final int DEFAULT_ITERATIONS = 1000;
    public static final int FALLBACK_ITERATIONS = 50;
    public static final int DEFAULT_PATH_LENGTH_ATTEMPTS = 50;

    private final int pathLengthAttempts;

    public NullModelSampler() {
        this(DEFAULT_PATH_LENGTH_ATTEMPTS);
    }

    public NullModelSampler(int pathLengthAttempts) {
        if (pathLengthAttempts < 1) {
            throw new IllegalArgumentException("pathLengthAttempts must be >= 1, got " + pathLengthAttempts);
        }
        this.pathLengthAttempts = pathLengthAttempts;
    }

    public RandomBaseline sample(int nodeCount, int edgeCount, int iterations, Random random) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
        }
        double clusteringSum = 0.0;
        int clusteringSamples = 0;
        double pathLengthSum = 0.0;
        int pathLengthSamples = 0;
        int exhausted = 0;

        for (int i = 0; i < iterations; i++) {
            InteractionGraph graph = RandomGraphs.gnm(nodeCount, edgeCount, random);
            MetricValue clustering = GraphAlgorithms.averageClustering(graph);
            if (clustering.isDefined()) {
                clusteringSum += clustering.value();
                clusteringSamples++;
            }

            MetricValue pathLength = samplePathLength(nodeCount, edgeCount, random);
            if (pathLength.isDefined()) {
                pathLengthSum += pathLength.value();
                pathLengthSamples++;
            } else {
                exhausted++;
            }
        }

        logger.debug("Random baseline n={} m={}: {}/{} clustering samples, {}/{} path length samples ({} exhausted)",
            nodeCount, edgeCount, clusteringSamples, iterations, pathLengthSamples, iterations, exhausted);

        MetricValue randCluster = clusteringSamples > 0
            ? MetricValue.of(clusteringSum / clusteringSamples)
            : MetricValue.undefined("no random graph with a defined clustering coefficient");
        MetricValue randPathLength = pathLengthSamples > 0
            ? MetricValue.of(pathLengthSum / pathLengthSamples)
            : MetricValue.undefined("no connected random graph within " + pathLengthAttempts + " attempts");
        return new RandomBaseline(randPathLength, randCluster, iterations, pathLengthSamples, clusteringSamples);
    }

    /**
     * Average path length of the first computable random graph, or undefined when
     * every attempt failed.
     */
    MetricValue samplePathLength(int nodeCount, int edgeCount, Random random) {
        for (int attempt = 0; attempt < pathLengthAttempts; attempt++) {
            InteractionGraph graph = RandomGraphs.gnm(nodeCount, edgeCount, random);
            MetricValue pathLength = GraphAlgorithms.averageShortestPathLength(graph);
            if (pathLength.isDefined()) {
                return pathLength;
            }
        }
        return MetricValue.undefined("retry budget of " + pathLengthAttempts + " attempts exhausted");
    }
}
