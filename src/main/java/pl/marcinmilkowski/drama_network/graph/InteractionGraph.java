package pl.marcinmilkowski.drama_network.graph;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleWeightedGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Undirected, weighted, simple graph of characters, backed by a JGraphT
 * {@link SimpleWeightedGraph}. Edge weights are co-occurrence counts.
 *
 * Nodes keep their insertion order, which makes iteration (and therefore every
 * derived table) deterministic. Instances are immutable; use {@link Builder}.
 */
public final class InteractionGraph {

    /**
     * One undirected edge, reported once with {@code source} as given when it was added.
     */
    public record Edge(String source, String target, int weight) {
    }

    private final Graph<String, DefaultWeightedEdge> graph;

    private InteractionGraph(Graph<String, DefaultWeightedEdge> graph) {
        this.graph = new AsUnmodifiableGraph<>(graph);
    }

    /**
     * Wrap a graph built elsewhere in this package (random graphs).
     */
    static InteractionGraph of(Graph<String, DefaultWeightedEdge> graph) {
        return new InteractionGraph(graph);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InteractionGraph empty() {
        return new Builder().build();
    }

    /**
     * Read-only JGraphT view for the graph algorithms.
     */
    public Graph<String, DefaultWeightedEdge> asGraph() {
        return graph;
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(graph.vertexSet());
    }

    public int nodeCount() {
        return graph.vertexSet().size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    public boolean isEmpty() {
        return graph.vertexSet().isEmpty();
    }

    public boolean containsNode(String node) {
        return graph.containsVertex(node);
    }

    public Set<String> neighbors(String node) {
        if (!graph.containsVertex(node)) {
            return Set.of();
        }
        return Collections.unmodifiableSet(Graphs.neighborSetOf(graph, node));
    }

    public int degree(String node) {
        return graph.containsVertex(node) ? graph.degreeOf(node) : 0;
    }

    public boolean hasEdge(String u, String v) {
        return weight(u, v) > 0;
    }

    /**
     * Weight of the edge between u and v, or 0 if there is none.
     */
    public int weight(String u, String v) {
        if (!graph.containsVertex(u) || !graph.containsVertex(v)) return 0;
        DefaultWeightedEdge e = graph.getEdge(u, v);
        return e != null ? (int) Math.round(graph.getEdgeWeight(e)) : 0;
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(graph.edgeSet().size());
        for (DefaultWeightedEdge e : graph.edgeSet()) {
            edges.add(new Edge(graph.getEdgeSource(e), graph.getEdgeTarget(e),
                (int) Math.round(graph.getEdgeWeight(e))));
        }
        return edges;
    }

    /**
     * Induced subgraph on the given nodes, keeping this graph's node order.
     */
    public InteractionGraph subgraph(Set<String> keep) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String node : graph.vertexSet()) {
            if (keep.contains(node)) {
                ordered.add(node);
            }
        }
        return new InteractionGraph(new AsSubgraph<>(graph, ordered));
    }

    @Override
    public String toString() {
        return String.format("InteractionGraph[%d nodes, %d edges]", nodeCount(), edgeCount());
    }

    /**
     * Mutable builder. Adding an edge adds missing endpoints; adding an existing
     * edge again increases its weight.
     */
    public static final class Builder {
        private final SimpleWeightedGraph<String, DefaultWeightedEdge> graph =
            new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
        private boolean built = false;

        public Builder addNode(String node) {
            checkNotBuilt();
            graph.addVertex(node);
            return this;
        }

        public Builder addEdge(String u, String v, int weight) {
            checkNotBuilt();
            if (u.equals(v)) {
                throw new IllegalArgumentException("Self-loops are not allowed: " + u);
            }
            if (weight < 1) {
                throw new IllegalArgumentException("Edge weight must be >= 1, got " + weight);
            }
            graph.addVertex(u);
            graph.addVertex(v);
            DefaultWeightedEdge existing = graph.getEdge(u, v);
            if (existing != null) {
                graph.setEdgeWeight(existing, graph.getEdgeWeight(existing) + weight);
            } else {
                Graphs.addEdge(graph, u, v, weight);
            }
            return this;
        }

        public boolean hasEdge(String u, String v) {
            return graph.containsVertex(u) && graph.containsVertex(v) && graph.containsEdge(u, v);
        }

        public int nodeCount() {
            return graph.vertexSet().size();
        }

        /**
         * Hand the graph over; the builder cannot be used afterwards.
         */
        public InteractionGraph build() {
            checkNotBuilt();
            built = true;
            return new InteractionGraph(graph);
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("Graph has already been built");
            }
        }
    }
}
