package pl.marcinmilkowski.drama_network.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the character interaction graph of a play from its segment sequence.
 *
 * <p>The segments and the characters form a bipartite graph (segment i is linked
 * to every character speaking in it). Projecting it onto the characters links
 * two characters whenever they share a segment, weighted by the number of
 * segments they share.</p>
 *
 * <p>Characters that never speak do not enter the bipartite graph and are
 * therefore absent from the projection, even when declared in the dramatis
 * personae.</p>
 */
public class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * Segment/character incidence. Segment nodes are the segment indices.
     */
    static final class BipartiteGraph {
        final Map<Integer, Set<String>> charactersBySegment = new LinkedHashMap<>();
        final Map<String, Set<Integer>> segmentsByCharacter = new LinkedHashMap<>();

        void addSegment(int segment) {
            charactersBySegment.computeIfAbsent(segment, k -> new LinkedHashSet<>());
        }

        void addIncidence(int segment, String character) {
            addSegment(segment);
            charactersBySegment.get(segment).add(character);
            segmentsByCharacter.computeIfAbsent(character, k -> new LinkedHashSet<>()).add(segment);
        }
    }

    public InteractionGraph build(List<Set<String>> segments) {
        BipartiteGraph bipartite = toBipartite(segments);
        InteractionGraph graph = project(bipartite);
        logger.debug("Projected {} segments onto {} characters, {} edges",
            segments.size(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    static BipartiteGraph toBipartite(List<Set<String>> segments) {
        BipartiteGraph bipartite = new BipartiteGraph();
        for (int i = 0; i < segments.size(); i++) {
            bipartite.addSegment(i);
            for (String character : segments.get(i)) {
                bipartite.addIncidence(i, character);
            }
        }
        return bipartite;
    }

    /**
     * Weighted projection onto the character side.
     */
    static InteractionGraph project(BipartiteGraph bipartite) {
        InteractionGraph.Builder builder = InteractionGraph.builder();
        List<String> characters = new ArrayList<>(bipartite.segmentsByCharacter.keySet());
        for (String character : characters) {
            builder.addNode(character);
        }

        for (String u : characters) {
            Map<String, Integer> shared = new LinkedHashMap<>();
            for (int segment : bipartite.segmentsByCharacter.get(u)) {
                for (String v : bipartite.charactersBySegment.get(segment)) {
                    if (!v.equals(u)) {
                        shared.merge(v, 1, Integer::sum);
                    }
                }
            }
            for (Map.Entry<String, Integer> entry : shared.entrySet()) {
                if (!builder.hasEdge(u, entry.getKey())) {
                    builder.addEdge(u, entry.getKey(), entry.getValue());
                }
            }
        }
        return builder.build();
    }
}
