package pl.marcinmilkowski.drama_network.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A play as delivered by a corpus reader: identifier, metadata, the declared
 * character universe and the ordered sequence of segments (scenes or acts),
 * each holding the canonical names of the characters speaking in it.
 *
 * Immutable. Segment and universe order is preserved.
 */
public record PlayRecord(
    String id,
    PlayMetadata metadata,
    List<String> universe,
    List<Set<String>> segments
) {

    public PlayRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Play id must not be blank");
        }
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Play " + id + " has no segments");
        }
        universe = List.copyOf(new LinkedHashSet<>(universe));
        List<Set<String>> copied = new ArrayList<>(segments.size());
        for (Set<String> segment : segments) {
            copied.add(Collections.unmodifiableSet(new LinkedHashSet<>(segment)));
        }
        segments = Collections.unmodifiableList(copied);
    }

    public static PlayRecord of(String id, List<String> universe, List<Set<String>> segments) {
        return new PlayRecord(id, PlayMetadata.untitled(id, segments.size()), universe, segments);
    }

    public String title() {
        return metadata.title() != null ? metadata.title() : id;
    }

    public int segmentCount() {
        return segments.size();
    }
}
