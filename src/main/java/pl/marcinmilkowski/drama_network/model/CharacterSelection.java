package pl.marcinmilkowski.drama_network.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of picking "the" top character of a play.
 *
 * A tie is a regular outcome and renders as {@code SEVERAL}. {@link Kind#NONE}
 * is used when there is nothing to choose from (a play without characters).
 */
public record CharacterSelection(Kind kind, List<String> characters) {

    public static final String SEVERAL = "SEVERAL";

    public enum Kind { SINGLE, TIED, NONE }

    public CharacterSelection {
        characters = List.copyOf(characters);
    }

    public static CharacterSelection single(String character) {
        return new CharacterSelection(Kind.SINGLE, List.of(character));
    }

    /**
     * A tie between the given characters. The list may be empty when no
     * character matched uniquely at all; it still renders as SEVERAL.
     */
    public static CharacterSelection tied(List<String> characters) {
        return new CharacterSelection(Kind.TIED, characters);
    }

    public static CharacterSelection none() {
        return new CharacterSelection(Kind.NONE, List.of());
    }

    /**
     * Single character if exactly one candidate, a tie otherwise.
     */
    public static CharacterSelection fromCandidates(List<String> candidates) {
        if (candidates.size() == 1) {
            return single(candidates.get(0));
        }
        return tied(candidates);
    }

    public boolean isSingle() {
        return kind == Kind.SINGLE;
    }

    public Optional<String> character() {
        return isSingle() ? Optional.of(characters.get(0)) : Optional.empty();
    }

    @Override
    public String toString() {
        switch (kind) {
            case SINGLE:
                return characters.get(0);
            case TIED:
                return SEVERAL;
            default:
                return MetricValue.NAN;
        }
    }
}
