package pl.marcinmilkowski.drama_network.model;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CharacterSelectionTest {

    @Test
    @DisplayName("A single candidate is selected")
    void testSingle() {
        CharacterSelection s = CharacterSelection.fromCandidates(List.of("Nathan"));

        assertTrue(s.isSingle());
        assertEquals("Nathan", s.character().orElseThrow());
        assertEquals("Nathan", s.toString());
    }

    @Test
    @DisplayName("Several candidates render as SEVERAL")
    void testTie() {
        CharacterSelection s = CharacterSelection.fromCandidates(List.of("Nathan", "Saladin"));

        assertEquals(CharacterSelection.Kind.TIED, s.kind());
        assertTrue(s.character().isEmpty());
        assertEquals(List.of("Nathan", "Saladin"), s.characters());
        assertEquals("SEVERAL", s.toString());
    }

    @Test
    @DisplayName("No candidate at all is still a tie")
    void testEmptyCandidates() {
        CharacterSelection s = CharacterSelection.fromCandidates(List.of());
        assertEquals("SEVERAL", s.toString());
    }

    @Test
    @DisplayName("none() renders as NaN")
    void testNone() {
        CharacterSelection s = CharacterSelection.none();
        assertEquals(CharacterSelection.Kind.NONE, s.kind());
        assertEquals("NaN", s.toString());
    }
}
