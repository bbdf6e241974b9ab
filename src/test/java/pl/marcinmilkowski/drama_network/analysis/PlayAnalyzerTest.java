package pl.marcinmilkowski.drama_network.analysis;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.drama_network.TestPlays;
import pl.marcinmilkowski.drama_network.config.AnalysisConfigLoader.AnalysisConfig;
import pl.marcinmilkowski.drama_network.model.CharacterSelection;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for PlayAnalyzer on small plays.
 */
class PlayAnalyzerTest {

    private PlayAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PlayAnalyzer(AnalysisConfig.defaults().withIterations(20).withSeed(7L));
    }

    @Test
    @DisplayName("Triangle play summary")
    void testTriangleSummary() {
        PlayAnalysis analysis = analyzer.analyze(TestPlays.triangle());
        GraphMetricsSummary s = analysis.summary();

        assertEquals("triangle", analysis.id());
        assertEquals(3, s.charcount());
        assertEquals(3, s.edgecount());
        assertEquals(2.0, s.maxdegree().value(), 1e-12);
        assertEquals(1.0, s.density().value(), 1e-12);
        assertEquals(1.0, s.avgpathlength().value(), 1e-12);
        assertEquals(1.0, s.clusteringCoefficient().value(), 1e-12);
        assertEquals(1.0, s.randcluster().value(), 1e-12);
        assertEquals(1.0, s.randavgpathl().value(), 1e-12);
        assertEquals(2.0 / 3.0, s.allInIndex().value(), 1e-12);
        assertEquals("SEVERAL", s.centralCharacter().toString());
        assertFalse(s.centralCharacterEntryIndex().isDefined());
        assertEquals("A,C", s.charactersLastIn());

        assertEquals(20, analysis.baseline().iterations());
        assertEquals(2, analysis.changeRates().size());
        assertTrue(analysis.characters().isRanked());
        assertEquals(3, analysis.characters().size());
    }

    @Test
    @DisplayName("Path play has a single central character")
    void testPathCentral() {
        PlayAnalysis analysis = analyzer.analyze(TestPlays.path());

        assertEquals(CharacterSelection.single("B"), analysis.summary().centralCharacter());
        assertEquals(0.5, analysis.summary().centralCharacterEntryIndex().value(), 1e-12);
        assertEquals(CharacterSelection.single("B"), analysis.topRanked().get(RankAggregator.CENTRAL));
    }

    @Test
    @DisplayName("Disconnected play uses the largest component and fewer random graphs")
    void testDisconnectedFallback() {
        PlayAnalysis analysis = analyzer.analyze(TestPlays.disconnected());

        assertEquals(2, analysis.summary().connectedComponents());
        assertEquals(1.0, analysis.summary().avgpathlength().value(), 1e-12);
        assertEquals(analyzer.getConfig().fallbackIterations(), analysis.baseline().iterations());
    }

    @Test
    @DisplayName("Seeded analysis is reproducible")
    void testReproducible() {
        PlayAnalysis first = analyzer.analyze(TestPlays.disconnected());
        PlayAnalysis second = analyzer.analyze(TestPlays.disconnected());

        assertEquals(first.baseline(), second.baseline());
        assertEquals(first.summary(), second.summary());
    }

    @Test
    @DisplayName("Summary JSON renders undefined values as NaN")
    void testSummaryJson() {
        String json = analyzer.analyze(TestPlays.triangle()).summary().toJson().toJSONString();

        assertTrue(json.contains("\"central_character\":\"SEVERAL\""));
        assertTrue(json.contains("\"central_character_entry_index\":\"NaN\""));
        assertTrue(json.contains("\"charcount\":3"));
    }
}
