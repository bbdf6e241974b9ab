package pl.marcinmilkowski.drama_network.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.analysis.CentralityMetric;
import pl.marcinmilkowski.drama_network.analysis.GraphMetricsSummary;
import pl.marcinmilkowski.drama_network.analysis.PlayAnalysis;
import pl.marcinmilkowski.drama_network.analysis.RankAggregator;
import pl.marcinmilkowski.drama_network.model.CharacterSelection;
import pl.marcinmilkowski.drama_network.model.PlayMetadata;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Corpus-wide tables: one row per play.
 */
public class CorpusExporter {

    private static final Logger logger = LoggerFactory.getLogger(CorpusExporter.class);

    public static final String CORPUS_METRICS_FILE = "corpus_metrics.csv";
    public static final String CENTRAL_CHARACTERS_FILE = "central_characters.csv";

    public static final List<String> METRICS_HEADER = List.of(
        "ID", "author", "title", "subtitle", "year", "genretitle", "filename",
        "charcount", "edgecount", "maxdegree", "avgdegree",
        "clustering_coefficient", "clustering_coefficient_random",
        "avgpathlength", "average_path_length_random", "density",
        "segment_count", "count_type", "all_in_index", "central_character_entry_index",
        "change_rate_mean", "change_rate_std", "final_scene_size_index",
        "central_character", "characters_last_in", "connected_components");

    public static final List<String> CENTRAL_HEADER = List.of(
        "ID", "author", "title", "year",
        "frequency", "degree", "betweenness", "closeness", "central");

    static List<Object> metricsRow(GraphMetricsSummary s) {
        PlayMetadata m = s.metadata();
        return Arrays.asList(
            s.id(), m.author(), m.title(), m.subtitle(), m.dateDefinite(), m.genretitle(), m.filename(),
            s.charcount(), s.edgecount(), s.maxdegree(), s.avgdegree(),
            s.clusteringCoefficient(), s.randcluster(),
            s.avgpathlength(), s.randavgpathl(), s.density(),
            m.segmentCount(), m.countType(), s.allInIndex(), s.centralCharacterEntryIndex(),
            s.changeRateMean(), s.changeRateStd(), s.finalSceneSizeIndex(),
            s.centralCharacter(), s.charactersLastIn(), s.connectedComponents());
    }

    static List<Object> centralRow(PlayAnalysis analysis) {
        PlayMetadata m = analysis.play().metadata();
        List<Object> row = new ArrayList<>(Arrays.asList(analysis.id(), m.author(), m.title(), m.dateDefinite()));
        for (String column : List.of(CentralityMetric.FREQUENCY.columnName(), CentralityMetric.DEGREE.columnName(),
                CentralityMetric.BETWEENNESS.columnName(), CentralityMetric.CLOSENESS.columnName(),
                RankAggregator.CENTRAL)) {
            CharacterSelection selection = analysis.topRanked().get(column);
            row.add(selection != null ? selection : CharacterSelection.none());
        }
        return row;
    }

    public Path writeCorpusMetrics(List<PlayAnalysis> analyses, Path outputFolder) throws IOException {
        Files.createDirectories(outputFolder);
        Path file = outputFolder.resolve(CORPUS_METRICS_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, METRICS_HEADER);
            for (PlayAnalysis analysis : analyses) {
                CsvFormat.writeRow(out, metricsRow(analysis.summary()));
            }
        }
        logger.info("Wrote corpus metrics for {} plays to {}", analyses.size(), file);
        return file;
    }

    public Path writeCentralCharacters(List<PlayAnalysis> analyses, Path outputFolder) throws IOException {
        Files.createDirectories(outputFolder);
        Path file = outputFolder.resolve(CENTRAL_CHARACTERS_FILE);
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, CENTRAL_HEADER);
            for (PlayAnalysis analysis : analyses) {
                CsvFormat.writeRow(out, centralRow(analysis));
            }
        }
        logger.info("Wrote central characters for {} plays to {}", analyses.size(), file);
        return file;
    }
}
