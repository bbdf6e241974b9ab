package pl.marcinmilkowski.drama_network.export;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.analysis.CentralityMetric;
import pl.marcinmilkowski.drama_network.analysis.CharacterMetrics;
import pl.marcinmilkowski.drama_network.analysis.PlayAnalysis;
import pl.marcinmilkowski.drama_network.graph.InteractionGraph;
import pl.marcinmilkowski.drama_network.viz.NetworkLayout;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the per-play outputs: graph metrics, character table, change rates,
 * edge list, JSON summary and SVG network plot.
 */
public class PlayExporter {

    private static final Logger logger = LoggerFactory.getLogger(PlayExporter.class);

    public static final List<String> CHARACTER_HEADER = characterHeader();

    private final int width;
    private final int height;
    private final int layoutIterations;

    public PlayExporter(int width, int height, int layoutIterations) {
        this.width = width;
        this.height = height;
        this.layoutIterations = layoutIterations;
    }

    private static List<String> characterHeader() {
        List<String> header = new ArrayList<>(List.of("name", "frequency", "degree", "betweenness", "closeness"));
        for (CentralityMetric metric : CentralityMetric.values()) {
            header.add(metric.rankColumnName());
        }
        header.add("avg_centrality_rank");
        header.add("composite_centrality");
        return List.copyOf(header);
    }

    /**
     * Write every per-play file into the output folder, creating it if needed.
     *
     * @return the files written
     */
    public List<Path> write(PlayAnalysis analysis, Path outputFolder) throws IOException {
        Files.createDirectories(outputFolder);
        String prefix = CsvFormat.safeFileName(analysis.id() + "_" + analysis.play().title());

        List<Path> written = new ArrayList<>();
        written.add(writeGraphMetrics(analysis, outputFolder.resolve(prefix + "_graph.csv")));
        written.add(writeCharacters(analysis, outputFolder.resolve(prefix + "_chars.csv")));
        written.add(writeChangeRates(analysis.changeRates(), outputFolder.resolve(prefix + "_change_rates.csv")));
        written.add(writeEdgeList(analysis.graph(), outputFolder.resolve(prefix + "_edgelist.csv")));
        written.add(writeJson(analysis, outputFolder.resolve(prefix + ".json")));
        written.add(writeSvg(analysis.graph(), outputFolder.resolve(prefix + ".svg")));

        logger.info("Wrote {} files for {} to {}", written.size(), analysis.id(), outputFolder);
        return written;
    }

    public Path writeGraphMetrics(PlayAnalysis analysis, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, CorpusExporter.METRICS_HEADER);
            CsvFormat.writeRow(out, CorpusExporter.metricsRow(analysis.summary()));
        }
        return file;
    }

    public Path writeCharacters(PlayAnalysis analysis, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, CHARACTER_HEADER);
            for (CharacterMetrics row : analysis.characters().rows()) {
                CharacterMetrics.Ranks ranks = row.ranks();
                List<Object> fields = new ArrayList<>(List.of(
                    row.character(), row.frequency(), row.degree(), row.betweenness(), row.closeness()));
                for (CentralityMetric metric : CentralityMetric.values()) {
                    fields.add(metric.rankOf(ranks));
                }
                fields.add(ranks.avgCentrality());
                fields.add(ranks.composite());
                CsvFormat.writeRow(out, fields);
            }
        }
        return file;
    }

    /**
     * One row per pair of consecutive segments, numbered from 1.
     */
    public Path writeChangeRates(List<Double> changeRates, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, List.of("segment", "change_rate"));
            for (int i = 0; i < changeRates.size(); i++) {
                CsvFormat.writeRow(out, List.of(i + 1, changeRates.get(i)));
            }
        }
        return file;
    }

    public Path writeEdgeList(InteractionGraph graph, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvFormat.writeRow(out, List.of("source", "target", "weight"));
            for (InteractionGraph.Edge edge : graph.edges()) {
                CsvFormat.writeRow(out, List.of(edge.source(), edge.target(), edge.weight()));
            }
        }
        return file;
    }

    public Path writeJson(PlayAnalysis analysis, Path file) throws IOException {
        String json = JSON.toJSONString(analysis.summary().toJson(), JSONWriter.Feature.PrettyFormat);
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    public Path writeSvg(InteractionGraph graph, Path file) throws IOException {
        NetworkLayout layout = new NetworkLayout(graph, width, height);
        layout.compute(layoutIterations);
        Files.writeString(file, layout.toSVG(), StandardCharsets.UTF_8);
        return file;
    }
}
