package pl.marcinmilkowski.drama_network.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.analysis.PlayAnalysis;
import pl.marcinmilkowski.drama_network.analysis.PlayAnalyzer;
import pl.marcinmilkowski.drama_network.config.AnalysisConfigLoader.AnalysisConfig;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes every play of a corpus folder on a fixed thread pool.
 *
 * A play that cannot be read or analyzed is logged and left out; the others
 * are still returned, in file name order.
 */
public class CorpusAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CorpusAnalyzer.class);

    private final AnalysisConfig config;
    private final LinaReader reader;
    private final PlayAnalyzer analyzer;

    public CorpusAnalyzer(AnalysisConfig config) {
        this(config, new LinaReader(), new PlayAnalyzer(config));
    }

    CorpusAnalyzer(AnalysisConfig config, LinaReader reader, PlayAnalyzer analyzer) {
        this.config = config;
        this.reader = reader;
        this.analyzer = analyzer;
    }

    /**
     * Play files in the folder matching the configured pattern, sorted by name.
     */
    public List<Path> listPlays(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Corpus folder not found: " + folder);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, config.filePattern())) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }

    public List<PlayAnalysis> analyzeAll(Path folder) throws IOException, InterruptedException {
        List<Path> files = listPlays(folder);
        logger.info("Analyzing {} plays from {} with {} threads", files.size(), folder, config.threads());

        AtomicInteger processed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(config.threads());
        List<Future<PlayAnalysis>> futures = new ArrayList<>();
        try {
            for (Path file : files) {
                futures.add(executor.submit(() -> {
                    PlayAnalysis analysis = analyzer.analyze(reader.read(file));
                    int count = processed.incrementAndGet();
                    if (count % 10 == 0) {
                        logger.info("Progress: {}/{} plays analyzed", count, files.size());
                    }
                    return analysis;
                }));
            }

            List<PlayAnalysis> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException ee) {
                    logger.error("Failed to analyze '{}', skipping", files.get(i).getFileName(), ee.getCause());
                }
            }
            logger.info("Analyzed {}/{} plays", results.size(), files.size());
            return results;
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        }
    }
}
