package pl.marcinmilkowski.drama_network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.drama_network.analysis.PlayAnalysis;
import pl.marcinmilkowski.drama_network.config.AnalysisConfigLoader;
import pl.marcinmilkowski.drama_network.config.AnalysisConfigLoader.AnalysisConfig;
import pl.marcinmilkowski.drama_network.corpus.CorpusAnalyzer;
import pl.marcinmilkowski.drama_network.export.CorpusExporter;
import pl.marcinmilkowski.drama_network.export.PlayExporter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Main entry point for the Drama Network application.
 * Reads a folder of plays, analyzes their character networks and writes the result tables.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Options shared by all analysis commands.
     */
    static final class Options {
        String input;
        String output;
        String config;
        Integer iterations;
        Long seed;
        Integer threads;
    }

    public static void main(String[] args) {
        logger.info("Starting Drama Network application...");

        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "analyze":
                case "metrics":
                case "central":
                case "all":
                    Options options = parseOptions(args);
                    if (options == null) {
                        return;
                    }
                    run(command, options);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: " + command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    static Options parseOptions(String[] args) {
        Options options = new Options();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    options.input = args[++i];
                    break;
                case "--output":
                case "-o":
                    options.output = args[++i];
                    break;
                case "--config":
                case "-c":
                    options.config = args[++i];
                    break;
                case "--iterations":
                    options.iterations = Integer.parseInt(args[++i]);
                    break;
                case "--seed":
                    options.seed = Long.parseLong(args[++i]);
                    break;
                case "--threads":
                    options.threads = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (options.input == null || options.output == null) {
            System.err.println("Error: --input and --output are required");
            System.err.println("Usage: java -jar drama-network.jar " + args[0] + " --input <folder> --output <folder>");
            return null;
        }
        return options;
    }

    static AnalysisConfig loadConfig(Options options) throws IOException {
        AnalysisConfigLoader loader = options.config != null
            ? new AnalysisConfigLoader(Paths.get(options.config))
            : AnalysisConfigLoader.createDefault();
        AnalysisConfig config = loader.getConfig();
        if (options.iterations != null) {
            config = config.withIterations(options.iterations);
        }
        if (options.seed != null) {
            config = config.withSeed(options.seed);
        }
        if (options.threads != null) {
            config = config.withThreads(options.threads);
        }
        return config;
    }

    static void run(String command, Options options) throws IOException, InterruptedException {
        AnalysisConfig config = loadConfig(options);
        Path input = Paths.get(options.input);
        Path output = Paths.get(options.output);

        System.out.println("Input: " + input);
        System.out.println("Output: " + output);
        System.out.println("Random graphs per play: " + config.iterations());
        System.out.println();

        List<PlayAnalysis> analyses = new CorpusAnalyzer(config).analyzeAll(input);
        CorpusExporter corpusExporter = new CorpusExporter();

        if (command.equals("analyze") || command.equals("all")) {
            PlayExporter playExporter = new PlayExporter(config.width(), config.height(), config.layoutIterations());
            for (PlayAnalysis analysis : analyses) {
                playExporter.write(analysis, output);
            }
        }
        if (command.equals("metrics") || command.equals("all")) {
            corpusExporter.writeCorpusMetrics(analyses, output);
        }
        if (command.equals("central") || command.equals("all")) {
            corpusExporter.writeCentralCharacters(analyses, output);
        }

        System.out.println("Results:");
        System.out.println("--------");
        for (PlayAnalysis analysis : analyses) {
            System.out.printf("  %s (%s): chars=%d, edges=%d, central=%s%n",
                analysis.id(),
                analysis.play().title(),
                analysis.summary().charcount(),
                analysis.summary().edgecount(),
                analysis.summary().centralCharacter());
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar drama-network.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  analyze   - Write per-play tables, edge lists and network plots");
        System.out.println("  metrics   - Write corpus_metrics.csv (one row per play)");
        System.out.println("  central   - Write central_characters.csv (top characters per play)");
        System.out.println("  all       - All of the above");
        System.out.println("  help      - Show this help message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --input, -i <folder>    Folder with LINA XML plays (required)");
        System.out.println("  --output, -o <folder>   Output folder, created if missing (required)");
        System.out.println("  --config, -c <file>     Analysis config JSON (default: bundled config/analysis.json)");
        System.out.println("  --iterations <n>        Random graphs per play (overrides config)");
        System.out.println("  --seed <n>              Seed for reproducible random baselines");
        System.out.println("  --threads <n>           Plays analyzed in parallel");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar drama-network.jar all --input corpus/ --output results/");
        System.out.println("  java -jar drama-network.jar metrics -i corpus/ -o results/ --iterations 100 --seed 7");
    }
}
