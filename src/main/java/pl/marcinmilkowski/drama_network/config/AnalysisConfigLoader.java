package pl.marcinmilkowski.drama_network.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads analysis settings from JSON.
 *
 * Expected JSON structure (every section and field except "version" is optional):
 * {
 *   "version": "1.0",
 *   "randomization": {
 *     "iterations": 1000,
 *     "fallback_iterations": 50,
 *     "path_length_attempts": 50,
 *     "seed": null
 *   },
 *   "corpus": { "threads": 4, "file_pattern": "*.xml" },
 *   "rendering": { "width": 1000, "height": 800, "layout_iterations": 200 }
 * }
 */
public class AnalysisConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "config/analysis.json";

    private final AnalysisConfig config;
    private final String source;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public AnalysisConfigLoader(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Analysis config file not found: " + configPath);
        }
        this.source = configPath.toString();
        this.config = parse(Files.readString(configPath), source);
        logger.info("Loaded analysis config version {} from {}", config.version(), source);
    }

    private AnalysisConfigLoader(String content, String source) {
        this.source = source;
        this.config = parse(content, source);
        logger.info("Loaded analysis config version {} from {}", config.version(), source);
    }

    /**
     * Load the configuration bundled with the application.
     */
    public static AnalysisConfigLoader createDefault() {
        try (InputStream in = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled analysis config not found: " + DEFAULT_RESOURCE);
            }
            return new AnalysisConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled analysis config: " + DEFAULT_RESOURCE, e);
        }
    }

    public static AnalysisConfigLoader fromJson(String content) {
        return new AnalysisConfigLoader(content, "inline");
    }

    static AnalysisConfig parse(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (RuntimeException e) {
            // truncated input can surface as a parser-internal exception instead of JSONException
            throw new IllegalArgumentException("Malformed analysis config " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty analysis config: " + source);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in analysis config");
        }

        AnalysisConfig defaults = AnalysisConfig.defaults();
        JSONObject randomization = section(root, "randomization");
        JSONObject corpus = section(root, "corpus");
        JSONObject rendering = section(root, "rendering");

        AnalysisConfig config = new AnalysisConfig(
            version,
            randomization.getIntValue("iterations", defaults.iterations()),
            randomization.getIntValue("fallback_iterations", defaults.fallbackIterations()),
            randomization.getIntValue("path_length_attempts", defaults.pathLengthAttempts()),
            randomization.getLong("seed"),
            corpus.getIntValue("threads", defaults.threads()),
            stringOrDefault(corpus, "file_pattern", defaults.filePattern()),
            rendering.getIntValue("width", defaults.width()),
            rendering.getIntValue("height", defaults.height()),
            rendering.getIntValue("layout_iterations", defaults.layoutIterations())
        );
        config.validate();
        return config;
    }

    private static JSONObject section(JSONObject root, String name) {
        JSONObject section = root.getJSONObject(name);
        return section != null ? section : new JSONObject();
    }

    private static String stringOrDefault(JSONObject obj, String key, String fallback) {
        String value = obj.getString(key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public String getSource() {
        return source;
    }

    /**
     * Effective analysis settings.
     */
    public record AnalysisConfig(
        String version,
        int iterations,            // Random graphs per play
        int fallbackIterations,    // Random graphs when path length came from the largest component
        int pathLengthAttempts,    // Draws per path length sample before giving up
        Long seed,                 // null = non-reproducible sampling
        int threads,
        String filePattern,
        int width,
        int height,
        int layoutIterations
    ) {

        public static AnalysisConfig defaults() {
            return new AnalysisConfig("1.0", 1000, 50, 50, null, 4, "*.xml", 1000, 800, 200);
        }

        public AnalysisConfig withIterations(int newIterations) {
            AnalysisConfig copy = new AnalysisConfig(version, newIterations, fallbackIterations, pathLengthAttempts,
                seed, threads, filePattern, width, height, layoutIterations);
            copy.validate();
            return copy;
        }

        public AnalysisConfig withSeed(Long newSeed) {
            return new AnalysisConfig(version, iterations, fallbackIterations, pathLengthAttempts,
                newSeed, threads, filePattern, width, height, layoutIterations);
        }

        public AnalysisConfig withThreads(int newThreads) {
            AnalysisConfig copy = new AnalysisConfig(version, iterations, fallbackIterations, pathLengthAttempts,
                seed, newThreads, filePattern, width, height, layoutIterations);
            copy.validate();
            return copy;
        }

        void validate() {
            requireAtLeast("randomization.iterations", iterations, 1);
            requireAtLeast("randomization.fallback_iterations", fallbackIterations, 1);
            requireAtLeast("randomization.path_length_attempts", pathLengthAttempts, 1);
            requireAtLeast("corpus.threads", threads, 1);
            requireAtLeast("rendering.width", width, 100);
            requireAtLeast("rendering.height", height, 100);
            requireAtLeast("rendering.layout_iterations", layoutIterations, 1);
        }

        private static void requireAtLeast(String field, int value, int min) {
            if (value < min) {
                throw new IllegalArgumentException("'" + field + "' must be >= " + min + ", got " + value);
            }
        }

        public JSONObject toJson() {
            JSONObject randomization = new JSONObject();
            randomization.put("iterations", iterations);
            randomization.put("fallback_iterations", fallbackIterations);
            randomization.put("path_length_attempts", pathLengthAttempts);
            randomization.put("seed", seed);

            JSONObject corpus = new JSONObject();
            corpus.put("threads", threads);
            corpus.put("file_pattern", filePattern);

            JSONObject rendering = new JSONObject();
            rendering.put("width", width);
            rendering.put("height", height);
            rendering.put("layout_iterations", layoutIterations);

            JSONObject root = new JSONObject();
            root.put("version", version);
            root.put("randomization", randomization);
            root.put("corpus", corpus);
            root.put("rendering", rendering);
            return root;
        }
    }
}
