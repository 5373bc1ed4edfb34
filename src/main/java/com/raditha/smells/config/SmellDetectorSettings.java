package com.raditha.smells.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads detector configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML file > preset defaults
 */
public class SmellDetectorSettings {
    private static final Logger logger = LoggerFactory.getLogger(SmellDetectorSettings.class);

    public static final String DEFAULT_CONFIG_FILE = "smell-detector.yml";
    private static final String DETECTOR_KEY = "smell_detector";
    private static final String AI_KEY = "ai_service";

    private SmellDetectorSettings() {
    }

    /**
     * Values given on the command line. Null means "not given".
     *
     * @param longMethod       Long method threshold
     * @param maxParams        Parameter threshold
     * @param windowSize       Block window size
     * @param thresholdPercent Block similarity, 0-100
     * @param preset           Preset name
     * @param disableAI        Skip the naming service
     */
    public record CliOverrides(
            Integer longMethod,
            Integer maxParams,
            Integer windowSize,
            Integer thresholdPercent,
            String preset,
            boolean disableAI) {

        public static CliOverrides none() {
            return new CliOverrides(null, null, null, null, null, false);
        }
    }

    /**
     * Load configuration from a YAML file. A missing default file is not an error; a
     * missing explicitly named file is.
     *
     * @param configFile YAML file, or null to look for {@value #DEFAULT_CONFIG_FILE}
     */
    public static SmellDetectorConfig loadConfig(Path configFile, CliOverrides cli) throws IOException {
        Map<String, Object> yaml;
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            yaml = readYaml(configFile);
        } else {
            Path defaultFile = Path.of(DEFAULT_CONFIG_FILE);
            yaml = Files.exists(defaultFile) ? readYaml(defaultFile) : Map.of();
        }
        return loadConfig(yaml, cli);
    }

    /**
     * Build configuration from an already parsed YAML document.
     */
    public static SmellDetectorConfig loadConfig(Map<String, Object> yaml, CliOverrides cli) {
        Map<String, Object> detector = getMap(yaml, DETECTOR_KEY);

        String preset = cli.preset() != null ? cli.preset() : getString(detector, "preset", null);
        SmellDetectorConfig base = SmellDetectorConfig.preset(preset);

        int longMethod = cli.longMethod() != null ? cli.longMethod()
                : getInt(detector, "long_method_threshold", base.longMethodThreshold());
        int maxParams = cli.maxParams() != null ? cli.maxParams()
                : getInt(detector, "parameter_threshold", base.parameterThreshold());
        int window = cli.windowSize() != null ? cli.windowSize()
                : getInt(detector, "window_size", base.windowSize());
        double similarity = cli.thresholdPercent() != null ? cli.thresholdPercent() / 100.0
                : getDouble(detector, "similarity_threshold", base.similarityThreshold());
        double structural = getDouble(detector, "structural_threshold", base.structuralThreshold());

        AIServiceConfig ai = buildAiConfig(getMap(yaml, AI_KEY));
        if (cli.disableAI()) {
            ai = ai.withEnabled(false);
        }

        SmellDetectorConfig config = new SmellDetectorConfig(longMethod, maxParams, window, similarity, structural, ai);
        logger.debug("Effective configuration: {}", config);
        return config;
    }

    static Map<String, Object> readYaml(Path file) throws IOException {
        String text = Files.readString(file);
        if (text.isBlank()) {
            return Map.of();
        }
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        @SuppressWarnings("unchecked")
        Map<String, Object> document = yamlMapper.readValue(text, Map.class);
        return document == null ? Map.of() : document;
    }

    private static AIServiceConfig buildAiConfig(Map<String, Object> config) {
        AIServiceConfig defaults = AIServiceConfig.defaults();
        String apiKey = getString(config, "api_key", null);
        String endpoint = getString(config, "api_endpoint", null);
        return new AIServiceConfig(
                getBoolean(config, "enabled", defaults.enabled()),
                apiKey != null && !apiKey.isBlank() ? apiKey : defaults.apiKey(),
                endpoint != null ? endpoint : defaults.apiEndpoint(),
                getString(config, "model", defaults.model()),
                getInt(config, "timeout_seconds", defaults.timeoutSeconds()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
