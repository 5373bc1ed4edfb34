package com.raditha.smells.config;

/**
 * Thresholds for the smell detectors.
 *
 * @param longMethodThreshold  Maximum non-empty lines before a function is a long method
 * @param parameterThreshold   Maximum parameters before a function has a long parameter list
 * @param windowSize           Statements per window for block duplicate detection
 * @param similarityThreshold  Minimum Jaccard similarity between duplicate blocks (0.0-1.0)
 * @param structuralThreshold  Similarity above which two functions are structurally alike (0.0-1.0)
 * @param aiService            Naming service settings
 */
public record SmellDetectorConfig(
        int longMethodThreshold,
        int parameterThreshold,
        int windowSize,
        double similarityThreshold,
        double structuralThreshold,
        AIServiceConfig aiService) {

    public SmellDetectorConfig {
        if (longMethodThreshold < 0) {
            throw new IllegalArgumentException("long_method_threshold must be >= 0");
        }
        if (parameterThreshold < 0) {
            throw new IllegalArgumentException("parameter_threshold must be >= 0");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("window_size must be >= 1");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarity_threshold must be between 0.0 and 1.0");
        }
        if (structuralThreshold < 0.0 || structuralThreshold > 1.0) {
            throw new IllegalArgumentException("structural_threshold must be between 0.0 and 1.0");
        }
        if (aiService == null) {
            aiService = AIServiceConfig.defaults();
        }
    }

    /**
     * Standard preset: 15 lines, 3 parameters, 2-statement windows at 75% similarity.
     */
    public static SmellDetectorConfig standard() {
        return new SmellDetectorConfig(15, 3, 2, 0.75, 0.80, AIServiceConfig.defaults());
    }

    /**
     * Strict preset: only near-identical duplicates (90%), longer windows.
     */
    public static SmellDetectorConfig strict() {
        return new SmellDetectorConfig(15, 3, 3, 0.90, 0.90, AIServiceConfig.defaults());
    }

    /**
     * Lenient preset: report looser duplicates (60%).
     */
    public static SmellDetectorConfig lenient() {
        return new SmellDetectorConfig(15, 3, 2, 0.60, 0.70, AIServiceConfig.defaults());
    }

    public static SmellDetectorConfig preset(String name) {
        if (name == null) {
            return standard();
        }
        return switch (name.toLowerCase()) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "standard" -> standard();
            default -> throw new IllegalArgumentException("Unknown preset: " + name);
        };
    }
}
