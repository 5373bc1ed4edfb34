package com.raditha.smells.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Configuration priority: CLI > YAML > defaults.
 */
class SmellDetectorSettingsTest {

    @Test
    void testDefaultsWithoutYaml() {
        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(Map.of(),
                SmellDetectorSettings.CliOverrides.none());

        assertEquals(15, config.longMethodThreshold());
        assertEquals(3, config.parameterThreshold());
        assertEquals(2, config.windowSize());
        assertEquals(0.75, config.similarityThreshold());
        assertEquals(0.80, config.structuralThreshold());
    }

    @Test
    void testYamlOverridesDefaults() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of(
                "long_method_threshold", 30,
                "similarity_threshold", 0.9));

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(yaml, SmellDetectorSettings.CliOverrides.none());

        assertEquals(30, config.longMethodThreshold());
        assertEquals(0.9, config.similarityThreshold());
        assertEquals(3, config.parameterThreshold());
    }

    @Test
    void testCliOverridesYaml() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of(
                "long_method_threshold", 30,
                "parameter_threshold", 6,
                "window_size", 4));
        SmellDetectorSettings.CliOverrides cli = new SmellDetectorSettings.CliOverrides(10, null, 3, 80, null, false);

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(yaml, cli);

        assertEquals(10, config.longMethodThreshold());
        assertEquals(6, config.parameterThreshold());
        assertEquals(3, config.windowSize());
        assertEquals(0.80, config.similarityThreshold(), 1e-9);
    }

    @Test
    void testZeroFromCliIsAValue() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of(
                "long_method_threshold", 30,
                "similarity_threshold", 0.9));
        SmellDetectorSettings.CliOverrides cli = new SmellDetectorSettings.CliOverrides(0, null, null, 0, null, false);

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(yaml, cli);

        assertEquals(0, config.longMethodThreshold());
        assertEquals(0.0, config.similarityThreshold());
    }

    @Test
    void testPresetFromCliBeatsYamlPreset() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of("preset", "lenient"));
        SmellDetectorSettings.CliOverrides cli = new SmellDetectorSettings.CliOverrides(null, null, null, null, "strict", false);

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(yaml, cli);

        assertEquals(SmellDetectorConfig.strict().similarityThreshold(), config.similarityThreshold());
        assertEquals(3, config.windowSize());
    }

    @Test
    void testUnknownPreset() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of("preset", "extreme"));

        assertThrows(IllegalArgumentException.class,
                () -> SmellDetectorSettings.loadConfig(yaml, SmellDetectorSettings.CliOverrides.none()));
    }

    @Test
    void testInvalidValueRejected() {
        Map<String, Object> yaml = Map.of("smell_detector", Map.of("window_size", 0));

        assertThrows(IllegalArgumentException.class,
                () -> SmellDetectorSettings.loadConfig(yaml, SmellDetectorSettings.CliOverrides.none()));
    }

    @Test
    void testAiSettings() {
        Map<String, Object> yaml = Map.of("ai_service", Map.of(
                "enabled", true,
                "api_key", "from-yaml",
                "model", "gemini-test",
                "timeout_seconds", 3));

        AIServiceConfig ai = SmellDetectorSettings.loadConfig(yaml, SmellDetectorSettings.CliOverrides.none()).aiService();

        assertTrue(ai.isUsable());
        assertEquals("gemini-test", ai.model());
        assertEquals(3, ai.timeoutSeconds());
        assertFalse(ai.toString().contains("from-yaml"));
    }

    @Test
    void testNoAiFlagDisablesService() {
        Map<String, Object> yaml = Map.of("ai_service", Map.of("api_key", "from-yaml"));
        SmellDetectorSettings.CliOverrides cli = new SmellDetectorSettings.CliOverrides(null, null, null, null, null, true);

        AIServiceConfig ai = SmellDetectorSettings.loadConfig(yaml, cli).aiService();

        assertFalse(ai.enabled());
        assertFalse(ai.isUsable());
    }

    @Test
    void testLoadFromFile() throws IOException, URISyntaxException {
        Path file = Path.of(getClass().getResource("/smell-detector-test.yml").toURI());

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(file, SmellDetectorSettings.CliOverrides.none());

        assertEquals(20, config.longMethodThreshold());
        assertEquals(4, config.parameterThreshold());
        assertEquals(3, config.windowSize());
        assertEquals(SmellDetectorConfig.lenient().similarityThreshold(), config.similarityThreshold());
        assertFalse(config.aiService().enabled());
    }

    @Test
    void testMissingExplicitFile(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("absent.yml");

        assertThrows(IllegalArgumentException.class,
                () -> SmellDetectorSettings.loadConfig(missing, SmellDetectorSettings.CliOverrides.none()));
    }

    @Test
    void testEmptyFile(@TempDir Path tempDir) throws IOException {
        Path empty = tempDir.resolve("empty.yml");
        Files.writeString(empty, "");

        SmellDetectorConfig config = SmellDetectorSettings.loadConfig(empty, SmellDetectorSettings.CliOverrides.none());

        assertEquals(15, config.longMethodThreshold());
    }
}
