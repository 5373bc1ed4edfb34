package com.raditha.smells.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.smells.config.AIServiceConfig;
import com.raditha.smells.refactoring.NamingOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Asks Gemini for a method name describing a code snippet.
 * <p>
 * Every failure (missing key, timeout, network error, unexpected response) is logged
 * and answered with an empty result.
 */
public class GeminiNamingOracle implements NamingOracle {
    private static final Logger logger = LoggerFactory.getLogger(GeminiNamingOracle.class);

    static final int MAX_SNIPPET_LENGTH = 500;

    private final GeminiAIService aiService;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiNamingOracle(GeminiAIService aiService) {
        this.aiService = aiService;
    }

    /**
     * Oracle for the given settings: Gemini when enabled and configured with a key,
     * otherwise one that never answers.
     */
    public static NamingOracle create(AIServiceConfig config) {
        if (!config.isUsable()) {
            logger.info("AI naming disabled; extracted methods get default names");
            return NamingOracle.unavailable();
        }
        try {
            return new GeminiNamingOracle(new GeminiAIService(config));
        } catch (IOException e) {
            logger.warn("AI naming unavailable: {}", e.getMessage());
            return NamingOracle.unavailable();
        }
    }

    @Override
    public Optional<String> suggestName(String snippet) {
        String code = snippet.length() > MAX_SNIPPET_LENGTH
                ? snippet.substring(0, MAX_SNIPPET_LENGTH) + "..."
                : snippet;
        try {
            String response = aiService.sendApiRequest(buildPayload(buildNamingPrompt(code)));
            return extractText(response);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Naming request interrupted");
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            logger.warn("Naming request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String buildNamingPrompt(String code) {
        return "Suggest a concise Java method name for this code snippet. "
                + "Return ONLY the method name in camelCase, no explanation, no quotes, no punctuation.\n\n"
                + "Code:\n" + code + "\n\nMethod name:";
    }

    String buildPayload(String prompt) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        ObjectNode content = contents.addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);
        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("temperature", 0.3);
        generationConfig.put("maxOutputTokens", 50);
        return mapper.writeValueAsString(root);
    }

    /**
     * Response format: {"candidates":[{"content":{"parts":[{"text":"..."}]}}]}
     */
    Optional<String> extractText(String responseBody) throws IOException {
        JsonNode text = mapper.readTree(responseBody)
                .path("candidates").path(0)
                .path("content").path("parts").path(0)
                .path("text");
        if (!text.isTextual() || text.asText().isBlank()) {
            logger.debug("Naming response had no text: {}", responseBody);
            return Optional.empty();
        }
        return Optional.of(text.asText());
    }
}
