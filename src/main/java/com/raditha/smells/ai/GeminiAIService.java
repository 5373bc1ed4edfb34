package com.raditha.smells.ai;

import com.raditha.smells.config.AIServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Minimal client for the Gemini {@code generateContent} endpoint.
 * Sends a JSON payload and returns the raw response body.
 */
public class GeminiAIService {
    private static final Logger logger = LoggerFactory.getLogger(GeminiAIService.class);

    private final HttpClient httpClient;
    private final AIServiceConfig config;

    public GeminiAIService(AIServiceConfig config) throws IOException {
        this(config, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.timeoutSeconds()))
                .build());
    }

    GeminiAIService(AIServiceConfig config, HttpClient httpClient) throws IOException {
        // fail fast when there is nothing to authenticate with
        if (!config.hasApiKey()) {
            throw new IOException(
                    "AI service API key is required. Set GEMINI_API_KEY environment variable or configure ai_service.api_key in "
                            + "smell-detector.yml");
        }
        this.config = config;
        this.httpClient = httpClient;
    }

    /**
     * Sends an API request to Gemini AI service.
     *
     * @param payload JSON request body
     * @return JSON response body
     * @throws IOException          on network failure or a non-200 response
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public String sendApiRequest(String payload) throws IOException, InterruptedException {
        String url = config.apiEndpoint().replace("{model}", config.model()) + "?key=" + config.apiKey();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .build();

        logger.debug("Calling model {}", config.model());
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException(
                    "API request failed with status: " + response.statusCode() + ", body: " + response.body());
        }

        return response.body();
    }
}
