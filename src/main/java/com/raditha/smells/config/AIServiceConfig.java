package com.raditha.smells.config;

/**
 * Settings for the Gemini naming service.
 *
 * @param enabled        Whether helper names may be requested from the service at all
 * @param apiKey         API key, may be null when the service is not configured
 * @param apiEndpoint    Endpoint template, {@code {model}} is replaced by the model name
 * @param model          Model name
 * @param timeoutSeconds Connect and request timeout
 */
public record AIServiceConfig(
        boolean enabled,
        String apiKey,
        String apiEndpoint,
        String model,
        int timeoutSeconds) {

    public static final String DEFAULT_ENDPOINT =
            "https://generativelanguage.googleapis.com/v1beta/models/{model}:generateContent";
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    public AIServiceConfig {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeout_seconds must be >= 1");
        }
        if (apiEndpoint == null || apiEndpoint.isBlank()) {
            apiEndpoint = DEFAULT_ENDPOINT;
        }
        if (model == null || model.isBlank()) {
            model = DEFAULT_MODEL;
        }
    }

    /**
     * Defaults, with the key and endpoint taken from the environment when set.
     */
    public static AIServiceConfig defaults() {
        return new AIServiceConfig(true, env("GEMINI_API_KEY"), env("AI_SERVICE_ENDPOINT"),
                DEFAULT_MODEL, DEFAULT_TIMEOUT_SECONDS);
    }

    public static AIServiceConfig disabled() {
        return new AIServiceConfig(false, null, DEFAULT_ENDPOINT, DEFAULT_MODEL, DEFAULT_TIMEOUT_SECONDS);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Whether the service can actually be called.
     */
    public boolean isUsable() {
        return enabled && hasApiKey();
    }

    public AIServiceConfig withEnabled(boolean value) {
        return new AIServiceConfig(value, apiKey, apiEndpoint, model, timeoutSeconds);
    }

    static String env(String name) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? null : value;
    }

    @Override
    public String toString() {
        // keep the key out of logs
        return String.format("AIServiceConfig[enabled=%s, apiKey=%s, apiEndpoint=%s, model=%s, timeoutSeconds=%d]",
                enabled, hasApiKey() ? "***" : "<none>", apiEndpoint, model, timeoutSeconds);
    }
}
