package com.raditha.smells.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.smells.config.AIServiceConfig;
import com.raditha.smells.refactoring.NamingOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeminiNamingOracleTest {

    private static final String RESPONSE = """
            {"candidates":[{"content":{"parts":[{"text":"calculateTotal"}],"role":"model"}}]}
            """;

    private GeminiAIService service;
    private GeminiNamingOracle oracle;

    @BeforeEach
    void setUp() {
        service = mock(GeminiAIService.class);
        oracle = new GeminiNamingOracle(service);
    }

    @AfterEach
    void tearDown() {
        // clear any interrupt left by a test
        Thread.interrupted();
    }

    @Test
    void testExtractsSuggestedName() throws Exception {
        when(service.sendApiRequest(anyString())).thenReturn(RESPONSE);

        assertEquals(Optional.of("calculateTotal"), oracle.suggestName("int total = a + b;"));
    }

    @Test
    void testPayloadCarriesPrompt() throws Exception {
        when(service.sendApiRequest(anyString())).thenReturn(RESPONSE);

        oracle.suggestName("int total = a + b;");

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(service).sendApiRequest(payload.capture());
        JsonNode root = new ObjectMapper().readTree(payload.getValue());
        assertEquals("user", root.path("contents").path(0).path("role").asText());
        String prompt = root.path("contents").path(0).path("parts").path(0).path("text").asText();
        assertTrue(prompt.contains("int total = a + b;"));
        assertEquals(50, root.path("generationConfig").path("maxOutputTokens").asInt());
    }

    @Test
    void testLongSnippetIsTruncated() throws Exception {
        when(service.sendApiRequest(anyString())).thenReturn(RESPONSE);

        oracle.suggestName("x".repeat(2000));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(service).sendApiRequest(payload.capture());
        assertFalse(payload.getValue().contains("x".repeat(GeminiNamingOracle.MAX_SNIPPET_LENGTH + 1)));
    }

    @Test
    void testHttpFailureIsEmpty() throws Exception {
        when(service.sendApiRequest(anyString())).thenThrow(new IOException("API request failed with status: 500"));

        assertEquals(Optional.empty(), oracle.suggestName("a();"));
    }

    @Test
    void testInterruptIsEmptyAndRestoresFlag() throws Exception {
        when(service.sendApiRequest(anyString())).thenThrow(new InterruptedException());

        assertEquals(Optional.empty(), oracle.suggestName("a();"));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testMalformedResponseIsEmpty() throws Exception {
        when(service.sendApiRequest(anyString())).thenReturn("not json");
        assertEquals(Optional.empty(), oracle.suggestName("a();"));

        when(service.sendApiRequest(anyString())).thenReturn("{\"candidates\":[]}");
        assertEquals(Optional.empty(), oracle.suggestName("a();"));
    }

    @Test
    void testCreateWithoutKeyIsUnavailable() {
        AIServiceConfig config = new AIServiceConfig(true, null, null, null, 10);

        NamingOracle created = GeminiNamingOracle.create(config);

        assertFalse(created instanceof GeminiNamingOracle);
        assertEquals(Optional.empty(), created.suggestName("a();"));
    }

    @Test
    void testCreateDisabledIsUnavailable() {
        AIServiceConfig config = new AIServiceConfig(false, "key", null, null, 10);

        assertFalse(GeminiNamingOracle.create(config) instanceof GeminiNamingOracle);
    }

    @Test
    void testCreateWithKey() {
        AIServiceConfig config = new AIServiceConfig(true, "key", null, null, 10);

        assertTrue(GeminiNamingOracle.create(config) instanceof GeminiNamingOracle);
    }
}
