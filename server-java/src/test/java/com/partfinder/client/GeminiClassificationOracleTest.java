package com.partfinder.client;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.MalformedResponseException;
import com.partfinder.exception.UpstreamUnavailableException;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeminiClassificationOracleTest {

    private final GeminiClassificationOracle oracle = new GeminiClassificationOracle(
            new OkHttpClient(), new Gson(), new StoreLocatorProperties(), "test-key");

    @Test
    void concatenatesTextPartsOfFirstCandidate() throws Exception {
        String body = """
                {"candidates": [{"content": {"parts": [{"text": "```json\\n[\\"hardware"}, {"text": "_store\\"]\\n```"}]}},
                                {"content": {"parts": [{"text": "ignored"}]}}]}
                """;

        assertEquals("```json\n[\"hardware_store\"]\n```", oracle.extractText(body));
    }

    @Test
    void envelopeWithoutCandidatesIsMalformed() {
        assertThrows(MalformedResponseException.class, () -> oracle.extractText("{\"candidates\": []}"));
        assertThrows(MalformedResponseException.class, () -> oracle.extractText("{\"promptFeedback\": {}}"));
        assertThrows(MalformedResponseException.class, () -> oracle.extractText("not json"));
    }

    @Test
    void requestCarriesPromptAndGenerationLimits() {
        JsonObject body = JsonParser.parseString(oracle.buildRequestBody("Classify this", 200)).getAsJsonObject();

        assertEquals("Classify this", body.getAsJsonArray("contents").get(0).getAsJsonObject()
                .getAsJsonArray("parts").get(0).getAsJsonObject().get("text").getAsString());
        assertEquals(200, body.getAsJsonObject("generationConfig").get("maxOutputTokens").getAsInt());
    }

    @Test
    void callsAreSkippedOnceTheSearchIsCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(UpstreamUnavailableException.class,
                () -> oracle.complete("prompt", 10, token));
    }
}
