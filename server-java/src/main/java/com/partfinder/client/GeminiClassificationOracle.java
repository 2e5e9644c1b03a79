package com.partfinder.client;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.MalformedResponseException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Slf4j
public class GeminiClassificationOracle implements ClassificationOracle {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final Gson gson;
    private final StoreLocatorProperties.Gemini settings;
    private final String apiKey;

    public GeminiClassificationOracle(
            OkHttpClient upstreamHttpClient,
            Gson gson,
            StoreLocatorProperties properties,
            @Value("${gemini.api.key:}") String apiKey
    ) {
        this.httpClient = upstreamHttpClient;
        this.gson = gson;
        this.settings = properties.getGemini();
        this.apiKey = apiKey;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(String prompt, int maxOutputTokens, CancellationToken token) throws IOException {
        String url = settings.getBaseUrl() + "/models/" + settings.getModel() + ":generateContent?key=" + apiKey;
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(buildRequestBody(prompt, maxOutputTokens), JSON))
                .build();

        String responseBody = UpstreamCalls.execute(httpClient, request, token, "Gemini API");
        return extractText(responseBody);
    }

    String buildRequestBody(String prompt, int maxOutputTokens) {
        JsonObject textPart = new JsonObject();
        textPart.addProperty("text", prompt);
        JsonArray parts = new JsonArray();
        parts.add(textPart);

        JsonObject content = new JsonObject();
        content.addProperty("role", "user");
        content.add("parts", parts);
        JsonArray contents = new JsonArray();
        contents.add(content);

        JsonObject generationConfig = new JsonObject();
        generationConfig.addProperty("temperature", settings.getTemperature());
        generationConfig.addProperty("maxOutputTokens", maxOutputTokens);

        JsonObject body = new JsonObject();
        body.add("contents", contents);
        body.add("generationConfig", generationConfig);
        return gson.toJson(body);
    }

    /**
     * Pulls the generated text out of a generateContent envelope.
     */
    String extractText(String responseBody) throws MalformedResponseException {
        try {
            JsonObject envelope = JsonParser.parseString(responseBody).getAsJsonObject();
            JsonArray candidates = envelope.getAsJsonArray("candidates");
            if (candidates == null || candidates.isEmpty()) {
                throw new MalformedResponseException("Gemini response has no candidates");
            }
            JsonArray parts = candidates.get(0).getAsJsonObject()
                    .getAsJsonObject("content")
                    .getAsJsonArray("parts");
            StringBuilder text = new StringBuilder();
            parts.forEach(part -> {
                JsonObject partObject = part.getAsJsonObject();
                if (partObject.has("text")) {
                    text.append(partObject.get("text").getAsString());
                }
            });
            log.debug("Gemini extracted text: {}", text);
            return text.toString();
        } catch (RuntimeException e) {
            throw new MalformedResponseException("Failed to parse Gemini response: " + e.getMessage(), e);
        }
    }
}
