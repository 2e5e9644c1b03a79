package com.partfinder.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.partfinder.client.CancellationToken;
import com.partfinder.client.ClassificationOracle;
import com.partfinder.client.OracleJsonExtractor;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.model.StoreTypeTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which kinds of stores to search for a part.
 */
@Service
@Slf4j
public class StoreTypeClassifier {

    static final int MAX_TAGS = 4;

    private static final String PROMPT = """
        You are an expert in appliance parts retail. I need to find stores that carry this specific appliance part:

        Part: %s
        Category: %s

        Return ONLY a JSON array of store types that would SPECIFICALLY carry appliance parts like this.
        Choose from these values only:
        - hardware_store (Home Depot, Lowe's, Ace Hardware)
        - home_goods_store (appliance sections)
        - electronics_store (for electronic appliance parts)
        - generic_store (general stores, only if appliance-related)

        Do not include restaurants, clothing stores, salons, gas stations, banks or similar businesses.

        Example response: ["hardware_store", "home_goods_store"]
        """;

    private final ClassificationOracle oracle;
    private final Cache<String, List<StoreTypeTag>> cache;

    public StoreTypeClassifier(ClassificationOracle oracle, StoreLocatorProperties properties) {
        this.oracle = oracle;
        this.cache = properties.getCache().isEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(properties.getCache().getMaxSize())
                        .expireAfterWrite(properties.getCache().getTtl())
                        .<String, List<StoreTypeTag>>build()
                : null;
    }

    public List<StoreTypeTag> classify(String partName, String partCategory) {
        return classify(partName, partCategory, CancellationToken.none());
    }

    /**
     * Always returns between one and four tags. Any oracle problem yields the full
     * tag set so that the search casts the widest net.
     */
    public List<StoreTypeTag> classify(String partName, String partCategory, CancellationToken token) {
        if (!oracle.isAvailable()) {
            log.warn("Classification oracle not configured, using fallback store types");
            return fallbackTags();
        }

        String key = normalize(partName) + "|" + normalize(partCategory);
        List<StoreTypeTag> cached = cache != null ? cache.getIfPresent(key) : null;
        if (cached != null) {
            return cached;
        }

        String category = partCategory == null || partCategory.isBlank() ? "Unknown" : partCategory;
        try {
            String answer = oracle.complete(String.format(PROMPT, partName, category), 200, token);
            List<StoreTypeTag> tags = parseTags(OracleJsonExtractor.firstArray(answer, OracleJsonExtractor::containsString));
            if (tags.isEmpty()) {
                log.warn("Oracle returned no recognised store types for '{}', using fallback", partName);
                return fallbackTags();
            }
            log.info("Oracle store types for '{}': {}", partName, tags);
            if (cache != null) {
                cache.put(key, tags);
            }
            return tags;
        } catch (IOException e) {
            log.warn("Store type classification failed for '{}', using fallback: {}", partName, e.getMessage());
            return fallbackTags();
        }
    }

    static List<StoreTypeTag> parseTags(JsonArray array) {
        Set<StoreTypeTag> tags = new LinkedHashSet<>();
        for (JsonElement element : array) {
            if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                StoreTypeTag.fromValue(element.getAsString()).ifPresentOrElse(
                        tags::add,
                        () -> log.debug("Dropping unknown store type '{}'", element.getAsString()));
            }
            if (tags.size() == MAX_TAGS) {
                break;
            }
        }
        return List.copyOf(tags);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static List<StoreTypeTag> fallbackTags() {
        return StoreTypeTag.all();
    }
}
