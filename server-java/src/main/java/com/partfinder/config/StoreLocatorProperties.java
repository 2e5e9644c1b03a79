package com.partfinder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "store-locator")
public class StoreLocatorProperties {

    private Gemini gemini = new Gemini();
    private Places places = new Places();
    private Search search = new Search();
    private Ranking ranking = new Ranking();
    private Cache cache = new Cache();

    /** Per upstream HTTP call. */
    private Duration callTimeout = Duration.ofSeconds(10);
    /** Whole pipeline, after which the fallback stores are returned. */
    private Duration pipelineTimeout = Duration.ofSeconds(30);
    private int executorPoolSize = 8;

    @Data
    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-2.0-flash";
        private double temperature = 0.1;
    }

    @Data
    public static class Places {
        private String baseUrl = "https://places.googleapis.com/v1";
        private int maxResultCount = 20;
        private int maxRadiusMeters = 50_000;
    }

    @Data
    public static class Search {
        private double defaultMaxDistanceMiles = 5.0;
        private double maxDistanceMiles = 50.0;
        private int defaultResultCap = 5;
        private int maxResultCap = 10;
        private int minLikelihood = 60;
        private int oracleCandidateLimit = 15;
    }

    @Data
    public static class Ranking {
        private double penaltyPerMile = 5.0;
        private double tieBreakThreshold = 10.0;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(15);
        private long maxSize = 500;
    }
}
