package com.partfinder.config;

import com.google.gson.Gson;
import com.google.maps.GeoApiContext;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(StoreLocatorProperties.class)
@Slf4j
public class AppConfig {

    @Value("${google.maps.api.key:}")
    private String googleMapsApiKey;

    /**
     * The geocoder skips this context when no maps key is configured.
     */
    @Bean
    public GeoApiContext geoApiContext(StoreLocatorProperties properties) {
        long timeoutMillis = properties.getCallTimeout().toMillis();
        return new GeoApiContext.Builder()
                .apiKey(googleMapsApiKey.isBlank() ? "unset" : googleMapsApiKey)
                .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    public OkHttpClient upstreamHttpClient(StoreLocatorProperties properties) {
        return new OkHttpClient.Builder()
                .callTimeout(properties.getCallTimeout())
                .connectTimeout(properties.getCallTimeout())
                .readTimeout(properties.getCallTimeout())
                .build();
    }

    @Bean
    public Gson gson() {
        return new Gson();
    }

    @Bean
    public HeuristicWeights heuristicWeights(StoreLocatorProperties properties) {
        return HeuristicWeights.defaults().toBuilder()
                .minLikelihood(properties.getSearch().getMinLikelihood())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor storeSearchExecutor(StoreLocatorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorPoolSize());
        executor.setMaxPoolSize(properties.getExecutorPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("store-search-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ApplicationRunner upstreamConfigurationReport(
            @Value("${gemini.api.key:}") String geminiApiKey,
            @Value("${google.places.api.key:${google.maps.api.key:}}") String placesApiKey) {
        return args -> {
            if (geminiApiKey.isBlank()) {
                log.warn("Gemini API key not found. Store types and availability will use heuristics.");
            }
            if (placesApiKey.isBlank()) {
                log.warn("Google Places API key not found. Store search will return synthetic fallback stores.");
            }
            if (googleMapsApiKey.isBlank()) {
                log.warn("Google Maps API key not found. ZIP codes resolve from the built-in table only.");
            }
        };
    }
}
