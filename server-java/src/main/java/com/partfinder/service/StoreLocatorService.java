package com.partfinder.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.partfinder.client.CancellationToken;
import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.InvalidSearchRequestException;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.Part;
import com.partfinder.model.RankedStore;
import com.partfinder.model.SearchRequest;
import com.partfinder.model.StoreSearchResult;
import com.partfinder.model.StoreTypeTag;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the store search pipeline: classify the part, search for candidates, verify
 * availability, enforce the distance budget, rank and price. Upstream failures never
 * reach the caller; only an invalid request does.
 */
@Service
@Slf4j
public class StoreLocatorService {

    static final String FALLBACK_ADVISORY =
            "Live store data is unavailable. Showing typical stores that carry appliance parts; call ahead to confirm.";

    private final StoreTypeClassifier classifier;
    private final CandidateSearchClient searchClient;
    private final AvailabilityVerifier verifier;
    private final DistanceFilter distanceFilter;
    private final RelevanceRanker ranker;
    private final PricingEstimator pricingEstimator;
    private final FallbackStoreGenerator fallbackStoreGenerator;
    private final Executor executor;
    private final Duration pipelineTimeout;
    private final double maxDistanceLimit;
    private final Cache<SearchKey, VerifiedCandidates> cache;

    public StoreLocatorService(StoreTypeClassifier classifier,
                               CandidateSearchClient searchClient,
                               AvailabilityVerifier verifier,
                               DistanceFilter distanceFilter,
                               RelevanceRanker ranker,
                               PricingEstimator pricingEstimator,
                               FallbackStoreGenerator fallbackStoreGenerator,
                               StoreLocatorProperties properties,
                               @Qualifier("storeSearchExecutor") Executor executor) {
        this.classifier = classifier;
        this.searchClient = searchClient;
        this.verifier = verifier;
        this.distanceFilter = distanceFilter;
        this.ranker = ranker;
        this.pricingEstimator = pricingEstimator;
        this.fallbackStoreGenerator = fallbackStoreGenerator;
        this.executor = executor;
        this.pipelineTimeout = properties.getPipelineTimeout();
        this.maxDistanceLimit = properties.getSearch().getMaxDistanceMiles();
        this.cache = properties.getCache().isEnabled()
                ? Caffeine.newBuilder()
                        .maximumSize(properties.getCache().getMaxSize())
                        .expireAfterWrite(properties.getCache().getTtl())
                        .build()
                : null;
    }

    /**
     * Blocks for at most the pipeline timeout. On timeout the in-flight upstream
     * calls are cancelled and the synthetic fallback stores are returned.
     */
    public StoreSearchResult findStores(SearchRequest request) {
        CompletableFuture<StoreSearchResult> future = findStoresAsync(request);
        try {
            return future.get(pipelineTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Store search for '{}' timed out after {}, using fallback stores",
                    request.getPart().getName(), pipelineTimeout);
            future.cancel(true);
            return fallbackResult(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Store search interrupted");
        } catch (ExecutionException e) {
            log.error("Store search pipeline failed, using fallback stores", e.getCause());
            return fallbackResult(request);
        }
    }

    /**
     * Cancelling the returned future cancels every upstream call still running for
     * this request.
     */
    public CompletableFuture<StoreSearchResult> findStoresAsync(SearchRequest request) {
        validate(request);

        SearchKey key = SearchKey.of(request);
        VerifiedCandidates cached = cache != null ? cache.getIfPresent(key) : null;
        if (cached != null) {
            log.info("Cache hit for '{}' near {}", request.getPart().getName(), request.getOrigin());
            return CompletableFuture.completedFuture(finish(request, cached));
        }

        CancellationToken token = new CancellationToken();
        CompletableFuture<StoreSearchResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> runPipeline(request, key, token), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Store search executor saturated, using fallback stores for '{}': {}",
                    request.getPart().getName(), e.getMessage());
            return CompletableFuture.completedFuture(fallbackResult(request));
        }
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                token.cancel();
            }
        });
        return future;
    }

    StoreSearchResult runPipeline(SearchRequest request, SearchKey key, CancellationToken token) {
        Part part = request.getPart();
        log.info("Finding stores within {} mi of {} for part: {}",
                request.getMaxDistanceMiles(), request.getOrigin(), part.getName());
        try {
            List<StoreTypeTag> tags = classifier.classify(part.getName(), part.getCategory(), token);
            checkCancelled(token);

            List<CandidateStore> candidates = searchClient.search(
                    request.getOrigin(), tags, request.getMaxDistanceMiles(), token);
            checkCancelled(token);

            // origin-independent, so it can be shared by every origin in the cache cell
            List<CandidateStore> assessed = verifier.assess(candidates, part, token);
            checkCancelled(token);

            boolean degraded = candidates.stream().anyMatch(CandidateStore::isSynthetic);
            VerifiedCandidates outcome = new VerifiedCandidates(assessed, tags, degraded);
            if (cache != null && !degraded) {
                cache.put(key, outcome);
            }
            return finish(request, outcome);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Store search pipeline failed for '{}', using fallback stores", part.getName(), e);
            return fallbackResult(request);
        }
    }

    private StoreSearchResult finish(SearchRequest request, VerifiedCandidates outcome) {
        List<CandidateStore> inRange = distanceFilter.filter(
                outcome.getCandidates(), request.getOrigin(), request.getMaxDistanceMiles());
        List<RankedStore> stores = ranker.rank(verifier.confirm(inRange), request.getResultCap()).stream()
                .map(store -> store.withEstimatedPrice(pricingEstimator.estimate(request.getPart(), store)))
                .toList();

        stores.forEach(store -> log.info("- {}: {} (likelihood: {}%)",
                store.getName(), store.getDistanceFormatted(), store.getLikelihood()));

        return StoreSearchResult.builder()
                .stores(stores)
                .storeTypes(outcome.getTags())
                .degraded(outcome.isDegraded())
                .advisory(stores.isEmpty() ? emptyAdvisory(request)
                        : outcome.isDegraded() ? FALLBACK_ADVISORY : null)
                .build();
    }

    StoreSearchResult fallbackResult(SearchRequest request) {
        List<RankedStore> stores = fallbackStoreGenerator.generate(
                request.getOrigin(), request.getPart(), request.getMaxDistanceMiles());
        return StoreSearchResult.builder()
                .stores(stores.size() > request.getResultCap() ? stores.subList(0, request.getResultCap()) : stores)
                .storeTypes(StoreTypeClassifier.fallbackTags())
                .degraded(true)
                .advisory(FALLBACK_ADVISORY)
                .build();
    }

    void validate(SearchRequest request) {
        if (request == null || request.getPart() == null
                || request.getPart().getName() == null || request.getPart().getName().isBlank()) {
            throw new InvalidSearchRequestException("Part name is required");
        }
        if (request.getOrigin() == null || !request.getOrigin().hasValidRange()) {
            throw new InvalidSearchRequestException("A valid origin location is required");
        }
        double distance = request.getMaxDistanceMiles();
        if (!Double.isFinite(distance) || distance <= 0 || distance > maxDistanceLimit) {
            throw new InvalidSearchRequestException(
                    "maxDistanceMiles must be greater than 0 and at most " + maxDistanceLimit);
        }
        if (request.getResultCap() < 1) {
            throw new InvalidSearchRequestException("resultCap must be at least 1");
        }
    }

    private static String emptyAdvisory(SearchRequest request) {
        return String.format(Locale.ROOT,
                "No stores within %s mi are likely to carry this part. Try a larger radius or a different ZIP code.",
                formatMiles(request.getMaxDistanceMiles()));
    }

    private static String formatMiles(double miles) {
        return miles == Math.rint(miles) ? String.valueOf((long) miles) : String.valueOf(miles);
    }

    private static void checkCancelled(CancellationToken token) {
        if (token.isCancelled()) {
            throw new CancellationException("Store search cancelled");
        }
    }

    public void clearCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    /**
     * Cache key: part identity, origin snapped to a 0.01° grid, budget and cap.
     * Cached candidates are re-filtered and their heuristic scores recomputed
     * against the exact origin on every hit.
     */
    @Value
    static class SearchKey {
        String partSignature;
        long latitudeCell;
        long longitudeCell;
        double maxDistanceMiles;
        int resultCap;

        static SearchKey of(SearchRequest request) {
            GeoPoint origin = request.getOrigin();
            return new SearchKey(
                    request.getPart().signature(),
                    Math.round(origin.getLatitude() * 100),
                    Math.round(origin.getLongitude() * 100),
                    request.getMaxDistanceMiles(),
                    request.getResultCap());
        }
    }

    @Value
    static class VerifiedCandidates {
        List<CandidateStore> candidates;
        List<StoreTypeTag> tags;
        boolean degraded;
    }
}
