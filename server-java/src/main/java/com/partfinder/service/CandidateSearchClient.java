package com.partfinder.service;

import com.partfinder.client.CancellationToken;
import com.partfinder.client.PlacesSearchProvider;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.StoreTypeTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds raw candidate stores around the origin through the places provider,
 * falling back to synthetic stores when the provider is unusable.
 */
@Service
@Slf4j
public class CandidateSearchClient {

    private final PlacesSearchProvider provider;
    private final FallbackStoreGenerator fallbackStoreGenerator;

    public CandidateSearchClient(PlacesSearchProvider provider, FallbackStoreGenerator fallbackStoreGenerator) {
        this.provider = provider;
        this.fallbackStoreGenerator = fallbackStoreGenerator;
    }

    public List<CandidateStore> search(GeoPoint origin, List<StoreTypeTag> tags, double maxDistanceMiles) {
        return search(origin, tags, maxDistanceMiles, CancellationToken.none());
    }

    /**
     * Operational candidates within the budget, each with its distance filled in.
     */
    public List<CandidateStore> search(GeoPoint origin, List<StoreTypeTag> tags, double maxDistanceMiles,
                                       CancellationToken token) {
        if (!provider.isAvailable()) {
            log.warn("Places provider not configured, using fallback stores");
            return fallbackStoreGenerator.generateCandidates(origin, maxDistanceMiles);
        }

        List<CandidateStore> places;
        try {
            places = provider.searchNearby(origin, radiusMeters(maxDistanceMiles), placesTypes(tags), token);
        } catch (IOException e) {
            log.warn("Places search failed, using fallback stores: {}", e.getMessage());
            return fallbackStoreGenerator.generateCandidates(origin, maxDistanceMiles);
        }

        if (places.isEmpty()) {
            log.info("No places found, using fallback stores");
            return fallbackStoreGenerator.generateCandidates(origin, maxDistanceMiles);
        }

        List<CandidateStore> candidates = new ArrayList<>();
        for (CandidateStore place : places) {
            if (!place.isOperational()) {
                log.debug("Skipping non-operational place {}", place.getName());
                continue;
            }
            if (place.getLocation() == null || !place.getLocation().hasFiniteCoordinates()) {
                log.debug("Skipping {} without usable coordinates", place.getName());
                continue;
            }
            double distance = DistanceCalculator.distanceMiles(origin, place.getLocation());
            if (!(distance <= maxDistanceMiles)) {
                log.debug("Skipping {} at {} mi, beyond {} mi", place.getName(), distance, maxDistanceMiles);
                continue;
            }
            candidates.add(place.withDistance(distance));
        }
        log.info("Places provider returned {} places, {} operational within {} mi",
                places.size(), candidates.size(), maxDistanceMiles);
        return candidates;
    }

    double radiusMeters(double maxDistanceMiles) {
        return Math.min(DistanceCalculator.milesToMeters(maxDistanceMiles), provider.maxRadiusMeters());
    }

    static List<String> placesTypes(List<StoreTypeTag> tags) {
        Set<String> types = new LinkedHashSet<>();
        tags.forEach(tag -> types.add(tag.placesType()));
        return new ArrayList<>(types);
    }
}
