package com.partfinder.service;

import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.LikelihoodSource;
import com.partfinder.model.Part;
import com.partfinder.model.Provenance;
import com.partfinder.model.RankedStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Last-resort result set used when no real store data can be obtained. The stores
 * are archetypes, not real businesses, and are marked {@link Provenance#SYNTHETIC}.
 */
@Service
@Slf4j
public class FallbackStoreGenerator {

    static final int MAX_SYNTHETIC_STORES = 5;
    static final double BUDGET_FRACTION = 0.9;

    private static final List<Archetype> ARCHETYPES = List.of(
            new Archetype("home-depot", "The Home Depot", List.of("home_goods_store", "hardware_store"),
                    85, "Major home improvement retailer with appliance parts section", 45, 0.9, 4.2, 1250),
            new Archetype("lowes", "Lowe's Home Improvement", List.of("home_goods_store", "hardware_store"),
                    80, "Home improvement store with appliance section", 135, 0.9, 4.1, 980),
            new Archetype("appliance-parts", "Local Appliance Parts Center", List.of("store"),
                    92, "Specialized appliance parts retailer", 295, 0.7, 4.5, 156),
            new Archetype("ace", "Ace Hardware", List.of("hardware_store"),
                    82, "Hardware store that may carry common appliance parts", 245, 0.7, 4.3, 324),
            new Archetype("parts-repair", "Appliance Parts & Repair", List.of("store"),
                    95, "Appliance parts specialist with extensive inventory", 0, 1.0, 4.0, 89)
    );

    private final RelevanceRanker ranker;
    private final PricingEstimator pricingEstimator;

    public FallbackStoreGenerator(RelevanceRanker ranker, PricingEstimator pricingEstimator) {
        this.ranker = ranker;
        this.pricingEstimator = pricingEstimator;
    }

    /**
     * Ranked and priced synthetic stores, every one within {@code maxDistanceMiles}.
     */
    public List<RankedStore> generate(GeoPoint origin, Part part, double maxDistanceMiles) {
        return ranker.rank(generateCandidates(origin, maxDistanceMiles), MAX_SYNTHETIC_STORES).stream()
                .map(store -> store.withEstimatedPrice(pricingEstimator.estimate(part, store)))
                .toList();
    }

    /**
     * Synthetic candidates with distance and likelihood already set.
     */
    public List<CandidateStore> generateCandidates(GeoPoint origin, double maxDistanceMiles) {
        log.warn("Generating synthetic fallback stores around {} within {} mi", origin, maxDistanceMiles);
        String near = String.format(Locale.ROOT, "Near %.3f, %.3f (approximate)",
                origin.getLatitude(), origin.getLongitude());

        List<CandidateStore> stores = new ArrayList<>();
        for (Archetype archetype : ARCHETYPES) {
            double target = Math.min(archetype.getPreferredMiles(), maxDistanceMiles * BUDGET_FRACTION);
            GeoPoint location = DistanceCalculator.destination(origin, archetype.getBearing(), target);
            double distance = DistanceCalculator.distanceMiles(origin, location);
            if (distance > maxDistanceMiles) {
                // rounding can only push a point one tenth out; pull it back to the origin
                location = origin;
                distance = 0.0;
            }
            stores.add(CandidateStore.builder()
                    .id("synthetic-" + archetype.getKey())
                    .name(archetype.getName())
                    .address(near)
                    .location(location)
                    .types(archetype.getTypes())
                    .rating(archetype.getRating())
                    .ratingCount(archetype.getRatingCount())
                    .operational(true)
                    .provenance(Provenance.SYNTHETIC)
                    .distanceMiles(distance)
                    .likelihood(archetype.getLikelihood())
                    .likelihoodReason(archetype.getReason())
                    .likelihoodSource(LikelihoodSource.FALLBACK)
                    .build());
        }
        return stores;
    }

    @Value
    private static class Archetype {
        String key;
        String name;
        List<String> types;
        int likelihood;
        String reason;
        double bearing;
        double preferredMiles;
        double rating;
        int ratingCount;
    }
}
