package com.partfinder.service;

import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.model.AvailabilityLabel;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.RankedStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders verified candidates by likelihood with a per-mile penalty. Stores whose
 * scores are within the tie-break threshold of each other are ordered by distance,
 * so a nearby store is not beaten by a marginally "likelier" one miles away.
 */
@Service
public class RelevanceRanker {

    private final double penaltyPerMile;
    private final double tieBreakThreshold;

    @Autowired
    public RelevanceRanker(StoreLocatorProperties properties) {
        this(properties.getRanking().getPenaltyPerMile(), properties.getRanking().getTieBreakThreshold());
    }

    RelevanceRanker(double penaltyPerMile, double tieBreakThreshold) {
        this.penaltyPerMile = penaltyPerMile;
        this.tieBreakThreshold = tieBreakThreshold;
    }

    public double relevanceScore(int likelihood, double distanceMiles) {
        return likelihood - distanceMiles * penaltyPerMile;
    }

    public double getTieBreakThreshold() {
        return tieBreakThreshold;
    }

    /**
     * Candidates must already carry a distance and a likelihood. Prices are not
     * filled in here.
     */
    public List<RankedStore> rank(List<CandidateStore> candidates, int resultCap) {
        List<RankedStore> ranked = new ArrayList<>(candidates.size());
        for (CandidateStore candidate : candidates) {
            ranked.add(toRanked(candidate));
        }
        insertionSort(ranked, comparator());
        return ranked.size() > resultCap ? List.copyOf(ranked.subList(0, resultCap)) : List.copyOf(ranked);
    }

    Comparator<RankedStore> comparator() {
        return (a, b) -> {
            if (Math.abs(a.getRelevanceScore() - b.getRelevanceScore()) > tieBreakThreshold) {
                return Double.compare(b.getRelevanceScore(), a.getRelevanceScore());
            }
            int byDistance = Double.compare(a.getDistanceMiles(), b.getDistanceMiles());
            if (byDistance != 0) {
                return byDistance;
            }
            int byScore = Double.compare(b.getRelevanceScore(), a.getRelevanceScore());
            return byScore != 0 ? byScore : String.valueOf(a.getId()).compareTo(String.valueOf(b.getId()));
        };
    }

    /**
     * The threshold comparator is not transitive, which List.sort may reject.
     * Insertion sort only ever places an element next to neighbours it compares
     * correctly with, so every adjacent pair in the result respects the comparator.
     */
    static <T> void insertionSort(List<T> items, Comparator<? super T> comparator) {
        for (int i = 1; i < items.size(); i++) {
            T current = items.get(i);
            int j = i - 1;
            while (j >= 0 && comparator.compare(items.get(j), current) > 0) {
                items.set(j + 1, items.get(j));
                j--;
            }
            items.set(j + 1, current);
        }
    }

    private RankedStore toRanked(CandidateStore candidate) {
        if (candidate.getDistanceMiles() == null || candidate.getLikelihood() == null) {
            throw new IllegalStateException("Candidate " + candidate.getId() + " has not been verified and filtered");
        }
        double distance = candidate.getDistanceMiles();
        int likelihood = candidate.getLikelihood();

        return RankedStore.builder()
                .id(candidate.getId())
                .name(candidate.getName())
                .address(candidate.getAddress())
                .coordinates(candidate.getLocation())
                .types(candidate.getTypes())
                .rating(candidate.getRating())
                .ratingCount(candidate.getRatingCount())
                .phone(candidate.getPhone())
                .website(candidate.getWebsite())
                .directionsUrl(directionsUrl(candidate))
                .openNow(candidate.getOpenNow())
                .provenance(candidate.getProvenance())
                .distanceMiles(distance)
                .distanceFormatted(DistanceCalculator.formatDistance(distance))
                .likelihood(likelihood)
                .likelihoodReason(candidate.getLikelihoodReason())
                .availabilityLabel(AvailabilityLabel.forLikelihood(likelihood))
                .relevanceScore(relevanceScore(likelihood, distance))
                .build();
    }

    private static String directionsUrl(CandidateStore candidate) {
        if (candidate.getGoogleMapsUri() != null && !candidate.getGoogleMapsUri().isBlank()) {
            return candidate.getGoogleMapsUri();
        }
        return String.format(Locale.ROOT, "https://www.google.com/maps/dir/?api=1&destination=%.6f,%.6f",
                candidate.getLocation().getLatitude(), candidate.getLocation().getLongitude());
    }
}
