package com.partfinder.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * A store returned by the search provider (or made up by the fallback generator)
 * before it has been ranked. Distance and likelihood are filled in as the
 * candidate moves through the pipeline; each step produces a new copy.
 */
@Value
@Builder(toBuilder = true)
public class CandidateStore {
    String id;
    String name;
    String address;
    GeoPoint location;
    @Singular
    List<String> types; // raw provider category tags
    Double rating;
    Integer ratingCount;
    String phone;
    String website;
    String googleMapsUri;
    Boolean openNow; // null when the provider did not say
    boolean operational;
    Provenance provenance;

    Double distanceMiles;
    Integer likelihood;
    String likelihoodReason;
    LikelihoodSource likelihoodSource;

    public CandidateStore withDistance(double miles) {
        return toBuilder().distanceMiles(miles).build();
    }

    public CandidateStore withLikelihood(int score, String reason) {
        return toBuilder().likelihood(score).likelihoodReason(reason).build();
    }

    public CandidateStore withLikelihood(int score, String reason, LikelihoodSource source) {
        return toBuilder().likelihood(score).likelihoodReason(reason).likelihoodSource(source).build();
    }

    public boolean hasLikelihood() {
        return likelihood != null;
    }

    public boolean isSynthetic() {
        return provenance == Provenance.SYNTHETIC;
    }

    public String lowerCaseName() {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
