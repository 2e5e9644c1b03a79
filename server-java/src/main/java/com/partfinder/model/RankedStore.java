package com.partfinder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A store as it leaves the pipeline. {@code distanceMiles} never exceeds the
 * request's distance budget.
 */
@Value
@Builder(toBuilder = true)
public class RankedStore {
    String id;
    String name;
    String address;
    GeoPoint coordinates;
    List<String> types;
    Double rating;
    Integer ratingCount;
    String phone;
    String website;
    String directionsUrl;
    Boolean openNow;
    Provenance provenance;

    double distanceMiles;
    String distanceFormatted;
    int likelihood;
    String likelihoodReason;
    AvailabilityLabel availabilityLabel;
    PriceEstimate estimatedPrice;
    double relevanceScore;

    public String getAvailabilityText() {
        return availabilityLabel == null ? null : availabilityLabel.getDisplayText();
    }

    public boolean isSynthetic() {
        return provenance == Provenance.SYNTHETIC;
    }

    public RankedStore withEstimatedPrice(PriceEstimate price) {
        return toBuilder().estimatedPrice(price).build();
    }
}
