package com.partfinder.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SearchRequest {
    public static final int DEFAULT_RESULT_CAP = 5;

    Part part;
    GeoPoint origin;
    double maxDistanceMiles;
    @Builder.Default
    int resultCap = DEFAULT_RESULT_CAP;
}
