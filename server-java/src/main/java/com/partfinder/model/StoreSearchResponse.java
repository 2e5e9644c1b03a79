package com.partfinder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreSearchResponse {
    private boolean success;
    private GeoPoint origin;
    private Double maxDistanceMiles;
    private List<String> storeTypes;
    private List<RankedStore> stores;
    private boolean degraded;
    private String advisory;
    private String error;
}
