package com.partfinder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of the store search endpoint. Either coordinates or a ZIP code
 * must be supplied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreSearchRequest {
    private PartInfo part;
    private Double latitude;
    private Double longitude;
    private String zipCode;
    private Double maxDistanceMiles;
    private Integer resultCap;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartInfo {
        private String name;
        private String category;
        private String brand;
    }
}
