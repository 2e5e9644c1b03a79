package com.partfinder.service;

import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.InvalidSearchRequestException;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.Part;
import com.partfinder.model.SearchRequest;
import com.partfinder.model.StoreSearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link SearchRequest} from an API request body: applies defaults,
 * resolves a ZIP code when no coordinates were sent, and rejects what cannot be served.
 */
@Component
@Slf4j
public class SearchRequestResolver {

    private final GeocodingService geocodingService;
    private final StoreLocatorProperties.Search limits;

    public SearchRequestResolver(GeocodingService geocodingService, StoreLocatorProperties properties) {
        this.geocodingService = geocodingService;
        this.limits = properties.getSearch();
    }

    public SearchRequest resolve(StoreSearchRequest body) {
        if (body == null || body.getPart() == null
                || body.getPart().getName() == null || body.getPart().getName().isBlank()) {
            throw new InvalidSearchRequestException("Part name is required");
        }

        Part part = Part.builder()
                .name(body.getPart().getName().trim())
                .category(body.getPart().getCategory())
                .brand(body.getPart().getBrand())
                .build();

        return SearchRequest.builder()
                .part(part)
                .origin(resolveOrigin(body))
                .maxDistanceMiles(resolveDistance(body.getMaxDistanceMiles()))
                .resultCap(resolveResultCap(body.getResultCap()))
                .build();
    }

    private GeoPoint resolveOrigin(StoreSearchRequest body) {
        if (body.getLatitude() != null && body.getLongitude() != null) {
            GeoPoint origin = GeoPoint.of(body.getLatitude(), body.getLongitude());
            if (!origin.hasValidRange()) {
                throw new InvalidSearchRequestException("Coordinates out of range: " + origin);
            }
            return origin;
        }
        if (body.getZipCode() != null && !body.getZipCode().isBlank()) {
            if (!GeocodingService.isValidZipCode(body.getZipCode())) {
                throw new InvalidSearchRequestException("Invalid ZIP code: " + body.getZipCode());
            }
            GeoPoint origin = geocodingService.geocodeZipCode(body.getZipCode())
                    .orElseThrow(() -> new InvalidSearchRequestException(
                            "Invalid ZIP code or location not found: " + body.getZipCode()));
            log.info("Resolved ZIP code {} to {}", body.getZipCode(), origin);
            return origin;
        }
        throw new InvalidSearchRequestException("Location is required: send latitude/longitude or a ZIP code");
    }

    private double resolveDistance(Double requested) {
        if (requested == null) {
            return limits.getDefaultMaxDistanceMiles();
        }
        if (!Double.isFinite(requested) || requested <= 0 || requested > limits.getMaxDistanceMiles()) {
            throw new InvalidSearchRequestException(
                    "maxDistanceMiles must be greater than 0 and at most " + limits.getMaxDistanceMiles());
        }
        return requested;
    }

    private int resolveResultCap(Integer requested) {
        if (requested == null) {
            return limits.getDefaultResultCap();
        }
        if (requested < 1) {
            throw new InvalidSearchRequestException("resultCap must be at least 1");
        }
        if (requested > limits.getMaxResultCap()) {
            log.info("Clamping resultCap {} to {}", requested, limits.getMaxResultCap());
            return limits.getMaxResultCap();
        }
        return requested;
    }
}
