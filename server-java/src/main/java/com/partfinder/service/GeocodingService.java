package com.partfinder.service;

import com.google.maps.GeoApiContext;
import com.google.maps.GeocodingApi;
import com.google.maps.errors.ApiException;
import com.google.maps.model.ComponentFilter;
import com.google.maps.model.GeocodingResult;
import com.partfinder.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns a US ZIP code into coordinates.
 */
@Service
@Slf4j
public class GeocodingService {

    private static final Pattern ZIP_PATTERN = Pattern.compile("^\\d{5}(-\\d{4})?$");

    // Used when the geocoder is unavailable or has no answer.
    private static final Map<String, GeoPoint> KNOWN_ZIP_CODES = Map.of(
            "10001", GeoPoint.of(40.7505, -73.9934),
            "90210", GeoPoint.of(34.0901, -118.4065),
            "60601", GeoPoint.of(41.8781, -87.6298),
            "77001", GeoPoint.of(29.7604, -95.3698),
            "33101", GeoPoint.of(25.7617, -80.1918),
            "55101", GeoPoint.of(44.9537, -93.0900),
            "30301", GeoPoint.of(33.7490, -84.3880),
            "02101", GeoPoint.of(42.3601, -71.0589),
            "98101", GeoPoint.of(47.6062, -122.3321),
            "80201", GeoPoint.of(39.7392, -104.9903)
    );

    private final GeoApiContext geoApiContext;
    private final boolean enabled;

    public GeocodingService(GeoApiContext geoApiContext, @Value("${google.maps.api.key:}") String apiKey) {
        this.geoApiContext = geoApiContext;
        this.enabled = apiKey != null && !apiKey.isBlank();
    }

    public static boolean isValidZipCode(String zipCode) {
        return zipCode != null && ZIP_PATTERN.matcher(zipCode.trim()).matches();
    }

    public Optional<GeoPoint> geocodeZipCode(String zipCode) {
        if (!isValidZipCode(zipCode)) {
            return Optional.empty();
        }
        String zip = zipCode.trim();

        if (enabled) {
            try {
                log.info("Geocoding ZIP code {}", zip);
                GeocodingResult[] results = GeocodingApi.newRequest(geoApiContext)
                        .components(ComponentFilter.postalCode(zip), ComponentFilter.country("US"))
                        .language("en")
                        .await();
                if (results != null && results.length > 0) {
                    GeocodingResult result = results[0];
                    return Optional.of(GeoPoint.of(result.geometry.location.lat, result.geometry.location.lng));
                }
                log.warn("Geocoder had no result for ZIP code {}", zip);
            } catch (ApiException | IOException e) {
                log.warn("Geocoding failed for ZIP code {}: {}", zip, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Geocoding interrupted for ZIP code {}", zip);
            }
        }

        return Optional.ofNullable(KNOWN_ZIP_CODES.get(zip.substring(0, 5)));
    }
}
