package com.partfinder.service;

import com.partfinder.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GeocodingServiceTest {

    // no key: only the built-in table answers, and the context is never touched
    private final GeocodingService geocodingService = new GeocodingService(null, "");

    @Test
    void validatesFiveDigitAndZipPlusFour() {
        assertTrue(GeocodingService.isValidZipCode("90210"));
        assertTrue(GeocodingService.isValidZipCode(" 90210-1234 "));
        assertFalse(GeocodingService.isValidZipCode("9021"));
        assertFalse(GeocodingService.isValidZipCode("90210-12"));
        assertFalse(GeocodingService.isValidZipCode("ABCDE"));
        assertFalse(GeocodingService.isValidZipCode(null));
    }

    @Test
    void knownZipCodesResolveWithoutGeocoder() {
        assertEquals(Optional.of(GeoPoint.of(34.0901, -118.4065)), geocodingService.geocodeZipCode("90210"));
        assertEquals(Optional.of(GeoPoint.of(42.3601, -71.0589)), geocodingService.geocodeZipCode("02101-0001"));
    }

    @Test
    void unknownOrInvalidZipCodesResolveToNothing() {
        assertTrue(geocodingService.geocodeZipCode("99999").isEmpty());
        assertTrue(geocodingService.geocodeZipCode("not-a-zip").isEmpty());
    }
}
