package com.partfinder.service;

import com.partfinder.config.StoreLocatorProperties;
import com.partfinder.exception.InvalidSearchRequestException;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.SearchRequest;
import com.partfinder.model.StoreSearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchRequestResolverTest {

    private GeocodingService geocodingService;
    private SearchRequestResolver resolver;

    @BeforeEach
    void setUp() {
        geocodingService = mock(GeocodingService.class);
        resolver = new SearchRequestResolver(geocodingService, new StoreLocatorProperties());
    }

    private static StoreSearchRequest.StoreSearchRequestBuilder body() {
        return StoreSearchRequest.builder()
                .part(StoreSearchRequest.PartInfo.builder()
                        .name(" Dishwasher Door Seal ")
                        .category("Seals & Gaskets")
                        .brand("Whirlpool")
                        .build());
    }

    @Test
    void coordinatesWinAndDefaultsApply() {
        SearchRequest request = resolver.resolve(body().latitude(34.0522).longitude(-118.2437).zipCode("10001").build());

        assertEquals(GeoPoint.of(34.0522, -118.2437), request.getOrigin());
        assertEquals("Dishwasher Door Seal", request.getPart().getName());
        assertEquals("Whirlpool", request.getPart().getBrand());
        assertEquals(5.0, request.getMaxDistanceMiles());
        assertEquals(5, request.getResultCap());
        verify(geocodingService, never()).geocodeZipCode(anyString());
    }

    @Test
    void zipCodeIsGeocodedWhenNoCoordinatesAreSent() {
        when(geocodingService.geocodeZipCode("90210")).thenReturn(Optional.of(GeoPoint.of(34.0901, -118.4065)));

        SearchRequest request = resolver.resolve(body().zipCode("90210").maxDistanceMiles(10.0).build());

        assertEquals(GeoPoint.of(34.0901, -118.4065), request.getOrigin());
        assertEquals(10.0, request.getMaxDistanceMiles());
    }

    @Test
    void unknownOrInvalidZipCodeIsRejected() {
        when(geocodingService.geocodeZipCode("99999")).thenReturn(Optional.empty());

        InvalidSearchRequestException notFound = assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().zipCode("99999").build()));
        assertTrue(notFound.getMessage().contains("99999"));
        assertThrows(InvalidSearchRequestException.class, () -> resolver.resolve(body().zipCode("ABCDE").build()));
    }

    @Test
    void missingLocationIsRejected() {
        InvalidSearchRequestException e = assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().latitude(34.0).build()));

        assertTrue(e.getMessage().startsWith("Location is required"));
    }

    @Test
    void outOfRangeCoordinatesAreRejected() {
        assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().latitude(134.0).longitude(-118.0).build()));
    }

    @Test
    void missingPartIsRejected() {
        assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(StoreSearchRequest.builder().latitude(34.0).longitude(-118.0).build()));
        assertThrows(InvalidSearchRequestException.class, () -> resolver.resolve(StoreSearchRequest.builder()
                .part(StoreSearchRequest.PartInfo.builder().name("  ").build())
                .latitude(34.0).longitude(-118.0)
                .build()));
    }

    @Test
    void distanceBudgetMustBePositiveAndBounded() {
        assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().latitude(34.0).longitude(-118.0).maxDistanceMiles(0.0).build()));
        assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().latitude(34.0).longitude(-118.0).maxDistanceMiles(75.0).build()));
        assertEquals(50.0, resolver.resolve(body().latitude(34.0).longitude(-118.0).maxDistanceMiles(50.0).build())
                .getMaxDistanceMiles());
    }

    @Test
    void resultCapIsClampedButNeverBelowOne() {
        assertEquals(10, resolver.resolve(body().latitude(34.0).longitude(-118.0).resultCap(25).build()).getResultCap());
        assertThrows(InvalidSearchRequestException.class,
                () -> resolver.resolve(body().latitude(34.0).longitude(-118.0).resultCap(0).build()));
    }
}
