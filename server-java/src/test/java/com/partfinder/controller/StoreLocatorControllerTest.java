package com.partfinder.controller;

import com.partfinder.exception.InvalidSearchRequestException;
import com.partfinder.model.AvailabilityLabel;
import com.partfinder.model.GeoPoint;
import com.partfinder.model.Part;
import com.partfinder.model.Provenance;
import com.partfinder.model.RankedStore;
import com.partfinder.model.SearchRequest;
import com.partfinder.model.StoreSearchResult;
import com.partfinder.model.StoreTypeTag;
import com.partfinder.service.SearchRequestResolver;
import com.partfinder.service.StoreLocatorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = StoreLocatorController.class)
class StoreLocatorControllerTest {

    private static final String BODY =
            "{\"part\":{\"name\":\"Door Seal\",\"category\":\"Gaskets\"},\"latitude\":34.0522,\"longitude\":-118.2437}";

    @Autowired MockMvc mvc;
    @MockBean SearchRequestResolver requestResolver;
    @MockBean StoreLocatorService storeLocatorService;

    @Test
    void returnsRankedStoresInEnvelope() throws Exception {
        SearchRequest request = SearchRequest.builder()
                .part(Part.builder().name("Door Seal").category("Gaskets").build())
                .origin(GeoPoint.of(34.0522, -118.2437))
                .maxDistanceMiles(5)
                .build();
        RankedStore store = RankedStore.builder()
                .id("p1")
                .name("Ace Hardware")
                .address("1 Main St")
                .coordinates(GeoPoint.of(34.06, -118.24))
                .provenance(Provenance.PLACES)
                .distanceMiles(0.6)
                .distanceFormatted("0.6 mi")
                .likelihood(90)
                .availabilityLabel(AvailabilityLabel.LIKELY)
                .relevanceScore(87)
                .build();
        when(requestResolver.resolve(any())).thenReturn(request);
        when(storeLocatorService.findStores(request)).thenReturn(StoreSearchResult.builder()
                .store(store)
                .storeType(StoreTypeTag.HARDWARE_STORE)
                .build());

        mvc.perform(post("/api/stores/search").contentType("application/json").content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.maxDistanceMiles").value(5.0))
                .andExpect(jsonPath("$.storeTypes[0]").value("hardware_store"))
                .andExpect(jsonPath("$.stores[0].name").value("Ace Hardware"))
                .andExpect(jsonPath("$.stores[0].distanceFormatted").value("0.6 mi"))
                .andExpect(jsonPath("$.degraded").value(false));
    }

    @Test
    void invalidRequestIsBadRequest() throws Exception {
        when(requestResolver.resolve(any()))
                .thenThrow(new InvalidSearchRequestException("Location is required: send latitude/longitude or a ZIP code"));

        mvc.perform(post("/api/stores/search").contentType("application/json").content("{\"part\":{\"name\":\"Seal\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Location is required: send latitude/longitude or a ZIP code"));
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/stores/search").contentType("application/json").content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void unexpectedFailureIsServerError() throws Exception {
        when(requestResolver.resolve(any())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(post("/api/stores/search").contentType("application/json").content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void healthCheck() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
