package com.partfinder.service;

import com.partfinder.client.PlacesSearchProvider;
import com.partfinder.exception.MalformedResponseException;
import com.partfinder.model.CandidateStore;
import com.partfinder.model.StoreTypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateSearchClientTest {

    private PlacesSearchProvider provider;
    private CandidateSearchClient client;

    @BeforeEach
    void setUp() {
        provider = mock(PlacesSearchProvider.class);
        when(provider.isAvailable()).thenReturn(true);
        when(provider.maxRadiusMeters()).thenReturn(50_000);
        FallbackStoreGenerator fallback = new FallbackStoreGenerator(new RelevanceRanker(5.0, 10.0), new PricingEstimator());
        client = new CandidateSearchClient(provider, fallback);
    }

    @Test
    void keepsOperationalPlacesWithinBudgetWithDistance() throws Exception {
        CandidateStore closed = TestStores.place("closed", "Closed Hardware", 90, 1.0, "hardware_store").toBuilder()
                .operational(false)
                .build();
        CandidateStore nowhere = TestStores.place("nowhere", "Nowhere", 0, 1.0).toBuilder()
                .location(null)
                .build();
        when(provider.searchNearby(any(), anyDouble(), anyCollection(), any())).thenReturn(List.of(
                TestStores.place("near", "Near Hardware", 0, 1.8, "hardware_store"),
                closed,
                nowhere,
                TestStores.place("far", "Far Hardware", 180, 7.0, "hardware_store")));

        List<CandidateStore> candidates = client.search(TestStores.LOS_ANGELES, List.of(StoreTypeTag.HARDWARE_STORE), 5);

        assertEquals(1, candidates.size());
        assertEquals("near", candidates.get(0).getId());
        assertEquals(1.8, candidates.get(0).getDistanceMiles());
        assertFalse(candidates.get(0).hasLikelihood());
    }

    @Test
    void radiusFollowsTheBudgetUpToTheProviderMaximum() throws Exception {
        when(provider.searchNearby(any(), anyDouble(), anyCollection(), any()))
                .thenReturn(List.of(TestStores.place("near", "Near", 0, 1.0)));

        client.search(TestStores.LOS_ANGELES, StoreTypeTag.all(), 5);
        client.search(TestStores.LOS_ANGELES, StoreTypeTag.all(), 50);

        verify(provider).searchNearby(any(), eq(5 * 1609.34), anyCollection(), any());
        verify(provider).searchNearby(any(), eq(50_000.0), anyCollection(), any());
    }

    @Test
    void tagsAreTranslatedToProviderTypes() {
        assertEquals(List.of("hardware_store", "store"),
                CandidateSearchClient.placesTypes(List.of(StoreTypeTag.HARDWARE_STORE, StoreTypeTag.GENERIC_STORE)));
    }

    @Test
    void unavailableProviderYieldsSyntheticCandidates() throws Exception {
        when(provider.isAvailable()).thenReturn(false);

        List<CandidateStore> candidates = client.search(TestStores.LOS_ANGELES, StoreTypeTag.all(), 5);

        assertFalse(candidates.isEmpty());
        assertTrue(candidates.stream().allMatch(CandidateStore::isSynthetic));
        verify(provider, never()).searchNearby(any(), anyDouble(), anyCollection(), any());
    }

    @Test
    void failingOrEmptyProviderYieldsSyntheticCandidates() throws Exception {
        when(provider.searchNearby(any(), anyDouble(), anyCollection(), any()))
                .thenThrow(new MalformedResponseException("bad payload"))
                .thenReturn(List.of());

        assertTrue(client.search(TestStores.LOS_ANGELES, StoreTypeTag.all(), 5).stream()
                .allMatch(CandidateStore::isSynthetic));
        assertTrue(client.search(TestStores.LOS_ANGELES, StoreTypeTag.all(), 5).stream()
                .allMatch(CandidateStore::isSynthetic));
    }
}
