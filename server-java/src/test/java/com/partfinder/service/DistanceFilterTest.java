package com.partfinder.service;

import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistanceFilterTest {

    private final DistanceFilter filter = new DistanceFilter();

    @Test
    void recomputesDistanceInsteadOfTrustingUpstream() {
        CandidateStore lying = TestStores.place("lying", "Lying Store", 180, 7.0, "hardware_store")
                .withDistance(1.0);

        assertTrue(filter.filter(List.of(lying), TestStores.LOS_ANGELES, 5).isEmpty());
    }

    @Test
    void keepsStoresAtOrInsideTheBudgetWithFreshDistance() {
        CandidateStore edge = TestStores.place("edge", "Edge", 90, 5.0, "store").withDistance(99);
        CandidateStore near = TestStores.place("near", "Near", 0, 1.8, "store");

        List<CandidateStore> kept = filter.filter(List.of(edge, near), TestStores.LOS_ANGELES, 5);

        assertEquals(2, kept.size());
        assertEquals(5.0, kept.get(0).getDistanceMiles());
        assertEquals(1.8, kept.get(1).getDistanceMiles());
    }

    @Test
    void dropsStoresWithoutUsableCoordinates() {
        CandidateStore nan = TestStores.place("nan", "NaN", 0, 1, "store").toBuilder()
                .location(GeoPoint.of(Double.NaN, -118.2))
                .build();
        CandidateStore missing = TestStores.place("missing", "Missing", 0, 1, "store").toBuilder()
                .location(null)
                .build();

        assertTrue(filter.filter(List.of(nan, missing), TestStores.LOS_ANGELES, 5).isEmpty());
    }
}
