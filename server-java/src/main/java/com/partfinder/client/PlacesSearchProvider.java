package com.partfinder.client;

import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

public interface PlacesSearchProvider {

    boolean isAvailable();

    /**
     * Largest radius the provider accepts, in meters.
     */
    int maxRadiusMeters();

    /**
     * Businesses of the given provider types within {@code radiusMeters} of {@code center}.
     * Distances are not filled in.
     */
    List<CandidateStore> searchNearby(GeoPoint center, double radiusMeters, Collection<String> includedTypes,
                                      CancellationToken token) throws IOException;
}
