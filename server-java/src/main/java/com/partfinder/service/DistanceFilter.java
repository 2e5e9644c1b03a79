package com.partfinder.service;

import com.partfinder.model.CandidateStore;
import com.partfinder.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Enforces the distance budget. Distances are always recomputed here; whatever an
 * upstream source or an earlier step put on the candidate is not trusted.
 */
@Service
@Slf4j
public class DistanceFilter {

    public List<CandidateStore> filter(List<CandidateStore> candidates, GeoPoint origin, double maxDistanceMiles) {
        List<CandidateStore> kept = new ArrayList<>(candidates.size());
        for (CandidateStore candidate : candidates) {
            GeoPoint location = candidate.getLocation();
            if (location == null || !location.hasFiniteCoordinates()) {
                log.warn("Store {} missing coordinates, excluding from results", candidate.getName());
                continue;
            }
            double distance = DistanceCalculator.distanceMiles(origin, location);
            if (distance > maxDistanceMiles) {
                log.info("Filtering out {} - {} mi exceeds {} mi limit", candidate.getName(), distance, maxDistanceMiles);
                continue;
            }
            kept.add(candidate.withDistance(distance));
        }
        return kept;
    }
}
