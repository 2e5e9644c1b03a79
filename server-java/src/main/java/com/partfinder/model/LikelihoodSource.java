package com.partfinder.model;

/**
 * Where a candidate's likelihood came from. Heuristic scores include a proximity
 * bonus, so they are recomputed whenever the candidate's distance changes.
 */
public enum LikelihoodSource {
    ORACLE,
    HEURISTIC,
    FALLBACK
}
