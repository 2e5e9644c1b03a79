package com.partfinder.model;

public enum Provenance {
    /** Returned by the places search provider. */
    PLACES,
    /** Made up by the fallback generator; not a real business. */
    SYNTHETIC
}
