package com.partfinder.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Retail categories the pipeline is allowed to search for. Anything a classifier
 * returns outside this set is dropped.
 */
public enum StoreTypeTag {
    HARDWARE_STORE("hardware_store", "hardware_store"),
    HOME_GOODS_STORE("home_goods_store", "home_goods_store"),
    ELECTRONICS_STORE("electronics_store", "electronics_store"),
    GENERIC_STORE("generic_store", "store");

    private final String tag;
    private final String placesType;

    StoreTypeTag(String tag, String placesType) {
        this.tag = tag;
        this.placesType = placesType;
    }

    public String tag() {
        return tag;
    }

    /**
     * Type name understood by the places search provider.
     */
    public String placesType() {
        return placesType;
    }

    /**
     * Accepts either the tag or the provider type name, case-insensitive.
     */
    public static Optional<StoreTypeTag> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(normalized) || t.placesType.equals(normalized))
                .findFirst();
    }

    public static List<StoreTypeTag> all() {
        return List.of(values());
    }
}
