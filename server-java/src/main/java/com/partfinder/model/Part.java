package com.partfinder.model;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

@Value
@Builder
public class Part {
    String name;
    String category; // may be blank when the identifier could not tell
    String brand;

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    /**
     * Normalized identity of the part, used for cache keys.
     */
    public String signature() {
        return String.join("|",
                normalize(name),
                normalize(category),
                normalize(brand));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
