package com.partfinder.model;

import lombok.Value;

import java.util.Locale;

@Value
public class GeoPoint {
    double latitude;
    double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    public boolean hasFiniteCoordinates() {
        return Double.isFinite(latitude) && Double.isFinite(longitude);
    }

    public boolean hasValidRange() {
        return hasFiniteCoordinates()
                && latitude >= -90 && latitude <= 90
                && longitude >= -180 && longitude <= 180;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.4f, %.4f)", latitude, longitude);
    }
}
