package com.partfinder.service;

import com.partfinder.model.GeoPoint;

import java.util.Locale;

/**
 * Great-circle math in miles.
 */
public final class DistanceCalculator {

    public static final double EARTH_RADIUS_MILES = 3959.0;
    public static final double METERS_PER_MILE = 1609.34;

    private DistanceCalculator() {
    }

    /**
     * Haversine distance between two points, rounded to one decimal place.
     * NaN coordinates yield NaN.
     */
    public static double distanceMiles(GeoPoint a, GeoPoint b) {
        double dLat = toRadians(b.getLatitude() - a.getLatitude());
        double dLon = toRadians(b.getLongitude() - a.getLongitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(toRadians(a.getLatitude())) * Math.cos(toRadians(b.getLatitude()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));

        return round1(EARTH_RADIUS_MILES * c);
    }

    public static double toRadians(double degrees) {
        return degrees * (Math.PI / 180);
    }

    public static double milesToMeters(double miles) {
        return miles * METERS_PER_MILE;
    }

    public static String formatDistance(double miles) {
        if (miles < 0.1) {
            return "Less than 0.1 mi";
        }
        return String.format(Locale.ROOT, "%.1f mi", miles);
    }

    /**
     * Point reached by travelling {@code miles} from {@code origin} on the given
     * initial bearing (degrees clockwise from north).
     */
    public static GeoPoint destination(GeoPoint origin, double bearingDegrees, double miles) {
        double angular = miles / EARTH_RADIUS_MILES;
        double bearing = toRadians(bearingDegrees);
        double lat1 = toRadians(origin.getLatitude());
        double lon1 = toRadians(origin.getLongitude());

        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
                + Math.cos(lat1) * Math.sin(angular) * Math.cos(bearing));
        double lon2 = lon1 + Math.atan2(
                Math.sin(bearing) * Math.sin(angular) * Math.cos(lat1),
                Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));

        return GeoPoint.of(Math.toDegrees(lat2), normalizeLongitude(Math.toDegrees(lon2)));
    }

    static double round1(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return Math.round(value * 10) / 10.0;
    }

    private static double normalizeLongitude(double degrees) {
        return ((degrees + 540) % 360) - 180;
    }
}
