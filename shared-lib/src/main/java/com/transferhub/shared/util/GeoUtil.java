package com.transferhub.shared.util;

/**
 * Great-circle helpers used for geofence containment.
 */
public final class GeoUtil {

    public static final double EARTH_RADIUS_MILES = 3959.0;
    public static final double MILES_PER_KM       = 0.621371;

    private GeoUtil() {}

    public static double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    public static double kmToMiles(double km) {
        return km * MILES_PER_KM;
    }
}
