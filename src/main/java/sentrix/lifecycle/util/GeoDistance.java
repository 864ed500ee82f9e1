package sentrix.lifecycle.util;

import sentrix.lifecycle.exceptions.ValidationException;

/**
 * Great-circle distance and coordinate range checks.
 *
 * <p>
 * Uses the haversine formula on a spherical Earth of radius {@value #EARTH_RADIUS_KM} km. Accurate to well under a
 * metre at the sub-kilometre distances duplicate matching cares about.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
        // Utility class
    }

    /**
     * Computes the haversine distance between two points.
     *
     * @param lat1
     *            latitude of the first point in decimal degrees
     * @param lon1
     *            longitude of the first point in decimal degrees
     * @param lat2
     *            latitude of the second point in decimal degrees
     * @param lon2
     *            longitude of the second point in decimal degrees
     * @return distance in kilometres
     * @throws ValidationException
     *             if any coordinate is NaN or infinite
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        if (!Double.isFinite(lat1) || !Double.isFinite(lon1) || !Double.isFinite(lat2) || !Double.isFinite(lon2)) {
            throw new ValidationException("Coordinates must be finite (got " + lat1 + "," + lon1 + " -> " + lat2 + ","
                    + lon2 + ")");
        }
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) + Math.cos(Math.toRadians(lat1))
                * Math.cos(Math.toRadians(lat2)) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    public static boolean isValidLongitude(double lon) {
        return lon >= -180 && lon <= 180;
    }

    public static boolean isValidCoordinate(double lat, double lon) {
        return isValidLatitude(lat) && isValidLongitude(lon);
    }
}
