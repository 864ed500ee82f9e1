package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import sentrix.lifecycle.util.GeoDistance;

/**
 * GPS metadata extracted from EXIF of an ingested image.
 *
 * @param hasGps
 *            whether the image carried a GPS block
 * @param latitude
 *            decimal degrees (optional)
 * @param longitude
 *            decimal degrees (optional)
 */
public record GpsInfoType(@JsonProperty("has_gps") boolean hasGps, Double latitude, Double longitude) {

    public static GpsInfoType of(double latitude, double longitude) {
        return new GpsInfoType(true, latitude, longitude);
    }

    public static GpsInfoType none() {
        return new GpsInfoType(false, null, null);
    }

    /**
     * @return true when the flag is set and both coordinates are present and in range
     */
    @JsonIgnore
    public boolean isUsable() {
        return hasGps && latitude != null && longitude != null && GeoDistance.isValidCoordinate(latitude, longitude);
    }
}
