package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import sentrix.lifecycle.util.GeoDistance;

/**
 * Previously stored image record supplied by the storage layer for a duplicate check.
 *
 * <p>
 * Read-only: the engine never mutates or retains candidates beyond a single call.
 *
 * @param id
 *            storage-layer record id
 * @param contentHash
 *            SHA-256 of the stored image bytes
 * @param sizeBytes
 *            stored image size in bytes
 * @param imageUrl
 *            URL of the stored original image
 * @param cameraMake
 *            EXIF Make (optional)
 * @param cameraModel
 *            EXIF Model (optional)
 * @param hasGps
 *            whether the stored image carried GPS data
 * @param latitude
 *            decimal degrees (optional)
 * @param longitude
 *            decimal degrees (optional)
 */
public record DetectionCandidateType(@NotBlank String id, @NotBlank @JsonProperty("content_hash") String contentHash,
        @PositiveOrZero @JsonProperty("size_bytes") long sizeBytes, @JsonProperty("image_url") String imageUrl,
        @JsonProperty("camera_make") String cameraMake, @JsonProperty("camera_model") String cameraModel,
        @JsonProperty("has_gps") boolean hasGps, Double latitude, Double longitude) {

    @JsonIgnore
    public boolean hasCameraInfo() {
        return cameraMake != null || cameraModel != null;
    }

    @JsonIgnore
    public boolean hasUsableGps() {
        return hasGps && latitude != null && longitude != null && GeoDistance.isValidCoordinate(latitude, longitude);
    }
}
