package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Camera metadata extracted from EXIF of an ingested image.
 *
 * @param cameraMake
 *            EXIF Make (optional)
 * @param cameraModel
 *            EXIF Model (optional)
 */
public record CameraInfoType(@JsonProperty("camera_make") String cameraMake,
        @JsonProperty("camera_model") String cameraModel) {

    /**
     * @return true when at least one camera field was extracted
     */
    @JsonIgnore
    public boolean isPresent() {
        return cameraMake != null || cameraModel != null;
    }
}
