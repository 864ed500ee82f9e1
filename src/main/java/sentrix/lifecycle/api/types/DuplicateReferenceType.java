package sentrix.lifecycle.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Lightweight record pointing at previously stored image content instead of new bytes.
 *
 * @param recordId
 *            id of the new detection record
 * @param storageType
 *            always {@value #STORAGE_TYPE_REFERENCE}
 * @param referenceRecordId
 *            id of the record whose image is reused
 * @param originalFilename
 *            filename the new image was uploaded with (optional)
 * @param imageUrl
 *            URL of the reused original image
 * @param processedImageUrl
 *            URL of the reused processed image
 * @param duplicateConfidence
 *            similarity score of the match
 * @param storageSavedBytes
 *            size of the image that was not stored
 * @param duplicateType
 *            kind of match
 * @param detectedAt
 *            when the duplicate was detected
 */
public record DuplicateReferenceType(@NotBlank @JsonProperty("record_id") String recordId,
        @NotBlank @JsonProperty("storage_type") String storageType,
        @NotBlank @JsonProperty("reference_record_id") String referenceRecordId,
        @JsonProperty("original_filename") String originalFilename, @JsonProperty("image_url") String imageUrl,
        @JsonProperty("processed_image_url") String processedImageUrl,
        @JsonProperty("duplicate_confidence") double duplicateConfidence,
        @JsonProperty("storage_saved_bytes") long storageSavedBytes,
        @NotNull @JsonProperty("duplicate_type") DuplicateType duplicateType,
        @NotNull @JsonProperty("detected_at") Instant detectedAt) {

    public static final String STORAGE_TYPE_REFERENCE = "reference";
}
