package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Outcome of checking an ingested image against stored candidates.
 *
 * <p>
 * {@code isDuplicate} is only ever true for an exact content-hash and size match. When it is, the caller should
 * persist a reference to {@code referenceImageUrl} instead of the new bytes.
 *
 * @param isDuplicate
 *            whether an exact-content match exists
 * @param duplicateRecordId
 *            id of the referenced record (null when not a duplicate)
 * @param duplicateType
 *            {@link DuplicateType#EXACT_CONTENT} or {@link DuplicateType#NONE}
 * @param shouldStoreSeparately
 *            always {@code !isDuplicate}
 * @param referenceImageUrl
 *            image URL of the referenced record (null when not a duplicate)
 * @param confidence
 *            similarity score of the referenced record (0.0 to 1.0)
 * @param storageSavedBytes
 *            bytes not written because of the reference (0 when not a duplicate)
 */
public record DuplicateCheckResultType(@JsonProperty("is_duplicate") boolean isDuplicate,
        @JsonProperty("duplicate_record_id") String duplicateRecordId,
        @NotNull @JsonProperty("duplicate_type") DuplicateType duplicateType,
        @JsonProperty("should_store_separately") boolean shouldStoreSeparately,
        @JsonProperty("reference_image_url") String referenceImageUrl,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @JsonProperty("storage_saved_bytes") long storageSavedBytes) {

    /**
     * Creates a result telling the caller to store the image.
     *
     * @return non-duplicate result with zero confidence
     */
    public static DuplicateCheckResultType unique() {
        return new DuplicateCheckResultType(false, null, DuplicateType.NONE, true, null, 0.0, 0L);
    }

    /**
     * Creates a result telling the caller to reference an existing record.
     *
     * @param match
     *            the winning candidate
     * @param confidence
     *            similarity score of the winning candidate
     * @param newSizeBytes
     *            size of the image that will not be stored
     * @return duplicate result pointing at {@code match}
     */
    public static DuplicateCheckResultType exactContent(DetectionCandidateType match, double confidence,
            long newSizeBytes) {
        return new DuplicateCheckResultType(true, match.id(), DuplicateType.EXACT_CONTENT, false, match.imageUrl(),
                confidence, newSizeBytes);
    }
}
