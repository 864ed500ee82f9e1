package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Storage accounting for a batch of analyses, some of which were stored as duplicate references.
 *
 * @param totalAnalyses
 *            analyses in the batch
 * @param uniqueImages
 *            analyses that stored their own bytes
 * @param duplicateReferences
 *            analyses stored as references
 * @param storageSavedBytes
 *            bytes not written
 * @param storageSavedMb
 *            bytes not written, in MiB rounded to 2 decimals
 * @param deduplicationRate
 *            percentage of analyses stored as references, rounded to 1 decimal
 */
public record StorageSavingsType(@JsonProperty("total_analyses") int totalAnalyses,
        @JsonProperty("unique_images") int uniqueImages,
        @JsonProperty("duplicate_references") int duplicateReferences,
        @JsonProperty("storage_saved_bytes") long storageSavedBytes,
        @JsonProperty("storage_saved_mb") double storageSavedMb,
        @JsonProperty("deduplication_rate") double deduplicationRate) {
}
