package sentrix.lifecycle.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Derived view of how current a detection is. Recomputed on demand, never stored as authoritative state.
 *
 * @param expiresAt
 *            instant the detection stops being current
 * @param validityDays
 *            validity period the expiration was derived from, 0 when assessed from an expiration instant alone
 * @param status
 *            VALID, EXPIRING_SOON or EXPIRED
 * @param remainingDays
 *            whole days until expiration, never negative
 * @param validityPercentage
 *            100 for VALID, 10 for EXPIRING_SOON, 0 for EXPIRED
 * @param requiresRevalidation
 *            whether a UI should flag the detection for re-verification
 * @param persistenceType
 *            persistence class of the breeding site (null when assessed from an expiration instant alone)
 */
public record ValidityAssessmentType(@NotNull @JsonProperty("expires_at") Instant expiresAt,
        @PositiveOrZero @JsonProperty("validity_days") int validityDays, @NotNull ValidityStatus status,
        @PositiveOrZero @JsonProperty("remaining_days") long remainingDays,
        @Min(0) @Max(100) @JsonProperty("validity_percentage") int validityPercentage,
        @JsonProperty("requires_revalidation") boolean requiresRevalidation,
        @JsonProperty("persistence_type") PersistenceType persistenceType) {

    /**
     * Returns a copy tagged with the persistence class it was computed for.
     *
     * @param type
     *            persistence class of the assessed detection
     * @return tagged assessment
     */
    public ValidityAssessmentType withPersistenceType(PersistenceType type) {
        return new ValidityAssessmentType(expiresAt, validityDays, status, remainingDays, validityPercentage,
                requiresRevalidation, type);
    }
}
