package sentrix.lifecycle.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Manual extension of a detection's validity, returned for the storage layer to apply.
 *
 * @param previousExpiresAt
 *            expiration before the extension
 * @param expiresAt
 *            new expiration
 * @param extensionDays
 *            days added
 * @param reason
 *            why the validity was extended
 * @param extendedAt
 *            when the extension was requested
 */
public record ValidityExtensionType(@JsonProperty("previous_expires_at") Instant previousExpiresAt,
        @JsonProperty("expires_at") Instant expiresAt, @JsonProperty("extension_days") int extensionDays,
        String reason, @JsonProperty("extended_at") Instant extendedAt) {
}
