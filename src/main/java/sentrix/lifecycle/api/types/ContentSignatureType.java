package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Fingerprint of raw image bytes, used to detect byte-exact duplicates.
 *
 * @param sha256
 *            lowercase hex SHA-256 of the image bytes (64 characters)
 * @param md5
 *            lowercase hex MD5 of the image bytes (32 characters)
 * @param sizeBytes
 *            number of bytes hashed
 */
public record ContentSignatureType(@NotBlank String sha256, @NotBlank String md5,
        @PositiveOrZero @JsonProperty("size_bytes") long sizeBytes) {
}
