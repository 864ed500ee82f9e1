package sentrix.lifecycle.api.types;

/**
 * Lifecycle state of a detection relative to its expiration instant.
 */
public enum ValidityStatus {
    VALID, EXPIRING_SOON, EXPIRED
}
