package sentrix.lifecycle.services;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.ValidityAssessmentType;
import sentrix.lifecycle.api.types.ValidityExtensionType;
import sentrix.lifecycle.api.types.ValidityStatus;
import sentrix.lifecycle.config.LifecycleConfig;
import sentrix.lifecycle.exceptions.ValidationException;
import sentrix.lifecycle.util.LifecycleArguments;

/**
 * Derives expiry status, remaining time and alert decisions from an expiration instant.
 *
 * <p>
 * <b>Status thresholds:</b>
 * <ul>
 * <li><b>EXPIRED:</b> {@code now >= expiresAt}; percentage 0, requires revalidation</li>
 * <li><b>EXPIRING_SOON:</b> not expired and at most {@code expiring-soon-days} whole days left; percentage 10, requires
 * revalidation</li>
 * <li><b>VALID:</b> otherwise; percentage 100</li>
 * </ul>
 *
 * <p>
 * <b>Alert debounce:</b> the instant of the last alert is owned and persisted by the caller and passed in on every
 * call. This service keeps no record of alerts it has approved.
 */
@ApplicationScoped
public class ExpirationTrackerService {

    private static final Logger LOG = Logger.getLogger(ExpirationTrackerService.class);

    static final int PERCENT_VALID = 100;
    static final int PERCENT_EXPIRING_SOON = 10;
    static final int PERCENT_EXPIRED = 0;
    static final int UNKNOWN_VALIDITY_DAYS = 0;

    @Inject
    LifecycleConfig config;

    /**
     * @return true when {@code now} is at or past {@code expiresAt}
     */
    public boolean isExpired(Instant expiresAt, Instant now) {
        LifecycleArguments.requireInstant(expiresAt, "expiresAt");
        LifecycleArguments.requireInstant(now, "now");
        return !now.isBefore(expiresAt);
    }

    /**
     * Whole days left until expiration.
     *
     * @param expiresAt
     *            expiration instant
     * @param now
     *            evaluation instant
     * @return remaining whole days, 0 once expired (never negative)
     */
    public long remainingDays(Instant expiresAt, Instant now) {
        if (isExpired(expiresAt, now)) {
            return 0;
        }
        return Duration.between(now, expiresAt).toDays();
    }

    /**
     * @return true when not yet expired but within the expiring-soon window
     */
    public boolean isExpiringSoon(Instant expiresAt, Instant now) {
        return !isExpired(expiresAt, now) && remainingDays(expiresAt, now) <= config.expiringSoonDays();
    }

    /**
     * Classifies a detection relative to its expiration.
     *
     * @param expiresAt
     *            expiration instant
     * @param now
     *            evaluation instant
     * @return lifecycle status
     */
    public ValidityStatus statusOf(Instant expiresAt, Instant now) {
        if (isExpired(expiresAt, now)) {
            return ValidityStatus.EXPIRED;
        }
        return isExpiringSoon(expiresAt, now) ? ValidityStatus.EXPIRING_SOON : ValidityStatus.VALID;
    }

    /**
     * Builds the validity view of a detection known only by its expiration instant.
     *
     * @param expiresAt
     *            expiration instant
     * @param now
     *            evaluation instant
     * @return assessment with {@code validityDays} 0 (unknown) and no persistence class
     * @throws ValidationException
     *             if an instant is missing
     */
    public ValidityAssessmentType getValidityStatus(Instant expiresAt, Instant now) {
        return assess(expiresAt, UNKNOWN_VALIDITY_DAYS, now);
    }

    /**
     * Builds the full validity view of a detection.
     *
     * @param expiresAt
     *            expiration instant
     * @param validityDays
     *            validity period the expiration was derived from
     * @param now
     *            evaluation instant
     * @return assessment without a persistence class
     * @throws ValidationException
     *             if {@code validityDays < 1} or an instant is missing
     */
    public ValidityAssessmentType getValidityStatus(Instant expiresAt, int validityDays, Instant now) {
        if (validityDays < 1) {
            throw new ValidationException("validityDays", "Validity must be >= 1 day (got " + validityDays + ")");
        }
        return assess(expiresAt, validityDays, now);
    }

    private ValidityAssessmentType assess(Instant expiresAt, int validityDays, Instant now) {
        ValidityStatus status = statusOf(expiresAt, now);
        int percentage = switch (status) {
            case VALID -> PERCENT_VALID;
            case EXPIRING_SOON -> PERCENT_EXPIRING_SOON;
            case EXPIRED -> PERCENT_EXPIRED;
        };
        return new ValidityAssessmentType(expiresAt, validityDays, status, remainingDays(expiresAt, now), percentage,
                status != ValidityStatus.VALID, null);
    }

    /**
     * Whether a detection with an optional stored expiration needs re-verification.
     *
     * @param expiresAt
     *            stored expiration, or null when none was set
     * @param now
     *            evaluation instant
     * @return false when no expiration is set, otherwise true for EXPIRING_SOON and EXPIRED
     */
    public boolean requiresRevalidation(Instant expiresAt, Instant now) {
        if (expiresAt == null) {
            return false;
        }
        return statusOf(expiresAt, now) != ValidityStatus.VALID;
    }

    /**
     * Decides whether to dispatch an expiration alert.
     *
     * <p>
     * True only inside the expiring-soon window (never once expired) and only if no alert was sent, or the last one is
     * strictly older than the debounce period.
     *
     * @param expiresAt
     *            expiration instant
     * @param lastAlertSentAt
     *            when the caller last dispatched an alert for this detection (optional)
     * @param now
     *            evaluation instant
     * @return true if the caller should dispatch an alert and record {@code now} as its last alert
     */
    public boolean shouldSendExpirationAlert(Instant expiresAt, Instant lastAlertSentAt, Instant now) {
        if (!isExpiringSoon(expiresAt, now)) {
            return false;
        }
        if (lastAlertSentAt != null) {
            Duration sinceLastAlert = Duration.between(lastAlertSentAt, now);
            if (sinceLastAlert.compareTo(config.alertDebounce()) <= 0) {
                LOG.debugf("Suppressing expiration alert: last sent %s ago", sinceLastAlert);
                return false;
            }
        }
        return true;
    }

    /**
     * Extends a detection's validity by a number of days.
     *
     * @param currentExpiresAt
     *            current expiration
     * @param extensionDays
     *            days to add (at least 1)
     * @param reason
     *            why the validity is extended (defaults to "manual_extension")
     * @param extendedAt
     *            when the extension was requested
     * @return extension for the storage layer to apply
     * @throws ValidationException
     *             if {@code extensionDays < 1} or an instant is missing
     */
    public ValidityExtensionType extendValidity(Instant currentExpiresAt, int extensionDays, String reason,
            Instant extendedAt) {
        LifecycleArguments.requireInstant(currentExpiresAt, "currentExpiresAt");
        LifecycleArguments.requireInstant(extendedAt, "extendedAt");
        if (extensionDays < 1) {
            throw new ValidationException("Extension must be >= 1 day (got " + extensionDays + ")");
        }
        String effectiveReason = reason == null || reason.isBlank() ? "manual_extension" : reason;
        Instant newExpiration = currentExpiresAt.plus(Duration.ofDays(extensionDays));
        LOG.infof("Extending validity by %d days to %s (%s)", extensionDays, newExpiration, effectiveReason);
        return new ValidityExtensionType(currentExpiresAt, newExpiration, extensionDays, effectiveReason, extendedAt);
    }
}
