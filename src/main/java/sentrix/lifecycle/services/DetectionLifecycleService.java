package sentrix.lifecycle.services;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.BreedingSiteType;
import sentrix.lifecycle.api.types.CameraInfoType;
import sentrix.lifecycle.api.types.ContentSignatureType;
import sentrix.lifecycle.api.types.DetectionCandidateType;
import sentrix.lifecycle.api.types.DetectionMetadataType;
import sentrix.lifecycle.api.types.DetectionRecordType;
import sentrix.lifecycle.api.types.DuplicateCheckResultType;
import sentrix.lifecycle.api.types.DuplicateReferenceType;
import sentrix.lifecycle.api.types.GpsInfoType;
import sentrix.lifecycle.api.types.PersistenceType;
import sentrix.lifecycle.api.types.RiskLevel;
import sentrix.lifecycle.api.types.StorageSavingsType;
import sentrix.lifecycle.api.types.ValidityAssessmentType;
import sentrix.lifecycle.api.types.ValidityExtensionType;
import sentrix.lifecycle.api.types.WeatherCondition;
import sentrix.lifecycle.config.LifecycleConfig;
import sentrix.lifecycle.exceptions.ValidationException;
import sentrix.lifecycle.integration.weather.SeasonalWeatherMapper;
import sentrix.lifecycle.observability.LifecycleMetrics;
import sentrix.lifecycle.observability.LoggingConfig;
import sentrix.lifecycle.util.LifecycleArguments;

/**
 * Entry point of the detection lifecycle engine.
 *
 * <p>
 * Composes the single-purpose services into the two calls a storage layer makes:
 * <ul>
 * <li>{@link #onIngest} - signature, exact-content lookup and similarity scoring for a newly uploaded image</li>
 * <li>{@link #onQuery} - persistence class, validity period and expiration status for a stored detection</li>
 * </ul>
 *
 * <p>
 * Nothing is persisted here. Candidate lists, stored detections and the last alert instant all come from the caller,
 * and every result is derived from arguments alone, so the bean is safe to call from any number of threads.
 */
@ApplicationScoped
public class DetectionLifecycleService {

    private static final Logger LOG = Logger.getLogger(DetectionLifecycleService.class);

    @Inject
    ContentSignatureService signatureService;

    @Inject
    DuplicateMatcherService duplicateMatcher;

    @Inject
    PersistenceClassifier classifier;

    @Inject
    ValidityCalculatorService validityCalculator;

    @Inject
    ExpirationTrackerService expirationTracker;

    @Inject
    LifecycleConfig config;

    @Inject
    LifecycleMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * Checks a newly uploaded image against stored candidates.
     *
     * @param newImageBytes
     *            raw image bytes
     * @param candidates
     *            stored records to compare against, most relevant first
     * @param cameraInfo
     *            camera metadata extracted from the upload (optional)
     * @param gpsInfo
     *            GPS metadata extracted from the upload (optional)
     * @return duplicate decision; when {@code isDuplicate} the caller persists a reference instead of the bytes
     * @throws ValidationException
     *             if {@code newImageBytes} is null
     */
    public DuplicateCheckResultType onIngest(byte[] newImageBytes, List<DetectionCandidateType> candidates,
            CameraInfoType cameraInfo, GpsInfoType gpsInfo) {
        Span span = tracer.spanBuilder("lifecycle.ingest")
                .setAttribute("candidates", candidates == null ? 0 : candidates.size()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();

            ContentSignatureType signature = signatureService.computeSignature(newImageBytes);
            LoggingConfig.setContentHash(signature.sha256());

            DuplicateCheckResultType result = duplicateMatcher.checkDuplicate(signature, signature.sizeBytes(),
                    candidates, cameraInfo, gpsInfo);

            span.setAttribute("duplicate", result.isDuplicate());
            span.setAttribute("confidence", result.confidence());
            metrics.recordDuplicateCheck(result.isDuplicate(), result.storageSavedBytes());
            return result;
        } catch (ValidationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Derives the current validity of a stored detection.
     *
     * <p>
     * When the record carries no weather condition, the calendar fallback for the detection month (read in the
     * configured season zone) is used instead.
     *
     * @param detection
     *            stored detection
     * @param now
     *            evaluation instant
     * @return assessment tagged with the site's persistence class
     * @throws ValidationException
     *             if the record is missing, lacks a risk level or detection date, or has confidence outside [0,1]
     */
    public ValidityAssessmentType onQuery(DetectionRecordType detection, Instant now) {
        if (detection == null) {
            throw new ValidationException("Detection record is required");
        }
        LifecycleArguments.requireInstant(detection.detectionDate(), "detectionDate");
        LifecycleArguments.requireInstant(now, "now");

        Span span = tracer.spanBuilder("lifecycle.query").startSpan();
        if (detection.id() != null) {
            span.setAttribute("detection.id", detection.id());
        }

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setDetectionId(detection.id());

            PersistenceType persistence = classifier.classify(detection.breedingSiteType());
            WeatherCondition weather = detection.weatherCondition();
            if (weather == null) {
                int month = detection.detectionDate().atZone(config.seasonZone()).getMonthValue();
                weather = SeasonalWeatherMapper.getSeasonalWeather(month);
                LOG.debugf("No recorded weather, using seasonal %s for month %d", weather, month);
            }

            int validityDays = validityCalculator.computeValidityDays(detection.breedingSiteType(),
                    detection.riskLevel(), weather, detection.confidence(), detection.validated());
            Instant expiresAt = detection.detectionDate().plus(Duration.ofDays(validityDays));

            ValidityAssessmentType assessment = expirationTracker.getValidityStatus(expiresAt, validityDays, now)
                    .withPersistenceType(persistence);

            span.setAttribute("persistence_type", persistence.name());
            span.setAttribute("validity_days", validityDays);
            span.setAttribute("status", assessment.status().name());
            metrics.recordValidityQuery(assessment.status());
            LOG.debugf("Detection %s is %s (expires %s, %d days remaining)", detection.id(), assessment.status(),
                    expiresAt, assessment.remainingDays());
            return assessment;
        } catch (ValidationException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Calendar weather fallback used when no live feed is wired in.
     *
     * @param month
     *            month of year (1-12)
     * @return seasonal weather condition
     */
    public WeatherCondition getSeasonalWeather(int month) {
        return SeasonalWeatherMapper.getSeasonalWeather(month);
    }

    /**
     * Decides whether the notification layer should dispatch an expiration alert.
     *
     * @param expiresAt
     *            expiration instant
     * @param lastAlertSentAt
     *            when the caller last dispatched an alert (optional)
     * @param now
     *            evaluation instant
     * @return true if an alert should be sent; the caller then records {@code now} as its last alert
     */
    public boolean shouldSendExpirationAlert(Instant expiresAt, Instant lastAlertSentAt, Instant now) {
        boolean send = expirationTracker.shouldSendExpirationAlert(expiresAt, lastAlertSentAt, now);
        metrics.recordAlertDecision(send);
        if (send) {
            LOG.infof("Expiration alert due for detection expiring at %s", expiresAt);
        }
        return send;
    }

    /**
     * Status of a stored detection known only by its expiration instant.
     *
     * @param expiresAt
     *            stored expiration
     * @param now
     *            evaluation instant
     * @return assessment with unknown validity period (0) and no persistence class
     */
    public ValidityAssessmentType getValidityStatus(Instant expiresAt, Instant now) {
        ValidityAssessmentType assessment = expirationTracker.getValidityStatus(expiresAt, now);
        metrics.recordValidityQuery(assessment.status());
        return assessment;
    }

    /**
     * Whether a stored detection should be flagged for re-verification.
     *
     * @param expiresAt
     *            stored expiration (null when none was set)
     * @param now
     *            evaluation instant
     * @return false without an expiration, otherwise true once expiring soon or expired
     */
    public boolean requiresRevalidation(Instant expiresAt, Instant now) {
        return expirationTracker.requiresRevalidation(expiresAt, now);
    }

    /**
     * Extends a detection's validity, e.g. after a field inspector confirms the site is still present.
     *
     * @param currentExpiresAt
     *            current expiration
     * @param extensionDays
     *            days to add (at least 1)
     * @param reason
     *            free-form reason (optional)
     * @param extendedAt
     *            when the extension was requested
     * @return extension to persist
     */
    public ValidityExtensionType extendValidity(Instant currentExpiresAt, int extensionDays, String reason,
            Instant extendedAt) {
        return expirationTracker.extendValidity(currentExpiresAt, extensionDays, reason, extendedAt);
    }

    public DuplicateReferenceType createDuplicateReference(String newRecordId, String originalFilename,
            DuplicateCheckResultType result, long newSizeBytes, Instant detectedAt) {
        return duplicateMatcher.createDuplicateReference(newRecordId, originalFilename, result, newSizeBytes,
                detectedAt);
    }

    public StorageSavingsType estimateStorageSavings(int totalAnalyses, List<DuplicateReferenceType> references) {
        return duplicateMatcher.estimateStorageSavings(totalAnalyses, references);
    }

    public DetectionMetadataType getDetectionMetadata(BreedingSiteType breedingSiteType, RiskLevel riskLevel) {
        return validityCalculator.getDetectionMetadata(breedingSiteType, riskLevel);
    }

    /**
     * Normalises a risk label from the detection pipeline.
     *
     * @param label
     *            Spanish or English risk label
     * @return parsed level, MEDIUM for unrecognised or missing labels
     */
    public RiskLevel resolveRiskLevel(String label) {
        return RiskLevel.fromLabel(label).orElseGet(() -> {
            LOG.warnf("Unknown risk level '%s', defaulting to %s", label, RiskLevel.MEDIUM);
            return RiskLevel.MEDIUM;
        });
    }
}
