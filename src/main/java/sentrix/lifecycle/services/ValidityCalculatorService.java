package sentrix.lifecycle.services;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.BreedingSiteType;
import sentrix.lifecycle.api.types.DetectionMetadataType;
import sentrix.lifecycle.api.types.PersistenceType;
import sentrix.lifecycle.api.types.RiskLevel;
import sentrix.lifecycle.api.types.WeatherCondition;
import sentrix.lifecycle.config.LifecycleConfig;
import sentrix.lifecycle.util.LifecycleArguments;

/**
 * Computes how long a detection stays current before it must be re-verified.
 *
 * <p>
 * <b>Model:</b> {@code days = base(persistence) × risk × weather × confidence × validation}, truncated to whole days and
 * floored at 1. Truncation tolerates floating-point error below {@link #WHOLE_DAY_TOLERANCE}, so a product that is
 * exactly whole in decimal arithmetic keeps its last day.
 * <ol>
 * <li><b>Base:</b> configured days for the site's persistence class (TRANSIENT 2 ... PERMANENT 365)</li>
 * <li><b>Risk:</b> HIGH extends, MEDIUM is neutral, LOW and MINIMAL shorten</li>
 * <li><b>Weather:</b> TRANSIENT sites only; rain and wet season keep puddles longer, sun and dry season shorter.
 * Structural sites ignore weather entirely</li>
 * <li><b>Confidence:</b> below the low threshold shortens; strictly above the high threshold extends slightly</li>
 * <li><b>Validation:</b> expert-confirmed detections stay actionable longer</li>
 * </ol>
 *
 * <p>
 * There is no upper clamp, so base ordering by persistence class holds for any identical set of modifiers.
 */
@ApplicationScoped
public class ValidityCalculatorService {

    private static final Logger LOG = Logger.getLogger(ValidityCalculatorService.class);

    // Absorbs binary rounding in products that are whole in decimal (180 x 0.7 = 125.99999999999999)
    static final double WHOLE_DAY_TOLERANCE = 1e-9;

    @Inject
    LifecycleConfig config;

    @Inject
    PersistenceClassifier classifier;

    /**
     * Computes the validity period of a detection.
     *
     * @param breedingSiteType
     *            site type (null for a label outside the taxonomy, classified MEDIUM_TERM)
     * @param riskLevel
     *            assessed risk
     * @param weatherCondition
     *            current weather (optional; only consulted for TRANSIENT sites)
     * @param confidence
     *            model confidence (0.0 to 1.0)
     * @param validated
     *            whether an expert confirmed the detection
     * @return validity in whole days, at least 1
     * @throws sentrix.lifecycle.exceptions.ValidationException
     *             if the risk level is missing or confidence is outside [0,1]
     */
    public int computeValidityDays(BreedingSiteType breedingSiteType, RiskLevel riskLevel,
            WeatherCondition weatherCondition, double confidence, boolean validated) {
        LifecycleArguments.requireRiskLevel(riskLevel);
        LifecycleArguments.requireConfidence(confidence);

        PersistenceType persistence = classifier.classify(breedingSiteType);
        double days = config.baseValidityDays(persistence);

        days *= config.riskMultiplier(riskLevel);

        if (weatherCondition != null && persistence.isWeatherDependent()) {
            days *= config.weatherMultiplier(weatherCondition);
        }

        if (confidence < config.lowConfidenceThreshold()) {
            days *= config.lowConfidenceFactor();
        } else if (confidence > config.highConfidenceThreshold()) {
            days *= config.highConfidenceFactor();
        }

        if (validated) {
            days *= config.validatedFactor();
        }

        int validityDays = Math.max(1, (int) Math.floor(days + WHOLE_DAY_TOLERANCE));
        LOG.debugf("Validity for %s (%s, risk=%s, weather=%s, confidence=%.2f, validated=%s): %d days",
                breedingSiteType, persistence, riskLevel, weatherCondition, confidence, validated, validityDays);
        return validityDays;
    }

    /**
     * Computes when a detection expires. Reads no clock: the only instant involved is {@code detectionDate}.
     *
     * @param detectionDate
     *            when the detection was made
     * @param breedingSiteType
     *            site type
     * @param riskLevel
     *            assessed risk
     * @param weatherCondition
     *            current weather (optional)
     * @param confidence
     *            model confidence (0.0 to 1.0)
     * @param validated
     *            whether an expert confirmed the detection
     * @return {@code detectionDate} plus the validity period
     */
    public Instant computeExpirationDate(Instant detectionDate, BreedingSiteType breedingSiteType,
            RiskLevel riskLevel, WeatherCondition weatherCondition, double confidence, boolean validated) {
        LifecycleArguments.requireInstant(detectionDate, "detectionDate");
        int days = computeValidityDays(breedingSiteType, riskLevel, weatherCondition, confidence, validated);
        return detectionDate.plus(Duration.ofDays(days));
    }

    /**
     * Describes the persistence characteristics of a breeding-site type.
     *
     * @param breedingSiteType
     *            site type (null for a label outside the taxonomy)
     * @param riskLevel
     *            assessed risk, echoed back
     * @return metadata for display
     */
    public DetectionMetadataType getDetectionMetadata(BreedingSiteType breedingSiteType, RiskLevel riskLevel) {
        PersistenceType persistence = classifier.classify(breedingSiteType);
        return new DetectionMetadataType(breedingSiteType, riskLevel, persistence,
                config.baseValidityDays(persistence), persistence.isWeatherDependent(),
                persistence.typicalLifespan(), persistence.requiresFrequentMonitoring(),
                persistence.requiresStructuralIntervention());
    }
}
