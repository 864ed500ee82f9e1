package sentrix.lifecycle.util;

import java.time.Instant;

import sentrix.lifecycle.api.types.RiskLevel;
import sentrix.lifecycle.exceptions.ValidationException;

/**
 * Argument checks shared by the lifecycle services. Each method throws {@link ValidationException} on failure.
 */
public final class LifecycleArguments {

    private LifecycleArguments() {
        // Utility class
    }

    public static void requireConfidence(double confidence) {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new ValidationException("confidence", "Confidence must be within [0, 1] (got " + confidence + ")");
        }
    }

    public static void requireRiskLevel(RiskLevel riskLevel) {
        if (riskLevel == null) {
            throw new ValidationException("riskLevel", "Risk level is required");
        }
    }

    public static void requireInstant(Instant instant, String name) {
        if (instant == null) {
            throw new ValidationException(name, name + " is required");
        }
    }

    public static void requireNonNegativeSize(long sizeBytes) {
        if (sizeBytes < 0) {
            throw new ValidationException("sizeBytes", "Image size must be >= 0 bytes (got " + sizeBytes + ")");
        }
    }
}
