package sentrix.lifecycle.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Stored detection attributes the engine needs to derive a validity assessment.
 *
 * <p>
 * The stored record is authoritative; the assessment derived from it is never persisted as state.
 *
 * @param id
 *            storage-layer detection id
 * @param breedingSiteType
 *            classified site type (null when the stored label is outside the known taxonomy)
 * @param riskLevel
 *            assessed risk
 * @param confidence
 *            model confidence (0.0 to 1.0)
 * @param validated
 *            whether an expert confirmed the detection
 * @param detectionDate
 *            when the detection was made
 * @param weatherCondition
 *            weather recorded at detection time (optional, seasonal fallback applies when absent)
 */
public record DetectionRecordType(String id,
        @JsonProperty("breeding_site_type") BreedingSiteType breedingSiteType,
        @NotNull @JsonProperty("risk_level") RiskLevel riskLevel,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence, @JsonProperty("is_validated") boolean validated,
        @NotNull @JsonProperty("detection_date") Instant detectionDate,
        @JsonProperty("weather_condition") WeatherCondition weatherCondition) {
}
