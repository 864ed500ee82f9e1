package sentrix.lifecycle.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persistence facts about a breeding-site type, for display next to a detection.
 *
 * @param breedingSite
 *            site type (null when unknown to the taxonomy)
 * @param riskLevel
 *            assessed risk
 * @param persistenceType
 *            persistence class
 * @param baseValidityDays
 *            configured base validity for the persistence class
 * @param weatherDependent
 *            whether weather changes the validity period
 * @param typicalLifespan
 *            human-readable lifespan of the persistence class
 * @param requiresFrequentMonitoring
 *            true for transient sites
 * @param requiresStructuralIntervention
 *            true for long-term and permanent sites
 */
public record DetectionMetadataType(@JsonProperty("breeding_site") BreedingSiteType breedingSite,
        @JsonProperty("risk_level") RiskLevel riskLevel,
        @JsonProperty("persistence_type") PersistenceType persistenceType,
        @JsonProperty("base_validity_days") int baseValidityDays,
        @JsonProperty("is_weather_dependent") boolean weatherDependent,
        @JsonProperty("typical_lifespan") String typicalLifespan,
        @JsonProperty("requires_frequent_monitoring") boolean requiresFrequentMonitoring,
        @JsonProperty("requires_structural_intervention") boolean requiresStructuralIntervention) {
}
