/*
 * Copyright 2025 Sentrix
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package sentrix.lifecycle.config;

import java.time.Duration;
import java.time.ZoneId;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import sentrix.lifecycle.api.types.PersistenceType;
import sentrix.lifecycle.api.types.RiskLevel;
import sentrix.lifecycle.api.types.WeatherCondition;

/**
 * Tunable policy tables for duplicate matching, validity decay and expiration alerting.
 *
 * <p>
 * The duplicate weights, the GPS proximity threshold and the risk/weather/confidence multipliers are heuristics with
 * no independently documented derivation. They are exposed here so epidemiologists can review and override them
 * without a code change.
 *
 * <p>
 * <b>Configuration Properties (prefix {@code sentrix.lifecycle}):</b>
 * <ul>
 * <li>{@code validity.base-days.*} - base validity per persistence class (default: 2/14/60/180/365)</li>
 * <li>{@code validity.risk-multiplier.*} - HIGH 1.5, MEDIUM 1.0, LOW 0.8, MINIMAL 0.6</li>
 * <li>{@code validity.weather-multiplier.*} - applied to TRANSIENT sites only</li>
 * <li>{@code validity.low-confidence-threshold}/{@code -factor} - 0.7 / 0.7</li>
 * <li>{@code validity.high-confidence-threshold}/{@code -factor} - 0.9 / 1.1</li>
 * <li>{@code validity.validated-factor} - 1.3</li>
 * <li>{@code duplicate.content-weight}/{@code camera-weight}/{@code gps-weight} - 0.4 / 0.3 / 0.3</li>
 * <li>{@code duplicate.gps-proximity-km} - 0.1 (100 m)</li>
 * <li>{@code expiration.expiring-soon-days} - 1</li>
 * <li>{@code expiration.alert-debounce-hours} - 24</li>
 * <li>{@code season.zone} - zone used to read the calendar month (default: America/Argentina/Buenos_Aires)</li>
 * </ul>
 *
 * <p>
 * Field initializers mirror the annotation defaults so the class can be constructed directly in unit tests.
 */
@ApplicationScoped
@Startup
public class LifecycleConfig {

    private static final Logger LOG = Logger.getLogger(LifecycleConfig.class);

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.base-days.transient",
            defaultValue = "2")
    int transientDays = 2;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.base-days.short-term",
            defaultValue = "14")
    int shortTermDays = 14;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.base-days.medium-term",
            defaultValue = "60")
    int mediumTermDays = 60;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.base-days.long-term",
            defaultValue = "180")
    int longTermDays = 180;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.base-days.permanent",
            defaultValue = "365")
    int permanentDays = 365;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.risk-multiplier.high",
            defaultValue = "1.5")
    double highRiskMultiplier = 1.5;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.risk-multiplier.medium",
            defaultValue = "1.0")
    double mediumRiskMultiplier = 1.0;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.risk-multiplier.low",
            defaultValue = "0.8")
    double lowRiskMultiplier = 0.8;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.risk-multiplier.minimal",
            defaultValue = "0.6")
    double minimalRiskMultiplier = 0.6;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.weather-multiplier.sunny",
            defaultValue = "0.5")
    double sunnyMultiplier = 0.5;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.weather-multiplier.rainy",
            defaultValue = "1.5")
    double rainyMultiplier = 1.5;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.weather-multiplier.cloudy",
            defaultValue = "1.0")
    double cloudyMultiplier = 1.0;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.weather-multiplier.dry-season",
            defaultValue = "0.6")
    double drySeasonMultiplier = 0.6;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.weather-multiplier.wet-season",
            defaultValue = "1.8")
    double wetSeasonMultiplier = 1.8;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.low-confidence-threshold",
            defaultValue = "0.7")
    double lowConfidenceThreshold = 0.7;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.low-confidence-factor",
            defaultValue = "0.7")
    double lowConfidenceFactor = 0.7;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.high-confidence-threshold",
            defaultValue = "0.9")
    double highConfidenceThreshold = 0.9;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.high-confidence-factor",
            defaultValue = "1.1")
    double highConfidenceFactor = 1.1;

    @ConfigProperty(
            name = "sentrix.lifecycle.validity.validated-factor",
            defaultValue = "1.3")
    double validatedFactor = 1.3;

    @ConfigProperty(
            name = "sentrix.lifecycle.duplicate.content-weight",
            defaultValue = "0.4")
    double contentWeight = 0.4;

    @ConfigProperty(
            name = "sentrix.lifecycle.duplicate.camera-weight",
            defaultValue = "0.3")
    double cameraWeight = 0.3;

    @ConfigProperty(
            name = "sentrix.lifecycle.duplicate.gps-weight",
            defaultValue = "0.3")
    double gpsWeight = 0.3;

    @ConfigProperty(
            name = "sentrix.lifecycle.duplicate.gps-proximity-km",
            defaultValue = "0.1")
    double gpsProximityKm = 0.1;

    @ConfigProperty(
            name = "sentrix.lifecycle.expiration.expiring-soon-days",
            defaultValue = "1")
    int expiringSoonDays = 1;

    @ConfigProperty(
            name = "sentrix.lifecycle.expiration.alert-debounce-hours",
            defaultValue = "24")
    int alertDebounceHours = 24;

    @ConfigProperty(
            name = "sentrix.lifecycle.season.zone",
            defaultValue = "America/Argentina/Buenos_Aires")
    String seasonZone = "America/Argentina/Buenos_Aires";

    /**
     * Validates the policy tables at startup.
     *
     * @throws LifecycleConfigurationException
     *             if any base validity is not positive, the base validities are not strictly increasing by persistence
     *             class, a multiplier or weight is out of range, or the season zone is unknown
     */
    @PostConstruct
    public void validateConfiguration() {
        int[] baseDays = {transientDays, shortTermDays, mediumTermDays, longTermDays, permanentDays};
        for (int i = 0; i < baseDays.length; i++) {
            if (baseDays[i] < 1) {
                throw fail("Base validity for " + PersistenceType.values()[i] + " must be >= 1 day (got "
                        + baseDays[i] + ")");
            }
            if (i > 0 && baseDays[i] <= baseDays[i - 1]) {
                throw fail("Base validity must increase with persistence: " + PersistenceType.values()[i] + "="
                        + baseDays[i] + " is not greater than " + PersistenceType.values()[i - 1] + "="
                        + baseDays[i - 1]);
            }
        }

        if (!(highRiskMultiplier >= mediumRiskMultiplier && mediumRiskMultiplier >= lowRiskMultiplier
                && lowRiskMultiplier >= minimalRiskMultiplier && minimalRiskMultiplier > 0)) {
            throw fail(String.format("Risk multipliers must be positive and non-increasing from HIGH to MINIMAL "
                    + "(got %.2f/%.2f/%.2f/%.2f)", highRiskMultiplier, mediumRiskMultiplier, lowRiskMultiplier,
                    minimalRiskMultiplier));
        }

        for (double multiplier : new double[]{sunnyMultiplier, rainyMultiplier, cloudyMultiplier,
                drySeasonMultiplier, wetSeasonMultiplier, lowConfidenceFactor, highConfidenceFactor,
                validatedFactor}) {
            if (!(multiplier > 0)) {
                throw fail("Validity multipliers must be positive (got " + multiplier + ")");
            }
        }

        if (!isUnitInterval(lowConfidenceThreshold) || !isUnitInterval(highConfidenceThreshold)
                || lowConfidenceThreshold > highConfidenceThreshold) {
            throw fail(String.format("Confidence thresholds must satisfy 0 <= low <= high <= 1 (got %.2f/%.2f)",
                    lowConfidenceThreshold, highConfidenceThreshold));
        }

        if (!isUnitInterval(contentWeight) || !isUnitInterval(cameraWeight) || !isUnitInterval(gpsWeight)) {
            throw fail(String.format("Duplicate weights must be within [0,1] (got %.2f/%.2f/%.2f)", contentWeight,
                    cameraWeight, gpsWeight));
        }

        if (!(gpsProximityKm >= 0) || expiringSoonDays < 0 || alertDebounceHours < 0) {
            throw fail("Distance and window thresholds must not be negative");
        }

        try {
            ZoneId.of(seasonZone);
        } catch (RuntimeException e) {
            LOG.fatalf("Unknown season zone: %s", seasonZone);
            throw new LifecycleConfigurationException("Unknown season zone: " + seasonZone, e);
        }

        LOG.infof("Lifecycle policy loaded: base days %d/%d/%d/%d/%d, duplicate weights %.2f/%.2f/%.2f within %.3f km",
                transientDays, shortTermDays, mediumTermDays, longTermDays, permanentDays, contentWeight,
                cameraWeight, gpsWeight, gpsProximityKm);
    }

    /**
     * Base validity for a persistence class, before any modifier.
     *
     * @param type
     *            persistence class
     * @return base validity in days
     */
    public int baseValidityDays(PersistenceType type) {
        return switch (type) {
            case TRANSIENT -> transientDays;
            case SHORT_TERM -> shortTermDays;
            case MEDIUM_TERM -> mediumTermDays;
            case LONG_TERM -> longTermDays;
            case PERMANENT -> permanentDays;
        };
    }

    public double riskMultiplier(RiskLevel riskLevel) {
        return switch (riskLevel) {
            case HIGH -> highRiskMultiplier;
            case MEDIUM -> mediumRiskMultiplier;
            case LOW -> lowRiskMultiplier;
            case MINIMAL -> minimalRiskMultiplier;
        };
    }

    public double weatherMultiplier(WeatherCondition condition) {
        return switch (condition) {
            case SUNNY -> sunnyMultiplier;
            case RAINY -> rainyMultiplier;
            case CLOUDY -> cloudyMultiplier;
            case DRY_SEASON -> drySeasonMultiplier;
            case WET_SEASON -> wetSeasonMultiplier;
        };
    }

    public double lowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public double lowConfidenceFactor() {
        return lowConfidenceFactor;
    }

    public double highConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public double highConfidenceFactor() {
        return highConfidenceFactor;
    }

    public double validatedFactor() {
        return validatedFactor;
    }

    public double contentWeight() {
        return contentWeight;
    }

    public double cameraWeight() {
        return cameraWeight;
    }

    public double gpsWeight() {
        return gpsWeight;
    }

    public double gpsProximityKm() {
        return gpsProximityKm;
    }

    public int expiringSoonDays() {
        return expiringSoonDays;
    }

    public Duration alertDebounce() {
        return Duration.ofHours(alertDebounceHours);
    }

    public ZoneId seasonZone() {
        return ZoneId.of(seasonZone);
    }

    private static boolean isUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static LifecycleConfigurationException fail(String message) {
        LOG.fatal(message);
        return new LifecycleConfigurationException(message);
    }

    /**
     * Exception thrown when the lifecycle policy configuration is invalid.
     */
    public static class LifecycleConfigurationException extends RuntimeException {

        public LifecycleConfigurationException(String message) {
            super(message);
        }

        public LifecycleConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
