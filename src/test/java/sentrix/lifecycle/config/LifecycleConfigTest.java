/*
 * Copyright 2025 Sentrix
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package sentrix.lifecycle.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;

import sentrix.lifecycle.api.types.PersistenceType;
import sentrix.lifecycle.api.types.RiskLevel;
import sentrix.lifecycle.api.types.WeatherCondition;
import sentrix.lifecycle.config.LifecycleConfig.LifecycleConfigurationException;

/**
 * Unit tests for {@link LifecycleConfig} defaults and startup validation.
 *
 * <p>
 * <b>Note:</b> These are lightweight unit tests that don't require the Quarkus context. Loading the same values from
 * application.yaml is covered by the wiring test.
 */
public class LifecycleConfigTest {

    @Test
    public void testDefaults_passValidation() {
        LifecycleConfig config = new LifecycleConfig();

        assertDoesNotThrow(config::validateConfiguration, "Default policy tables should be valid");
    }

    @Test
    public void testDefaults_tables() {
        LifecycleConfig config = new LifecycleConfig();

        assertEquals(2, config.baseValidityDays(PersistenceType.TRANSIENT));
        assertEquals(14, config.baseValidityDays(PersistenceType.SHORT_TERM));
        assertEquals(60, config.baseValidityDays(PersistenceType.MEDIUM_TERM));
        assertEquals(180, config.baseValidityDays(PersistenceType.LONG_TERM));
        assertEquals(365, config.baseValidityDays(PersistenceType.PERMANENT));
        assertEquals(1.5, config.riskMultiplier(RiskLevel.HIGH));
        assertEquals(0.6, config.riskMultiplier(RiskLevel.MINIMAL));
        assertEquals(1.8, config.weatherMultiplier(WeatherCondition.WET_SEASON));
        assertEquals(Duration.ofHours(24), config.alertDebounce());
        assertEquals(ZoneId.of("America/Argentina/Buenos_Aires"), config.seasonZone());
    }

    @Test
    public void testValidationFailsWithNonPositiveBaseDays() {
        LifecycleConfig config = new LifecycleConfig();
        config.transientDays = 0;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration,
                "Validation should fail when a base validity is below one day");
    }

    /**
     * A longer-lived persistence class must never expire sooner than a shorter-lived one.
     */
    @Test
    public void testValidationFailsWhenBaseDaysNotIncreasing() {
        LifecycleConfig config = new LifecycleConfig();
        config.longTermDays = 60;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration,
                "Validation should fail when LONG_TERM does not outlast MEDIUM_TERM");
    }

    @Test
    public void testValidationFailsWhenLowRiskOutlastsHighRisk() {
        LifecycleConfig config = new LifecycleConfig();
        config.lowRiskMultiplier = 2.0;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }

    @Test
    public void testValidationFailsWithNonPositiveWeatherMultiplier() {
        LifecycleConfig config = new LifecycleConfig();
        config.sunnyMultiplier = 0.0;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }

    @Test
    public void testValidationFailsWithWeightOutsideUnitInterval() {
        LifecycleConfig config = new LifecycleConfig();
        config.gpsWeight = 1.5;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }

    @Test
    public void testValidationFailsWithInvertedConfidenceThresholds() {
        LifecycleConfig config = new LifecycleConfig();
        config.lowConfidenceThreshold = 0.95;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }

    @Test
    public void testValidationFailsWithNegativeDebounce() {
        LifecycleConfig config = new LifecycleConfig();
        config.alertDebounceHours = -1;

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }

    @Test
    public void testValidationFailsWithUnknownZone() {
        LifecycleConfig config = new LifecycleConfig();
        config.seasonZone = "Mars/Olympus_Mons";

        assertThrows(LifecycleConfigurationException.class, config::validateConfiguration);
    }
}
