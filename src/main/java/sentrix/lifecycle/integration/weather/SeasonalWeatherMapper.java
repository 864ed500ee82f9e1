/*
 * Copyright (c) 2025 Sentrix. All rights reserved.
 */
package sentrix.lifecycle.integration.weather;

import sentrix.lifecycle.api.types.WeatherCondition;
import sentrix.lifecycle.exceptions.ValidationException;

/**
 * Utility for deriving a {@link WeatherCondition} without a live weather service.
 *
 * <p>
 * Field work happens in the southern hemisphere, so the calendar fallback follows southern seasons. A live feed is
 * wired by callers; when it reports WMO codes, {@link #fromWmoCode(int)} translates them.
 *
 * <h2>Calendar Fallback</h2>
 * <ul>
 * <li>December-February (summer): WET_SEASON</li>
 * <li>June-August (winter): DRY_SEASON</li>
 * <li>Other months (autumn, spring): CLOUDY</li>
 * </ul>
 *
 * <h2>WMO Code Ranges</h2>
 * <ul>
 * <li>0-1: Clear / mainly clear - SUNNY</li>
 * <li>2-3, 45-48: Cloud and fog - CLOUDY</li>
 * <li>51-67, 80-82, 95-99: Drizzle, rain, showers, thunderstorm - RAINY</li>
 * <li>Snow and unknown codes - CLOUDY</li>
 * </ul>
 *
 * @see <a href="https://open-meteo.com/en/docs">Open-Meteo API Docs</a>
 */
public final class SeasonalWeatherMapper {

    private SeasonalWeatherMapper() {
        // Utility class
    }

    /**
     * Estimates weather from the calendar month.
     *
     * @param month
     *            month of year (1-12)
     * @return seasonal weather condition
     * @throws ValidationException
     *             if {@code month} is outside 1-12
     */
    public static WeatherCondition getSeasonalWeather(int month) {
        return switch (month) {
            case 12, 1, 2 -> WeatherCondition.WET_SEASON;
            case 6, 7, 8 -> WeatherCondition.DRY_SEASON;
            case 3, 4, 5, 9, 10, 11 -> WeatherCondition.CLOUDY;
            default -> throw new ValidationException("Month must be within 1-12 (got " + month + ")");
        };
    }

    /**
     * Maps a WMO weather code reported by a live feed.
     *
     * @param code
     *            WMO weather code (0-99)
     * @return weather condition, CLOUDY for snow and unknown codes
     */
    public static WeatherCondition fromWmoCode(int code) {
        return switch (code) {
            case 0, 1 -> WeatherCondition.SUNNY;
            case 51, 53, 55, 56, 57, 61, 63, 65, 66, 67, 80, 81, 82, 95, 96, 99 -> WeatherCondition.RAINY;
            default -> WeatherCondition.CLOUDY; // 2, 3, fog, snow
        };
    }
}
