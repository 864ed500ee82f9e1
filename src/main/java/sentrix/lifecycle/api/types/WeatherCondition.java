package sentrix.lifecycle.api.types;

/**
 * Weather conditions that change how long standing water persists.
 */
public enum WeatherCondition {
    SUNNY, RAINY, CLOUDY, WET_SEASON, DRY_SEASON
}
