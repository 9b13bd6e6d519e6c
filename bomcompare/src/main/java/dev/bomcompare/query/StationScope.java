package dev.bomcompare.query;

import java.util.Objects;

/**
 * Pairs the precis forecast area with the station that observes it.
 *
 * <p>
 * Forecasts and observations use different identifiers (an area name vs a WMO
 * number); only forecasts for {@code forecastArea} are matched with readings
 * from {@code observationStation}.
 * </p>
 */
public record StationScope(String forecastArea, String observationStation) {

    public StationScope {
        Objects.requireNonNull(forecastArea, "forecastArea");
        Objects.requireNonNull(observationStation, "observationStation");
    }

    public boolean matches(String forecastStationId, String observationStationId) {
        return forecastArea.equals(forecastStationId) && observationStation.equals(observationStationId);
    }

    public boolean covers(String forecastStationId) {
        return forecastArea.equals(forecastStationId);
    }

    /**
     * Maps a user-supplied station filter (area name or station number) to a forecast area.
     * Null means no filter.
     */
    public String forecastAreaFor(String stationFilter) {
        if (stationFilter == null || stationFilter.isBlank())
            return null;
        String f = stationFilter.strip();
        return f.equals(observationStation) ? forecastArea : f;
    }
}
