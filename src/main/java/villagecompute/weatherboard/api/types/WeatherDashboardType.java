package villagecompute.weatherboard.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON view of a user's dashboard.
 *
 * @param cities
 *            snapshots for every tracked city that could be fetched
 * @param unavailableCityIds
 *            tracked cities whose weather could not be fetched on this request
 */
public record WeatherDashboardType(List<WeatherSnapshotType> cities,
        @JsonProperty("unavailable_city_ids") List<Long> unavailableCityIds) {
}
