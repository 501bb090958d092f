/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import io.quarkus.qute.TemplateData;

/**
 * Normalized current weather for one city at one point in time.
 *
 * <p>
 * Built by {@link villagecompute.weatherboard.integration.weather.WeatherSnapshotNormalizer} from an OpenWeatherMap
 * response and cached for a fixed window. Textual fields fall back to {@value #NOT_AVAILABLE} when the provider omits
 * them; numeric temperatures stay null so templates can decide how to render a gap.
 *
 * @param id
 *            OpenWeatherMap city identifier
 * @param name
 *            city display name
 * @param country
 *            ISO country code, empty when unknown
 * @param description
 *            textual condition description (e.g., "light rain")
 * @param temp
 *            current temperature in Celsius
 * @param tempMin
 *            minimum temperature in Celsius
 * @param tempMax
 *            maximum temperature in Celsius
 * @param icon
 *            OpenWeatherMap icon code (e.g., "10d")
 * @param pressure
 *            atmospheric pressure in hPa
 * @param humidity
 *            relative humidity percentage
 * @param visibility
 *            visibility in kilometres with one decimal
 * @param windSpeed
 *            wind speed in metres per second
 * @param observedAt
 *            local observation time
 * @param sunrise
 *            local sunrise time
 * @param sunset
 *            local sunset time
 */
@TemplateData
@Schema(
        description = "Current weather conditions for a tracked city")
public record WeatherSnapshotType(@Schema(
        description = "OpenWeatherMap city identifier",
        example = "2643743",
        required = true) long id,

        @Schema(
                description = "City display name",
                example = "London") String name,

        @Schema(
                description = "ISO country code",
                example = "GB") String country,

        @Schema(
                description = "Condition description",
                example = "light rain") String description,

        @Schema(
                description = "Current temperature in Celsius",
                example = "12.4") Double temp,

        @Schema(
                description = "Minimum temperature in Celsius",
                example = "10.9") @JsonProperty("temp_min") Double tempMin,

        @Schema(
                description = "Maximum temperature in Celsius",
                example = "13.8") @JsonProperty("temp_max") Double tempMax,

        @Schema(
                description = "Weather icon code",
                example = "10d") String icon,

        @Schema(
                description = "Atmospheric pressure in hPa",
                example = "1012") String pressure,

        @Schema(
                description = "Relative humidity percentage",
                example = "81") String humidity,

        @Schema(
                description = "Visibility in kilometres",
                example = "10.0") String visibility,

        @Schema(
                description = "Wind speed in m/s",
                example = "4.12") @JsonProperty("wind_speed") String windSpeed,

        @Schema(
                description = "Local observation time",
                example = "3:45pm, oct 19") @JsonProperty("dt_formatted") String observedAt,

        @Schema(
                description = "Local sunrise time",
                example = "7:21am") @JsonProperty("sunrise_formatted") String sunrise,

        @Schema(
                description = "Local sunset time",
                example = "6:02pm") @JsonProperty("sunset_formatted") String sunset) {

    /** Placeholder for values the provider did not supply. */
    public static final String NOT_AVAILABLE = "N/A";
}
