/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.integration.weather;

import static villagecompute.weatherboard.api.types.WeatherSnapshotType.NOT_AVAILABLE;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import villagecompute.weatherboard.api.types.WeatherSnapshotType;

/**
 * Turns a loosely-typed OpenWeatherMap current-weather body into a {@link WeatherSnapshotType}.
 *
 * <p>
 * All "optional field, default value" decisions live here. Every nested object may be missing or of the wrong type;
 * the normalizer never throws for such input and substitutes the documented default instead.
 *
 * <h2>Field Defaults</h2>
 * <ul>
 * <li>name, description, pressure, humidity, wind speed, visibility, times: {@code N/A}</li>
 * <li>country: empty string</li>
 * <li>temperatures, icon: null</li>
 * </ul>
 *
 * @see <a href="https://openweathermap.org/current">OpenWeatherMap Current Weather Data</a>
 */
public final class WeatherSnapshotNormalizer {

    private WeatherSnapshotNormalizer() {
        // Utility class
    }

    /**
     * Builds a snapshot from a response body that has already passed the {@code cod} check.
     *
     * @param root
     *            parsed response body
     * @param cityId
     *            the requested city identifier
     * @param now
     *            reference instant for time formatting
     * @return normalized snapshot
     */
    public static WeatherSnapshotType normalize(JsonNode root, long cityId, Instant now) {
        JsonNode body = root == null ? MissingNode.getInstance() : root;
        JsonNode main = body.path("main");
        JsonNode sys = body.path("sys");
        JsonNode wind = body.path("wind");
        JsonNode weatherList = body.path("weather");
        JsonNode weather = weatherList.isArray() && weatherList.size() > 0 ? weatherList.get(0)
                : MissingNode.getInstance();

        Integer offset = integerOrNull(body.path("timezone"));

        return new WeatherSnapshotType(cityId, text(body.path("name"), NOT_AVAILABLE), text(sys.path("country"), ""),
                text(weather.path("description"), NOT_AVAILABLE), doubleOrNull(main.path("temp")),
                doubleOrNull(main.path("temp_min")), doubleOrNull(main.path("temp_max")),
                text(weather.path("icon"), null), numberText(main.path("pressure")),
                numberText(main.path("humidity")), visibility(body.path("visibility")),
                numberText(wind.path("speed")),
                LocalTimeFormatter.format(longOrNull(body.path("dt")), offset, now),
                LocalTimeFormatter.format(longOrNull(sys.path("sunrise")), offset, now),
                LocalTimeFormatter.format(longOrNull(sys.path("sunset")), offset, now));
    }

    /**
     * Converts visibility in metres to kilometres with one decimal.
     *
     * @param node
     *            visibility node in metres
     * @return e.g. {@code "4.0"} for 4000, {@code N/A} when absent or not numeric
     */
    static String visibility(JsonNode node) {
        if (!node.isNumber()) {
            return NOT_AVAILABLE;
        }
        // Half-even on the exact binary value: 250 m gives 0.2, 150 m gives 0.1
        return new BigDecimal(node.asDouble() / 1000.0).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String text(JsonNode node, String fallback) {
        if (node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return fallback;
        }
        return node.asText();
    }

    private static String numberText(JsonNode node) {
        return node.isNumber() ? node.asText() : NOT_AVAILABLE;
    }

    private static Double doubleOrNull(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private static Long longOrNull(JsonNode node) {
        return node.isNumber() ? node.asLong() : null;
    }

    private static Integer integerOrNull(JsonNode node) {
        return node.isNumber() && node.canConvertToInt() ? node.asInt() : null;
    }
}
