package villagecompute.weatherboard.integration.weather;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.weatherboard.TestConstants;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;

/**
 * Unit tests for {@link WeatherSnapshotNormalizer}.
 */
class WeatherSnapshotNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testNormalize_fullResponse() throws IOException {
        JsonNode root = readStub("wiremock/openweathermap/current-weather-london.json");

        WeatherSnapshotType snapshot = WeatherSnapshotNormalizer.normalize(root, TestConstants.LONDON_CITY_ID,
                TestConstants.STUB_NOW);

        assertEquals(TestConstants.LONDON_CITY_ID, snapshot.id());
        assertEquals("London", snapshot.name());
        assertEquals("GB", snapshot.country());
        assertEquals("broken clouds", snapshot.description());
        assertEquals(14.62, snapshot.temp());
        assertEquals(13.31, snapshot.tempMin());
        assertEquals(15.69, snapshot.tempMax());
        assertEquals("04d", snapshot.icon());
        assertEquals("1013", snapshot.pressure());
        assertEquals("77", snapshot.humidity());
        assertEquals("4.0", snapshot.visibility());
        assertEquals("3.6", snapshot.windSpeed());
        assertEquals("1pm, oct 19", snapshot.observedAt());
        assertEquals("7:42am", snapshot.sunrise());
        assertEquals("6:06pm", snapshot.sunset());
    }

    @Test
    void testNormalize_minimalResponseUsesDefaults() throws IOException {
        JsonNode root = readStub("wiremock/openweathermap/current-weather-minimal.json");

        WeatherSnapshotType snapshot = WeatherSnapshotNormalizer.normalize(root, 42L, TestConstants.STUB_NOW);

        assertEquals(42L, snapshot.id());
        assertEquals("N/A", snapshot.name());
        assertEquals("", snapshot.country());
        assertEquals("N/A", snapshot.description());
        assertEquals(21.5, snapshot.temp());
        assertNull(snapshot.tempMin());
        assertNull(snapshot.tempMax());
        assertNull(snapshot.icon());
        assertEquals("N/A", snapshot.pressure());
        assertEquals("N/A", snapshot.humidity());
        assertEquals("N/A", snapshot.visibility());
        assertEquals("N/A", snapshot.windSpeed());
        assertEquals("12pm, oct 19", snapshot.observedAt());
        assertEquals("N/A", snapshot.sunrise());
        assertEquals("N/A", snapshot.sunset());
    }

    @Test
    void testNormalize_wrongTypesDoNotThrow() throws IOException {
        JsonNode root = objectMapper.readTree("""
                {"name": "Oddville", "weather": "cloudy", "main": [1, 2], "sys": 7, "wind": {"speed": "fast"},
                 "visibility": "far", "dt": "yesterday", "timezone": 0}
                """);

        WeatherSnapshotType snapshot = WeatherSnapshotNormalizer.normalize(root, 7L, TestConstants.STUB_NOW);

        assertEquals("Oddville", snapshot.name());
        assertEquals("N/A", snapshot.description());
        assertNull(snapshot.temp());
        assertEquals("", snapshot.country());
        assertEquals("N/A", snapshot.windSpeed());
        assertEquals("N/A", snapshot.visibility());
        assertEquals("N/A", snapshot.observedAt());
    }

    @Test
    void testNormalize_nonNumericPressureAndHumidity() throws IOException {
        JsonNode root = objectMapper.readTree("""
                {"name": "Oddville", "main": {"temp": 9.5, "pressure": "high", "humidity": true}}
                """);

        WeatherSnapshotType snapshot = WeatherSnapshotNormalizer.normalize(root, 7L, TestConstants.STUB_NOW);

        assertEquals(9.5, snapshot.temp());
        assertEquals("N/A", snapshot.pressure());
        assertEquals("N/A", snapshot.humidity());
    }

    @Test
    void testVisibility() throws IOException {
        assertEquals("4.0", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("4000")));
        assertEquals("10.0", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("10000")));
        assertEquals("0.2", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("250")));
        assertEquals("0.1", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("150")));
        assertEquals("0.3", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("350")));
        assertEquals("1.6", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("1550")));
        assertEquals("N/A", WeatherSnapshotNormalizer.visibility(objectMapper.readTree("null")));
        assertEquals("N/A", WeatherSnapshotNormalizer.visibility(objectMapper.missingNode()));
    }

    private JsonNode readStub(String path) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(path)) {
            return objectMapper.readTree(in);
        }
    }
}
