package villagecompute.weatherboard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link WeatherTemplateExtensions}.
 */
class WeatherTemplateExtensionsTest {

    @Test
    void testDegrees() {
        assertEquals("15°C", WeatherTemplateExtensions.degrees(14.62));
        assertEquals("-3°C", WeatherTemplateExtensions.degrees(-2.7));
        assertEquals("N/A", WeatherTemplateExtensions.degrees(null));
    }

    @Test
    void testIconUrl() {
        assertEquals("https://openweathermap.org/img/wn/04d@2x.png", WeatherTemplateExtensions.iconUrl("04d"));
        assertEquals("", WeatherTemplateExtensions.iconUrl(null));
    }

    @Test
    void testPlace() {
        assertEquals("London, GB", WeatherTemplateExtensions.place("London", "GB"));
        assertEquals("Oddville", WeatherTemplateExtensions.place("Oddville", ""));
    }
}
