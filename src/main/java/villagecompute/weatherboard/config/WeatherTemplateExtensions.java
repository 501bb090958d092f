package villagecompute.weatherboard.config;

import io.quarkus.qute.TemplateExtension;

import java.util.Locale;

/**
 * Qute helpers for rendering weather values, available as {@code {wx:degrees(city.temp)}} and so on.
 */
@TemplateExtension(
        namespace = "wx")
public class WeatherTemplateExtensions {

    static final String ICON_URL = "https://openweathermap.org/img/wn/%s@2x.png";

    /**
     * Rounds a Celsius temperature to whole degrees.
     *
     * @param value
     *            temperature, may be null
     * @return e.g. "15°C", or "N/A"
     */
    public static String degrees(Double value) {
        if (value == null) {
            return "N/A";
        }
        return String.format(Locale.ROOT, "%d°C", Math.round(value));
    }

    /**
     * @param icon
     *            OpenWeatherMap icon code (e.g. "04d"), may be null
     * @return icon image URL, or an empty string when there is no icon
     */
    public static String iconUrl(String icon) {
        if (icon == null || icon.isBlank()) {
            return "";
        }
        return String.format(ICON_URL, icon);
    }

    /**
     * @return "London, GB", or just the name when the country is unknown
     */
    public static String place(String name, String country) {
        if (country == null || country.isBlank()) {
            return name;
        }
        return name + ", " + country;
    }
}
