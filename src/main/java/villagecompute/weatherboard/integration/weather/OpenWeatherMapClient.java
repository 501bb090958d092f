/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.integration.weather;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherboard.exceptions.WeatherProviderException;
import villagecompute.weatherboard.exceptions.WeatherProviderException.Kind;

/**
 * HTTP client for the OpenWeatherMap current weather endpoint.
 *
 * <p>
 * Issues exactly one request per call, with no retry. Responses are accepted only when the HTTP status is 2xx, the
 * body is a JSON object and its embedded {@code cod} is 200; anything else raises {@link WeatherProviderException}.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Endpoint: {@code GET {base-url}/data/2.5/weather}</li>
 * <li>Lookup by id: {@code id=<cityId>}; lookup by name: {@code q=<name>}</li>
 * <li>Authentication: {@code appid=<api key>}</li>
 * <li>Units: metric (Celsius, m/s)</li>
 * <li>{@code cod} is a number on success and may be a string on errors</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * OpenWeatherMapClient client;
 *
 * JsonNode body = client.fetchCurrentWeather(2643743L);
 * }
 * </pre>
 *
 * @see <a href="https://openweathermap.org/current">OpenWeatherMap API Documentation</a>
 */
@ApplicationScoped
public class OpenWeatherMapClient {

    private static final Logger LOG = Logger.getLogger(OpenWeatherMapClient.class);

    static final String WEATHER_PATH = "/data/2.5/weather";
    private static final int CONNECT_TIMEOUT_SECONDS = 5;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    @Inject
    public OpenWeatherMapClient(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "weatherboard.weather.base-url",
                    defaultValue = "https://api.openweathermap.org") String baseUrl,
            @ConfigProperty(
                    name = "weatherboard.weather.api-key") String apiKey,
            @ConfigProperty(
                    name = "weatherboard.weather.timeout-seconds",
                    defaultValue = "10") int timeoutSeconds) {
        this(objectMapper, baseUrl, apiKey, Duration.ofSeconds(timeoutSeconds));
    }

    public OpenWeatherMapClient(ObjectMapper objectMapper, String baseUrl, String apiKey, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS)).build();
    }

    /**
     * Fetches current weather for a city identifier.
     *
     * @param cityId
     *            OpenWeatherMap city identifier
     * @return response body with {@code cod == 200}
     * @throws WeatherProviderException
     *             on transport failure, non-2xx status, non-200 {@code cod} or malformed body
     */
    public JsonNode fetchCurrentWeather(long cityId) {
        LOG.debugf("Fetching OpenWeatherMap weather for city %d", cityId);
        return get("id", Long.toString(cityId));
    }

    /**
     * Looks a city up by free-text name.
     *
     * @param name
     *            city name as typed by the user (e.g., "London" or "London,GB")
     * @return response body with {@code cod == 200}; its {@code id} is the canonical identifier
     * @throws WeatherProviderException
     *             on transport failure, non-2xx status (404 when no city matches), non-200 {@code cod} or malformed
     *             body
     */
    public JsonNode fetchByName(String name) {
        LOG.debugf("Looking up OpenWeatherMap city '%s'", name);
        return get("q", name);
    }

    private JsonNode get(String parameter, String value) {
        HttpRequest request = HttpRequest.newBuilder().uri(buildUri(parameter, value)).timeout(requestTimeout)
                .header("Accept", "application/json").GET().build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WeatherProviderException(Kind.TRANSPORT,
                    "OpenWeatherMap request failed for " + parameter + "=" + value, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeatherProviderException(Kind.TRANSPORT,
                    "OpenWeatherMap request interrupted for " + parameter + "=" + value, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new WeatherProviderException(Kind.HTTP_STATUS, status,
                    "OpenWeatherMap returned HTTP " + status + " for " + parameter + "=" + value);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new WeatherProviderException(Kind.MALFORMED,
                    "OpenWeatherMap returned unparseable body for " + parameter + "=" + value, e);
        }

        if (root == null || !root.isObject()) {
            throw new WeatherProviderException(Kind.MALFORMED, status,
                    "OpenWeatherMap returned a non-object body for " + parameter + "=" + value);
        }

        int cod = root.path("cod").asInt(-1);
        if (cod != 200) {
            throw new WeatherProviderException(Kind.PROVIDER_STATUS, cod, "OpenWeatherMap reported cod " + cod
                    + " for " + parameter + "=" + value + ": " + root.path("message").asText("Unknown error"));
        }

        return root;
    }

    private URI buildUri(String parameter, String value) {
        return URI.create(String.format("%s%s?%s=%s&appid=%s&units=metric", baseUrl, WEATHER_PATH, parameter,
                encode(value), encode(apiKey)));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
