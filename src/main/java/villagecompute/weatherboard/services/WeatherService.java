/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.services;

import java.time.Clock;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;
import villagecompute.weatherboard.exceptions.WeatherProviderException;
import villagecompute.weatherboard.integration.weather.OpenWeatherMapClient;
import villagecompute.weatherboard.integration.weather.WeatherSnapshotNormalizer;

/**
 * Cache-first access to current weather from OpenWeatherMap.
 *
 * <p>
 * Failures never escape this service. Transport errors, HTTP errors, non-200 {@code cod} values and malformed bodies
 * are logged, counted and turned into an empty result; nothing is cached for a failed fetch and nothing is retried.
 *
 * <h2>Metrics</h2>
 * <ul>
 * <li>{@code weather.cache.hits}, {@code weather.cache.misses}</li>
 * <li>{@code weather.fetch.total{status}}: success, or the failure kind</li>
 * <li>{@code weather.lookup.total{status}}: success, not_found, or the failure kind</li>
 * <li>{@code weather.api.duration{operation}}: outbound call latency</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * WeatherService weatherService;
 *
 * Optional<Long> cityId = weatherService.resolveCityId("London");
 * Optional<WeatherSnapshotType> weather = cityId.flatMap(weatherService::getWeather);
 * }
 * </pre>
 */
@ApplicationScoped
public class WeatherService {

    private static final Logger LOG = Logger.getLogger(WeatherService.class);

    private final OpenWeatherMapClient client;
    private final WeatherSnapshotCache cache;
    private final Clock clock;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    @Inject
    public WeatherService(OpenWeatherMapClient client, WeatherSnapshotCache cache, Clock clock, Tracer tracer,
            MeterRegistry meterRegistry) {
        this.client = client;
        this.cache = cache;
        this.clock = clock;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Gets weather for a city (cache-first).
     *
     * @param cityId
     *            OpenWeatherMap city identifier
     * @return the cached or freshly fetched snapshot, or empty when the provider call failed
     */
    public Optional<WeatherSnapshotType> getWeather(long cityId) {
        Span span = tracer.spanBuilder("weather.get").setAttribute("city_id", cityId).startSpan();
        try (Scope scope = span.makeCurrent()) {
            Optional<WeatherSnapshotType> cached = cache.get(cityId);
            if (cached.isPresent()) {
                incrementCounter("weather.cache.hits");
                span.setAttribute("cache_hit", true);
                LOG.debugf("Weather cache hit for %s", WeatherSnapshotCache.keyFor(cityId));
                return cached;
            }

            incrementCounter("weather.cache.misses");
            span.setAttribute("cache_hit", false);
            LOG.debugf("Weather cache miss for %s, fetching from API", WeatherSnapshotCache.keyFor(cityId));
            return fetchAndCache(cityId, span);
        } finally {
            span.end();
        }
    }

    /**
     * Fetches a city unconditionally and replaces its cache entry on success.
     *
     * @param cityId
     *            OpenWeatherMap city identifier
     * @return the fresh snapshot, or empty when the provider call failed (the old entry is kept)
     */
    public Optional<WeatherSnapshotType> refresh(long cityId) {
        Span span = tracer.spanBuilder("weather.refresh").setAttribute("city_id", cityId).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return fetchAndCache(cityId, span);
        } finally {
            span.end();
        }
    }

    /**
     * Resolves a free-text city name to its OpenWeatherMap identifier. Not cached.
     *
     * @param name
     *            city name as typed by the user
     * @return the canonical city identifier, or empty when unknown, blank or the call failed
     */
    public Optional<Long> resolveCityId(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }

        String query = name.trim();
        Span span = tracer.spanBuilder("weather.resolve").setAttribute("city_name", query).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        try (Scope scope = span.makeCurrent()) {
            JsonNode body = client.fetchByName(query);
            JsonNode id = body.path("id");
            if (!id.isIntegralNumber()) {
                incrementCounter("weather.lookup.total", "status", "malformed");
                LOG.warnf("City lookup for '%s' returned no numeric id", query);
                return Optional.empty();
            }

            incrementCounter("weather.lookup.total", "status", "success");
            LOG.debugf("Resolved city '%s' to id %d", query, id.asLong());
            return Optional.of(id.asLong());
        } catch (WeatherProviderException e) {
            span.recordException(e);
            if (e.isNotFound()) {
                incrementCounter("weather.lookup.total", "status", "not_found");
                LOG.infof("City not found: %s", query);
            } else {
                incrementCounter("weather.lookup.total", "status", statusTag(e));
                LOG.warnf("City lookup failed for '%s' (%s): %s", query, e.getKind(), e.getMessage());
            }
            return Optional.empty();
        } finally {
            sample.stop(Timer.builder("weather.api.duration").tag("operation", "lookup").register(meterRegistry));
            span.end();
        }
    }

    private Optional<WeatherSnapshotType> fetchAndCache(long cityId, Span span) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            JsonNode body = client.fetchCurrentWeather(cityId);
            WeatherSnapshotType snapshot = WeatherSnapshotNormalizer.normalize(body, cityId, clock.instant());
            cache.put(cityId, snapshot);

            incrementCounter("weather.fetch.total", "status", "success");
            LOG.infof("Fetched weather for city %d (%s) from API", cityId, snapshot.name());
            return Optional.of(snapshot);
        } catch (WeatherProviderException e) {
            span.recordException(e);
            incrementCounter("weather.fetch.total", "status", statusTag(e));
            LOG.warnf("Weather fetch failed for city %d (%s): %s", cityId, e.getKind(), e.getMessage());
            return Optional.empty();
        } finally {
            sample.stop(Timer.builder("weather.api.duration").tag("operation", "current").register(meterRegistry));
        }
    }

    private static String statusTag(WeatherProviderException e) {
        return e.getKind().name().toLowerCase();
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
