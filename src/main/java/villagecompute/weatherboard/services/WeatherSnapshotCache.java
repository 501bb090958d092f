/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.services;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;

/**
 * Process-local TTL cache of weather snapshots.
 *
 * <h2>Caching Strategy</h2>
 * <ul>
 * <li>Cache key: {@code weather_<cityId>}</li>
 * <li>TTL: fixed from the write ({@code weatherboard.weather.cache-ttl-seconds}, default 300); reads do not extend
 * it</li>
 * <li>Expiry: Caffeine {@code expireAfterWrite} driven by the injected {@link Clock}</li>
 * <li>No size bound; {@link #evictExpired()} is called by the maintenance job</li>
 * </ul>
 *
 * <p>
 * Reads and writes are individually thread-safe. A get followed by a put is not atomic, so two concurrent misses for
 * the same city both write and the later one wins.
 */
@ApplicationScoped
public class WeatherSnapshotCache {

    private static final Logger LOG = Logger.getLogger(WeatherSnapshotCache.class);

    static final String KEY_PREFIX = "weather_";

    private final Cache<String, WeatherSnapshotType> snapshots;
    private final Duration ttl;

    @Inject
    public WeatherSnapshotCache(Clock clock,
            @ConfigProperty(
                    name = "weatherboard.weather.cache-ttl-seconds",
                    defaultValue = "300") long ttlSeconds) {
        this(clock, Duration.ofSeconds(ttlSeconds));
    }

    public WeatherSnapshotCache(Clock clock, Duration ttl) {
        this.ttl = ttl;
        // Maintenance runs on the calling thread so expiry follows the clock deterministically
        this.snapshots = Caffeine.newBuilder().expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis())).executor(Runnable::run).build();
    }

    public static String keyFor(long cityId) {
        return KEY_PREFIX + cityId;
    }

    /**
     * Returns the live snapshot for a city.
     *
     * @param cityId
     *            OpenWeatherMap city identifier
     * @return the cached instance, or empty when absent or expired
     */
    public Optional<WeatherSnapshotType> get(long cityId) {
        return Optional.ofNullable(snapshots.getIfPresent(keyFor(cityId)));
    }

    /**
     * Stores a snapshot with the fixed TTL, replacing any existing entry.
     */
    public void put(long cityId, WeatherSnapshotType snapshot) {
        snapshots.put(keyFor(cityId), snapshot);
    }

    /**
     * Removes every entry whose expiry has passed.
     *
     * @return number of removed entries
     */
    public int evictExpired() {
        long before = snapshots.estimatedSize();
        snapshots.cleanUp();
        long evicted = Math.max(0, before - snapshots.estimatedSize());
        LOG.debugf("Evicted %d expired weather snapshots", evicted);
        return (int) evicted;
    }

    public int size() {
        snapshots.cleanUp();
        return (int) snapshots.estimatedSize();
    }

    public Duration ttl() {
        return ttl;
    }
}
