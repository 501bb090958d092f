/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherboard.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.weatherboard.observability.LoggingConfig;
import villagecompute.weatherboard.services.WeatherSnapshotCache;

/**
 * Periodically removes expired weather snapshots from the in-memory cache.
 *
 * <p>
 * Expired entries are already ignored on read; this job only keeps entries for cities nobody views any more from
 * accumulating. It never calls the weather provider.
 *
 * <p>
 * <b>Execution Schedule:</b> every {@code weatherboard.weather.maintenance-interval} (default 10 minutes).
 */
@ApplicationScoped
public class WeatherCacheMaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(WeatherCacheMaintenanceScheduler.class);

    @Inject
    WeatherSnapshotCache cache;

    @Scheduled(
            every = "{weatherboard.weather.maintenance-interval}",
            identity = "weather-cache-maintenance",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evictExpiredSnapshots() {
        LoggingConfig.setRequestOrigin("job.weather_cache_maintenance");
        try {
            int evicted = cache.evictExpired();
            if (evicted > 0) {
                LOG.infof("Evicted %d expired weather snapshots, %d remain", evicted, cache.size());
            } else {
                LOG.debugf("Weather cache maintenance found nothing to evict (%d entries)", cache.size());
            }
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
