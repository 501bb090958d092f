package villagecompute.weatherboard.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import villagecompute.weatherboard.TestConstants;
import villagecompute.weatherboard.TestFixtures;
import villagecompute.weatherboard.services.WeatherSnapshotCache;
import villagecompute.weatherboard.testing.MutableClock;

/**
 * Unit tests for {@link WeatherCacheMaintenanceScheduler}.
 */
class WeatherCacheMaintenanceSchedulerTest {

    @Test
    void testEvictExpiredSnapshots() {
        MutableClock clock = new MutableClock(TestConstants.STUB_NOW);
        WeatherSnapshotCache cache = new WeatherSnapshotCache(clock, Duration.ofSeconds(300));
        cache.put(TestConstants.LONDON_CITY_ID, TestFixtures.londonSnapshot());
        clock.advance(Duration.ofSeconds(200));
        cache.put(TestConstants.PARIS_CITY_ID, TestFixtures.parisSnapshot());
        clock.advance(Duration.ofSeconds(150));

        WeatherCacheMaintenanceScheduler scheduler = new WeatherCacheMaintenanceScheduler();
        scheduler.cache = cache;
        scheduler.evictExpiredSnapshots();

        assertEquals(1, cache.size());
        assertTrue(cache.get(TestConstants.PARIS_CITY_ID).isPresent());
    }
}
