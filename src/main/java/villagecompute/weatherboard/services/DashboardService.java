package villagecompute.weatherboard.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherboard.api.types.WeatherDashboardType;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;

/**
 * Assembles a user's dashboard from their subscriptions and the weather cache.
 *
 * <p>
 * Cities are fetched one after another in subscription order. A failed city is reported in
 * {@link WeatherDashboardType#unavailableCityIds()} and does not prevent the others from rendering.
 */
@ApplicationScoped
public class DashboardService {

    private static final Logger LOG = Logger.getLogger(DashboardService.class);

    @Inject
    UserCityService userCityService;

    @Inject
    WeatherService weatherService;

    public WeatherDashboardType buildDashboard(UUID userId) {
        List<WeatherSnapshotType> cities = new ArrayList<>();
        List<Long> unavailable = new ArrayList<>();

        for (Long cityId : userCityService.listCityIds(userId)) {
            Optional<WeatherSnapshotType> snapshot = weatherService.getWeather(cityId);
            if (snapshot.isPresent()) {
                cities.add(snapshot.get());
            } else {
                unavailable.add(cityId);
            }
        }

        if (!unavailable.isEmpty()) {
            LOG.warnf("Dashboard for user %s missing weather for cities %s", userId, unavailable);
        }
        return new WeatherDashboardType(cities, unavailable);
    }
}
