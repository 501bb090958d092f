package villagecompute.weatherboard.api.rest;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateInstance;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.api.filters.LoginRequired;
import villagecompute.weatherboard.api.types.FlashMessageType;
import villagecompute.weatherboard.api.types.WeatherDashboardType;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;
import villagecompute.weatherboard.exceptions.DuplicateResourceException;
import villagecompute.weatherboard.exceptions.ResourceNotFoundException;
import villagecompute.weatherboard.services.CurrentUser;
import villagecompute.weatherboard.services.DashboardService;
import villagecompute.weatherboard.services.FlashMessages;
import villagecompute.weatherboard.services.UserCityService;
import villagecompute.weatherboard.services.WeatherService;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Server-rendered dashboard: the city list, the city detail page and the add/remove actions.
 *
 * <p>
 * All routes require a signed-in user. Add and remove always redirect back to {@code /weather} with a flash message
 * describing the outcome.
 */
@Path("/")
@Produces(MediaType.TEXT_HTML)
@LoginRequired
public class DashboardResource {

    private static final Logger LOG = Logger.getLogger(DashboardResource.class);

    private static final URI DASHBOARD = URI.create("/weather");

    @Inject
    DashboardService dashboardService;

    @Inject
    UserCityService userCityService;

    @Inject
    WeatherService weatherService;

    @Inject
    CurrentUser currentUser;

    @Inject
    FlashMessages flashMessages;

    @Inject
    Tracer tracer;

    /**
     * Type-safe Qute templates.
     */
    @CheckedTemplate(
            requireTypeSafeExpressions = false)
    public static class Templates {
        public static native TemplateInstance index(DashboardPage page);

        public static native TemplateInstance cityDetail(CityPage page);
    }

    @GET
    @Path("/weather")
    public Response dashboard() {
        UUID userId = userId();
        Span span = tracer.spanBuilder("dashboard.render").setAttribute("user_id", userId.toString()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            WeatherDashboardType dashboard = dashboardService.buildDashboard(userId);

            if (dashboard.cities().isEmpty() && dashboard.unavailableCityIds().isEmpty()) {
                flashMessages.info("Your dashboard is empty. Add a city using the search bar!");
            }
            for (Long cityId : dashboard.unavailableCityIds()) {
                flashMessages.warning("Could not fetch weather data for city code " + cityId + ".");
            }

            span.setAttribute("city_count", dashboard.cities().size());
            return Response.ok(Templates.index(
                    new DashboardPage(currentUser.displayName(), flashMessages.drain(), dashboard.cities()))).build();
        } finally {
            span.end();
        }
    }

    @GET
    @Path("/city/{cityId}")
    public Response cityDetail(@PathParam("cityId") long cityId) {
        Optional<WeatherSnapshotType> city = weatherService.getWeather(cityId);
        if (city.isEmpty()) {
            flashMessages.error("Could not retrieve weather data for city ID " + cityId + ".");
            return Response.seeOther(DASHBOARD).build();
        }

        return Response.ok(Templates.cityDetail(
                new CityPage(currentUser.displayName(), flashMessages.drain(), city.get()))).build();
    }

    @POST
    @Path("/add_city")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response addCity(@FormParam("city_name") String cityName) {
        if (cityName == null || cityName.isBlank()) {
            flashMessages.error("You must enter a city name.");
            return Response.seeOther(DASHBOARD).build();
        }

        String name = cityName.trim();
        Optional<Long> cityId = weatherService.resolveCityId(name);
        if (cityId.isEmpty()) {
            flashMessages.error("Could not find a city named '" + name + "'.");
            return Response.seeOther(DASHBOARD).build();
        }

        try {
            userCityService.addCity(userId(), cityId.get());
            flashMessages.success("Added " + name + " to your dashboard.");
        } catch (DuplicateResourceException e) {
            flashMessages.warning(name + " is already in your list.");
        } catch (ResourceNotFoundException e) {
            LOG.warnf("Add city for missing user: %s", e.getMessage());
            flashMessages.error("Your account could not be found. Please log in again.");
        }
        return Response.seeOther(DASHBOARD).build();
    }

    @GET
    @Path("/delete_city/{cityId}")
    public Response deleteCity(@PathParam("cityId") long cityId) {
        try {
            userCityService.removeCity(userId(), cityId);
            flashMessages.success("City removed.");
        } catch (ResourceNotFoundException e) {
            flashMessages.error("City not found or you do not have permission to remove it.");
        }
        return Response.seeOther(DASHBOARD).build();
    }

    private UUID userId() {
        return currentUser.id().orElseThrow(() -> new IllegalStateException("No authenticated user"));
    }

    /**
     * Data for the dashboard page.
     */
    public record DashboardPage(String username, List<FlashMessageType> flashes, List<WeatherSnapshotType> cities) {
    }

    /**
     * Data for the city detail page.
     */
    public record CityPage(String username, List<FlashMessageType> flashes, WeatherSnapshotType city) {
    }
}
