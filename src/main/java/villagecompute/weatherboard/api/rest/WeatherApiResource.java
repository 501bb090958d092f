package villagecompute.weatherboard.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.api.filters.LoginRequired;
import villagecompute.weatherboard.api.types.WeatherDashboardType;
import villagecompute.weatherboard.api.types.WeatherSnapshotType;
import villagecompute.weatherboard.services.CurrentUser;
import villagecompute.weatherboard.services.DashboardService;
import villagecompute.weatherboard.services.UserCityService;
import villagecompute.weatherboard.services.WeatherService;

import java.util.Optional;
import java.util.UUID;

/**
 * JSON access to the signed-in user's weather.
 *
 * <p>
 * <b>Endpoints:</b>
 * <ul>
 * <li>GET /api/weather - snapshots for every tracked city plus the ids that could not be fetched</li>
 * <li>GET /api/weather/{cityId} - one snapshot (cache-first)</li>
 * <li>POST /api/weather/{cityId}/refresh - bypass the cache for a tracked city</li>
 * </ul>
 */
@Path("/api/weather")
@Produces(MediaType.APPLICATION_JSON)
@LoginRequired
@Tag(
        name = "Weather",
        description = "Current weather for the signed-in user's cities")
public class WeatherApiResource {

    private static final Logger LOG = Logger.getLogger(WeatherApiResource.class);

    @Inject
    DashboardService dashboardService;

    @Inject
    WeatherService weatherService;

    @Inject
    UserCityService userCityService;

    @Inject
    CurrentUser currentUser;

    @GET
    @Operation(
            summary = "Dashboard weather",
            description = "Returns a snapshot for each tracked city. Cities whose fetch failed are listed separately.")
    @APIResponses({@APIResponse(
            responseCode = "200",
            content = @Content(
                    schema = @Schema(
                            implementation = WeatherDashboardType.class))),
            @APIResponse(
                    responseCode = "401",
                    description = "Not signed in")})
    public WeatherDashboardType dashboard() {
        return dashboardService.buildDashboard(userId());
    }

    @GET
    @Path("/{cityId}")
    @Operation(
            summary = "City weather",
            description = "Returns the cached snapshot for a city, fetching it when the cache entry is missing or stale.")
    @APIResponses({@APIResponse(
            responseCode = "200",
            content = @Content(
                    schema = @Schema(
                            implementation = WeatherSnapshotType.class))),
            @APIResponse(
                    responseCode = "404",
                    description = "Weather unavailable for this city")})
    public Response city(@PathParam("cityId") long cityId) {
        Optional<WeatherSnapshotType> snapshot = weatherService.getWeather(cityId);
        if (snapshot.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Weather unavailable for city " + cityId)).build();
        }
        return Response.ok(snapshot.get()).build();
    }

    @POST
    @Path("/{cityId}/refresh")
    @Operation(
            summary = "Refresh city weather",
            description = "Fetches a tracked city from the provider and replaces its cache entry.")
    @APIResponses({@APIResponse(
            responseCode = "200",
            content = @Content(
                    schema = @Schema(
                            implementation = WeatherSnapshotType.class))),
            @APIResponse(
                    responseCode = "404",
                    description = "City not tracked"),
            @APIResponse(
                    responseCode = "502",
                    description = "Provider call failed")})
    public Response refresh(@PathParam("cityId") long cityId) {
        UUID userId = userId();
        if (!userCityService.isTracked(userId, cityId)) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("City " + cityId + " is not on your dashboard")).build();
        }

        Optional<WeatherSnapshotType> snapshot = weatherService.refresh(cityId);
        if (snapshot.isEmpty()) {
            LOG.warnf("Manual refresh failed for city %d", cityId);
            return Response.status(Response.Status.BAD_GATEWAY)
                    .entity(new ErrorResponse("Weather provider unavailable for city " + cityId)).build();
        }
        return Response.ok(snapshot.get()).build();
    }

    private UUID userId() {
        return currentUser.id().orElseThrow(() -> new IllegalStateException("No authenticated user"));
    }

    /**
     * Error body for non-2xx responses.
     */
    public record ErrorResponse(String error) {
    }
}
