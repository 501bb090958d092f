package villagecompute.weatherboard.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.services.CurrentUser;
import villagecompute.weatherboard.services.FlashMessages;

import java.net.URI;

/**
 * Rejects anonymous requests to {@code @LoginRequired} endpoints.
 *
 * <p>
 * <b>Priority:</b> Runs at {@code Priorities.AUTHORIZATION} (2000), after {@link SessionFilter} has established the
 * current user.
 */
@Provider
@LoginRequired
@Priority(Priorities.AUTHORIZATION)
public class LoginRequiredFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(LoginRequiredFilter.class);

    static final String LOGIN_MESSAGE = "Please log in to access this page.";

    @Inject
    CurrentUser currentUser;

    @Inject
    FlashMessages flashMessages;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (currentUser.isAuthenticated()) {
            return;
        }

        String path = requestContext.getUriInfo().getPath();
        LOG.debugf("Anonymous request to protected path %s", path);

        if (isApiRequest(path)) {
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .type(MediaType.APPLICATION_JSON).entity(new ErrorResponse("Authentication required")).build());
            return;
        }

        flashMessages.info(LOGIN_MESSAGE);
        requestContext.abortWith(Response.seeOther(URI.create("/")).build());
    }

    private static boolean isApiRequest(String path) {
        String normalized = path.startsWith("/") ? path.substring(1) : path;
        return normalized.startsWith("api/");
    }

    /**
     * Error body for 401 responses.
     */
    public record ErrorResponse(String error) {
    }
}
