package villagecompute.weatherboard.api.filters;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.ext.Provider;
import villagecompute.weatherboard.observability.LoggingConfig;
import villagecompute.weatherboard.services.AuthIdentityService;
import villagecompute.weatherboard.services.CurrentUser;
import villagecompute.weatherboard.services.FlashMessageService;

/**
 * Establishes per-request identity and flash state from cookies.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Enrich MDC with trace context and request path</li>
 * <li>Verify the session cookie and populate {@link CurrentUser}</li>
 * <li>Carry in flash messages from the previous response</li>
 * <li>On response: write still-pending flash messages, or expire a consumed flash cookie, then clear MDC</li>
 * </ol>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class SessionFilter implements ContainerRequestFilter, ContainerResponseFilter {

    @Inject
    AuthIdentityService authIdentityService;

    @Inject
    FlashMessageService flashMessageService;

    @Inject
    CurrentUser currentUser;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/" + stripLeadingSlash(requestContext.getUriInfo().getPath()));

        Cookie session = requestContext.getCookies().get(authIdentityService.sessionCookieName());
        if (session != null) {
            authIdentityService.verifySessionToken(session.getValue()).ifPresent(claims -> {
                currentUser.establish(claims);
                LoggingConfig.setUserId(claims.userId());
            });
        }

        Cookie flash = requestContext.getCookies().get(flashMessageService.cookieName());
        if (flash != null) {
            flashMessageService.carryIn(flash.getValue());
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            NewCookie flashCookie = flashMessageService.outgoingCookie();
            if (flashCookie != null) {
                responseContext.getHeaders().add(HttpHeaders.SET_COOKIE, flashCookie);
            }
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
