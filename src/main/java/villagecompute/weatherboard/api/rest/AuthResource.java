package villagecompute.weatherboard.api.rest;

import io.quarkus.qute.CheckedTemplate;
import io.quarkus.qute.TemplateInstance;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.ws.rs.BeanParam;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.api.filters.LoginRequired;
import villagecompute.weatherboard.api.types.FlashMessageType;
import villagecompute.weatherboard.api.types.LoginFormType;
import villagecompute.weatherboard.api.types.OAuthUrlResponseType;
import villagecompute.weatherboard.api.types.RegistrationFormType;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.exceptions.DuplicateResourceException;
import villagecompute.weatherboard.exceptions.ValidationException;
import villagecompute.weatherboard.services.AuthIdentityService;
import villagecompute.weatherboard.services.CurrentUser;
import villagecompute.weatherboard.services.FlashMessages;
import villagecompute.weatherboard.services.OAuthService;

import java.net.URI;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Login, registration and logout pages, plus the Google sign-in redirect flow.
 *
 * <p>
 * Successful sign-in of either kind sets the session cookie and redirects to {@code /weather}. Users who are already
 * signed in are sent straight to the dashboard from the login and registration pages.
 */
@Path("/")
@Produces(MediaType.TEXT_HTML)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    static final String GOOGLE_CALLBACK_PATH = "auth/google/callback";

    @Inject
    AuthIdentityService authService;

    @Inject
    OAuthService oauthService;

    @Inject
    CurrentUser currentUser;

    @Inject
    FlashMessages flashMessages;

    @Inject
    Validator validator;

    @ConfigProperty(
            name = "weatherboard.auth.google.enabled",
            defaultValue = "false")
    boolean googleEnabled;

    /**
     * Type-safe Qute templates.
     */
    @CheckedTemplate(
            requireTypeSafeExpressions = false)
    public static class Templates {
        public static native TemplateInstance login(AuthPage page);

        public static native TemplateInstance register(AuthPage page);
    }

    @GET
    public Response loginPage() {
        if (currentUser.isAuthenticated()) {
            return redirect("/weather");
        }
        return renderLogin(Response.Status.OK, null);
    }

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response login(@BeanParam LoginFormType form) {
        if (currentUser.isAuthenticated()) {
            return redirect("/weather");
        }

        Optional<String> invalid = firstViolation(form);
        if (invalid.isPresent()) {
            flashMessages.error(invalid.get());
            return renderLogin(Response.Status.BAD_REQUEST, form.email);
        }

        Optional<User> user = authService.authenticate(form.email, form.password);
        if (user.isEmpty()) {
            flashMessages.error("Invalid email or password.");
            return renderLogin(Response.Status.OK, form.email);
        }

        flashMessages.success("Logged in successfully.");
        return Response.seeOther(URI.create("/weather")).cookie(authService.issueSessionCookie(user.get())).build();
    }

    @GET
    @Path("/register")
    public Response registerPage() {
        if (currentUser.isAuthenticated()) {
            return redirect("/weather");
        }
        return renderRegister(Response.Status.OK, null, null);
    }

    @POST
    @Path("/register")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response register(@BeanParam RegistrationFormType form) {
        if (currentUser.isAuthenticated()) {
            return redirect("/weather");
        }

        Optional<String> invalid = firstViolation(form);
        if (invalid.isPresent()) {
            flashMessages.error(invalid.get());
            return renderRegister(Response.Status.BAD_REQUEST, form.username, form.email);
        }

        User user;
        try {
            user = authService.register(form.username, form.email, form.password);
        } catch (DuplicateResourceException e) {
            flashMessages.warning("Email already registered. Please log in instead.");
            return redirect("/");
        } catch (ValidationException e) {
            flashMessages.error(e.getMessage());
            return renderRegister(Response.Status.BAD_REQUEST, form.username, form.email);
        }

        flashMessages.success("Registration successful!");
        return Response.seeOther(URI.create("/weather")).cookie(authService.issueSessionCookie(user)).build();
    }

    @GET
    @Path("/logout")
    @LoginRequired
    public Response logout() {
        LOG.infof("User %s logged out", currentUser.id().map(UUID::toString).orElse("unknown"));
        flashMessages.info("You have been logged out.");
        return Response.seeOther(URI.create("/")).cookie(authService.clearSessionCookie()).build();
    }

    /**
     * Redirects the browser to Google's consent screen.
     */
    @GET
    @Path("/auth/google/login")
    public Response googleLogin(@Context UriInfo uriInfo) {
        if (!googleEnabled) {
            flashMessages.warning("Google sign-in is not enabled.");
            return redirect("/");
        }

        String redirectUri = uriInfo.getBaseUriBuilder().path(GOOGLE_CALLBACK_PATH).build().toString();
        OAuthUrlResponseType authUrl = oauthService.initiateGoogleLogin(UUID.randomUUID().toString(), redirectUri);
        return Response.seeOther(URI.create(authUrl.authorizationUrl())).build();
    }

    /**
     * Completes Google sign-in.
     *
     * @param code
     *            authorization code from Google
     * @param state
     *            CSRF state token
     * @param error
     *            error code when the user cancelled or consent failed
     */
    @GET
    @Path("/auth/google/callback")
    public Response googleCallback(@QueryParam("code") String code, @QueryParam("state") String state,
            @QueryParam("error") String error, @Context UriInfo uriInfo) {
        if (!googleEnabled) {
            flashMessages.warning("Google sign-in is not enabled.");
            return redirect("/");
        }

        if (error != null) {
            LOG.warnf("Google OAuth error: %s", error);
            flashMessages.error("Google sign-in was cancelled.");
            return redirect("/");
        }

        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            LOG.warn("Google OAuth callback missing code or state parameter");
            flashMessages.error("Google sign-in failed. Please try again.");
            return redirect("/");
        }

        String redirectUri = uriInfo.getBaseUriBuilder().path(GOOGLE_CALLBACK_PATH).build().toString();

        try {
            User user = oauthService.handleGoogleCallback(code, state, redirectUri);
            LOG.infof("Google OAuth success: userId=%s", user.id);
            flashMessages.success("Logged in successfully.");
            return Response.seeOther(URI.create("/weather")).cookie(authService.issueSessionCookie(user)).build();
        } catch (SecurityException e) {
            LOG.warnf("Google OAuth callback rejected: %s", e.getMessage());
            flashMessages.error("Your sign-in request expired. Please try again.");
            return renderLogin(Response.Status.FORBIDDEN, null);
        } catch (IllegalStateException e) {
            LOG.warnf("Google OAuth account conflict: %s", e.getMessage());
            flashMessages.error("This Google account cannot be used to sign in here.");
            return redirect("/");
        } catch (RuntimeException e) {
            LOG.errorf(e, "Google OAuth callback failed: %s", e.getMessage());
            flashMessages.error("Google sign-in failed. Please try again.");
            return redirect("/");
        }
    }

    private Response renderLogin(Response.Status status, String email) {
        return Response.status(status)
                .entity(Templates.login(new AuthPage(flashMessages.drain(), email, null, googleEnabled))).build();
    }

    private Response renderRegister(Response.Status status, String username, String email) {
        return Response.status(status)
                .entity(Templates.register(new AuthPage(flashMessages.drain(), email, username, googleEnabled)))
                .build();
    }

    private <T> Optional<String> firstViolation(T form) {
        Set<ConstraintViolation<T>> violations = validator.validate(form);
        return violations.stream().sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage).findFirst();
    }

    private static Response redirect(String path) {
        return Response.seeOther(URI.create(path)).build();
    }

    /**
     * Data for the login and registration pages.
     *
     * @param flashes
     *            messages to show once
     * @param email
     *            email to pre-fill after a failed attempt
     * @param username
     *            username to pre-fill after a failed registration
     * @param googleEnabled
     *            whether to offer Google sign-in
     */
    public record AuthPage(List<FlashMessageType> flashes, String email, String username, boolean googleEnabled) {
    }
}
