package villagecompute.weatherboard.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.api.types.GoogleTokenResponseType;
import villagecompute.weatherboard.api.types.GoogleUserInfoType;
import villagecompute.weatherboard.api.types.OAuthUrlResponseType;
import villagecompute.weatherboard.data.models.OAuthState;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.integration.oauth.GoogleOAuthClient;

/**
 * Service for the Google OAuth 2.0 login flow.
 *
 * <p>
 * Orchestrates the authorization code flow with CSRF protection:
 *
 * <ol>
 * <li>Generate authorization URL with state token
 * <li>Store state token in database (5-minute TTL)
 * <li>Validate and consume state token on callback
 * <li>Exchange authorization code for access token
 * <li>Retrieve user identity claims
 * <li>Find, link or create the user account
 * </ol>
 */
@ApplicationScoped
public class OAuthService {

    private static final Logger LOG = Logger.getLogger(OAuthService.class);

    public static final String PROVIDER_GOOGLE = "google";

    private static final Duration STATE_TTL = Duration.ofMinutes(5);

    @Inject
    GoogleOAuthClient googleClient;

    /**
     * Initiate Google OAuth login flow.
     *
     * @param sessionId
     *            browser correlation identifier stored alongside the state token
     * @param redirectUri
     *            the callback URL for this application
     * @return authorization URL and state token
     */
    @Transactional
    public OAuthUrlResponseType initiateGoogleLogin(String sessionId, String redirectUri) {
        String state = generateState(sessionId, PROVIDER_GOOGLE);
        String authUrl = googleClient.getAuthorizationUrl(redirectUri, state);
        return new OAuthUrlResponseType(authUrl, state);
    }

    /**
     * Handle Google OAuth callback.
     *
     * <p>
     * Account resolution:
     *
     * <ul>
     * <li>Provider + subject match: existing user
     * <li>Email match on an account without a provider link: link it and return it
     * <li>Otherwise: create a new provider account
     * </ul>
     *
     * @param code
     *            the authorization code
     * @param state
     *            the CSRF state token
     * @param redirectUri
     *            the callback URL (must match authorization request)
     * @return the authenticated user
     * @throws SecurityException
     *             if the state token is invalid or expired
     * @throws IllegalStateException
     *             if the provider returns no email, or the email belongs to an account linked to another identity
     */
    @Transactional
    public User handleGoogleCallback(String code, String state, String redirectUri) {
        validateState(state, PROVIDER_GOOGLE);

        GoogleTokenResponseType tokenResponse = googleClient.exchangeCodeForToken(code, redirectUri);
        GoogleUserInfoType userInfo = googleClient.getUserProfile(tokenResponse.accessToken());
        LOG.infof("Retrieved Google user profile: email=%s, sub=%s", userInfo.email(), userInfo.sub());

        Optional<User> existing = User.findByOAuth(PROVIDER_GOOGLE, userInfo.sub());
        if (existing.isPresent()) {
            LOG.infof("Existing Google user found: userId=%s", existing.get().id);
            return existing.get();
        }

        if (userInfo.email() == null || userInfo.email().isBlank()) {
            throw new IllegalStateException("Google account did not share an email address");
        }

        Optional<User> emailMatch = User.findByEmail(userInfo.email());
        if (emailMatch.isPresent()) {
            User user = emailMatch.get();
            if (user.oauthSubject != null) {
                throw new IllegalStateException("Email " + user.email + " is linked to another sign-in");
            }
            user.oauthProvider = PROVIDER_GOOGLE;
            user.oauthSubject = userInfo.sub();
            user.updatedAt = Instant.now();
            LOG.infof("Linked Google identity %s to existing user %s", userInfo.sub(), user.id);
            return user;
        }

        return User.createFromProvider(PROVIDER_GOOGLE, userInfo.sub(), userInfo.name(), userInfo.email());
    }

    /**
     * Persist a new single-use state token.
     */
    public String generateState(String sessionId, String provider) {
        OAuthState oauthState = OAuthState.issue(sessionId, provider, STATE_TTL);
        LOG.infof("SECURITY: Generated OAuth state: provider=%s, sessionId=%s, expiresAt=%s", provider, sessionId,
                oauthState.expiresAt);
        return oauthState.state;
    }

    /**
     * Validate and consume a state token.
     *
     * @return the session ID stored with the state
     * @throws SecurityException
     *             if the state is unknown, expired or already used
     */
    public String validateState(String state, String provider) {
        Optional<OAuthState> stateRecord = OAuthState.findByStateAndProvider(state, provider);

        if (stateRecord.isEmpty()) {
            LOG.warnf("SECURITY: Invalid or expired OAuth state: provider=%s", provider);
            throw new SecurityException("Invalid or expired state token");
        }

        String sessionId = stateRecord.get().sessionId;
        stateRecord.get().delete();
        LOG.infof("SECURITY: Validated OAuth state: provider=%s, sessionId=%s", provider, sessionId);
        return sessionId;
    }
}
