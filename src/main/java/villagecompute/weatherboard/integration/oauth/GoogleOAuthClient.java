package villagecompute.weatherboard.integration.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.UriBuilder;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import villagecompute.weatherboard.api.types.GoogleTokenResponseType;
import villagecompute.weatherboard.api.types.GoogleUserInfoType;

/**
 * Client for the Google OAuth 2.0 authorization code flow.
 *
 * <p>
 * Configuration properties:
 *
 * <ul>
 * <li>weatherboard.auth.google.client-id
 * <li>weatherboard.auth.google.client-secret
 * <li>weatherboard.auth.google.authorization-url
 * </ul>
 *
 * <p>
 * See: https://developers.google.com/identity/protocols/oauth2/web-server
 */
@ApplicationScoped
public class GoogleOAuthClient {

    @ConfigProperty(
            name = "weatherboard.auth.google.client-id")
    String clientId;

    @ConfigProperty(
            name = "weatherboard.auth.google.client-secret")
    String clientSecret;

    @ConfigProperty(
            name = "weatherboard.auth.google.authorization-url",
            defaultValue = "https://accounts.google.com/o/oauth2/v2/auth")
    String authorizationUrl;

    @Inject
    @RestClient
    GoogleOAuthRestClient restClient;

    /**
     * Builds the consent-screen URL requesting the {@code openid email profile} scopes.
     *
     * @param redirectUri
     *            the callback URL (must match Google Console configuration)
     * @param state
     *            CSRF state token
     * @return full authorization URL to redirect the browser to
     */
    public String getAuthorizationUrl(String redirectUri, String state) {
        return UriBuilder.fromUri(authorizationUrl).queryParam("client_id", clientId)
                .queryParam("redirect_uri", redirectUri).queryParam("response_type", "code")
                .queryParam("scope", "openid email profile").queryParam("state", state).build().toString();
    }

    /**
     * Exchange an authorization code for an access token.
     *
     * @param code
     *            the authorization code from the callback
     * @param redirectUri
     *            the redirect URI used in the authorization request
     * @return token response
     */
    public GoogleTokenResponseType exchangeCodeForToken(String code, String redirectUri) {
        return restClient.exchangeToken("authorization_code", code, redirectUri, clientId, clientSecret);
    }

    /**
     * Retrieve the user's identity claims using an access token.
     */
    public GoogleUserInfoType getUserProfile(String accessToken) {
        return restClient.getUserInfo("Bearer " + accessToken);
    }
}
