package villagecompute.weatherboard.integration.oauth;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;
import villagecompute.weatherboard.api.types.GoogleTokenResponseType;
import villagecompute.weatherboard.api.types.GoogleUserInfoType;

/**
 * REST client for Google's OAuth 2.0 token and OpenID Connect user info endpoints.
 *
 * <p>
 * The base URL is configured as {@code quarkus.rest-client.google-oauth.url}.
 */
@RegisterRestClient(
        configKey = "google-oauth")
@Path("/")
public interface GoogleOAuthRestClient {

    /**
     * Exchange an authorization code for tokens (RFC 6749 Section 4.1.3).
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    GoogleTokenResponseType exchangeToken(@FormParam("grant_type") String grantType, @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri, @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret);

    /**
     * Get the authenticated user's OpenID Connect claims.
     *
     * @param authorization
     *            Bearer token (format: "Bearer {access_token}")
     * @return user info with sub, email and name
     */
    @GET
    @Path("/oauth2/v3/userinfo")
    @Produces(MediaType.APPLICATION_JSON)
    GoogleUserInfoType getUserInfo(@HeaderParam("Authorization") String authorization);
}
