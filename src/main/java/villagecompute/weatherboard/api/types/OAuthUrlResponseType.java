package villagecompute.weatherboard.api.types;

/**
 * Authorization redirect for the OAuth login flow.
 *
 * @param authorizationUrl
 *            the full provider authorization URL with query parameters
 * @param state
 *            the CSRF state token embedded in the URL
 */
public record OAuthUrlResponseType(String authorizationUrl, String state) {
}
