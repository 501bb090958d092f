package villagecompute.weatherboard.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Google OpenID Connect user info response.
 *
 * <p>
 * Returned by GET https://www.googleapis.com/oauth2/v3/userinfo with Bearer token. Only the stable subject, display
 * name and email are used to identify the dashboard user.
 *
 * @param sub
 *            Google user ID (unique, stable identifier)
 * @param email
 *            user's email address
 * @param emailVerified
 *            whether email has been verified by Google
 * @param name
 *            full name
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GoogleUserInfoType(String sub, String email, @JsonProperty("email_verified") boolean emailVerified,
        String name) {
}
