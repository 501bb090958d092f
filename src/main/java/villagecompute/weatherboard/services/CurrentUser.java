package villagecompute.weatherboard.services;

import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.RequestScoped;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.services.AuthIdentityService.SessionClaims;

/**
 * The user the current request is made on behalf of.
 *
 * <p>
 * Populated by {@link villagecompute.weatherboard.api.filters.SessionFilter} from the verified session cookie. The
 * {@link User} entity is loaded lazily on first access so the filter itself never touches the database.
 */
@RequestScoped
public class CurrentUser {

    private SessionClaims claims;
    private User user;
    private boolean loaded;

    public void establish(SessionClaims claims) {
        this.claims = claims;
        this.user = null;
        this.loaded = false;
    }

    public boolean isAuthenticated() {
        return claims != null;
    }

    public Optional<UUID> id() {
        return claims == null ? Optional.empty() : Optional.of(claims.userId());
    }

    /**
     * @return the authenticated user entity, or empty when anonymous or the account no longer exists
     */
    public Optional<User> user() {
        if (claims == null) {
            return Optional.empty();
        }
        if (!loaded) {
            user = User.findById(claims.userId());
            loaded = true;
        }
        return Optional.ofNullable(user);
    }

    /**
     * @return name shown in the navigation bar
     */
    public String displayName() {
        return user().map(u -> u.username).orElse(claims == null ? "" : claims.email());
    }
}
