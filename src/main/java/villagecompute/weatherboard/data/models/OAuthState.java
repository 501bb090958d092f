package villagecompute.weatherboard.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * OAuth state token for CSRF protection.
 *
 * <p>
 * State tokens are random UUID v4 values with a short TTL. They are single-use and deleted after validation to prevent
 * replay attacks.
 */
@Entity
@Table(
        name = "oauth_states")
@NamedQuery(
        name = OAuthState.QUERY_FIND_BY_STATE_AND_PROVIDER,
        query = "SELECT o FROM OAuthState o WHERE o.state = :state AND o.provider = :provider "
                + "AND o.expiresAt > :now")
public class OAuthState extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_STATE_AND_PROVIDER = "OAuthState.findByStateAndProvider";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            nullable = false,
            unique = true)
    public String state;

    @Column(
            name = "session_id",
            nullable = false)
    public String sessionId;

    @Column(
            nullable = false)
    public String provider;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    /**
     * Find an OAuth state by state token and provider, rejecting expired tokens.
     *
     * @param state
     *            the state token (UUID v4)
     * @param provider
     *            the identity provider ('google')
     * @return the OAuthState if found and not expired, empty otherwise
     */
    public static Optional<OAuthState> findByStateAndProvider(String state, String provider) {
        return find("#" + QUERY_FIND_BY_STATE_AND_PROVIDER,
                Parameters.with("state", state).and("provider", provider).and("now", Instant.now()))
                .firstResultOptional();
    }

    /**
     * Creates and persists a fresh state token. Must be called inside a transaction.
     */
    public static OAuthState issue(String sessionId, String provider, Duration ttl) {
        OAuthState oauthState = new OAuthState();
        oauthState.state = UUID.randomUUID().toString();
        oauthState.sessionId = sessionId;
        oauthState.provider = provider;
        oauthState.createdAt = Instant.now();
        oauthState.expiresAt = oauthState.createdAt.plus(ttl);
        oauthState.persist();
        return oauthState;
    }

    /**
     * Deletes all expired state tokens.
     *
     * @return number of deleted rows
     */
    public static long deleteExpired() {
        return delete("expiresAt < ?1", Instant.now());
    }
}
