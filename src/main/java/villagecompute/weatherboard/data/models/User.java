package villagecompute.weatherboard.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * User entity implementing the Panache ActiveRecord pattern for both locally registered and identity-provider
 * accounts.
 *
 * <p>
 * Local accounts carry a bcrypt {@code password_hash}; accounts created through Google login carry the provider name
 * and its stable subject identifier instead, and cannot log in with a password.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code username} (TEXT) - Display name shown in the navigation bar</li>
 * <li>{@code email} (TEXT, unique) - Login identifier, stored lower-cased</li>
 * <li>{@code password_hash} (TEXT) - bcrypt hash, null for identity-provider accounts</li>
 * <li>{@code oauth_provider} (TEXT) - Identity provider name, null for local accounts</li>
 * <li>{@code oauth_subject} (TEXT) - Provider-issued subject identifier</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Record creation timestamp</li>
 * <li>{@code updated_at} (TIMESTAMPTZ) - Last modification timestamp</li>
 * </ul>
 *
 * @see UserCity for the user's tracked cities
 */
@Entity
@Table(
        name = "users")
public class User extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(User.class);

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false,
            length = 250)
    public String username;

    @Column(
            nullable = false,
            unique = true,
            length = 250)
    public String email;

    @Column(
            name = "password_hash",
            length = 250)
    public String passwordHash;

    @Column(
            name = "oauth_provider")
    public String oauthProvider;

    @Column(
            name = "oauth_subject")
    public String oauthSubject;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds a user by email address.
     *
     * @param email
     *            the user's email address (compared lower-cased)
     * @return Optional containing the user if found
     */
    public static Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return find("email", normalizeEmail(email)).firstResultOptional();
    }

    /**
     * Finds a user by identity provider and provider-issued subject identifier.
     *
     * @param provider
     *            identity provider name (e.g. google)
     * @param subject
     *            stable subject identifier
     * @return Optional containing the user if found
     */
    public static Optional<User> findByOAuth(String provider, String subject) {
        if (provider == null || subject == null) {
            return Optional.empty();
        }
        return find("oauthProvider = ?1 AND oauthSubject = ?2", provider, subject).firstResultOptional();
    }

    /**
     * Creates and persists a locally registered user. Must be called inside a transaction.
     *
     * @param username
     *            display name
     * @param email
     *            login email
     * @param passwordHash
     *            bcrypt hash of the password
     * @return persisted user with generated UUID
     */
    public static User createLocal(String username, String email, String passwordHash) {
        User user = new User();
        user.username = username;
        user.email = normalizeEmail(email);
        user.passwordHash = passwordHash;
        user.createdAt = Instant.now();
        user.updatedAt = user.createdAt;
        user.persist();
        LOG.infof("Created local user %s with id: %s", user.email, user.id);
        return user;
    }

    /**
     * Creates and persists a user from identity-provider claims. Must be called inside a transaction.
     *
     * @param provider
     *            identity provider name
     * @param subject
     *            provider-issued subject identifier
     * @param username
     *            display name from the provider profile
     * @param email
     *            email from the provider profile
     * @return persisted user with generated UUID
     */
    public static User createFromProvider(String provider, String subject, String username, String email) {
        User user = new User();
        user.username = username == null || username.isBlank() ? email : username;
        user.email = normalizeEmail(email);
        user.oauthProvider = provider;
        user.oauthSubject = subject;
        user.createdAt = Instant.now();
        user.updatedAt = user.createdAt;
        user.persist();
        LOG.infof("Created %s user %s with id: %s", provider, user.email, user.id);
        return user;
    }

    /**
     * @return true when the account can authenticate with a password
     */
    public boolean hasLocalPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase();
    }
}
