package villagecompute.weatherboard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.elytron.security.common.BcryptUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.core.NewCookie;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.exceptions.DuplicateResourceException;
import villagecompute.weatherboard.exceptions.ValidationException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Central authentication and identity management service.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Local registration with bcrypt password hashes</li>
 * <li>Password verification for local accounts</li>
 * <li>HS256-signed session tokens carried in an HttpOnly cookie</li>
 * </ul>
 *
 * <p>
 * Session tokens are compact JWTs with {@code sub} (user UUID), {@code email}, {@code iat} and {@code exp} claims. They
 * are stateless: logging out only clears the cookie.
 */
@ApplicationScoped
public class AuthIdentityService {

    private static final Logger LOG = Logger.getLogger(AuthIdentityService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    @ConfigProperty(
            name = "weatherboard.auth.session.cookie-name",
            defaultValue = "wb_session")
    String sessionCookieName;

    @ConfigProperty(
            name = "weatherboard.auth.session.max-age-seconds",
            defaultValue = "604800")
    long sessionMaxAgeSeconds;

    @ConfigProperty(
            name = "weatherboard.auth.session.secure",
            defaultValue = "true")
    boolean cookieSecure;

    @ConfigProperty(
            name = "weatherboard.auth.session.same-site",
            defaultValue = "Lax")
    String cookieSameSite;

    @ConfigProperty(
            name = "weatherboard.auth.session.secret",
            defaultValue = "local-dev-secret-change-me")
    String sessionSecret;

    @Inject
    Tracer tracer;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    /**
     * Registers a local account.
     *
     * @param username
     *            display name
     * @param email
     *            login email, stored lower-cased
     * @param password
     *            plain-text password, hashed with bcrypt before storage
     * @return the persisted user
     * @throws ValidationException
     *             if any field is blank
     * @throws DuplicateResourceException
     *             if the email is already registered
     */
    @Transactional
    public User register(String username, String email, String password) {
        if (isBlank(username) || isBlank(email) || isBlank(password)) {
            throw new ValidationException("Username, email and password are required.");
        }

        Span span = tracer.spanBuilder("auth.register").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            if (User.findByEmail(email).isPresent()) {
                LOG.infof("Registration rejected, email already registered: %s", User.normalizeEmail(email));
                span.addEvent("register.duplicate_email");
                throw new DuplicateResourceException("Email already registered: " + User.normalizeEmail(email));
            }

            User user = User.createLocal(username.trim(), email, BcryptUtil.bcryptHash(password));
            span.addEvent("register.created");
            return user;
        } finally {
            span.end();
        }
    }

    /**
     * Verifies local credentials.
     *
     * <p>
     * Accounts created through an identity provider have no password and never match.
     *
     * @return the matching user, or empty on unknown email or wrong password
     */
    public Optional<User> authenticate(String email, String password) {
        if (isBlank(email) || isBlank(password)) {
            return Optional.empty();
        }

        Span span = tracer.spanBuilder("auth.authenticate").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            Optional<User> user = User.findByEmail(email);
            if (user.isEmpty()) {
                LOG.infof("Login failed, unknown email: %s", User.normalizeEmail(email));
                return Optional.empty();
            }
            if (!user.get().hasLocalPassword()) {
                LOG.infof("Login refused for %s, account signs in with %s", user.get().email,
                        user.get().oauthProvider);
                return Optional.empty();
            }
            if (!BcryptUtil.matches(password, user.get().passwordHash)) {
                LOG.infof("Login failed, wrong password for %s", user.get().email);
                return Optional.empty();
            }

            LOG.infof("User %s authenticated with password", user.get().id);
            return user;
        } finally {
            span.end();
        }
    }

    /**
     * Creates a signed session token for a user.
     */
    public String createSessionToken(User user) {
        Objects.requireNonNull(user, "user is required");
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusSeconds(sessionMaxAgeSeconds);
        return generateJwt(user.id.toString(), user.email, issuedAt, expiresAt);
    }

    /**
     * Validates a session token's signature and expiry.
     *
     * @param token
     *            raw cookie value, may be null
     * @return the session claims, or empty when the token is missing, tampered with, malformed or expired
     */
    public Optional<SessionClaims> verifySessionToken(String token) {
        if (isBlank(token)) {
            return Optional.empty();
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            LOG.debug("Rejected session token with wrong segment count");
            return Optional.empty();
        }

        try {
            byte[] expected = sign(parts[0] + "." + parts[1]);
            byte[] actual = Base64.getUrlDecoder().decode(parts[2]);
            if (!MessageDigest.isEqual(expected, actual)) {
                LOG.warn("Rejected session token with invalid signature");
                return Optional.empty();
            }

            JsonNode payload = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            Instant expiresAt = Instant.ofEpochSecond(payload.path("exp").asLong(0));
            if (!clock.instant().isBefore(expiresAt)) {
                LOG.debugf("Rejected expired session token for %s", payload.path("sub").asText());
                return Optional.empty();
            }

            return Optional.of(new SessionClaims(UUID.fromString(payload.path("sub").asText()),
                    payload.path("email").asText(null), Instant.ofEpochSecond(payload.path("iat").asLong(0)),
                    expiresAt));
        } catch (IllegalArgumentException | IOException e) {
            LOG.debugf("Rejected malformed session token: %s", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builds the session cookie for a freshly authenticated user.
     */
    public NewCookie issueSessionCookie(User user) {
        String token = createSessionToken(user);
        LOG.infof("Issued session cookie for user %s (%s)", user.id, user.email);
        return sessionCookie(token, (int) sessionMaxAgeSeconds);
    }

    /**
     * Builds an expired session cookie that removes the browser's copy.
     */
    public NewCookie clearSessionCookie() {
        return sessionCookie("", 0);
    }

    public String sessionCookieName() {
        return sessionCookieName;
    }

    private NewCookie sessionCookie(String value, int maxAge) {
        return new NewCookie.Builder(sessionCookieName).value(value).path("/").maxAge(maxAge).secure(cookieSecure)
                .httpOnly(true).sameSite(mapSameSite(cookieSameSite)).build();
    }

    private String generateJwt(String subject, String email, Instant issuedAt, Instant expiresAt) {
        try {
            Map<String, Object> header = new LinkedHashMap<>();
            header.put("alg", "HS256");
            header.put("typ", "JWT");

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sub", subject);
            payload.put("email", email);
            payload.put("iat", issuedAt.getEpochSecond());
            payload.put("exp", expiresAt.getEpochSecond());

            String signingInput = base64Url(objectMapper.writeValueAsBytes(header)) + "."
                    + base64Url(objectMapper.writeValueAsBytes(payload));
            return signingInput + "." + base64Url(sign(signingInput));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode session token", e);
        }
    }

    private byte[] sign(String signingInput) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(sessionSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
    }

    private static String base64Url(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private NewCookie.SameSite mapSameSite(String sameSite) {
        if (sameSite == null) {
            return NewCookie.SameSite.LAX;
        }
        return switch (sameSite.trim().toLowerCase()) {
            case "strict" -> NewCookie.SameSite.STRICT;
            case "none" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }

    /**
     * Verified session token contents.
     *
     * @param userId
     *            token subject
     * @param email
     *            email at issue time
     * @param issuedAt
     *            issue time
     * @param expiresAt
     *            expiry time
     */
    public record SessionClaims(UUID userId, String email, Instant issuedAt, Instant expiresAt) {
    }
}
