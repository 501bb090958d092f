package villagecompute.weatherboard.services;

import java.io.IOException;
import java.util.Base64;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;
import villagecompute.weatherboard.api.types.FlashMessageType;

/**
 * Encodes flash messages into a short-lived cookie so they survive exactly one redirect.
 *
 * <p>
 * The cookie value is base64url-encoded JSON. A cookie that cannot be decoded is treated as empty.
 */
@ApplicationScoped
public class FlashMessageService {

    private static final Logger LOG = Logger.getLogger(FlashMessageService.class);

    private static final TypeReference<List<FlashMessageType>> MESSAGE_LIST = new TypeReference<>() {
    };

    @ConfigProperty(
            name = "weatherboard.flash.cookie-name",
            defaultValue = "wb_flash")
    String cookieName;

    @ConfigProperty(
            name = "weatherboard.flash.max-age-seconds",
            defaultValue = "60")
    int maxAgeSeconds;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    FlashMessages flashMessages;

    public String cookieName() {
        return cookieName;
    }

    /**
     * Loads messages carried by the incoming cookie into the request's pending list.
     *
     * @param cookieValue
     *            raw cookie value, may be null
     */
    public void carryIn(String cookieValue) {
        flashMessages.carryIn(decode(cookieValue));
    }

    /**
     * @return cookie to attach to the response, or null when no change is needed
     */
    public NewCookie outgoingCookie() {
        List<FlashMessageType> pending = flashMessages.pending();
        if (!pending.isEmpty()) {
            return buildCookie(encode(pending), maxAgeSeconds);
        }
        if (flashMessages.wasCarriedIn()) {
            return buildCookie("", 0);
        }
        return null;
    }

    List<FlashMessageType> decode(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return List.of();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(cookieValue);
            return objectMapper.readValue(json, MESSAGE_LIST);
        } catch (IllegalArgumentException | IOException e) {
            LOG.debugf("Ignoring unreadable flash cookie: %s", e.getMessage());
            return List.of();
        }
    }

    String encode(List<FlashMessageType> messages) {
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(objectMapper.writeValueAsBytes(messages));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode flash messages", e);
        }
    }

    private NewCookie buildCookie(String value, int maxAge) {
        return new NewCookie.Builder(cookieName).value(value).path("/").maxAge(maxAge).httpOnly(true)
                .sameSite(NewCookie.SameSite.LAX).build();
    }
}
