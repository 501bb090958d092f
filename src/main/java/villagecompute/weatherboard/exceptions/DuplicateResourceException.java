package villagecompute.weatherboard.exceptions;

/**
 * Exception thrown when attempting to create a resource that already exists (e.g., registered email, tracked city).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 409 Conflict by the JSON API.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
