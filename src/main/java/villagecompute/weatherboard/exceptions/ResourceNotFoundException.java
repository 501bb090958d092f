package villagecompute.weatherboard.exceptions;

/**
 * Exception thrown when a requested resource is not found (e.g., user, city subscription).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found by the JSON API and to an error flash
 * message by the dashboard pages.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
