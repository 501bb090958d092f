package villagecompute.weatherboard.exceptions;

/**
 * Exception thrown when input validation fails (e.g., blank city name, malformed registration form).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request by the JSON API.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
