package villagecompute.weatherboard.exceptions;

/**
 * Exception thrown when the OpenWeatherMap API cannot produce a usable response.
 *
 * <p>
 * Carries the failure {@link Kind} and, where one was received, the HTTP status so that callers can log the cause
 * precisely. {@link villagecompute.weatherboard.services.WeatherService} never lets this escape: every failure is
 * converted into an empty result at its boundary.
 */
public class WeatherProviderException extends RuntimeException {

    /**
     * Failure categories of an outbound weather call.
     */
    public enum Kind {
        /** Connection failure, timeout or interrupted call. */
        TRANSPORT,
        /** Non-2xx HTTP status. */
        HTTP_STATUS,
        /** Body reported a non-200 {@code cod}. */
        PROVIDER_STATUS,
        /** Body is not a JSON object or lacks a required field. */
        MALFORMED
    }

    private final Kind kind;
    private final int statusCode;

    public WeatherProviderException(Kind kind, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public WeatherProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = -1;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP or {@code cod} status code, or -1 when no status was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return true when the provider answered that the requested city does not exist
     */
    public boolean isNotFound() {
        return statusCode == 404 && (kind == Kind.HTTP_STATUS || kind == Kind.PROVIDER_STATUS);
    }
}
