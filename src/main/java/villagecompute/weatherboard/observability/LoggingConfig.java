package villagecompute.weatherboard.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code user_id} - Authenticated user UUID (absent for anonymous requests)</li>
 * <li>{@code request_origin} - HTTP request path or scheduled job name</li>
 * </ul>
 *
 * <p>
 * <b>Usage in HTTP Filters:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setUserId(userId);
 * LoggingConfig.setRequestOrigin(requestPath);
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear MDC at the
 * end of processing to prevent context leakage between requests served by the same thread.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_USER_ID = "user_id";

    /**
     * HTTP request path (e.g., "/weather") or job identifier (e.g., "job.weather_cache_maintenance").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings are used when no span is active
     * so the log structure stays consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * @param userId
     *            authenticated user id, ignored when null
     */
    public static void setUserId(UUID userId) {
        if (userId != null) {
            MDC.put(MDC_USER_ID, userId.toString());
        }
    }

    /**
     * @param requestOrigin
     *            path like "/weather" or a job identifier
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_USER_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
