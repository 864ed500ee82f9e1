package sentrix.lifecycle.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names for lifecycle engine logs and helpers to set and clear them.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code detection_id} - detection record being assessed</li>
 * <li>{@code content_hash} - SHA-256 of the image being ingested</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Every entry point that
 * enriches MDC clears it in a {@code finally} block.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_DETECTION_ID = "detection_id";

    public static final String MDC_CONTENT_HASH = "content_hash";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings when no span is
     * active.
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

    public static void setDetectionId(String detectionId) {
        if (detectionId != null) {
            MDC.put(MDC_DETECTION_ID, detectionId);
        }
    }

    public static void setContentHash(String contentHash) {
        if (contentHash != null) {
            MDC.put(MDC_CONTENT_HASH, contentHash);
        }
    }

    /**
     * Clears all lifecycle MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_DETECTION_ID);
        MDC.remove(MDC_CONTENT_HASH);
    }
}
