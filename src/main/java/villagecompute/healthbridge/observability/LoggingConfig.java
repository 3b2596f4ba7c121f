/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.observability;

import org.jboss.logging.MDC;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Standard MDC field names and helpers for structured logging.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code request_origin} - HTTP request path or scheduler identity</li>
 * <li>{@code refresh_trigger} - What initiated a token refresh (scheduler, admin, bootstrap)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Scheduled Ticks:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("scheduler.token-refresh");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers clear the MDC when
 * their unit of work ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_REFRESH_TRIGGER = "refresh_trigger";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span.
     *
     * <p>
     * If no span is active the fields are set to empty strings so the JSON log schema stays stable.
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
     * @param origin
     *            request path or scheduler identity
     */
    public static void setRequestOrigin(String origin) {
        if (origin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, origin);
        }
    }

    /**
     * @param trigger
     *            refresh trigger name
     */
    public static void setRefreshTrigger(String trigger) {
        if (trigger != null) {
            MDC.put(MDC_REFRESH_TRIGGER, trigger);
        }
    }

    /**
     * Removes all fields set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_REFRESH_TRIGGER);
    }
}
