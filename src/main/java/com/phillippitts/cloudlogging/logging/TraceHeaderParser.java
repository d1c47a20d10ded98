package com.phillippitts.cloudlogging.logging;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code TRACE_ID/SPAN_ID;o=TRACE_TRUE} trace headers.
 * Safe against malformed input: anything that does not match yields an empty result.
 */
public final class TraceHeaderParser {

    /** Name of the header set by Google front ends. */
    public static final String DEFAULT_HEADER_NAME = "X-Cloud-Trace-Context";

    private static final Pattern HEADER_PATTERN =
            Pattern.compile("^([0-9A-Za-z-]+)(?:/([0-9A-Za-z]*))?(?:;o=([0-9]+))?$");

    private TraceHeaderParser() {}

    /**
     * @param headerValue raw header value, may be {@code null}
     * @return parsed trace context, or empty when the header is missing or malformed
     */
    public static Optional<TraceContext> parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        Matcher m = HEADER_PATTERN.matcher(headerValue.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String span = m.group(2);
        if (span != null && span.isEmpty()) {
            span = null;
        }
        String option = m.group(3);
        Boolean sampled = option == null ? null : "1".equals(option);
        return Optional.of(new TraceContext(m.group(1), span, sampled));
    }
}
