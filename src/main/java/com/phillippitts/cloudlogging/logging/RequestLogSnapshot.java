package com.phillippitts.cloudlogging.logging;

/**
 * Immutable view of a {@link RequestLogs} taken at flush time.
 *
 * @param message accumulated lines, each starting with a newline
 * @param severity highest severity appended
 * @param loggerName logger of the first appended line, or {@code null} when nothing was appended
 * @param url request URL, or {@code null}
 * @param trace trace context, or {@code null}
 * @param extra caller attachment, or {@code null}
 * @param lineCount number of appended lines
 */
public record RequestLogSnapshot(
        String message,
        Severity severity,
        String loggerName,
        String url,
        TraceContext trace,
        Object extra,
        int lineCount
) {}
