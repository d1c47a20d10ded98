package com.phillippitts.cloudlogging.logging;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Logging state of one in-flight HTTP request: the accumulated message, the highest severity
 * seen so far and the request metadata the aggregated entry is tagged with.
 *
 * <p><b>Thread Safety:</b> not thread-safe. An instance is bound to exactly one request thread
 * through {@link RequestContextStore} and only that thread appends to it.
 */
public final class RequestLogs {

    private final String url;
    private final TraceContext trace;
    private final Object extra;

    private final StringBuilder message = new StringBuilder();
    private Severity severity = Severity.DEFAULT;
    private String loggerName;
    private int lineCount;

    /**
     * @param url request URL, may be {@code null} outside servlet requests
     * @param trace parsed trace header, or {@code null}
     * @param extra caller attachment serialized as-is, or {@code null}
     */
    public RequestLogs(String url, TraceContext trace, Object extra) {
        this.url = url;
        this.trace = trace;
        this.extra = extra;
    }

    /**
     * Captures URL and trace header of a servlet request.
     *
     * @param request inbound request
     * @param traceHeaderName header holding the trace context; {@code null} disables trace parsing
     * @param extra caller attachment, or {@code null}
     */
    public static RequestLogs create(HttpServletRequest request, String traceHeaderName, Object extra) {
        TraceContext trace = null;
        if (traceHeaderName != null && !traceHeaderName.isBlank()) {
            trace = TraceHeaderParser.parse(request.getHeader(traceHeaderName)).orElse(null);
        }
        return new RequestLogs(fullUrl(request), trace, extra);
    }

    private static String fullUrl(HttpServletRequest request) {
        StringBuffer url = request.getRequestURL();
        if (url == null) {
            return request.getRequestURI();
        }
        String query = request.getQueryString();
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query);
        }
        return url.toString();
    }

    /**
     * Adds one formatted line and raises the tracked severity when {@code lineSeverity} is higher.
     *
     * @param name logger that produced the line; the first one is kept as the entry's name
     * @param line line already prefixed with timestamp and severity
     * @param lineSeverity severity of the line
     */
    public void append(String name, String line, Severity lineSeverity) {
        if (loggerName == null) {
            loggerName = name;
        }
        message.append(line);
        lineCount++;
        if (lineSeverity != null && lineSeverity.isMoreSevereThan(severity)) {
            severity = lineSeverity;
        }
    }

    public RequestLogSnapshot snapshot() {
        return new RequestLogSnapshot(message.toString(), severity, loggerName, url, trace, extra, lineCount);
    }

    public boolean isEmpty() {
        return lineCount == 0;
    }

    public String getUrl() {
        return url;
    }

    public TraceContext getTrace() {
        return trace;
    }

    public Object getExtra() {
        return extra;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "RequestLogs{url=" + url + ", severity=" + severity + ", lines=" + lineCount + "}";
    }
}
