package com.phillippitts.cloudlogging.logging;

/**
 * Structured form of the request lifecycle: opening binds the logs, closing flushes them and
 * restores whatever binding was active before.
 *
 * <pre>{@code
 * try (RequestScope scope = appender.beginRequest(appender.newRequestLogs(request, null))) {
 *     chain.doFilter(request, response);
 * }
 * }</pre>
 *
 * <p>Must be closed on the thread that opened it.
 */
public final class RequestScope implements AutoCloseable {

    private final CloudLoggingAppender appender;
    private final RequestLogs requestLogs;
    private final ContextToken token;
    private boolean closed;

    RequestScope(CloudLoggingAppender appender, RequestLogs requestLogs) {
        this.appender = appender;
        this.requestLogs = requestLogs;
        this.token = appender.setRequest(requestLogs);
    }

    public RequestLogs getRequestLogs() {
        return requestLogs;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            appender.flush();
        } finally {
            appender.resetRequest(token);
        }
    }
}
