package com.phillippitts.cloudlogging.config.logging;

import com.phillippitts.cloudlogging.logging.CloudLoggingAppender;
import com.phillippitts.cloudlogging.logging.RequestLogs;
import com.phillippitts.cloudlogging.logging.RequestScope;
import com.phillippitts.cloudlogging.logging.TraceContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;

/**
 * Opens a request log scope around every HTTP request so that all events logged while the
 * request is handled end up in one Cloud Logging entry.
 *
 * <p>Values added to Log4j2's MDC (ThreadContext) for other appenders:</p>
 * <ul>
 *   <li>traceId: trace id from the configured trace header (if present)</li>
 *   <li>spanId: span id from the same header (if present)</li>
 * </ul>
 *
 * <p>The aggregated entry is flushed and the context cleared after the request, including when
 * the chain throws, to avoid leakage across pooled threads. Must run before every other filter.</p>
 */
public class RequestLoggingFilter implements Filter {

    private final CloudLoggingAppender appender;

    public RequestLoggingFilter(CloudLoggingAppender appender) {
        this.appender = appender;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        RequestLogs requestLogs = appender.newRequestLogs(http, null);
        try (RequestScope ignored = appender.beginRequest(requestLogs)) {
            TraceContext trace = requestLogs.getTrace();
            if (trace != null) {
                ThreadContext.put("traceId", trace.traceId());
                if (trace.spanId() != null) {
                    ThreadContext.put("spanId", trace.spanId());
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.remove("traceId");
            ThreadContext.remove("spanId");
        }
    }
}
