/**
 * HTTP side of request log aggregation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.cloudlogging.config.logging.RequestLoggingFilter} - Servlet filter
 *       that binds a {@link com.phillippitts.cloudlogging.logging.RequestLogs} to the request thread
 *       and flushes it when the request completes</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code traceId} - Trace id from the {@code X-Cloud-Trace-Context} header</li>
 *   <li>{@code spanId} - Span id from the same header</li>
 * </ul>
 *
 * @see com.phillippitts.cloudlogging.logging.CloudLoggingAppender
 * @since 1.0
 */
package com.phillippitts.cloudlogging.config.logging;
