/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so callers can handle them
 * uniformly. None of them ever escapes the appender's logging path: the appender reports
 * them through Log4j2's error handler instead.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.cloudlogging.exception.CloudLoggingException} - Base exception</li>
 *   <li>{@link com.phillippitts.cloudlogging.exception.LogEncodingException} - Thrown when an
 *       aggregated entry cannot be serialized by the configured JSON encoder</li>
 *   <li>{@link com.phillippitts.cloudlogging.exception.InvalidContextTokenException} - Thrown when
 *       a request context is reset with a token from another thread</li>
 * </ul>
 *
 * @see com.phillippitts.cloudlogging.logging.CloudLoggingAppender
 * @since 1.0
 */
package com.phillippitts.cloudlogging.exception;
