/**
 * Request-scoped log aggregation for Google Cloud Logging.
 *
 * <p>{@link com.phillippitts.cloudlogging.logging.CloudLoggingAppender} is a Log4j2 appender that,
 * while a {@link com.phillippitts.cloudlogging.logging.RequestLogs} is bound to the current thread,
 * buffers every event into it instead of writing. Flushing writes one JSON entry per request:
 *
 * <pre>
 * {"severity":"ERROR","name":"...","process":4242,"url":"https://host/path",
 *  "logging.googleapis.com/trace":"projects/my-proj/traces/105445aa7843bc8bf206b120001000",
 *  "logging.googleapis.com/spanId":"1",
 *  "message":"\n2025-01-01T00:00:00Z\tINFO\tfirst\n2025-01-01T00:00:01Z\tERROR\tsecond"}
 * </pre>
 *
 * <p>The binding is thread-confined ({@link com.phillippitts.cloudlogging.logging.RequestContextStore}),
 * so the appender must be called synchronously on the request thread. Async loggers would break
 * aggregation.
 *
 * @since 1.0
 */
package com.phillippitts.cloudlogging.logging;
