package com.phillippitts.cloudlogging.logging;

import com.phillippitts.cloudlogging.exception.InvalidContextTokenException;
import com.phillippitts.cloudlogging.logging.json.JsonEncoder;
import com.phillippitts.cloudlogging.logging.json.JsonEncoders;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Serializable;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Log4j2 appender that folds every log event of an HTTP request into one Google Cloud Logging
 * structured entry.
 *
 * <p>While a {@link RequestLogs} is bound to the calling thread, each event is appended to it as
 * {@code "\n<timestamp>\t<SEVERITY>\t<message>"} and nothing is written. {@link #flush()} then
 * writes the whole request as a single JSON line carrying the highest severity seen and the
 * trace fields Cloud Logging uses to group entries. Events logged outside a request are written
 * immediately, as plain text or, with {@code structuredPassthrough}, as a one-line JSON entry.
 *
 * <p>Declared in a Log4j2 configuration as:
 * <pre>
 * &lt;CloudLogging name="CloudLogging" traceHeaderName="X-Cloud-Trace-Context"
 *               project="${env:GCP_PROJECT:-}"/&gt;
 * </pre>
 *
 * <p>No failure inside the appender reaches the logging caller: encoding and write problems are
 * reported through the appender's {@link org.apache.logging.log4j.core.ErrorHandler}.
 */
@Plugin(name = CloudLoggingAppender.PLUGIN_NAME, category = Core.CATEGORY_NAME,
        elementType = Appender.ELEMENT_TYPE, printObject = true)
public final class CloudLoggingAppender extends AbstractAppender {

    public static final String PLUGIN_NAME = "CloudLogging";

    public static final String TRACE_FIELD = "logging.googleapis.com/trace";
    public static final String SPAN_ID_FIELD = "logging.googleapis.com/spanId";
    public static final String TRACE_SAMPLED_FIELD = "logging.googleapis.com/trace_sampled";
    public static final String ENCODING_ERROR_FIELD = "encodingError";

    private static final String PROJECT_ENV = "GCP_PROJECT";

    /**
     * Shared by every instance so a binding made through one appender is seen by its
     * replacement after a Log4j2 reconfiguration.
     */
    private static final RequestContextStore STORE = new RequestContextStore();

    private final String traceHeaderName;
    private final String project;
    private final JsonEncoder encoder;
    private final boolean structuredPassthrough;
    /** Fixed sink; {@code null} means whatever {@code System.out} is at write time. */
    private final PrintStream out;
    private final CloudLoggingStats stats = new CloudLoggingStats();
    private final long processId = ProcessHandle.current().pid();

    private CloudLoggingAppender(String name, Filter filter, Layout<? extends Serializable> layout,
                                 boolean ignoreExceptions, Property[] properties, String traceHeaderName,
                                 String project, JsonEncoder encoder, boolean structuredPassthrough,
                                 PrintStream out) {
        super(name, filter, layout, ignoreExceptions, properties);
        this.traceHeaderName = traceHeaderName;
        this.project = project;
        this.encoder = encoder;
        this.structuredPassthrough = structuredPassthrough;
        this.out = out;
    }

    @PluginBuilderFactory
    public static <B extends Builder<B>> B newBuilder() {
        return new Builder<B>().asBuilder();
    }

    @Override
    public void append(LogEvent event) {
        try {
            Severity severity = Severity.fromLevel(event.getLevel());
            String text = formatMessage(event);
            Optional<RequestLogs> active = STORE.current();
            if (active.isPresent()) {
                active.get().append(event.getLoggerName(), formatLine(event, severity, text), severity);
                return;
            }
            write(passthroughLine(event, severity, text));
            stats.linePassedThrough();
        } catch (RuntimeException e) {
            stats.appendFailed();
            error("Failed to append log event", event, e);
        }
    }

    /**
     * Writes the calling thread's aggregated entry and unbinds it. A no-op outside a request.
     * A request that logged nothing is unbound without writing.
     */
    public void flush() {
        Optional<RequestLogs> active = STORE.current();
        if (active.isEmpty()) {
            return;
        }
        STORE.clear();
        RequestLogs requestLogs = active.get();
        if (requestLogs.isEmpty()) {
            return;
        }
        try {
            write(encodeEntry(requestLogs.snapshot()));
            stats.entryFlushed();
        } catch (RuntimeException e) {
            error("Failed to flush request logs for " + requestLogs.getUrl(), e);
        }
    }

    public ContextToken setRequest(RequestLogs requestLogs) {
        return STORE.set(requestLogs);
    }

    public Optional<RequestLogs> getRequest() {
        return STORE.current();
    }

    /**
     * Restores the binding recorded in {@code token}. A token from another thread is reported
     * and the calling thread's binding is cleared so nothing leaks into later work.
     */
    public void resetRequest(ContextToken token) {
        try {
            STORE.reset(token);
        } catch (InvalidContextTokenException e) {
            error("Cannot restore request context", e);
            STORE.clear();
        }
    }

    public RequestScope beginRequest(RequestLogs requestLogs) {
        return new RequestScope(this, requestLogs);
    }

    public RequestLogs newRequestLogs(HttpServletRequest request, Object extra) {
        return RequestLogs.create(request, traceHeaderName, extra);
    }

    @Override
    public boolean stop(long timeout, TimeUnit timeUnit) {
        setStopping();
        boolean stopped = super.stop(timeout, timeUnit, false);
        sink().flush();
        setStopped();
        return stopped;
    }

    private String formatMessage(LogEvent event) {
        Layout<? extends Serializable> layout = getLayout();
        if (layout != null) {
            return stripTrailingNewline(String.valueOf(layout.toSerializable(event)));
        }
        String message = event.getMessage() == null ? "" : event.getMessage().getFormattedMessage();
        Throwable thrown = event.getThrown();
        if (thrown == null) {
            return message;
        }
        StringWriter trace = new StringWriter();
        thrown.printStackTrace(new PrintWriter(trace));
        return message + "\n" + stripTrailingNewline(trace.toString());
    }

    private static String formatLine(LogEvent event, Severity severity, String text) {
        return "\n" + timestamp(event) + "\t" + severity.name() + "\t" + text;
    }

    private String passthroughLine(LogEvent event, Severity severity, String text) {
        if (!structuredPassthrough) {
            return text;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("severity", severity.name());
        entry.put("name", event.getLoggerName());
        entry.put("process", processId);
        entry.put("time", timestamp(event));
        entry.put("message", text);
        try {
            return encoder.encode(entry);
        } catch (RuntimeException e) {
            stats.encodingFellBack();
            error("Failed to encode log line; writing plain text", event, e);
            return text;
        }
    }

    String encodeEntry(RequestLogSnapshot snapshot) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("severity", snapshot.severity().name());
        if (snapshot.loggerName() != null) {
            entry.put("name", snapshot.loggerName());
        }
        entry.put("process", processId);
        if (snapshot.url() != null) {
            entry.put("url", snapshot.url());
        }
        TraceContext trace = snapshot.trace();
        if (trace != null) {
            trace.traceResource(project).ifPresent(resource -> entry.put(TRACE_FIELD, resource));
            trace.span().ifPresent(span -> entry.put(SPAN_ID_FIELD, span));
            if (trace.sampled() != null) {
                entry.put(TRACE_SAMPLED_FIELD, trace.sampled());
            }
        }
        entry.put("message", snapshot.message());
        try {
            if (snapshot.extra() != null) {
                entry.put("extra", JsonEncoders.toPlainTree(snapshot.extra()));
            }
            return encoder.encode(entry);
        } catch (RuntimeException e) {
            stats.encodingFellBack();
            error("Failed to encode request log entry; retrying without attachment", e);
        }
        entry.remove("extra");
        entry.put(ENCODING_ERROR_FIELD, "attachment could not be serialized");
        try {
            return encoder.encode(entry);
        } catch (RuntimeException e) {
            error("Failed to encode degraded request log entry; writing plain text", e);
            return snapshot.message();
        }
    }

    private void write(String line) {
        PrintStream sink = sink();
        sink.print(line + "\n");
        if (sink.checkError()) {
            stats.writeFailed();
            error("Failed to write log output to " + (out == null ? "standard output" : "configured stream"));
        }
    }

    private PrintStream sink() {
        return out != null ? out : System.out;
    }

    private static String timestamp(LogEvent event) {
        org.apache.logging.log4j.core.time.Instant instant = event.getInstant();
        return Instant.ofEpochSecond(instant.getEpochSecond(), instant.getNanoOfSecond()).toString();
    }

    private static String stripTrailingNewline(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) {
            end--;
        }
        return s.substring(0, end);
    }

    public String getTraceHeaderName() {
        return traceHeaderName;
    }

    public String getProject() {
        return project;
    }

    public JsonEncoder getEncoder() {
        return encoder;
    }

    public boolean isStructuredPassthrough() {
        return structuredPassthrough;
    }

    public CloudLoggingStats getStats() {
        return stats;
    }

    /**
     * Builds the appender from a Log4j2 configuration element or from code.
     */
    public static class Builder<B extends Builder<B>> extends AbstractAppender.Builder<B>
            implements org.apache.logging.log4j.core.util.Builder<CloudLoggingAppender> {

        @PluginBuilderAttribute
        private String traceHeaderName = TraceHeaderParser.DEFAULT_HEADER_NAME;

        @PluginBuilderAttribute
        private String project = System.getenv(PROJECT_ENV);

        @PluginBuilderAttribute
        private String encoderClass;

        @PluginBuilderAttribute
        private boolean structuredPassthrough;

        private JsonEncoder encoder;
        private PrintStream out;

        public B setTraceHeaderName(String traceHeaderName) {
            this.traceHeaderName = traceHeaderName;
            return asBuilder();
        }

        public B setProject(String project) {
            this.project = project;
            return asBuilder();
        }

        public B setEncoderClass(String encoderClass) {
            this.encoderClass = encoderClass;
            return asBuilder();
        }

        public B setStructuredPassthrough(boolean structuredPassthrough) {
            this.structuredPassthrough = structuredPassthrough;
            return asBuilder();
        }

        /** Encoder instance; takes precedence over {@code encoderClass}. */
        public B setEncoder(JsonEncoder encoder) {
            this.encoder = encoder;
            return asBuilder();
        }

        /** Fixed output stream, mainly for tests. Defaults to the current {@code System.out}. */
        public B setOut(PrintStream out) {
            this.out = out;
            return asBuilder();
        }

        @Override
        public CloudLoggingAppender build() {
            JsonEncoder resolved = encoder != null ? encoder : JsonEncoders.fromClassName(encoderClass);
            String header = traceHeaderName == null || traceHeaderName.isBlank() ? null : traceHeaderName.trim();
            String resolvedProject = project == null || project.isBlank() ? null : project.trim();
            return new CloudLoggingAppender(getName(), getFilter(), getLayout(), isIgnoreExceptions(),
                    getPropertyArray(), header, resolvedProject, resolved, structuredPassthrough, out);
        }
    }
}
