package com.phillippitts.cloudlogging.config.properties;

import com.phillippitts.cloudlogging.logging.json.JsonEncoders;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the Cloud Logging appender.
 *
 * <p>Only used when the Log4j2 configuration does not already declare a {@code CloudLogging}
 * appender named {@link #getAppenderName()}; a declared appender keeps its XML attributes.
 */
@Validated
@ConfigurationProperties(prefix = "cloud-logging")
public class CloudLoggingProperties {

    /**
     * HTTP header carrying {@code TRACE_ID/SPAN_ID;o=TRACE_TRUE}.
     */
    @NotBlank
    private String traceHeaderName = "X-Cloud-Trace-Context";

    /**
     * GCP project id used to build {@code projects/<project>/traces/<trace>}. Defaults to the
     * {@code GCP_PROJECT} environment variable through application.properties.
     */
    private String project;

    @NotNull
    private JsonEncoders.Kind encoder = JsonEncoders.Kind.ORG_JSON;

    /**
     * Write log lines outside a request as JSON entries instead of plain text.
     */
    private boolean structuredPassthrough;

    @NotBlank
    private String appenderName = "CloudLogging";

    public String getTraceHeaderName() {
        return traceHeaderName;
    }

    public void setTraceHeaderName(String traceHeaderName) {
        this.traceHeaderName = traceHeaderName;
    }

    public String getProject() {
        return project;
    }

    public void setProject(String project) {
        this.project = project;
    }

    public JsonEncoders.Kind getEncoder() {
        return encoder;
    }

    public void setEncoder(JsonEncoders.Kind encoder) {
        this.encoder = encoder;
    }

    public boolean isStructuredPassthrough() {
        return structuredPassthrough;
    }

    public void setStructuredPassthrough(boolean structuredPassthrough) {
        this.structuredPassthrough = structuredPassthrough;
    }

    public String getAppenderName() {
        return appenderName;
    }

    public void setAppenderName(String appenderName) {
        this.appenderName = appenderName;
    }
}
