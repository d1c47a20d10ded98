package com.phillippitts.cloudlogging.logging;

import java.util.Objects;
import java.util.Optional;

/**
 * Trace identifiers carried by an inbound {@code X-Cloud-Trace-Context} style header.
 *
 * @param traceId hexadecimal trace id, never blank
 * @param spanId span id, or {@code null} when the header carried none
 * @param sampled value of the {@code o=} option, or {@code null} when absent
 */
public record TraceContext(String traceId, String spanId, Boolean sampled) {

    private static final String TRACE_RESOURCE_FORMAT = "projects/%s/traces/%s";

    public TraceContext {
        Objects.requireNonNull(traceId, "traceId");
    }

    /**
     * Builds the fully qualified trace resource name Cloud Logging groups entries by.
     *
     * @param project GCP project id
     * @return {@code projects/<project>/traces/<traceId>}, or empty when no project is configured
     */
    public Optional<String> traceResource(String project) {
        if (project == null || project.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(String.format(TRACE_RESOURCE_FORMAT, project.trim(), traceId));
    }

    public Optional<String> span() {
        return Optional.ofNullable(spanId);
    }
}
