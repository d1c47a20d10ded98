package com.phillippitts.cloudlogging.config;

import com.phillippitts.cloudlogging.logging.CloudLoggingAppender;
import com.phillippitts.cloudlogging.logging.CloudLoggingStats;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the appender counters via Micrometer.
 *
 * <ul>
 *   <li>cloud.logging.entries.flushed - Aggregated request entries written</li>
 *   <li>cloud.logging.lines.passthrough - Lines written outside any request</li>
 *   <li>cloud.logging.encoding.fallbacks - Entries written in degraded form after an encoding failure</li>
 *   <li>cloud.logging.write.errors - Failed writes to the output stream</li>
 *   <li>cloud.logging.append.failures - Events dropped by an unexpected appender failure</li>
 * </ul>
 *
 * <p>Available at {@code GET /actuator/metrics/cloud.logging.entries.flushed}.
 */
@Configuration
public class CloudLoggingMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(CloudLoggingMetricsConfig.class);

    @Bean
    public MeterBinder cloudLoggingMetrics(CloudLoggingAppender appender) {
        return registry -> {
            CloudLoggingStats stats = appender.getStats();

            FunctionCounter.builder("cloud.logging.entries.flushed", stats, CloudLoggingStats::getFlushedEntries)
                    .description("Aggregated request log entries written")
                    .register(registry);

            FunctionCounter.builder("cloud.logging.lines.passthrough", stats, CloudLoggingStats::getPassthroughLines)
                    .description("Log lines written outside any request")
                    .register(registry);

            FunctionCounter.builder("cloud.logging.encoding.fallbacks", stats, CloudLoggingStats::getEncodingFallbacks)
                    .description("Entries written in degraded form after an encoding failure")
                    .register(registry);

            FunctionCounter.builder("cloud.logging.write.errors", stats, CloudLoggingStats::getWriteErrors)
                    .description("Failed writes to the log output stream")
                    .register(registry);

            FunctionCounter.builder("cloud.logging.append.failures", stats, CloudLoggingStats::getAppendFailures)
                    .description("Log events dropped by an appender failure")
                    .register(registry);

            LOG.info("Cloud Logging metrics registered: cloud.logging.* available via /actuator/metrics");
        };
    }
}
