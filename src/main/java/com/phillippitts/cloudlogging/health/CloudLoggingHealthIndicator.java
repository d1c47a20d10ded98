package com.phillippitts.cloudlogging.health;

import com.phillippitts.cloudlogging.logging.CloudLoggingAppender;
import com.phillippitts.cloudlogging.logging.CloudLoggingStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the Cloud Logging appender.
 *
 * <p>Reports appender status for monitoring and alerting:
 * <ul>
 *   <li>UP: appender started and every write succeeded</li>
 *   <li>DEGRADED: appender started but output writes have failed</li>
 *   <li>DOWN: appender not started, log output is lost</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CloudLoggingHealthIndicator implements HealthIndicator {

    private final CloudLoggingAppender appender;

    public CloudLoggingHealthIndicator(CloudLoggingAppender appender) {
        this.appender = appender;
    }

    @Override
    public Health health() {
        CloudLoggingStats stats = appender.getStats();
        Health.Builder builder = new Health.Builder();

        if (!appender.isStarted()) {
            builder.down().withDetail("status", "Appender not started");
        } else if (stats.getWriteErrors() > 0) {
            builder.status("DEGRADED").withDetail("status", "Log output writes failing");
        } else {
            builder.up().withDetail("status", "Appender operational");
        }

        return builder
                .withDetail("appender", appender.getName())
                .withDetail("traceHeader", String.valueOf(appender.getTraceHeaderName()))
                .withDetail("project", String.valueOf(appender.getProject()))
                .withDetail("flushedEntries", stats.getFlushedEntries())
                .withDetail("passthroughLines", stats.getPassthroughLines())
                .withDetail("encodingFallbacks", stats.getEncodingFallbacks())
                .withDetail("writeErrors", stats.getWriteErrors())
                .build();
    }
}
