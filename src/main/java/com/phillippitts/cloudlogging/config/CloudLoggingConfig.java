package com.phillippitts.cloudlogging.config;

import com.phillippitts.cloudlogging.config.logging.RequestLoggingFilter;
import com.phillippitts.cloudlogging.config.properties.CloudLoggingProperties;
import com.phillippitts.cloudlogging.logging.CloudLoggingAppender;
import com.phillippitts.cloudlogging.logging.json.JsonEncoder;
import com.phillippitts.cloudlogging.logging.json.JsonEncoders;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;

/**
 * Wires the Cloud Logging appender into Log4j2 and the servlet filter chain.
 *
 * <p>If the active Log4j2 configuration declares a {@code CloudLogging} appender, that instance
 * is used as-is. Otherwise one is built from {@link CloudLoggingProperties} and attached to the
 * root logger. A {@link JsonEncoder} bean, when present, replaces the encoder selected by
 * {@code cloud-logging.encoder}.
 */
@org.springframework.context.annotation.Configuration
public class CloudLoggingConfig {

    private static final Logger LOG = LogManager.getLogger(CloudLoggingConfig.class);

    private final CloudLoggingProperties properties;

    public CloudLoggingConfig(CloudLoggingProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CloudLoggingAppender cloudLoggingAppender(ObjectProvider<JsonEncoder> encoderProvider) {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        return resolveAppender(context, properties, encoderProvider.getIfAvailable());
    }

    @Bean
    public FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilter(CloudLoggingAppender appender) {
        FilterRegistrationBean<RequestLoggingFilter> registration =
                new FilterRegistrationBean<>(new RequestLoggingFilter(appender));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.addUrlPatterns("/*");
        return registration;
    }

    /**
     * Returns the appender declared under {@code properties.appenderName}, or builds, starts and
     * attaches a new one to the root logger of {@code context}.
     *
     * @param context Log4j2 context to look in
     * @param properties appender settings used when nothing is declared
     * @param encoder encoder override, may be {@code null}
     * @return appender receiving the root logger's events
     */
    static CloudLoggingAppender resolveAppender(LoggerContext context,
                                                CloudLoggingProperties properties,
                                                JsonEncoder encoder) {
        Configuration configuration = context.getConfiguration();
        Appender declared = configuration.getAppender(properties.getAppenderName());
        if (declared instanceof CloudLoggingAppender cloudAppender) {
            LOG.info("Using Cloud Logging appender '{}' declared in Log4j2 configuration",
                    cloudAppender.getName());
            return cloudAppender;
        }
        if (declared != null) {
            LOG.warn("Appender '{}' is a {}, not a Cloud Logging appender; creating a new one",
                    declared.getName(), declared.getClass().getSimpleName());
        }

        CloudLoggingAppender appender = CloudLoggingAppender.newBuilder()
                .setName(properties.getAppenderName())
                .setConfiguration(configuration)
                .setTraceHeaderName(properties.getTraceHeaderName())
                .setProject(properties.getProject())
                .setEncoder(encoder != null ? encoder : JsonEncoders.of(properties.getEncoder()))
                .setStructuredPassthrough(properties.isStructuredPassthrough())
                .build();
        appender.start();
        configuration.addAppender(appender);
        configuration.getRootLogger().addAppender(appender, null, null);
        context.updateLoggers();

        LOG.info("Cloud Logging appender attached: traceHeader={}, project={}, encoder={}",
                appender.getTraceHeaderName(), appender.getProject(),
                appender.getEncoder().getClass().getSimpleName());
        return appender;
    }
}
