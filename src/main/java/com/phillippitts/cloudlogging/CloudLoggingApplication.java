package com.phillippitts.cloudlogging;

import com.phillippitts.cloudlogging.config.properties.CloudLoggingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CloudLoggingProperties.class)
public class CloudLoggingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudLoggingApplication.class, args);
    }

}
