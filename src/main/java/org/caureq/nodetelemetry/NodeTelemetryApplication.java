package org.caureq.nodetelemetry;

import org.caureq.nodetelemetry.config.TelemetryProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TelemetryProps.class)
public class NodeTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(NodeTelemetryApplication.class, args);
    }

}
