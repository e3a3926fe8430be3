package org.caureq.nodetelemetry.config;

import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    /** Own registry instead of the JVM-wide default, so each context starts clean. */
    @Bean
    public PrometheusRegistry telemetryRegistry() {
        return new PrometheusRegistry();
    }

    /** Text exposition format 0.0.4, without _created series. */
    @Bean
    public PrometheusTextFormatWriter textFormatWriter() {
        return new PrometheusTextFormatWriter(false);
    }
}
