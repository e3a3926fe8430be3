package org.caureq.nodetelemetry.api;

import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Prometheus scrape endpoint. Serves whatever the last publish cycle left in the registry;
 * never touches the store.
 */
@RestController
@RequiredArgsConstructor
public class ScrapeController {
    private final PrometheusRegistry registry;
    private final PrometheusTextFormatWriter writer;

    @GetMapping("/metrics")
    public ResponseEntity<byte[]> scrape() throws IOException {
        var out = new ByteArrayOutputStream();
        writer.write(out, registry.scrape());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, writer.getContentType())
                .body(out.toByteArray());
    }
}
