package org.caureq.nodetelemetry.service.metrics;

import io.prometheus.metrics.expositionformats.PrometheusTextFormatWriter;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Mirrors the gauge set into a node-exporter textfile-collector file.
 * Written to a temp file next to the target, then moved over it in one step.
 */
@Slf4j
@Component
public class TextfileExporter {
    private final PrometheusRegistry registry;
    private final PrometheusTextFormatWriter writer;
    private final Path target;

    public TextfileExporter(PrometheusRegistry registry, PrometheusTextFormatWriter writer, TelemetryProps props) {
        this.registry = registry;
        this.writer = writer;
        var path = props.textfile() == null ? null : props.textfile().path();
        this.target = (path == null || path.isBlank()) ? null : Path.of(path);
    }

    public boolean isEnabled() {
        return target != null;
    }

    /** @return true when the file was replaced */
    public boolean export() {
        if (target == null) return false;
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                writer.write(out, registry.scrape());
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[Textfile] wrote {}", target);
            return true;
        } catch (IOException e) {
            log.warn("[Textfile] cannot write {}: {}", target, e.getMessage());
            deleteTemp(tmp);
            return false;
        }
    }

    private void deleteTemp(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("[Textfile] cannot remove {}: {}", tmp, e.getMessage());
        }
    }
}
