package org.caureq.nodetelemetry.service.collectors;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code nvidia-smi --query-gpu=index,utilization.gpu --format=csv,noheader,nounits}.
 * A single-column output (utilization only) is also accepted; the line position is then the index.
 */
@Slf4j
public final class GpuQueryParser {
    private GpuQueryParser() {}

    public record GpuReading(String label, double utilizationPercent) {}

    public static List<GpuReading> parse(List<String> lines) {
        List<GpuReading> out = new ArrayList<>();
        int position = 0;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty()) continue;
            String[] cols = line.split(",");
            String index = cols.length >= 2 ? cols[0].trim() : String.valueOf(position);
            String value = cols[cols.length - 1].trim().replace("%", "").trim();
            position++;
            try {
                out.add(new GpuReading("gpu" + index, Double.parseDouble(value)));
            } catch (NumberFormatException e) {
                // [N/A] on devices that do not report utilization
                log.debug("[GPU] skipping line '{}'", line);
            }
        }
        return out;
    }
}
