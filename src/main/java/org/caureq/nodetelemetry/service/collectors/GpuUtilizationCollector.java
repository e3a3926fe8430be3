package org.caureq.nodetelemetry.service.collectors;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.domain.GpuSample;
import org.caureq.nodetelemetry.service.tools.GpuCapability;
import org.caureq.nodetelemetry.service.tools.ToolInvocationException;
import org.caureq.nodetelemetry.service.tools.ToolInvoker;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * High-frequency GPU sampler: one raw sample per device per tick.
 * A failed tick inserts nothing and never throws.
 */
@Slf4j
@Service
public class GpuUtilizationCollector {
    static final List<String> QUERY_ARGS =
            List.of("--query-gpu=index,utilization.gpu", "--format=csv,noheader,nounits");

    private final ToolInvoker tools;
    private final TelemetryStore store;
    private final GpuCapability capability;
    private final String tool;
    private final Clock clock;

    public GpuUtilizationCollector(ToolInvoker tools, TelemetryStore store, GpuCapability capability,
                                   TelemetryProps props, Clock clock) {
        this.tools = tools;
        this.store = store;
        this.capability = capability;
        this.tool = props.gpu().tool();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return capability.available();
    }

    /** @return number of samples stored this tick */
    public int sample() {
        if (!capability.available()) return 0;
        try {
            var readings = GpuQueryParser.parse(tools.invoke(tool, QUERY_ARGS));
            if (readings.isEmpty()) {
                log.warn("[GPU] {} returned no utilization values", tool);
                return 0;
            }
            Instant now = clock.instant();
            var rows = readings.stream()
                    .map(r -> GpuSample.builder().ts(now).label(r.label()).utilizationPercent(r.utilizationPercent()).build())
                    .toList();
            store.insertRawBatch(rows);
            log.debug("[GPU] stored {} sample(s)", rows.size());
            return rows.size();
        } catch (ToolInvocationException e) {
            log.warn("[GPU] sampling skipped: {}", e.getMessage());
        } catch (DataAccessException e) {
            log.error("[GPU] cannot store samples: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[GPU] sampling failed", e);
        }
        return 0;
    }
}
