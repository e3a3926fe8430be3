package org.caureq.nodetelemetry.service.collectors;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.domain.StorageUsage;
import org.caureq.nodetelemetry.service.tools.ToolInvocationException;
import org.caureq.nodetelemetry.service.tools.ToolInvoker;
import org.caureq.nodetelemetry.service.tools.ToolOutputParseException;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** Daily capacity poll of the configured mount point. */
@Slf4j
@Service
public class StorageUsageCollector {
    private final ToolInvoker tools;
    private final TelemetryStore store;
    private final TelemetryProps.StorageProps props;
    private final Clock clock;

    public StorageUsageCollector(ToolInvoker tools, TelemetryStore store, TelemetryProps props, Clock clock) {
        this.tools = tools;
        this.store = store;
        this.props = props.storage();
        this.clock = clock;
    }

    public Optional<StorageUsage> collect() {
        try {
            var reading = StorageReportParser.parse(tools.invoke(props.tool(), List.of("-h", props.mount())));
            var row = StorageUsage.builder()
                    .date(LocalDate.now(clock))
                    .mount(props.mount())
                    .usageGb(reading.usageGb())
                    .usagePercent(reading.usagePercent())
                    .build();
            var saved = store.insertStorageUsage(row);
            log.info("[Storage] {} used={}GB ({}%)", props.mount(), reading.usageGb(), reading.usagePercent());
            return Optional.of(saved);
        } catch (ToolInvocationException e) {
            log.warn("[Storage] collection failed for {}: {}", props.mount(), e.getMessage());
        } catch (ToolOutputParseException e) {
            log.warn("[Storage] unexpected df output for {}: {}", props.mount(), e.getMessage());
        } catch (DataAccessException e) {
            log.error("[Storage] cannot store usage for {}: {}", props.mount(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Storage] collection failed for {}", props.mount(), e);
        }
        return Optional.empty();
    }
}
