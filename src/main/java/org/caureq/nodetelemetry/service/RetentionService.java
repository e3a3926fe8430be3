package org.caureq.nodetelemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/** Prunes raw GPU samples older than telemetry.retention.raw-days. Aggregates are kept. */
@Slf4j
@Service
public class RetentionService {
    private final TelemetryStore store;
    private final int rawDays;
    private final Clock clock;

    public RetentionService(TelemetryStore store, TelemetryProps props, Clock clock) {
        this.store = store;
        this.rawDays = props.retention() == null ? 0 : props.retention().rawDays();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return rawDays > 0;
    }

    public int pruneRawSamples() {
        if (!isEnabled()) return 0;
        var cutoff = clock.instant().minus(Duration.ofDays(rawDays));
        try {
            int n = store.deleteRawBefore(cutoff);
            log.info("[Retention] removed {} raw sample(s) older than {}", n, cutoff);
            return n;
        } catch (DataAccessException e) {
            log.error("[Retention] prune failed: {}", e.getMessage());
            return 0;
        }
    }
}
