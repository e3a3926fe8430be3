package org.caureq.nodetelemetry.service.collectors;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.domain.AccountUsage;
import org.caureq.nodetelemetry.service.tools.ToolInvocationException;
import org.caureq.nodetelemetry.service.tools.ToolInvoker;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * CPU/GPU hours per account from the scheduler's accounting report, for one period tag
 * (7days, 30days). One row per account per collection.
 */
@Slf4j
@Service
public class AccountUsageCollector {
    static final String PERIOD_PLACEHOLDER = "{period}";

    private final ToolInvoker tools;
    private final TelemetryStore store;
    private final TelemetryProps.AccountingProps props;
    private final Clock clock;

    public AccountUsageCollector(ToolInvoker tools, TelemetryStore store, TelemetryProps props, Clock clock) {
        this.tools = tools;
        this.store = store;
        this.props = props.accounting();
        this.clock = clock;
    }

    /** @return number of account rows stored */
    public int collect(String periodTag) {
        try {
            var lines = tools.invoke(props.tool(), argsFor(periodTag));
            var readings = AccountingReportParser.parse(lines);
            if (readings.isEmpty()) {
                log.info("[Accounting] no account rows for {}", periodTag);
                return 0;
            }
            Instant now = clock.instant();
            var rows = readings.stream()
                    .map(r -> AccountUsage.builder()
                            .periodTag(periodTag)
                            .account(r.account())
                            .cpuHours(r.cpuHours())
                            .gpuHours(r.gpuHours())
                            .collectedAt(now)
                            .build())
                    .toList();
            store.insertAccountUsage(rows);
            log.info("[Accounting] stored {} account row(s) for {}", rows.size(), periodTag);
            return rows.size();
        } catch (ToolInvocationException e) {
            log.warn("[Accounting] collection failed ({}): {}", periodTag, e.getMessage());
        } catch (DataAccessException e) {
            log.error("[Accounting] cannot store rows ({}): {}", periodTag, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Accounting] collection failed ({})", periodTag, e);
        }
        return 0;
    }

    List<String> argsFor(String periodTag) {
        if (props.args() == null) return List.of();
        return props.args().stream().map(a -> a.replace(PERIOD_PLACEHOLDER, periodTag)).toList();
    }
}
