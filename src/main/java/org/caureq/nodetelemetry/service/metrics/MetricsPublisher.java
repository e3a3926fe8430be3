package org.caureq.nodetelemetry.service.metrics;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.domain.AccountUsage;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.domain.GpuAggregate;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Re-projects the latest stored aggregates onto the exported gauges.
 *
 * Everything is read first; gauges are only touched once all reads succeeded, so a store
 * failure leaves the previous cycle's values in place. Never writes to the store.
 */
@Slf4j
@Service
public class MetricsPublisher {
    static final int STORAGE_WINDOW_DAYS = 30;

    private final TelemetryStore store;
    private final TelemetryGauges gauges;
    private final TextfileExporter textfile;
    private final TelemetryProps props;
    private final Clock clock;

    public MetricsPublisher(TelemetryStore store, TelemetryGauges gauges, TextfileExporter textfile,
                            TelemetryProps props, Clock clock) {
        this.store = store;
        this.gauges = gauges;
        this.textfile = textfile;
        this.props = props;
        this.clock = clock;
    }

    public record PublishResult(int series, int pruned) {}

    public synchronized PublishResult publish() {
        Snapshot snap;
        try {
            snap = read();
        } catch (DataAccessException e) {
            log.error("[Publish] store read failed, keeping previous values: {}", e.getMessage());
            return new PublishResult(0, 0);
        }

        int pruned = 0;
        pruned += gauges.replace(gauges.weeklyGpuUtilization(), byLabel(snap.weeklyGpu()));
        pruned += gauges.replace(gauges.monthlyGpuUtilization(), byLabel(snap.monthlyGpu()));
        pruned += gauges.replace(gauges.weeklyCpuHours(), byAccount(snap.weeklyAccounts(), AccountUsage::getCpuHours));
        pruned += gauges.replace(gauges.monthlyCpuHours(), byAccount(snap.monthlyAccounts(), AccountUsage::getCpuHours));
        pruned += gauges.replace(gauges.weeklyGpuHours(), byAccount(snap.weeklyAccounts(), AccountUsage::getGpuHours));
        pruned += gauges.replace(gauges.monthlyGpuHours(), byAccount(snap.monthlyAccounts(), AccountUsage::getGpuHours));
        pruned += gauges.replace(gauges.monthlyStorageGb(), snap.storageGb());
        pruned += gauges.replace(gauges.monthlyStoragePercent(), snap.storagePercent());

        int series = snap.weeklyGpu().size() + snap.monthlyGpu().size()
                + 2 * (snap.weeklyAccounts().size() + snap.monthlyAccounts().size())
                + snap.storageGb().size() + snap.storagePercent().size();
        log.debug("[Publish] {} series, {} stale label(s) removed", series, pruned);

        textfile.export();
        return new PublishResult(series, pruned);
    }

    private Snapshot read() {
        var accounting = props.accounting();
        var mount = props.storage().mount();
        var storage = store.storageAverageSince(mount, LocalDate.now(clock).minusDays(STORAGE_WINDOW_DAYS));

        Map<String, Double> storageGb = new LinkedHashMap<>();
        Map<String, Double> storagePct = new LinkedHashMap<>();
        if (storage != null && storage.getSamples() != null && storage.getSamples() > 0) {
            if (storage.getUsageGb() != null) storageGb.put(mount, storage.getUsageGb());
            if (storage.getUsagePercent() != null) storagePct.put(mount, storage.getUsagePercent());
        }
        return new Snapshot(
                store.latestAggregates(AggregatePeriod.WEEK),
                store.latestAggregates(AggregatePeriod.MONTH),
                store.latestAccountUsage(accounting.weeklyPeriod()),
                store.latestAccountUsage(accounting.monthlyPeriod()),
                storageGb, storagePct);
    }

    private static Map<String, Double> byLabel(List<GpuAggregate> rows) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (var r : rows) m.put(r.getLabel(), r.getAverageUtilization());
        return m;
    }

    private static Map<String, Double> byAccount(List<AccountUsage> rows, ToDoubleFunction<AccountUsage> value) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (var r : rows) m.put(r.getAccount(), value.applyAsDouble(r));
        return m;
    }

    private record Snapshot(List<GpuAggregate> weeklyGpu, List<GpuAggregate> monthlyGpu,
                            List<AccountUsage> weeklyAccounts, List<AccountUsage> monthlyAccounts,
                            Map<String, Double> storageGb, Map<String, Double> storagePercent) {}
}
