package org.caureq.nodetelemetry.service;

import lombok.RequiredArgsConstructor;
import org.caureq.nodetelemetry.api.dto.AccountUsageDTO;
import org.caureq.nodetelemetry.api.dto.GpuAggregateDTO;
import org.caureq.nodetelemetry.api.dto.StorageSummaryDTO;
import org.caureq.nodetelemetry.api.dto.StorageUsageDTO;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.domain.GpuAggregate;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Read side for the JSON API. Same store reads as the publisher, never a write.
 */
@Service
@RequiredArgsConstructor
public class TelemetryQueryService {
    static final int MAX_STORAGE_DAYS = 366;

    private final TelemetryStore store;
    private final TelemetryProps props;
    private final Clock clock;

    /** Latest row per label, or every row in [from, to] when both bounds are given. */
    public List<GpuAggregateDTO> aggregates(AggregatePeriod period, LocalDate from, LocalDate to) {
        List<GpuAggregate> rows;
        if (from == null && to == null) {
            rows = store.latestAggregates(period);
        } else {
            if (from == null || to == null) throw new IllegalArgumentException("from and to go together");
            if (from.isAfter(to)) throw new IllegalArgumentException("from must not be after to");
            rows = store.aggregatesBetween(period, from, to);
        }
        return rows.stream()
                .map(a -> new GpuAggregateDTO(a.getDate(), a.getPeriod(), a.getLabel(), a.getAverageUtilization()))
                .toList();
    }

    public List<AccountUsageDTO> accountUsage(String periodTag) {
        var acc = props.accounting();
        if (!periodTag.equals(acc.weeklyPeriod()) && !periodTag.equals(acc.monthlyPeriod())) {
            throw new IllegalArgumentException("unknown period tag: " + periodTag
                    + " (expected " + acc.weeklyPeriod() + " or " + acc.monthlyPeriod() + ")");
        }
        return store.latestAccountUsage(periodTag).stream()
                .map(u -> new AccountUsageDTO(u.getPeriodTag(), u.getAccount(), u.getCpuHours(), u.getGpuHours(),
                        u.getCollectedAt().atZone(clock.getZone()).toOffsetDateTime()))
                .toList();
    }

    public StorageSummaryDTO storage(int days) {
        int window = Math.max(1, Math.min(days, MAX_STORAGE_DAYS));
        var mount = props.storage().mount();
        var since = LocalDate.now(clock).minusDays(window);
        var avg = store.storageAverageSince(mount, since);
        var history = store.storageHistorySince(mount, since).stream()
                .map(s -> new StorageUsageDTO(s.getDate(), s.getUsageGb(), s.getUsagePercent()))
                .toList();
        int points = (avg == null || avg.getSamples() == null) ? 0 : avg.getSamples().intValue();
        return new StorageSummaryDTO(mount, since,
                points == 0 ? null : avg.getUsageGb(),
                points == 0 ? null : avg.getUsagePercent(),
                points, history);
    }
}
