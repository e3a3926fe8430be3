package org.caureq.nodetelemetry.store;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.domain.AccountUsage;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.domain.GpuAggregate;
import org.caureq.nodetelemetry.domain.GpuSample;
import org.caureq.nodetelemetry.domain.StorageUsage;
import org.caureq.nodetelemetry.repo.AccountUsageRepo;
import org.caureq.nodetelemetry.repo.GpuAggregateRepo;
import org.caureq.nodetelemetry.repo.GpuSampleRepo;
import org.caureq.nodetelemetry.repo.LabelAverage;
import org.caureq.nodetelemetry.repo.StorageAverage;
import org.caureq.nodetelemetry.repo.StorageUsageRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point to the persisted telemetry.
 *
 * Writes
 * - Each call is one transaction, committed before the write lock is released,
 *   so concurrent collector tasks are serialized (single-writer discipline).
 * - Aggregates are upserted by (date, period, label); re-running a rollup replaces values.
 *
 * Reads
 * - Read-only transactions, no lock. The database's MVCC only ever shows committed rows.
 *
 * Persistence errors surface as Spring's DataAccessException; callers decide how to degrade.
 */
@Slf4j
@Service
public class TelemetryStore {
    private final GpuSampleRepo sampleRepo;
    private final GpuAggregateRepo aggregateRepo;
    private final StorageUsageRepo storageRepo;
    private final AccountUsageRepo accountRepo;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final ReentrantLock writeLock = new ReentrantLock(true);

    public TelemetryStore(GpuSampleRepo sampleRepo, GpuAggregateRepo aggregateRepo,
                          StorageUsageRepo storageRepo, AccountUsageRepo accountRepo,
                          PlatformTransactionManager txManager) {
        this.sampleRepo = sampleRepo;
        this.aggregateRepo = aggregateRepo;
        this.storageRepo = storageRepo;
        this.accountRepo = accountRepo;
        this.writeTx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
    }

    /* --------------------- writes --------------------- */

    public GpuSample insertRaw(GpuSample sample) {
        return write(status -> sampleRepo.save(sample));
    }

    /** All samples of one sampling tick, all-or-nothing. */
    public List<GpuSample> insertRawBatch(List<GpuSample> samples) {
        if (samples.isEmpty()) return List.of();
        return write(status -> sampleRepo.saveAll(samples));
    }

    public GpuAggregate upsertAggregate(LocalDate date, AggregatePeriod period, String label, double average) {
        return write(status -> upsert(date, period, label, average));
    }

    /** Upserts one rollup result set in a single transaction, so readers see all of it or none. */
    public List<GpuAggregate> upsertAggregates(LocalDate date, AggregatePeriod period, List<LabelAverage> averages) {
        if (averages.isEmpty()) return List.of();
        return write(status -> {
            List<GpuAggregate> out = new ArrayList<>(averages.size());
            for (LabelAverage a : averages) {
                if (a.getAverage() == null) continue;
                out.add(upsert(date, period, a.getLabel(), a.getAverage()));
            }
            return out;
        });
    }

    public StorageUsage insertStorageUsage(StorageUsage row) {
        return write(status -> storageRepo.save(row));
    }

    public List<AccountUsage> insertAccountUsage(List<AccountUsage> rows) {
        if (rows.isEmpty()) return List.of();
        return write(status -> accountRepo.saveAll(rows));
    }

    public int deleteRawBefore(Instant cutoff) {
        Integer n = write(status -> sampleRepo.deleteOlderThan(cutoff));
        return n == null ? 0 : n;
    }

    /* --------------------- reads --------------------- */

    /** Per-label mean of raw samples with from <= ts < to. */
    public List<LabelAverage> rawAveragesBetween(Instant from, Instant to) {
        return read(status -> sampleRepo.averageByLabel(from, to));
    }

    /** Per-label mean of stored averages of one period, dates inclusive. */
    public List<LabelAverage> aggregateAveragesBetween(AggregatePeriod period, LocalDate from, LocalDate to) {
        return read(status -> aggregateRepo.averageByLabel(period, from, to));
    }

    /** Rows written by the newest rollup of the period. */
    public List<GpuAggregate> latestAggregates(AggregatePeriod period) {
        return read(status -> aggregateRepo.findLatestRollup(period));
    }

    public List<GpuAggregate> aggregatesBetween(AggregatePeriod period, LocalDate from, LocalDate to) {
        return read(status -> aggregateRepo.findByPeriodAndDateBetweenOrderByDateAscLabelAsc(period, from, to));
    }

    /** Rows of the newest accounting collection for the tag. */
    public List<AccountUsage> latestAccountUsage(String periodTag) {
        return read(status -> accountRepo.findLatestCollection(periodTag));
    }

    public StorageAverage storageAverageSince(String mount, LocalDate since) {
        return read(status -> storageRepo.averageSince(mount, since));
    }

    public List<StorageUsage> storageHistorySince(String mount, LocalDate since) {
        return read(status -> storageRepo.findByMountAndDateGreaterThanEqualOrderByDateAsc(mount, since));
    }

    /* --------------------- internals --------------------- */

    private GpuAggregate upsert(LocalDate date, AggregatePeriod period, String label, double average) {
        var row = aggregateRepo.findByDateAndPeriodAndLabel(date, period, label)
                .orElseGet(() -> GpuAggregate.builder().date(date).period(period).label(label).build());
        boolean replacing = row.getId() != null;
        row.setAverageUtilization(average);
        var saved = aggregateRepo.save(row);
        if (replacing) log.debug("[Store] replaced {} {} {} -> {}", period, date, label, average);
        return saved;
    }

    private <T> T write(TransactionCallback<T> work) {
        writeLock.lock();
        try {
            return writeTx.execute(work);
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T read(TransactionCallback<T> work) {
        return readTx.execute(work);
    }
}
