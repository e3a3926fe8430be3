package org.caureq.nodetelemetry.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.repo.LabelAverage;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * GPU rollups along the cadence chain day -> week -> month.
 *
 * - day:   mean of raw samples of one calendar day
 * - week:  mean of the day averages of the trailing 7 days (mean of means)
 * - month: mean of the week averages of the trailing 30 days
 *
 * Results are upserted by (date, period, label), so running a rollup twice for the same
 * window leaves one row with the same value. A store failure makes the run a no-op.
 */
@Slf4j
@Service
public class AggregationService {
    static final int WEEK_WINDOW_DAYS = 7;
    static final int MONTH_WINDOW_DAYS = 30;

    private final TelemetryStore store;
    private final Clock clock;

    public AggregationService(TelemetryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public int rollupDaily() {
        return rollup(AggregatePeriod.DAY, today());
    }

    public int rollupWeekly() {
        return rollup(AggregatePeriod.WEEK, today());
    }

    public int rollupMonthly() {
        return rollup(AggregatePeriod.MONTH, today());
    }

    /**
     * Runs one rollup as if "today" were {@code referenceDate}.
     * The day rollup summarizes the day before the reference date.
     *
     * @return rows written, 0 when there was nothing to summarize or the store failed
     */
    public int rollup(AggregatePeriod period, LocalDate referenceDate) {
        try {
            var written = switch (period) {
                case DAY -> daily(referenceDate.minusDays(1));
                case WEEK -> fromFiner(AggregatePeriod.DAY, AggregatePeriod.WEEK, referenceDate, WEEK_WINDOW_DAYS);
                case MONTH -> fromFiner(AggregatePeriod.WEEK, AggregatePeriod.MONTH, referenceDate, MONTH_WINDOW_DAYS);
            };
            log.info("[Rollup] {} for {}: {} row(s)", period, referenceDate, written);
            return written;
        } catch (DataAccessException e) {
            log.error("[Rollup] {} for {} failed: {}", period, referenceDate, e.getMessage());
            return 0;
        }
    }

    private int daily(LocalDate day) {
        var zone = clock.getZone();
        var from = day.atStartOfDay(zone).toInstant();
        var to = day.plusDays(1).atStartOfDay(zone).toInstant();
        List<LabelAverage> averages = store.rawAveragesBetween(from, to);
        return store.upsertAggregates(day, AggregatePeriod.DAY, averages).size();
    }

    private int fromFiner(AggregatePeriod source, AggregatePeriod target, LocalDate today, int windowDays) {
        List<LabelAverage> averages = store.aggregateAveragesBetween(source, today.minusDays(windowDays), today);
        return store.upsertAggregates(today, target, averages).size();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
