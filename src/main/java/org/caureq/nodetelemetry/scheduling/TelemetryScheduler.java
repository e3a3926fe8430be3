package org.caureq.nodetelemetry.scheduling;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.service.AggregationService;
import org.caureq.nodetelemetry.service.RetentionService;
import org.caureq.nodetelemetry.service.collectors.AccountUsageCollector;
import org.caureq.nodetelemetry.service.collectors.GpuUtilizationCollector;
import org.caureq.nodetelemetry.service.collectors.StorageUsageCollector;
import org.caureq.nodetelemetry.service.metrics.MetricsPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives collectors, rollups and the publisher, each on its own fixed delay.
 *
 * <p>Every task gets its own pool thread, runs once right after startup and then waits its interval
 * after each run finishes (a slow run pushes the next one back). On shutdown future runs are
 * cancelled and running ones get {@code telemetry.scheduler.shutdown-grace} to finish their
 * store transaction before the remaining threads are interrupted.
 */
@Slf4j
@Component
public class TelemetryScheduler {
    private final List<PeriodicTask> tasks;
    private final TelemetryProps.SchedulerProps props;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private ThreadPoolTaskScheduler executor;

    public TelemetryScheduler(GpuUtilizationCollector gpu, AccountUsageCollector accounting,
                              StorageUsageCollector storage, AggregationService aggregation,
                              MetricsPublisher publisher, RetentionService retention,
                              TelemetryProps props, Clock clock) {
        this.props = props.scheduler();
        this.tasks = buildTasks(gpu, accounting, storage, aggregation, publisher, retention, props, clock);
    }

    static List<PeriodicTask> buildTasks(GpuUtilizationCollector gpu, AccountUsageCollector accounting,
                                         StorageUsageCollector storage, AggregationService aggregation,
                                         MetricsPublisher publisher, RetentionService retention,
                                         TelemetryProps props, Clock clock) {
        var acc = props.accounting();
        var rollup = props.rollup();
        List<PeriodicTask> list = new ArrayList<>();
        if (gpu.isEnabled()) {
            list.add(new PeriodicTask("gpu-sample", props.gpu().interval(), gpu::sample, clock));
        }
        list.add(new PeriodicTask("storage-usage", props.storage().interval(), storage::collect, clock));
        list.add(new PeriodicTask("accounting-" + acc.weeklyPeriod(), acc.weeklyInterval(),
                () -> accounting.collect(acc.weeklyPeriod()), clock));
        list.add(new PeriodicTask("accounting-" + acc.monthlyPeriod(), acc.monthlyInterval(),
                () -> accounting.collect(acc.monthlyPeriod()), clock));
        list.add(new PeriodicTask("rollup-daily", rollup.dailyInterval(), aggregation::rollupDaily, clock));
        list.add(new PeriodicTask("rollup-weekly", rollup.weeklyInterval(), aggregation::rollupWeekly, clock));
        list.add(new PeriodicTask("rollup-monthly", rollup.monthlyInterval(), aggregation::rollupMonthly, clock));
        list.add(new PeriodicTask("publish", props.publish().interval(), publisher::publish, clock));
        if (retention.isEnabled()) {
            list.add(new PeriodicTask("retention", props.retention().interval(), retention::pruneRawSamples, clock));
        }
        return List.copyOf(list);
    }

    @PostConstruct
    public synchronized void start() {
        if (!props.enabled()) {
            log.info("[Scheduler] disabled, {} task(s) not started", tasks.size());
            return;
        }
        executor = new ThreadPoolTaskScheduler();
        executor.setPoolSize(tasks.size());
        executor.setThreadNamePrefix("telemetry-");
        executor.setDaemon(true);
        executor.setRemoveOnCancelPolicy(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(grace().toMillis());
        executor.initialize();
        for (var task : tasks) {
            futures.add(executor.scheduleWithFixedDelay(task, executor.getClock().instant(), task.interval()));
            log.info("[Scheduler] {} every {}", task.name(), task.interval());
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (executor == null) return;
        futures.forEach(f -> f.cancel(false));
        executor.shutdown();
        var pool = executor.getScheduledThreadPoolExecutor();
        if (!pool.isTerminated()) {
            log.warn("[Scheduler] tasks still running after {}, interrupting", grace());
            pool.shutdownNow();
        }
        executor = null;
        futures.clear();
        log.info("[Scheduler] Shut down");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.getScheduledThreadPoolExecutor().isShutdown();
    }

    public List<PeriodicTask.Status> status() {
        return tasks.stream().map(PeriodicTask::status).toList();
    }

    List<PeriodicTask> tasks() {
        return tasks;
    }

    private Duration grace() {
        return props.shutdownGrace() == null ? Duration.ofSeconds(30) : props.shutdownGrace();
    }
}
