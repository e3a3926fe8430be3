package org.caureq.nodetelemetry.service.metrics;

import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The exported gauge set. Only {@link MetricsPublisher} writes to it.
 *
 * {@link #replace} sets every given label value and removes the label values set by the
 * previous cycle that are missing now, so a vanished GPU or account leaves the scrape.
 */
@Slf4j
@Component
public class TelemetryGauges {
    public static final String WEEKLY_GPU_UTILIZATION = "weekly_gpu_utilization";
    public static final String MONTHLY_GPU_UTILIZATION = "monthly_gpu_utilization";
    public static final String WEEKLY_CPU_HOURS = "weekly_cpu_usage_hours";
    public static final String MONTHLY_CPU_HOURS = "monthly_cpu_usage_hours";
    public static final String WEEKLY_GPU_HOURS = "weekly_gpu_usage_hours";
    public static final String MONTHLY_GPU_HOURS = "monthly_gpu_usage_hours";
    public static final String MONTHLY_STORAGE_GB = "monthly_storage_usage_gb";
    public static final String MONTHLY_STORAGE_PERCENT = "monthly_storage_usage_percent";

    private final Gauge weeklyGpuUtilization;
    private final Gauge monthlyGpuUtilization;
    private final Gauge weeklyCpuHours;
    private final Gauge monthlyCpuHours;
    private final Gauge weeklyGpuHours;
    private final Gauge monthlyGpuHours;
    private final Gauge monthlyStorageGb;
    private final Gauge monthlyStoragePercent;

    private final Map<Gauge, Set<String>> published = new HashMap<>();

    public TelemetryGauges(PrometheusRegistry registry) {
        weeklyGpuUtilization = gauge(registry, WEEKLY_GPU_UTILIZATION, "Weekly average GPU utilization", "account");
        monthlyGpuUtilization = gauge(registry, MONTHLY_GPU_UTILIZATION, "Monthly average GPU utilization", "account");
        weeklyCpuHours = gauge(registry, WEEKLY_CPU_HOURS, "Weekly CPU usage", "account");
        monthlyCpuHours = gauge(registry, MONTHLY_CPU_HOURS, "Monthly CPU usage", "account");
        weeklyGpuHours = gauge(registry, WEEKLY_GPU_HOURS, "Total GPU hours used in the last week per account", "account");
        monthlyGpuHours = gauge(registry, MONTHLY_GPU_HOURS, "Total GPU hours used in the last month per account", "account");
        monthlyStorageGb = gauge(registry, MONTHLY_STORAGE_GB, "Monthly average storage used", "mount");
        monthlyStoragePercent = gauge(registry, MONTHLY_STORAGE_PERCENT, "Monthly average storage percent used", "mount");
    }

    public Gauge weeklyGpuUtilization() { return weeklyGpuUtilization; }
    public Gauge monthlyGpuUtilization() { return monthlyGpuUtilization; }
    public Gauge weeklyCpuHours() { return weeklyCpuHours; }
    public Gauge monthlyCpuHours() { return monthlyCpuHours; }
    public Gauge weeklyGpuHours() { return weeklyGpuHours; }
    public Gauge monthlyGpuHours() { return monthlyGpuHours; }
    public Gauge monthlyStorageGb() { return monthlyStorageGb; }
    public Gauge monthlyStoragePercent() { return monthlyStoragePercent; }

    /** @return number of label values removed as stale */
    public synchronized int replace(Gauge gauge, Map<String, Double> valuesByLabel) {
        valuesByLabel.forEach((label, value) -> gauge.labelValues(label).set(value));
        Set<String> previous = published.getOrDefault(gauge, Set.of());
        int pruned = 0;
        for (String label : previous) {
            if (!valuesByLabel.containsKey(label)) {
                gauge.remove(label);
                log.debug("[Publish] dropped stale label '{}'", label);
                pruned++;
            }
        }
        published.put(gauge, new HashSet<>(valuesByLabel.keySet()));
        return pruned;
    }

    private static Gauge gauge(PrometheusRegistry registry, String name, String help, String label) {
        return Gauge.builder().name(name).help(help).labelNames(label).register(registry);
    }
}
