package org.caureq.nodetelemetry.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * All tunables of the agent, bound from {@code telemetry.*}.
 * Defaults live in application.properties; every nested record is required there.
 */
@Validated
@ConfigurationProperties(prefix = "telemetry")
public record TelemetryProps(String zone,
                             @NotNull @Valid ToolsProps tools,
                             @NotNull @Valid GpuProps gpu,
                             @NotNull @Valid AccountingProps accounting,
                             @NotNull @Valid StorageProps storage,
                             @NotNull @Valid RollupProps rollup,
                             @NotNull @Valid PublishProps publish,
                             TextfileProps textfile,
                             @NotNull @Valid RetentionProps retention,
                             @NotNull @Valid SchedulerProps scheduler) {

    /** Timeout applied to every external tool invocation */
    public record ToolsProps(Duration timeout) {}

    /** GPU sampling; when enabled the query tool is probed once at startup */
    public record GpuProps(boolean enabled, @NotBlank String tool, @NotNull Duration interval) {}

    /** Workload accounting. {@code {period}} in args is replaced with the period tag. */
    public record AccountingProps(@NotBlank String tool, List<String> args,
                                  @NotBlank String weeklyPeriod, @NotBlank String monthlyPeriod,
                                  @NotNull Duration weeklyInterval, @NotNull Duration monthlyInterval) {}

    public record StorageProps(@NotBlank String tool, @NotBlank String mount, @NotNull Duration interval) {}

    public record RollupProps(@NotNull Duration dailyInterval, @NotNull Duration weeklyInterval,
                              @NotNull Duration monthlyInterval) {}

    public record PublishProps(@NotNull Duration interval) {}

    /** Optional node-exporter textfile target; blank disables the export */
    public record TextfileProps(String path) {}

    /** Raw sample pruning; rawDays <= 0 keeps everything */
    public record RetentionProps(int rawDays, Duration interval) {}

    public record SchedulerProps(boolean enabled, Duration shutdownGrace) {}

    public ZoneId zoneId() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone);
    }
}
