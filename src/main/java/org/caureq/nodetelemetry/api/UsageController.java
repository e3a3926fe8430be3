package org.caureq.nodetelemetry.api;

import lombok.RequiredArgsConstructor;
import org.caureq.nodetelemetry.api.dto.AccountUsageDTO;
import org.caureq.nodetelemetry.api.dto.GpuAggregateDTO;
import org.caureq.nodetelemetry.api.dto.StorageSummaryDTO;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.service.TelemetryQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * JSON read APIs over the stored rollups, accounting rows and storage history.
 * The scrape endpoint stays the source for dashboards; this is for inspection and debugging.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UsageController {
    private final TelemetryQueryService service;

    /**
     * GPU aggregates of one period.
     *
     * @param period day, week or month
     * @param from optional first date (ISO), requires {@code to}
     * @param to optional last date (ISO), inclusive
     */
    @GetMapping("/gpu/aggregates")
    public List<GpuAggregateDTO> aggregates(
            @RequestParam String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return service.aggregates(AggregatePeriod.parse(period), from, to);
    }

    @GetMapping("/accounts/usage")
    public List<AccountUsageDTO> accounts(@RequestParam(defaultValue = "7days") String period) {
        return service.accountUsage(period);
    }

    @GetMapping("/storage/usage")
    public StorageSummaryDTO storage(@RequestParam(defaultValue = "30") int days) {
        return service.storage(days);
    }
}
