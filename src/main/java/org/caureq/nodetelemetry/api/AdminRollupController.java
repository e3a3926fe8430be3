package org.caureq.nodetelemetry.api;

import lombok.RequiredArgsConstructor;
import org.caureq.nodetelemetry.api.dto.RollupResultDTO;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.service.AggregationService;
import org.caureq.nodetelemetry.service.metrics.MetricsPublisher;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;

/** On-demand rollups and publish cycles. Guarded by ApiKeyAdminFilter. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminRollupController {
    private final AggregationService aggregation;
    private final MetricsPublisher publisher;
    private final Clock clock;

    /** Safe to repeat: rollups upsert, so a second call rewrites the same rows. */
    @PostMapping("/rollups/{period}")
    public RollupResultDTO rollup(@PathVariable String period,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        var p = AggregatePeriod.parse(period);
        var ref = date == null ? LocalDate.now(clock) : date;
        return new RollupResultDTO(p, ref, aggregation.rollup(p, ref));
    }

    @PostMapping("/publish")
    public ResponseEntity<Void> publish() {
        publisher.publish();
        return ResponseEntity.noContent().build();
    }
}
