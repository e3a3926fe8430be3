package org.caureq.nodetelemetry.api;

import lombok.RequiredArgsConstructor;
import org.caureq.nodetelemetry.scheduling.PeriodicTask;
import org.caureq.nodetelemetry.scheduling.TelemetryScheduler;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Read-only view of the periodic tasks (state, last run, last outcome). */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {
    private final TelemetryScheduler scheduler;

    @GetMapping("/tasks")
    public List<PeriodicTask.Status> tasks() { return scheduler.status(); }
}
