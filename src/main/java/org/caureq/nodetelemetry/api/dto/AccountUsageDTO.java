package org.caureq.nodetelemetry.api.dto;

import java.time.OffsetDateTime;

public record AccountUsageDTO(
        String periodTag,
        String account,
        double cpuHours,
        double gpuHours,
        OffsetDateTime collectedAt
) {}
