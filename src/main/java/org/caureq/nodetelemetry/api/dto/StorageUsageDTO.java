package org.caureq.nodetelemetry.api.dto;

import java.time.LocalDate;

public record StorageUsageDTO(
        LocalDate date,
        double usageGb,
        double usagePercent
) {}
