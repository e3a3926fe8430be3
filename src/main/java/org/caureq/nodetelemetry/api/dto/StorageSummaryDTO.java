package org.caureq.nodetelemetry.api.dto;

import java.time.LocalDate;
import java.util.List;

public record StorageSummaryDTO(
        String mount,
        LocalDate since,
        Double usageGbAvg,       // null when no data in the window
        Double usagePercentAvg,
        Integer points,
        List<StorageUsageDTO> history
) {}
