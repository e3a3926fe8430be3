package org.caureq.nodetelemetry.api.dto;

import org.caureq.nodetelemetry.domain.AggregatePeriod;

import java.time.LocalDate;

public record GpuAggregateDTO(
        LocalDate date,
        AggregatePeriod period,
        String label,          // gpu0, gpu1...
        double averageUtilization
) {}
