package org.caureq.nodetelemetry.api.dto;

import org.caureq.nodetelemetry.domain.AggregatePeriod;

import java.time.LocalDate;

public record RollupResultDTO(
        AggregatePeriod period,
        LocalDate referenceDate,
        int rows
) {}
