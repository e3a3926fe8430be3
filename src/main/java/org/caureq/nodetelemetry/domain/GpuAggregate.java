package org.caureq.nodetelemetry.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDate;

@Entity
@Table(name = "gpu_utilization_aggregate",
        uniqueConstraints = @UniqueConstraint(name = "uk_gpu_agg_key", columnNames = {"agg_date", "period", "label"}),
        indexes = @Index(name = "idx_gpu_agg_period_date", columnList = "period, agg_date"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GpuAggregate {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agg_date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private AggregatePeriod period;

    @Column(nullable = false, length = 64)
    private String label;

    @Column(name = "average_utilization", nullable = false)
    private double averageUtilization;
}
