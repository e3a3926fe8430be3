package org.caureq.nodetelemetry.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity
@Table(name = "account_usage", indexes = {
        @Index(name = "idx_account_usage_period", columnList = "period_tag, account, collected_at DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AccountUsage {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_tag", nullable = false, length = 32)
    private String periodTag; // 7days, 30days

    @Column(nullable = false, length = 128)
    private String account;

    @Column(name = "cpu_hours", nullable = false)
    private double cpuHours;

    @Column(name = "gpu_hours", nullable = false)
    private double gpuHours;

    @Column(name = "collected_at", nullable = false)
    private Instant collectedAt;
}
