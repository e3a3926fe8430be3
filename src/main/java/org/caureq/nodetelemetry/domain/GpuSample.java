package org.caureq.nodetelemetry.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity
@Table(name = "gpu_utilization_raw", indexes = {
        @Index(name = "idx_gpu_raw_ts", columnList = "ts")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GpuSample {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant ts;

    @Column(nullable = false, length = 64)
    private String label; // gpu0, gpu1...

    @Column(name = "utilization_percent", nullable = false)
    private double utilizationPercent;
}
