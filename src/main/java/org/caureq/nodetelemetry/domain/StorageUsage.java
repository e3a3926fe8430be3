package org.caureq.nodetelemetry.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDate;

@Entity
@Table(name = "storage_usage", indexes = {
        @Index(name = "idx_storage_mount_date", columnList = "mount, usage_date")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StorageUsage {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "usage_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 256)
    private String mount;

    @Column(name = "usage_gb", nullable = false)
    private double usageGb;

    @Column(name = "usage_percent", nullable = false)
    private double usagePercent;
}
