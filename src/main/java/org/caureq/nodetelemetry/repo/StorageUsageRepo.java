package org.caureq.nodetelemetry.repo;

import org.caureq.nodetelemetry.domain.StorageUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface StorageUsageRepo extends JpaRepository<StorageUsage, Long> {
    List<StorageUsage> findByMountAndDateGreaterThanEqualOrderByDateAsc(String mount, LocalDate since);

    @Query("select avg(s.usageGb) as usageGb, avg(s.usagePercent) as usagePercent, count(s) as samples " +
            "from StorageUsage s where s.mount = :mount and s.date >= :since")
    StorageAverage averageSince(@Param("mount") String mount, @Param("since") LocalDate since);
}
