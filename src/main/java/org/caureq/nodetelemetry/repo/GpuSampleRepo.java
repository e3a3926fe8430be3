package org.caureq.nodetelemetry.repo;

import org.caureq.nodetelemetry.domain.GpuSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface GpuSampleRepo extends JpaRepository<GpuSample, Long> {
    /** Mean utilization per label over [from, to). */
    @Query("select s.label as label, avg(s.utilizationPercent) as average from GpuSample s " +
            "where s.ts >= :from and s.ts < :to group by s.label order by s.label")
    List<LabelAverage> averageByLabel(@Param("from") Instant from, @Param("to") Instant to);

    @Modifying
    @Query("delete from GpuSample s where s.ts < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
