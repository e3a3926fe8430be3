package org.caureq.nodetelemetry.repo;

import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.domain.GpuAggregate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface GpuAggregateRepo extends JpaRepository<GpuAggregate, Long> {
    Optional<GpuAggregate> findByDateAndPeriodAndLabel(LocalDate date, AggregatePeriod period, String label);
    List<GpuAggregate> findByPeriodOrderByDateAscLabelAsc(AggregatePeriod period);
    List<GpuAggregate> findByPeriodAndDateBetweenOrderByDateAscLabelAsc(AggregatePeriod period, LocalDate from, LocalDate to);
    long countByPeriod(AggregatePeriod period);

    /** Mean of the stored averages per label for one period, dates inclusive. */
    @Query("select a.label as label, avg(a.averageUtilization) as average from GpuAggregate a " +
            "where a.period = :period and a.date >= :from and a.date <= :to group by a.label order by a.label")
    List<LabelAverage> averageByLabel(@Param("period") AggregatePeriod period,
                                      @Param("from") LocalDate from, @Param("to") LocalDate to);

    /** Rows of the newest rollup date for the period; labels absent from that rollup are not returned. */
    @Query("select a from GpuAggregate a where a.period = :period and a.date = " +
            "(select max(b.date) from GpuAggregate b where b.period = :period) " +
            "order by a.label")
    List<GpuAggregate> findLatestRollup(@Param("period") AggregatePeriod period);
}
