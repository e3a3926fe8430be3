package org.caureq.nodetelemetry.repo;

import org.caureq.nodetelemetry.domain.AccountUsage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface AccountUsageRepo extends JpaRepository<AccountUsage, Long> {
    /** Rows of the newest collection for a period tag; one collection shares its collectedAt. */
    @Query("select u from AccountUsage u where u.periodTag = :tag and u.collectedAt = " +
            "(select max(v.collectedAt) from AccountUsage v where v.periodTag = :tag) " +
            "order by u.account")
    List<AccountUsage> findLatestCollection(@Param("tag") String periodTag);
}
