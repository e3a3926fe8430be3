package org.caureq.nodetelemetry.api;

import org.caureq.nodetelemetry.domain.AccountUsage;
import org.caureq.nodetelemetry.domain.AggregatePeriod;
import org.caureq.nodetelemetry.domain.StorageUsage;
import org.caureq.nodetelemetry.repo.AccountUsageRepo;
import org.caureq.nodetelemetry.repo.GpuAggregateRepo;
import org.caureq.nodetelemetry.repo.StorageUsageRepo;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class UsageControllerTest {

    @Autowired MockMvc mvc;
    @Autowired TelemetryStore store;
    @Autowired Clock clock;
    @Autowired GpuAggregateRepo aggregateRepo;
    @Autowired AccountUsageRepo accountRepo;
    @Autowired StorageUsageRepo storageRepo;

    private LocalDate today;

    @BeforeEach
    void setUp() {
        aggregateRepo.deleteAll();
        accountRepo.deleteAll();
        storageRepo.deleteAll();
        today = LocalDate.now(clock);
    }

    @Test
    void latestWeeklyAggregatePerLabel() throws Exception {
        store.upsertAggregate(today.minusDays(7), AggregatePeriod.WEEK, "gpu0", 10.0);
        store.upsertAggregate(today, AggregatePeriod.WEEK, "gpu0", 40.0);

        mvc.perform(get("/api/gpu/aggregates").param("period", "week"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].label").value("gpu0"))
                .andExpect(jsonPath("$[0].period").value("WEEK"))
                .andExpect(jsonPath("$[0].averageUtilization").value(40.0))
                .andExpect(jsonPath("$[0].date").value(today.toString()));
    }

    @Test
    void aggregateRangeIsInclusive() throws Exception {
        store.upsertAggregate(today.minusDays(2), AggregatePeriod.DAY, "gpu0", 1.0);
        store.upsertAggregate(today.minusDays(1), AggregatePeriod.DAY, "gpu0", 2.0);
        store.upsertAggregate(today, AggregatePeriod.DAY, "gpu0", 3.0);

        mvc.perform(get("/api/gpu/aggregates")
                        .param("period", "day")
                        .param("from", today.minusDays(1).toString())
                        .param("to", today.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].averageUtilization").value(2.0));
    }

    @Test
    void unknownPeriodIsBadRequest() throws Exception {
        mvc.perform(get("/api/gpu/aggregates").param("period", "fortnight"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void halfOpenRangeIsBadRequest() throws Exception {
        mvc.perform(get("/api/gpu/aggregates").param("period", "day").param("from", today.toString()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedDateIsBadRequest() throws Exception {
        mvc.perform(get("/api/gpu/aggregates").param("period", "day").param("from", "yesterday").param("to", "today"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void accountUsageShowsLatestCollection() throws Exception {
        var earlier = Instant.now().minusSeconds(86_400);
        var later = Instant.now();
        store.insertAccountUsage(List.of(account("7days", "alice", 1.0, earlier)));
        store.insertAccountUsage(List.of(account("7days", "alice", 12.5, later)));

        mvc.perform(get("/api/accounts/usage").param("period", "7days"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].account").value("alice"))
                .andExpect(jsonPath("$[0].cpuHours").value(12.5));
    }

    @Test
    void unknownAccountingPeriodIsBadRequest() throws Exception {
        mvc.perform(get("/api/accounts/usage").param("period", "90days"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void storageSummaryAveragesWindow() throws Exception {
        store.insertStorageUsage(storage(today.minusDays(1), 100.0, 50.0));
        store.insertStorageUsage(storage(today, 300.0, 70.0));

        mvc.perform(get("/api/storage/usage").param("days", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mount").value("/rs01"))
                .andExpect(jsonPath("$.points").value(2))
                .andExpect(jsonPath("$.usageGbAvg").value(200.0))
                .andExpect(jsonPath("$.usagePercentAvg").value(60.0))
                .andExpect(jsonPath("$.history", hasSize(2)));
    }

    @Test
    void storageSummaryWithoutRowsHasNoAverage() throws Exception {
        mvc.perform(get("/api/storage/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points").value(0))
                .andExpect(jsonPath("$.usageGbAvg").value(nullValue()));
    }

    private static AccountUsage account(String tag, String name, double cpu, Instant at) {
        return AccountUsage.builder().periodTag(tag).account(name).cpuHours(cpu).gpuHours(0).collectedAt(at).build();
    }

    private static StorageUsage storage(LocalDate date, double gb, double pct) {
        return StorageUsage.builder().date(date).mount("/rs01").usageGb(gb).usagePercent(pct).build();
    }
}
