package org.caureq.nodetelemetry.api;

import org.caureq.nodetelemetry.repo.AccountUsageRepo;
import org.caureq.nodetelemetry.repo.GpuAggregateRepo;
import org.caureq.nodetelemetry.repo.StorageUsageRepo;
import org.caureq.nodetelemetry.service.collectors.AccountUsageCollector;
import org.caureq.nodetelemetry.service.metrics.MetricsPublisher;
import org.caureq.nodetelemetry.service.tools.ToolInvoker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ScrapeControllerTest {

    @Autowired MockMvc mvc;
    @Autowired AccountUsageCollector accounting;
    @Autowired MetricsPublisher publisher;
    @Autowired AccountUsageRepo accountRepo;
    @Autowired GpuAggregateRepo aggregateRepo;
    @Autowired StorageUsageRepo storageRepo;

    @MockBean ToolInvoker tools;

    @BeforeEach
    void setUp() {
        accountRepo.deleteAll();
        aggregateRepo.deleteAll();
        storageRepo.deleteAll();
        publisher.publish();
    }

    @Test
    void collectedAccountHoursAppearAfterPublish() throws Exception {
        when(tools.invoke(eq("sreport"), anyList()))
                .thenReturn(List.of("Account CPU_Hours GPU_Hours", "alice 12.5 3"));

        assertEquals(1, accounting.collect("7days"));
        publisher.publish();

        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, startsWith("text/plain")))
                .andExpect(content().string(containsString("weekly_cpu_usage_hours{account=\"alice\"} 12.5\n")))
                .andExpect(content().string(containsString("weekly_gpu_usage_hours{account=\"alice\"} 3.0\n")));
    }

    @Test
    void scrapeServesLastPublishedValuesOnly() throws Exception {
        when(tools.invoke(eq("sreport"), anyList()))
                .thenReturn(List.of("Account CPU_Hours GPU_Hours", "carol 5 0"));
        accounting.collect("30days");

        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(not(containsString("account=\"carol\""))));

        publisher.publish();

        mvc.perform(get("/metrics"))
                .andExpect(content().string(containsString("monthly_cpu_usage_hours{account=\"carol\"} 5.0")));
    }

    @Test
    void emptyStoreExportsNoSeries() throws Exception {
        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(not(containsString("{account="))))
                .andExpect(content().string(not(containsString("{mount="))));
    }
}
