package org.caureq.nodetelemetry.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class StatusControllerTest {

    @Autowired MockMvc mvc;

    @Test
    void listsConfiguredTasksWithoutGpuOrRetention() throws Exception {
        mvc.perform(get("/api/status/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(7)))
                .andExpect(jsonPath("$[*].name").value(hasItems(
                        "storage-usage", "accounting-7days", "accounting-30days",
                        "rollup-daily", "rollup-weekly", "rollup-monthly", "publish")));
    }

    @Test
    void tasksThatNeverRanReportIdle() throws Exception {
        mvc.perform(get("/api/status/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("IDLE"))
                .andExpect(jsonPath("$[0].lastOutcome").value("NEVER_RUN"))
                .andExpect(jsonPath("$[0].runs").value(0));
    }
}
