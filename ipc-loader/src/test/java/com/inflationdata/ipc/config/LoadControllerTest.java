package com.inflationdata.ipc.config;

import com.inflationdata.ipc.model.LoadSummary;
import com.inflationdata.ipc.service.InflationLoadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.Optional;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LoadControllerTest {

    private InflationLoadService loadService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        loadService = mock(InflationLoadService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new LoadController(loadService, new IpcLoaderProperties())).build();
    }

    @Test
    void triggerIncremental_shouldAcceptAndRunInBackground() throws Exception {
        mockMvc.perform(post("/load/incremental"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("incremental"));

        verify(loadService, timeout(2000)).runIncremental();
    }

    @Test
    void triggerFrom_shouldRunFromGivenDate() throws Exception {
        mockMvc.perform(post("/load/from/2024-01-01"))
                .andExpect(status().isAccepted());

        verify(loadService, timeout(2000)).runFrom(LocalDate.of(2024, 1, 1));
    }

    @Test
    void triggerFrom_shouldRejectMalformedDate() throws Exception {
        mockMvc.perform(post("/load/from/january"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void lastRun_shouldBeEmptyBeforeAnyRun() throws Exception {
        when(loadService.lastSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/load/last"))
                .andExpect(status().isNoContent());
    }

    @Test
    void lastRun_shouldReturnLatestSummary() throws Exception {
        when(loadService.lastSummary()).thenReturn(Optional.of(
                new LoadSummary("r1", LoadSummary.SUCCESS, null, null, 3, 1, 0, 0, 2, 0, null)));

        mockMvc.perform(get("/load/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.rowsInserted").value(3));
    }

    @Test
    void status_shouldReportOutputMode() throws Exception {
        mockMvc.perform(get("/load/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputMode").value("DATABASE"))
                .andExpect(jsonPath("$.sources").value(0));
    }
}
