package com.inflationdata.ipc.runner;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.LoadSummary;
import com.inflationdata.ipc.output.OutputRouter;
import com.inflationdata.ipc.service.InflationLoadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StartupLoadRunnerTest {

    private InflationLoadService loadService;
    private OutputRouter outputRouter;
    private IpcLoaderProperties properties;
    private StartupLoadRunner runner;

    @BeforeEach
    void setUp() {
        loadService = mock(InflationLoadService.class);
        outputRouter = mock(OutputRouter.class);
        properties = new IpcLoaderProperties();
        runner = new StartupLoadRunner(loadService, outputRouter, properties);
    }

    private static LoadSummary summary(String status) {
        return new LoadSummary("run", status, null, null, 0, 0, 0, 0, 0, 0, null);
    }

    @Test
    void run_shouldLoadIncrementallyByDefault() {
        when(loadService.runIncremental()).thenReturn(summary(LoadSummary.SUCCESS));

        runner.run(new DefaultApplicationArguments());

        verify(outputRouter).ensureSchema();
        verify(loadService).runIncremental();
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void run_shouldReprocessFromStartDateOption() {
        when(loadService.runFrom(LocalDate.of(2024, 1, 1))).thenReturn(summary(LoadSummary.SUCCESS));

        runner.run(new DefaultApplicationArguments("--start-date=2024-01-01"));

        verify(loadService).runFrom(LocalDate.of(2024, 1, 1));
        verify(loadService, never()).runIncremental();
    }

    @Test
    void run_shouldExitNonZeroWhenLoadFails() {
        when(loadService.runIncremental()).thenReturn(summary(LoadSummary.FAILED));

        runner.run(new DefaultApplicationArguments());

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_shouldRejectMalformedStartDate() {
        runner.run(new DefaultApplicationArguments("--start-date=2024/01/01"));

        verify(loadService, never()).runFrom(any());
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_shouldStopWhenSchemaCannotBeCreated() {
        doThrow(new IpcLoadException("database down")).when(outputRouter).ensureSchema();

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(loadService);
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_shouldOnlyPrepareSchemaInServiceMode() {
        properties.getRun().setOnStartup(false);

        runner.run(new DefaultApplicationArguments());

        verify(outputRouter).ensureSchema();
        verifyNoInteractions(loadService);
        assertEquals(0, runner.getExitCode());
    }
}
