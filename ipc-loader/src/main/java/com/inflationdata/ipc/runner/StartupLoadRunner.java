package com.inflationdata.ipc.runner;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.model.LoadSummary;
import com.inflationdata.ipc.output.OutputRouter;
import com.inflationdata.ipc.service.InflationLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * On application startup:
 *  1. Always ensure the database schema exists
 *  2. If ipc-loader.run.on-startup=true, run one load:
 *     incremental by default, or from --start-date=YYYY-MM-DD
 *
 * The outcome becomes the process exit code (0 success, 1 failure).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupLoadRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String START_DATE_OPTION = "start-date";

    private final InflationLoadService loadService;
    private final OutputRouter outputRouter;
    private final IpcLoaderProperties properties;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        try {
            outputRouter.ensureSchema();
        } catch (Exception e) {
            log.error("Could not initialise the inflation schema: {}", e.getMessage(), e);
            exitCode = 1;
            return;
        }

        if (!properties.getRun().isOnStartup()) {
            log.info("Loader ready. Trigger runs with POST /load/incremental or POST /load/from/{date}");
            return;
        }

        List<String> startDates = args.getOptionValues(START_DATE_OPTION);
        LoadSummary summary;

        if (startDates == null || startDates.isEmpty()) {
            log.info("Running incremental load on startup");
            summary = loadService.runIncremental();
        } else {
            LocalDate start;
            try {
                start = LocalDate.parse(startDates.get(0));
            } catch (DateTimeParseException e) {
                log.error("--{} must be YYYY-MM-DD, got '{}'", START_DATE_OPTION, startDates.get(0));
                exitCode = 1;
                return;
            }
            log.info("Reprocessing from {} on startup", start);
            summary = loadService.runFrom(start);
        }

        exitCode = summary.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
