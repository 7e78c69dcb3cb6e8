package com.inflationdata.ipc.config;

import com.inflationdata.ipc.model.LoadSummary;
import com.inflationdata.ipc.service.InflationLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LoadController {

    private final InflationLoadService loadService;
    private final IpcLoaderProperties properties;

    // ── Load triggers ────────────────────────────────────────────────────────
    // Runs are serialised inside the service; a second trigger waits for the first.

    @PostMapping("/load/incremental")
    public ResponseEntity<Map<String, String>> triggerIncremental() {
        new Thread(loadService::runIncremental, "manual-load-incremental").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "incremental"));
    }

    @PostMapping("/load/from/{date}")
    public ResponseEntity<Map<String, String>> triggerFrom(@PathVariable String date) {
        LocalDate start;
        try {
            start = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be YYYY-MM-DD"));
        }
        new Thread(() -> loadService.runFrom(start), "manual-load-from-" + date).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", start.toString()));
    }

    @GetMapping("/load/last")
    public ResponseEntity<LoadSummary> lastRun() {
        return loadService.lastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/load/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "ipc-loader",
                "version", "1.0.0",
                "dataSource", "datos.gob.ar / INDEC IPC",
                "sources", properties.enabledSources().size(),
                "outputMode", properties.getOutput().getMode().name()
        ));
    }
}
