package com.inflationdata.ipc.service;

import com.inflationdata.ipc.config.IpcLoaderProperties;
import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.model.WideTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

/**
 * Downloads one wide IPC table from datos.gob.ar.
 *
 * Timeouts come from the RestTemplate; transient HTTP and I/O failures are retried
 * by Resilience4j (instance "ipcSource"). A body that is empty or has no data rows
 * is a structural failure and is not retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IpcSourceClient {

    private final RestTemplate restTemplate;

    @Retry(name = "ipcSource")
    public WideTable fetch(IpcLoaderProperties.Source source) {
        log.info("Downloading {} from {}", source.getName(), source.getUrl());

        String body = restTemplate.getForObject(source.getUrl(), String.class);
        if (body == null || body.isBlank()) {
            throw new IpcLoadException("Empty response from source " + source.getName());
        }

        WideTable table = parse(source.getName(), body);
        log.info("Downloaded {}: {} rows, {} columns", source.getName(), table.rows().size(), table.columnCount());
        return table;
    }

    WideTable parse(String sourceName, String body) {
        // datos.gob.ar serves UTF-8 with BOM
        String content = body.startsWith("\uFEFF") ? body.substring(1) : body;

        try (CSVReader reader = new CSVReader(new StringReader(content))) {
            List<String[]> lines = reader.readAll();
            if (lines.isEmpty()) {
                throw new IpcLoadException("No header in source " + sourceName);
            }

            List<String> header = Arrays.stream(lines.get(0)).map(String::trim).toList();
            List<String[]> rows = lines.subList(1, lines.size()).stream()
                    .filter(row -> !(row.length == 1 && row[0].isBlank()))
                    .toList();

            if (header.size() < 2) {
                throw new IpcLoadException("Source " + sourceName + " has no value columns");
            }
            if (rows.isEmpty()) {
                throw new IpcLoadException("Source " + sourceName + " returned a header without data rows");
            }
            return new WideTable(sourceName, header, rows);

        } catch (IOException | CsvException e) {
            throw new IpcLoadException("Unreadable CSV from source " + sourceName, e);
        }
    }
}
