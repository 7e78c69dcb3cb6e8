package com.inflationdata.ipc.service;

import com.inflationdata.ipc.exception.IpcLoadException;
import com.inflationdata.ipc.exception.UnknownClassificationException;
import com.inflationdata.ipc.model.CategoryNames;
import com.inflationdata.ipc.model.Nature;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a (category name, classification) pair to its economic nature.
 *
 * Only the division axis carries a nature; every other category is NONE.
 * The division table is read once at start-up and never changes afterwards.
 */
@Slf4j
public class NatureDeriver {

    private final Map<String, Nature> divisions;

    public NatureDeriver(Map<String, Nature> divisions) {
        this.divisions = Map.copyOf(divisions);
    }

    /**
     * @throws UnknownClassificationException for a division the table does not list
     */
    public Nature derive(String categoryName, String classification) {
        if (!CategoryNames.DIVISION.equals(categoryName)) {
            return Nature.NONE;
        }
        Nature nature = divisions.get(classification);
        if (nature == null) {
            throw new UnknownClassificationException(categoryName, classification);
        }
        return nature;
    }

    public int size() {
        return divisions.size();
    }

    /**
     * Read a {@code classification,nature} CSV with a header row.
     */
    public static NatureDeriver fromCsv(Reader source) {
        try (CSVReader reader = new CSVReader(source)) {
            List<String[]> lines = reader.readAll();
            Map<String, Nature> table = new HashMap<>();

            for (int i = 1; i < lines.size(); i++) {
                String[] line = lines.get(i);
                if (line.length < 2 || line[0].isBlank()) continue;

                String classification = line[0].trim();
                Nature nature = parseNature(line[1].trim(), i + 1);
                if (table.putIfAbsent(classification, nature) != null) {
                    throw new IpcLoadException("Duplicate nature entry for '" + classification + "' at line " + (i + 1));
                }
            }

            log.info("Nature table loaded: {} division classifications", table.size());
            return new NatureDeriver(table);

        } catch (IOException | CsvException e) {
            throw new IpcLoadException("Cannot read nature table", e);
        }
    }

    private static Nature parseNature(String value, int lineNumber) {
        try {
            Nature nature = Nature.valueOf(value);
            if (nature == Nature.NONE) {
                throw new IpcLoadException("Division nature cannot be NONE (line " + lineNumber + ")");
            }
            return nature;
        } catch (IllegalArgumentException e) {
            throw new IpcLoadException("Unknown nature '" + value + "' at line " + lineNumber, e);
        }
    }
}
