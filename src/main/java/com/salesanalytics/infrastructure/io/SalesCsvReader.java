package com.salesanalytics.infrastructure.io;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.salesanalytics.domain.exception.SalesDataReadException;
import com.salesanalytics.domain.model.RawSalesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads CSV sales data (header row first) into a {@link RawSalesTable}.
 *
 * Cells are kept as text; typing is the cleaning stage's job. A short row
 * leaves its trailing cells null. A row longer than the header, or a source
 * that cannot be read at all, is fatal.
 */
@Slf4j
@Component
public class SalesCsvReader {

    // written by spreadsheet "CSV UTF-8" exports; String.trim() keeps it
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    public RawSalesTable read(String csvContent) {
        if (csvContent == null || csvContent.isBlank()) {
            throw new SalesDataReadException("Sales data is empty");
        }
        return read(new StringReader(csvContent), "request body");
    }

    public RawSalesTable read(Path file) {
        log.info("Loading data from {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (NoSuchFileException e) {
            log.error("Data file not found: {}", file);
            throw new SalesDataReadException("Data file not found: " + file, e);
        } catch (IOException e) {
            log.error("Error loading data from {}: {}", file, e.getMessage());
            throw new SalesDataReadException("Unable to read sales data from " + file, e);
        }
    }

    private RawSalesTable read(Reader source, String sourceName) {
        try (CSVReader csvReader = new CSVReader(source)) {
            List<String[]> lines = csvReader.readAll();
            if (lines.isEmpty()) {
                throw new SalesDataReadException("No header row in " + sourceName);
            }

            String[] header = lines.get(0);
            if (header.length > 0 && header[0].startsWith(BYTE_ORDER_MARK)) {
                log.debug("Stripping byte order mark from {}", sourceName);
                header[0] = header[0].substring(BYTE_ORDER_MARK.length());
            }

            List<String> columns = new ArrayList<>();
            for (String name : header) {
                columns.add(name.trim());
            }

            List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
            for (int i = 1; i < lines.size(); i++) {
                String[] cells = lines.get(i);
                if (isBlankLine(cells)) {
                    continue;
                }
                if (cells.length > columns.size()) {
                    throw new SalesDataReadException(String.format(
                            "Line %d of %s has %d fields, header has %d", i + 1, sourceName, cells.length, columns.size()));
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    row.put(columns.get(c), c < cells.length ? cells[c] : null);
                }
                rows.add(row);
            }

            log.info("Loaded {} rows and {} columns from {}", rows.size(), columns.size(), sourceName);
            return new RawSalesTable(columns, rows);

        } catch (IOException | CsvException e) {
            log.error("Error parsing sales data from {}: {}", sourceName, e.getMessage());
            throw new SalesDataReadException("Unable to parse sales data from " + sourceName, e);
        }
    }

    private static boolean isBlankLine(String[] cells) {
        return cells.length == 0 || (cells.length == 1 && cells[0].isBlank());
    }
}
