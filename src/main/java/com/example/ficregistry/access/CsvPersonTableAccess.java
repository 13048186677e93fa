package com.example.ficregistry.access;

import com.example.ficregistry.service.PersonRegistryException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

/**
 * Person table stored as a UTF-8 CSV file whose first record is the header row. Headers
 * are read positionally so duplicated or blank header cells do not break parsing.
 */
@Slf4j
public class CsvPersonTableAccess implements PersonTableAccess {

    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private final Path path;

    public CsvPersonTableAccess(Path path) {
        this.path = path;
    }

    @Override
    public PersonTable read() {
        if (!Files.isRegularFile(path)) {
            throw PersonRegistryException.sourceNotFound(location());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.isEmpty()) {
                throw new IllegalStateException("missing header row");
            }
            List<String> headers = new ArrayList<>(records.get(0).toList());
            if (!headers.isEmpty() && !headers.get(0).isEmpty() && headers.get(0).charAt(0) == BOM) {
                headers.set(0, headers.get(0).substring(1));
            }
            List<List<String>> rows = new ArrayList<>(records.size() - 1);
            for (CSVRecord record : records.subList(1, records.size())) {
                rows.add(record.toList());
            }
            log.debug("Read {} rows from {}", rows.size(), location());
            return new PersonTable(headers, rows);
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException ex) {
            throw PersonRegistryException.sourceUnreadable(location(), ex);
        }
    }

    @Override
    public void write(PersonTable table) {
        Path absolute = path.toAbsolutePath();
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
                printer.printRecord(table.headers());
                for (List<String> row : table.rows()) {
                    printer.printRecord(row);
                }
            }
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write person table " + location(), ex);
        }
    }

    @Override
    public String location() {
        return path.toString();
    }
}
