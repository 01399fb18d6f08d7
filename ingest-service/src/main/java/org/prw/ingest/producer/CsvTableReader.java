package org.prw.ingest.producer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.ByteOrderMark;
import org.apache.commons.io.input.BOMInputStream;
import org.prw.common.exception.DataShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reads a headed CSV table into memory. Header names are matched case-insensitively and
 * cell values are trimmed.
 */
public class CsvTableReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreHeaderCase(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    /**
     * A parsed table. {@code headerNames} keeps the file's column order and spelling.
     */
    public record Table(String dataset, Path file, List<String> headerNames, List<CSVRecord> records) {}

    /**
     * Columns a dataset must declare in its header.
     */
    public record Requirement(String dataset, Path file, List<String> columns) {}

    /**
     * Checks every requirement before failing, so the exception lists all gaps at once.
     *
     * @throws DataShapeException if any dataset lacks a required column
     */
    public static void requireColumns(List<Requirement> requirements) throws DataShapeException, IOException {
        Map<String, List<String>> missing = new TreeMap<>();
        for (Requirement requirement : requirements) {
            Set<String> present = readHeader(requirement.file()).stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
            List<String> absent = requirement.columns().stream()
                .filter(column -> !present.contains(column.toLowerCase(Locale.ROOT)))
                .toList();
            if (!absent.isEmpty()) {
                log.error("Dataset {} ({}) is missing columns {}", requirement.dataset(), requirement.file(), absent);
                missing.put(requirement.dataset(), absent);
            }
        }
        if (!missing.isEmpty()) {
            throw new DataShapeException(missing);
        }
    }

    /**
     * Opens a UTF-8 text file, dropping a leading byte order mark if the file has one.
     */
    public static BufferedReader openReader(Path file) throws IOException {
        BOMInputStream in = BOMInputStream.builder()
            .setInputStream(Files.newInputStream(file))
            .setByteOrderMarks(ByteOrderMark.UTF_8)
            .get();
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static List<String> readHeader(Path file) throws IOException {
        try (BufferedReader reader = openReader(file);
             CSVParser parser = FORMAT.parse(reader)) {
            return parser.getHeaderNames();
        }
    }

    public static Table read(String dataset, Path file) throws IOException {
        try (BufferedReader reader = openReader(file);
             CSVParser parser = FORMAT.parse(reader)) {
            List<CSVRecord> records = new ArrayList<>();
            for (CSVRecord record : parser) {
                records.add(record);
            }
            log.info("Read {} rows from {} ({})", records.size(), file, dataset);
            return new Table(dataset, file, Collections.unmodifiableList(parser.getHeaderNames()), records);
        }
    }

    /**
     * @return the trimmed value, or null when the column is absent, short or blank
     */
    public static String value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return null;
        }
        String value = record.get(column);
        return value == null || value.isBlank() ? null : value;
    }
}
