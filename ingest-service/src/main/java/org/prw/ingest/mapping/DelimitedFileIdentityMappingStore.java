package org.prw.ingest.mapping;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.prw.data.identity.IdentityMapping;
import org.prw.ingest.producer.CsvTableReader;
import org.prw.ingest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identity mapping kept in a CSV file with header {@code source_id,pseudonymous_id}.
 * <p>
 * A missing or empty file is an empty store. Appends rewrite the whole file into a sibling temp file
 * and move it over the original, so a crash mid-append leaves the previous file intact.
 * This class does no locking; see {@link IdentityResolutionService}.
 */
public class DelimitedFileIdentityMappingStore implements IdentityMappingStore {
    private static final Logger log = LoggerFactory.getLogger(DelimitedFileIdentityMappingStore.class);

    public static final String SOURCE_ID_COLUMN = "source_id";
    public static final String PSEUDONYMOUS_ID_COLUMN = "pseudonymous_id";

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .build();

    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(SOURCE_ID_COLUMN, PSEUDONYMOUS_ID_COLUMN)
        .build();

    private final Path storeFile;

    public DelimitedFileIdentityMappingStore(Path storeFile) {
        this.storeFile = storeFile;
    }

    public Path getStoreFile() {
        return storeFile;
    }

    @Override
    public Map<String, String> load() throws IOException {
        if (!Files.exists(storeFile) || Files.size(storeFile) == 0) {
            log.info("Identity store {} does not exist yet, starting empty", storeFile);
            return new HashMap<>();
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> pseudonymousIds = new HashSet<>();

        try (BufferedReader reader = CsvTableReader.openReader(storeFile);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            if (!parser.getHeaderMap().containsKey(SOURCE_ID_COLUMN)
                || !parser.getHeaderMap().containsKey(PSEUDONYMOUS_ID_COLUMN)) {
                throw new IOException(String.format(
                    "Identity store %s must have columns %s,%s. Found: %s",
                    storeFile, SOURCE_ID_COLUMN, PSEUDONYMOUS_ID_COLUMN, parser.getHeaderNames()));
            }

            for (CSVRecord record : parser) {
                String sourceId = record.get(SOURCE_ID_COLUMN);
                String pseudonymousId = record.get(PSEUDONYMOUS_ID_COLUMN);
                if (sourceId.isEmpty() || pseudonymousId.isEmpty()) {
                    throw new IOException("Identity store " + storeFile + " has an empty value at record "
                        + record.getRecordNumber());
                }
                // Source ids are PHI, report the record number only
                if (mapping.putIfAbsent(sourceId, pseudonymousId) != null) {
                    throw new IOException("Identity store " + storeFile + " repeats a source id at record "
                        + record.getRecordNumber());
                }
                if (!pseudonymousIds.add(pseudonymousId)) {
                    throw new IOException("Identity store " + storeFile + " repeats pseudonymous id "
                        + pseudonymousId + " at record " + record.getRecordNumber());
                }
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Failed to parse identity store " + storeFile + ": " + e.getMessage(), e);
        }

        log.info("Loaded {} identity mappings from {}", mapping.size(), storeFile);
        return mapping;
    }

    @Override
    public void append(List<IdentityMapping> rows) throws IOException {
        if (rows.isEmpty()) {
            log.info("No new identity mappings to append");
            return;
        }
        boolean exists = Files.exists(storeFile) && Files.size(storeFile) > 0;
        AtomicFiles.replace(storeFile, writer -> {
            if (exists) {
                String current = Files.readString(storeFile, StandardCharsets.UTF_8);
                writer.write(current);
                if (!current.isEmpty() && !current.endsWith("\n")) {
                    writer.write(WRITE_FORMAT.getRecordSeparator());
                }
            }
            CSVFormat format = exists ? WRITE_FORMAT.builder().setSkipHeaderRecord(true).build() : WRITE_FORMAT;
            CSVPrinter printer = new CSVPrinter(writer, format);
            for (IdentityMapping row : rows) {
                printer.printRecord(row.sourceId(), row.pseudonymousId());
            }
            printer.flush();
        });
        log.info("Appended {} identity mappings to {}", rows.size(), storeFile);
    }
}
