package org.prw.ingest.writer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.prw.ingest.producer.CsvTableReader;
import org.prw.ingest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Copies a source batch with its source id column swapped for {@code prw_id}, in the same
 * position. Rows without an assignment (blank source id) are dropped; the caller records them.
 */
public class PseudonymizedCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(PseudonymizedCsvWriter.class);

    public static final String PRW_ID_COLUMN = "prw_id";

    /**
     * @param assignments source id to pseudonymous id, from the committed resolution
     * @return rows written
     */
    public long write(CsvTableReader.Table source, String sourceIdColumn, Map<String, String> assignments,
                      Path target) throws IOException {
        List<String> header = new ArrayList<>(source.headerNames());
        int sourceIndex = -1;
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equalsIgnoreCase(sourceIdColumn)) {
                sourceIndex = i;
            } else if (header.get(i).equalsIgnoreCase(PRW_ID_COLUMN)) {
                throw new IOException("Source batch " + source.file() + " already has a " + PRW_ID_COLUMN + " column");
            }
        }
        if (sourceIndex < 0) {
            throw new IOException("Source batch " + source.file() + " has no column " + sourceIdColumn);
        }
        header.set(sourceIndex, PRW_ID_COLUMN);

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(new String[0]))
            .build();
        int idIndex = sourceIndex;
        long[] written = {0};

        AtomicFiles.replace(target, writer -> {
            CSVPrinter printer = new CSVPrinter(writer, format);
            List<String> row = new ArrayList<>(header.size());
            for (CSVRecord record : source.records()) {
                String prwId = idIndex < record.size() ? assignments.get(record.get(idIndex)) : null;
                if (prwId == null) {
                    continue;
                }
                row.clear();
                for (int i = 0; i < header.size(); i++) {
                    if (i == idIndex) {
                        row.add(prwId);
                    } else {
                        row.add(i < record.size() ? record.get(i) : "");
                    }
                }
                printer.printRecord(row);
                written[0]++;
            }
            printer.flush();
        });

        log.info("Wrote {} pseudonymized rows to {}", written[0], target);
        return written[0];
    }
}
