package org.prw.ingest.job;

import org.apache.commons.csv.CSVRecord;
import org.prw.ingest.failure.FailureReason;
import org.prw.ingest.failure.FailureRecord;
import org.prw.ingest.failure.FailureSink;
import org.prw.ingest.mapping.IdentityResolutionService;
import org.prw.ingest.producer.CsvTableReader;
import org.prw.ingest.writer.PseudonymizedCsvWriter;
import org.prw.processing.identity.PseudonymousIdResolver.BatchResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns pseudonymous ids to a source batch.
 * <p>
 * New mappings are committed to the identity store before the pseudonymized copy of the batch
 * is written, so no output ever references an id the store does not hold.
 */
public class IdentityResolutionJob {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionJob.class);

    public static final String DATASET = "identity_mapping";

    private final Path sourceFile;
    private final String sourceIdColumn;
    private final Path pseudonymizedFile;
    private final IdentityResolutionService resolutionService;
    private final PseudonymizedCsvWriter pseudonymizedWriter = new PseudonymizedCsvWriter();

    /**
     * @param pseudonymizedFile where to write the pseudonymized batch, or null to skip it
     */
    public IdentityResolutionJob(Path sourceFile, String sourceIdColumn, Path pseudonymizedFile,
                                 IdentityResolutionService resolutionService) {
        this.sourceFile = sourceFile;
        this.sourceIdColumn = sourceIdColumn;
        this.pseudonymizedFile = pseudonymizedFile;
        this.resolutionService = resolutionService;
    }

    public List<CsvTableReader.Requirement> requirements() {
        return List.of(new CsvTableReader.Requirement(DATASET, sourceFile, List.of(sourceIdColumn)));
    }

    /**
     * Maps a requirement on the pseudonymized batch onto the source batch, whose header the
     * pseudonymized copy keeps apart from the id column renamed to {@code prw_id}.
     */
    public CsvTableReader.Requirement pseudonymizedRequirement(CsvTableReader.Requirement requirement) {
        List<String> columns = requirement.columns().stream()
            .filter(column -> !column.equalsIgnoreCase(PseudonymizedCsvWriter.PRW_ID_COLUMN))
            .toList();
        return new CsvTableReader.Requirement(requirement.dataset(), sourceFile, columns);
    }

    public Map<String, Long> run(String runId, FailureSink failureSink) throws IOException {
        log.info("Resolving identities in {} (column {})", sourceFile, sourceIdColumn);
        CsvTableReader.Table table = CsvTableReader.read(DATASET, sourceFile);

        List<String> sourceIds = new ArrayList<>(table.records().size());
        for (CSVRecord record : table.records()) {
            sourceIds.add(CsvTableReader.value(record, sourceIdColumn));
        }

        BatchResolution resolution = resolutionService.resolveAndCommit(sourceIds);

        for (int position : resolution.rejectedPositions()) {
            CSVRecord record = table.records().get(position);
            failureSink.recordFailure(new FailureRecord(runId, DATASET, sourceFile.toString(),
                record.getRecordNumber(), null, sourceIdColumn, null, FailureReason.MISSING_SOURCE_ID, null));
        }

        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("rows", (long) sourceIds.size());
        counts.put("distinctSourceIds", (long) resolution.assignments().size());
        counts.put("newMappings", (long) resolution.newMappings().size());
        counts.put("reused", (long) resolution.reusedCount());
        counts.put("collisions", (long) resolution.collisionCount());
        counts.put("rejected", (long) resolution.rejectedPositions().size());

        if (pseudonymizedFile != null) {
            long written = pseudonymizedWriter.write(table, sourceIdColumn, resolution.assignments(), pseudonymizedFile);
            counts.put("pseudonymizedRows", written);
        }

        log.info("Identity resolution complete: {}", counts);
        return counts;
    }
}
