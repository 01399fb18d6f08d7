package org.prw.ingest.producer;

import org.apache.commons.csv.CSVRecord;
import org.prw.data.patient.Encounter;
import org.prw.ingest.failure.FailureReason;
import org.prw.ingest.failure.FailureRecord;
import org.prw.ingest.failure.FailureSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Produces {@link Encounter}s from the encounters table.
 *
 * Columns (case-insensitive): prw_id, encounter_date, dept, service_provider, encounter_type,
 * appt_status, diagnoses. All but diagnoses are required.
 * Dates are ISO dates or date-times; a space may separate date and time.
 */
public class EncounterCsvProducer {
    private static final Logger log = LoggerFactory.getLogger(EncounterCsvProducer.class);

    public static final String DATASET = "encounters";

    public static final String PRW_ID = "prw_id";
    public static final String ENCOUNTER_DATE = "encounter_date";
    public static final String DEPT = "dept";
    public static final String SERVICE_PROVIDER = "service_provider";
    public static final String ENCOUNTER_TYPE = "encounter_type";
    public static final String APPT_STATUS = "appt_status";
    public static final String DIAGNOSES = "diagnoses";

    public static final List<String> REQUIRED_COLUMNS =
        List.of(PRW_ID, ENCOUNTER_DATE, DEPT, SERVICE_PROVIDER, ENCOUNTER_TYPE, APPT_STATUS);

    private final String runId;
    private final FailureSink failureSink;

    public EncounterCsvProducer(String runId, FailureSink failureSink) {
        this.runId = runId;
        this.failureSink = failureSink;
    }

    /**
     * @param knownPatients patient ids of the batch; encounters for anyone else are rejected
     */
    public List<Encounter> produce(CsvTableReader.Table table, Set<String> knownPatients) {
        List<Encounter> encounters = new ArrayList<>(table.records().size());
        String inputFile = table.file().toString();

        for (CSVRecord record : table.records()) {
            String prwId = CsvTableReader.value(record, PRW_ID);
            if (prwId == null) {
                failureSink.recordFailure(FailureRecord.of(runId, DATASET, inputFile, record.getRecordNumber(),
                    FailureReason.MISSING_PATIENT_ID, "prw_id is blank"));
                continue;
            }
            if (!knownPatients.contains(prwId)) {
                failureSink.recordFailure(new FailureRecord(runId, DATASET, inputFile, record.getRecordNumber(),
                    prwId, PRW_ID, null, FailureReason.UNKNOWN_PATIENT, null));
                continue;
            }

            String rawDate = CsvTableReader.value(record, ENCOUNTER_DATE);
            if (rawDate == null) {
                failureSink.recordFailure(new FailureRecord(runId, DATASET, inputFile, record.getRecordNumber(),
                    prwId, ENCOUNTER_DATE, null, FailureReason.MISSING_ENCOUNTER_DATE, null));
                continue;
            }
            LocalDateTime encounterDate;
            try {
                encounterDate = parseDate(rawDate);
            } catch (DateTimeParseException e) {
                failureSink.recordFailure(new FailureRecord(runId, DATASET, inputFile, record.getRecordNumber(),
                    prwId, ENCOUNTER_DATE, rawDate, FailureReason.INVALID_ENCOUNTER_DATE, e.getMessage()));
                continue;
            }

            encounters.add(new Encounter(
                prwId,
                encounterDate,
                CsvTableReader.value(record, DEPT),
                CsvTableReader.value(record, SERVICE_PROVIDER),
                CsvTableReader.value(record, ENCOUNTER_TYPE),
                CsvTableReader.value(record, APPT_STATUS),
                CsvTableReader.value(record, DIAGNOSES)));
        }

        log.info("Produced {} encounters from {} rows in {}", encounters.size(), table.records().size(), table.file());
        return encounters;
    }

    static LocalDateTime parseDate(String raw) {
        if (raw.length() == 10) {
            return LocalDate.parse(raw).atStartOfDay();
        }
        return LocalDateTime.parse(raw.replace(' ', 'T'));
    }
}
