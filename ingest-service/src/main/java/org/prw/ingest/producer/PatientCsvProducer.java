package org.prw.ingest.producer;

import org.apache.commons.csv.CSVRecord;
import org.prw.data.patient.Patient;
import org.prw.ingest.failure.FailureReason;
import org.prw.ingest.failure.FailureRecord;
import org.prw.ingest.failure.FailureSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Produces {@link Patient}s from the patients table.
 *
 * Columns (case-insensitive): prw_id, age, sex, panel_provider, panel_location.
 * Only prw_id and age are required; a table without the panel columns treats every patient
 * as a candidate.
 */
public class PatientCsvProducer {
    private static final Logger log = LoggerFactory.getLogger(PatientCsvProducer.class);

    public static final String DATASET = "patients";

    public static final String PRW_ID = "prw_id";
    public static final String AGE = "age";
    public static final String SEX = "sex";
    public static final String PANEL_PROVIDER = "panel_provider";
    public static final String PANEL_LOCATION = "panel_location";

    public static final List<String> REQUIRED_COLUMNS = List.of(PRW_ID, AGE);

    private final String runId;
    private final FailureSink failureSink;

    public PatientCsvProducer(String runId, FailureSink failureSink) {
        this.runId = runId;
        this.failureSink = failureSink;
    }

    public List<Patient> produce(CsvTableReader.Table table) {
        List<Patient> patients = new ArrayList<>(table.records().size());
        Set<String> seen = new HashSet<>();
        String inputFile = table.file().toString();

        for (CSVRecord record : table.records()) {
            String prwId = CsvTableReader.value(record, PRW_ID);
            if (prwId == null) {
                failureSink.recordFailure(FailureRecord.of(runId, DATASET, inputFile, record.getRecordNumber(),
                    FailureReason.MISSING_PATIENT_ID, "prw_id is blank"));
                continue;
            }
            if (!seen.add(prwId)) {
                failureSink.recordFailure(new FailureRecord(runId, DATASET, inputFile, record.getRecordNumber(),
                    prwId, PRW_ID, null, FailureReason.DUPLICATE_PATIENT_ID, "first row for this patient kept"));
                continue;
            }

            String rawAge = CsvTableReader.value(record, AGE);
            Integer age;
            try {
                age = parseAge(rawAge);
            } catch (NumberFormatException | ArithmeticException e) {
                failureSink.recordFailure(new FailureRecord(runId, DATASET, inputFile, record.getRecordNumber(),
                    prwId, AGE, rawAge, FailureReason.INVALID_AGE, e.getMessage()));
                continue;
            }

            patients.add(new Patient(
                prwId,
                age,
                CsvTableReader.value(record, SEX),
                CsvTableReader.value(record, PANEL_PROVIDER),
                CsvTableReader.value(record, PANEL_LOCATION)));
        }

        log.info("Produced {} patients from {} rows in {}", patients.size(), table.records().size(), table.file());
        return patients;
    }

    /**
     * Ages arrive as whole numbers, sometimes rendered with a zero fraction ("4.0").
     * A blank age is unknown, not invalid.
     */
    static Integer parseAge(String raw) {
        if (raw == null) {
            return null;
        }
        int age = new BigDecimal(raw).intValueExact();
        if (age < 0) {
            throw new NumberFormatException("Negative age: " + raw);
        }
        return age;
    }
}
