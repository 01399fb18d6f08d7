package org.prw.ingest.job;

import org.prw.data.panel.PanelRule;
import org.prw.data.patient.Encounter;
import org.prw.data.patient.Patient;
import org.prw.ingest.failure.FailureSink;
import org.prw.ingest.producer.CsvTableReader;
import org.prw.ingest.producer.EncounterCsvProducer;
import org.prw.ingest.producer.PatientCsvProducer;
import org.prw.ingest.writer.PanelAssignmentCsvWriter;
import org.prw.processing.panel.PanelAssignmentEngine;
import org.prw.processing.panel.PanelAssignmentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the patient and encounter batches, runs the empanelment cascade and replaces the
 * PanelAssignment table. The table is only written once every patient has an outcome.
 */
public class PanelAssignmentJob {
    private static final Logger log = LoggerFactory.getLogger(PanelAssignmentJob.class);

    public static final String DATASET = "panel_assignment";

    private final Path patientsFile;
    private final Path encountersFile;
    private final Path outputFile;
    private final PanelAssignmentEngine engine;
    private final PanelAssignmentCsvWriter writer = new PanelAssignmentCsvWriter();

    public PanelAssignmentJob(Path patientsFile, Path encountersFile, Path outputFile, PanelAssignmentEngine engine) {
        this.patientsFile = patientsFile;
        this.encountersFile = encountersFile;
        this.outputFile = outputFile;
        this.engine = engine;
    }

    public List<CsvTableReader.Requirement> requirements() {
        return List.of(
            new CsvTableReader.Requirement(PatientCsvProducer.DATASET, patientsFile, PatientCsvProducer.REQUIRED_COLUMNS),
            new CsvTableReader.Requirement(EncounterCsvProducer.DATASET, encountersFile, EncounterCsvProducer.REQUIRED_COLUMNS));
    }

    public Map<String, Long> run(String runId, FailureSink failureSink, LocalDateTime now) throws IOException {
        log.info("Assigning panels as of {}", now);

        List<Patient> patients = new PatientCsvProducer(runId, failureSink)
            .produce(CsvTableReader.read(PatientCsvProducer.DATASET, patientsFile));
        Set<String> knownPatients = patients.stream().map(Patient::prwId).collect(Collectors.toSet());
        List<Encounter> encounters = new EncounterCsvProducer(runId, failureSink)
            .produce(CsvTableReader.read(EncounterCsvProducer.DATASET, encountersFile), knownPatients);

        PanelAssignmentEngine.Result result = engine.assign(patients, encounters, now);
        writer.write(result.outcomes(), outputFile);

        PanelAssignmentSummary summary = result.summary();
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("patients", (long) summary.patientCount());
        counts.put("encounters", (long) summary.encounterCount());
        counts.put("eligibleEncounters", (long) summary.eligibleEncounterCount());
        for (PanelRule rule : PanelRule.values()) {
            counts.put(rule.name(), (long) summary.count(rule));
        }
        return counts;
    }
}
