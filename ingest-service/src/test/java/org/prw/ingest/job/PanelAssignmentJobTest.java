package org.prw.ingest.job;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prw.data.panel.PanelRules;
import org.prw.ingest.failure.FailureReason;
import org.prw.ingest.failure.FailureSink;
import org.prw.processing.panel.PanelAssignmentEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

class PanelAssignmentJobTest {

    static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    static final PanelRules RULES = PanelRules.builder()
        .pedsDepartments(Set.of("PEDS"))
        .wellVisitTypes(Set.of("CC WELL CH"))
        .providerToLocation(Map.of("A", "LOC A", "B", "LOC B", "PED", "PEDS LOC"))
        .excludedEncounterTypes(Set.of("LAB ONLY"))
        .build();

    static final String PATIENTS = """
        prw_id,age,sex,panel_provider,panel_location
        1,40,F,,
        2,6,M,,
        3,50,F,B,LOC B
        4,30,M,,
        """;

    static final String ENCOUNTERS = """
        prw_id,encounter_date,dept,service_provider,encounter_type,appt_status,diagnoses
        1,2024-05-01,FAMILY,A,OFFICE,Completed,
        1,2024-04-01,FAMILY,A,OFFICE,Completed,
        1,2024-03-01,FAMILY,B,OFFICE,Completed,
        1,2024-05-15,FAMILY,B,OFFICE,Canceled,
        1,2024-05-20,FAMILY,B,LAB ONLY,Completed,
        2,2024-05-01,PEDS,PED,OFFICE,Completed,
        2,2024-03-01,PEDS,PED,OFFICE,Completed,
        2,2024-01-01,PEDS,PED,OFFICE,Completed,
        4,2020-01-01,FAMILY,A,OFFICE,Completed,
        9,2024-05-01,FAMILY,A,OFFICE,Completed,
        """;

    @Test
    void shouldWritePanelAssignmentTable(@TempDir Path testDir) throws IOException {
        Path patients = testDir.resolve("patients.csv");
        Path encounters = testDir.resolve("encounters.csv");
        Path output = testDir.resolve("out/panel_assignment.csv");
        Files.writeString(patients, PATIENTS);
        Files.writeString(encounters, ENCOUNTERS);

        PanelAssignmentJob job = new PanelAssignmentJob(patients, encounters, output, new PanelAssignmentEngine(RULES));
        Map<String, Long> counts;
        try (FailureSink sink = new FailureSink(testDir.resolve("failures.jsonl"))) {
            counts = job.run("run-1", sink, NOW);
            Assertions.assertEquals(1, sink.getFailures("encounters", FailureReason.UNKNOWN_PATIENT));
        }

        List<String> lines = Files.readAllLines(output);
        Assertions.assertEquals(List.of(
            "prw_id,panel_location,panel_provider,rule_trace",
            "1,LOC A,A,CUT_2",
            "2,PEDIATRICS,,\"PEDS[RULE_1,RULE_3]\"",
            "3,LOC B,B,PREVIOUSLY_SETTLED",
            "4,,,UNASSIGNED"), lines);

        Assertions.assertEquals(4L, counts.get("patients"));
        Assertions.assertEquals(9L, counts.get("encounters"));
        Assertions.assertEquals(7L, counts.get("eligibleEncounters"));
        Assertions.assertEquals(1L, counts.get("CUT_2"));
        Assertions.assertEquals(1L, counts.get("PEDIATRICS"));
        Assertions.assertEquals(1L, counts.get("UNASSIGNED"));
    }

    @Test
    void shouldRequireEveryEncounterColumnButDiagnoses(@TempDir Path testDir) {
        PanelAssignmentJob job = new PanelAssignmentJob(testDir.resolve("p.csv"), testDir.resolve("e.csv"),
            testDir.resolve("out.csv"), new PanelAssignmentEngine(RULES));

        Assertions.assertEquals(List.of("prw_id", "age"), job.requirements().get(0).columns());
        Assertions.assertFalse(job.requirements().get(1).columns().contains("diagnoses"));
        Assertions.assertEquals(6, job.requirements().get(1).columns().size());
    }
}
