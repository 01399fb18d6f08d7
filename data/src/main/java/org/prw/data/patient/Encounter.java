package org.prw.data.patient;

import java.time.LocalDateTime;

/**
 * A single clinical encounter, already keyed by pseudonymous id. Read-only to the panel engine.
 */
public record Encounter(
    String prwId,
    LocalDateTime encounterDate,
    String department,
    String serviceProvider,
    String encounterType,
    String apptStatus,
    String diagnosisText
) {

    public Encounter withNames(String department, String serviceProvider, String encounterType) {
        return new Encounter(prwId, encounterDate, department, serviceProvider, encounterType, apptStatus, diagnosisText);
    }
}
