package org.prw.ingest.failure;

/**
 * Stable enumeration of row-level failure reasons for Splunk/Elastic consumption.
 */
public enum FailureReason {
    MISSING_SOURCE_ID("Source patient id missing or blank"),
    MISSING_PATIENT_ID("Pseudonymous patient id missing or blank"),
    DUPLICATE_PATIENT_ID("Pseudonymous patient id repeated in patient batch"),
    INVALID_AGE("Age is not a whole number"),
    MISSING_ENCOUNTER_DATE("Encounter date missing"),
    INVALID_ENCOUNTER_DATE("Encounter date unparseable"),
    UNKNOWN_PATIENT("Encounter references a patient not in the patient batch");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
