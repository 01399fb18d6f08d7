package org.prw.ingest.failure;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSONL record for failure capture (Splunk/Elastic compatible).
 * <p>
 * Never carries a source patient id; rows are located by file and record number instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(
    String runId,
    String dataset,
    String inputFile,
    Long recordNumber,
    String prwId,
    String column,
    String valueRaw,
    FailureReason reasonCode,
    String reasonDetail
) {

    public static FailureRecord of(String runId, String dataset, String inputFile, long recordNumber,
                                   FailureReason reason, String detail) {
        return new FailureRecord(runId, dataset, inputFile, recordNumber, null, null, null, reason, detail);
    }
}
