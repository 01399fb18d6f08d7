package org.prw.ingest.writer;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.prw.data.panel.PanelOutcome;
import org.prw.ingest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the PanelAssignment table. Each run replaces the whole file.
 */
public class PanelAssignmentCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(PanelAssignmentCsvWriter.class);

    static final String[] HEADER = {"prw_id", "panel_location", "panel_provider", "rule_trace"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADER)
        .build();

    public void write(List<PanelOutcome> outcomes, Path target) throws IOException {
        AtomicFiles.replace(target, writer -> {
            CSVPrinter printer = new CSVPrinter(writer, FORMAT);
            for (PanelOutcome outcome : outcomes) {
                printer.printRecord(outcome.prwId(), outcome.panelLocation(), outcome.panelProvider(), outcome.ruleTrace());
            }
            printer.flush();
        });
        log.info("Wrote {} panel assignments to {}", outcomes.size(), target);
    }
}
