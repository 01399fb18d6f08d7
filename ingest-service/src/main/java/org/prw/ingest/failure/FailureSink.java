package org.prw.ingest.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSONL failure sink for Splunk/Elastic consumption.
 *
 * Thread-safe. Writes one JSON object per line; the file is truncated when the sink opens.
 */
public class FailureSink implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FailureSink.class);

    private final Path outputFile;
    private final BufferedWriter writer;
    private final ObjectMapper mapper;

    // Rollup counters, dataset -> reason -> count
    private final Map<String, Map<FailureReason, Long>> rollupCounters = new TreeMap<>();
    private long totalFailures = 0;

    public FailureSink(Path outputFile) throws IOException {
        this.outputFile = outputFile;
        if (outputFile.getParent() != null) {
            Files.createDirectories(outputFile.getParent());
        }
        this.writer = Files.newBufferedWriter(outputFile,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);

        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        log.info("Initialized failure sink: {}", outputFile);
    }

    /**
     * Records a failure (thread-safe).
     *
     * @throws UncheckedIOException if the record cannot be written
     */
    public synchronized void recordFailure(FailureRecord record) {
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write failure record to " + outputFile, e);
        }

        rollupCounters
            .computeIfAbsent(record.dataset(), k -> new EnumMap<>(FailureReason.class))
            .merge(record.reasonCode(), 1L, Long::sum);
        totalFailures++;
    }

    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public synchronized long getFailures(String dataset, FailureReason reason) {
        return rollupCounters.getOrDefault(dataset, Map.of()).getOrDefault(reason, 0L);
    }

    /**
     * Logs the rollup summary. The JSONL file itself stays one record per line.
     */
    private void logRollup() {
        for (Map.Entry<String, Map<FailureReason, Long>> datasetEntry : rollupCounters.entrySet()) {
            for (Map.Entry<FailureReason, Long> reasonEntry : datasetEntry.getValue().entrySet()) {
                log.warn("Failures in {}: {} x {}", datasetEntry.getKey(), reasonEntry.getValue(), reasonEntry.getKey());
            }
        }
        log.info("Total failures: {}", totalFailures);
    }

    @Override
    public synchronized void close() throws IOException {
        logRollup();
        writer.close();
        log.info("Closed failure sink: {}", outputFile);
    }
}
