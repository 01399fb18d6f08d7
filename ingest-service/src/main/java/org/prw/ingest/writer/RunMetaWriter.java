package org.prw.ingest.writer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.prw.ingest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps the run-meta file: for each dataset, the last successful run and its row counts.
 * Entries for other datasets are preserved.
 */
public class RunMetaWriter {
    private static final Logger log = LoggerFactory.getLogger(RunMetaWriter.class);

    public record DatasetRun(String runId, Instant completedAt, Map<String, Long> counts) {}

    private static final TypeReference<TreeMap<String, DatasetRun>> META_TYPE = new TypeReference<>() {};

    private final Path metaFile;
    private final ObjectMapper mapper;

    public RunMetaWriter(Path metaFile) {
        this.metaFile = metaFile;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, DatasetRun> read() throws IOException {
        if (!Files.exists(metaFile)) {
            return new TreeMap<>();
        }
        return mapper.readValue(metaFile.toFile(), META_TYPE);
    }

    public void record(String dataset, DatasetRun run) throws IOException {
        Map<String, DatasetRun> meta = read();
        meta.put(dataset, run);
        AtomicFiles.replace(metaFile, writer -> mapper.writeValue(writer, meta));
        log.info("Recorded run {} for {} in {}", run.runId(), dataset, metaFile);
    }
}
