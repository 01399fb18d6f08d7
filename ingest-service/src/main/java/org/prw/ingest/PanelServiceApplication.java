package org.prw.ingest;

import org.prw.common.salt.SaltLoader;
import org.prw.ingest.config.PanelServiceConfig;
import org.prw.ingest.failure.FailureSink;
import org.prw.ingest.job.IdentityResolutionJob;
import org.prw.ingest.job.PanelAssignmentJob;
import org.prw.ingest.mapping.DelimitedFileIdentityMappingStore;
import org.prw.ingest.mapping.IdentityResolutionService;
import org.prw.ingest.producer.CsvTableReader;
import org.prw.ingest.writer.RunMetaWriter;
import org.prw.processing.identity.Fnv1aIdHashFunction;
import org.prw.processing.identity.SaltedHashIdResolver;
import org.prw.processing.panel.PanelAssignmentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PRW empanelment service.
 *
 * Orchestrates:
 * - Identity resolution of a source batch against the identity store
 * - Panel assignment over the patient and encounter batches
 * - Failure tracking and run metadata
 *
 * Run with:
 * java -jar ingest-service.jar \
 *   --prw.output-dir=/data/prw/out \
 *   --prw.identity-source-file=/data/prw/in/patients_src.csv \
 *   --prw.identity-store-file=/data/prw/identity/mapping.csv \
 *   --prw.identity-salt-file=/data/prw/identity/salt \
 *   --prw.pseudonymized-file=/data/prw/out/patients.csv \
 *   --prw.patients-file=/data/prw/out/patients.csv \
 *   --prw.encounters-file=/data/prw/in/encounters.csv
 *
 * Every input is checked for required columns before anything is written.
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration.class
})
@ConfigurationPropertiesScan("org.prw.ingest.config")
public class PanelServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PanelServiceApplication.class);

    private final PanelServiceConfig config;
    private final PanelAssignmentEngine engine;
    private final Clock clock;

    public PanelServiceApplication(PanelServiceConfig config, PanelAssignmentEngine engine, Clock clock) {
        this.config = config;
        this.engine = engine;
        this.clock = clock;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PanelServiceApplication.class);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting PRW empanelment run");

        String runId = UUID.randomUUID().toString();
        log.info("Run ID: {}", runId);
        Instant startTime = clock.instant();

        IdentityResolutionJob identityJob = config.isIdentityEnabled() ? createIdentityJob() : null;
        PanelAssignmentJob panelJob = config.isPanelEnabled() ? createPanelJob() : null;

        // Data-shape check for every input before any output exists
        List<CsvTableReader.Requirement> requirements = new ArrayList<>();
        if (identityJob != null) {
            requirements.addAll(identityJob.requirements());
        }
        if (panelJob != null) {
            for (CsvTableReader.Requirement requirement : panelJob.requirements()) {
                // The pseudonymized batch does not exist yet; check its source instead
                requirements.add(identityJob != null && config.isPseudonymizedOutput(requirement.file().toString())
                    ? identityJob.pseudonymizedRequirement(requirement)
                    : requirement);
            }
        }
        CsvTableReader.requireColumns(requirements);

        RunMetaWriter runMeta = new RunMetaWriter(Path.of(config.getRunMetaFile()));

        try (FailureSink failureSink = new FailureSink(Path.of(config.getFailureFile()))) {
            if (identityJob != null) {
                Map<String, Long> counts = identityJob.run(runId, failureSink);
                runMeta.record(IdentityResolutionJob.DATASET, new RunMetaWriter.DatasetRun(runId, clock.instant(), counts));
            }

            if (panelJob != null) {
                LocalDateTime now = referenceTime();
                Map<String, Long> counts = panelJob.run(runId, failureSink, now);
                runMeta.record(PanelAssignmentJob.DATASET, new RunMetaWriter.DatasetRun(runId, clock.instant(), counts));
            }
        }

        Duration duration = Duration.between(startTime, clock.instant());
        log.info("=== RUN COMPLETE ===");
        log.info("Run ID: {}", runId);
        log.info("Duration: {} seconds", duration.toSeconds());
        log.info("Failures: {}", config.getFailureFile());
        log.info("Run meta: {}", config.getRunMetaFile());
    }

    private IdentityResolutionJob createIdentityJob() throws IOException {
        String salt = SaltLoader.loadSaltOrDefault(config.getIdentitySaltFile());
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(
            salt, new Fnv1aIdHashFunction(), config.getIdentityMaxRetries());

        Path storeFile = Path.of(config.getIdentityStoreFile());
        IdentityResolutionService service = new IdentityResolutionService(
            new DelimitedFileIdentityMappingStore(storeFile),
            resolver,
            IdentityResolutionService.lockFileFor(storeFile));

        String pseudonymized = config.getPseudonymizedFile();
        return new IdentityResolutionJob(
            Path.of(config.getIdentitySourceFile()),
            config.getIdentitySourceIdColumn(),
            pseudonymized == null || pseudonymized.isBlank() ? null : Path.of(pseudonymized),
            service);
    }

    private PanelAssignmentJob createPanelJob() {
        return new PanelAssignmentJob(
            Path.of(config.getPatientsFile()),
            Path.of(config.getEncountersFile()),
            Path.of(config.getPanelOutputFile()),
            engine);
    }

    /**
     * The configured reference time, or the clock's current time. Every window in the run is
     * measured from this one value.
     */
    private LocalDateTime referenceTime() {
        String configured = config.getReferenceTime();
        if (configured != null && !configured.isBlank()) {
            return LocalDateTime.parse(configured);
        }
        return LocalDateTime.now(clock);
    }
}
