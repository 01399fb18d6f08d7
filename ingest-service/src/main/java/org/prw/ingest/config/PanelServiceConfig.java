package org.prw.ingest.config;

import jakarta.annotation.PostConstruct;
import org.prw.processing.identity.SaltedHashIdResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the empanelment service.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "prw.*" prefix. Each step runs only when its inputs are configured:
 * identity resolution needs {@code prw.identity-source-file}, panel assignment needs
 * {@code prw.patients-file} and {@code prw.encounters-file}. Identity resolution runs first, so a
 * panel input may be the {@code prw.pseudonymized-file} it writes.
 */
@ConfigurationProperties(prefix = "prw")
public class PanelServiceConfig {
    private static final Logger log = LoggerFactory.getLogger(PanelServiceConfig.class);

    // Required properties
    private String outputDir;

    // Identity resolution
    private String identitySourceFile; // null = skip identity resolution
    private String identitySourceIdColumn = "mrn";
    private String identityStoreFile;
    private String identitySaltFile; // null = built-in salt
    private String pseudonymizedFile; // null = do not write a pseudonymized copy
    private int identityMaxRetries = SaltedHashIdResolver.DEFAULT_MAX_RETRIES;

    // Panel assignment
    private String patientsFile; // null = skip panel assignment
    private String encountersFile;
    private String panelOutputFile;
    private String referenceTime; // null = now
    private int panelThreads = 1;
    private boolean stripTrailingIds = true;

    // Optional properties with defaults
    private String failureFile;
    private String runMetaFile;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        // Collect all validation errors
        List<String> errors = new ArrayList<>();

        if (outputDir == null || outputDir.isBlank()) {
            errors.add("prw.output-dir is required");
        }
        if (!isIdentityEnabled() && !isPanelEnabled()) {
            errors.add("nothing to do: set prw.identity-source-file and/or prw.patients-file with prw.encounters-file");
        }
        if (isBlank(patientsFile) != isBlank(encountersFile)) {
            errors.add("prw.patients-file and prw.encounters-file must be set together");
        }
        if (isIdentityEnabled()) {
            if (isBlank(identityStoreFile)) {
                errors.add("prw.identity-store-file is required when prw.identity-source-file is set");
            }
            if (isBlank(identitySourceIdColumn)) {
                errors.add("prw.identity-source-id-column must not be blank");
            }
        }

        // If any required properties missing, fail immediately
        if (!errors.isEmpty()) {
            String errorMsg = "Missing required configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        // Now validate paths and values
        if (isIdentityEnabled()) {
            requireFile(identitySourceFile, "Identity source file", errors);
            if (!isBlank(identitySaltFile)) {
                requireFile(identitySaltFile, "Salt file", errors);
            }
        }
        if (isPanelEnabled()) {
            // A panel input may be the pseudonymized batch that identity resolution writes first
            if (!isPseudonymizedOutput(patientsFile)) {
                requireFile(patientsFile, "Patients file", errors);
            }
            if (!isPseudonymizedOutput(encountersFile)) {
                requireFile(encountersFile, "Encounters file", errors);
            }
        }
        if (identityMaxRetries < 0) {
            errors.add("prw.identity-max-retries must not be negative: " + identityMaxRetries);
        }
        if (panelThreads < 1) {
            errors.add("prw.panel-threads must be at least 1: " + panelThreads);
        }
        if (!isBlank(referenceTime)) {
            try {
                LocalDateTime.parse(referenceTime);
            } catch (DateTimeParseException e) {
                errors.add("prw.reference-time is not an ISO date-time: " + referenceTime);
            }
        }

        // Check output directory is writable (create if needed)
        Path outputPath = Path.of(outputDir);
        try {
            Files.createDirectories(outputPath);
            if (!Files.isWritable(outputPath)) {
                errors.add("Output directory is not writable: " + outputDir);
            }
        } catch (Exception e) {
            errors.add("Cannot create output directory: " + outputDir + " - " + e.getMessage());
        }

        // Set defaults for optional properties
        if (isBlank(failureFile)) {
            failureFile = outputDir + "/failures.jsonl";
        }
        if (isBlank(runMetaFile)) {
            runMetaFile = outputDir + "/prw_meta.json";
        }
        if (isBlank(panelOutputFile)) {
            panelOutputFile = outputDir + "/panel_assignment.csv";
        }

        // Fail fast if any errors
        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        // Log effective configuration. The salt itself is never logged.
        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Output dir: {}", outputDir);
        log.info("Failure file: {}", failureFile);
        log.info("Run meta file: {}", runMetaFile);
        if (isIdentityEnabled()) {
            log.info("Identity source: {} (column {})", identitySourceFile, identitySourceIdColumn);
            log.info("Identity store: {}", identityStoreFile);
            log.info("Salt file: {}", isBlank(identitySaltFile) ? "(none - built-in salt)" : identitySaltFile);
            log.info("Pseudonymized output: {}", isBlank(pseudonymizedFile) ? "(none)" : pseudonymizedFile);
            log.info("Identity max retries: {}", identityMaxRetries);
        } else {
            log.info("Identity resolution: (disabled)");
        }
        if (isPanelEnabled()) {
            log.info("Patients file: {}", patientsFile);
            log.info("Encounters file: {}", encountersFile);
            log.info("Panel output file: {}", panelOutputFile);
            log.info("Reference time: {}", isBlank(referenceTime) ? "(now)" : referenceTime);
            log.info("Panel threads: {}", panelThreads);
            log.info("Strip trailing ids: {}", stripTrailingIds);
        } else {
            log.info("Panel assignment: (disabled)");
        }
        log.info("================================");
    }

    private static void requireFile(String file, String label, List<String> errors) {
        if (!Files.isRegularFile(Path.of(file))) {
            errors.add(label + " not found: " + file);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * @return true when {@code file} names the pseudonymized batch this run writes before panel assignment
     */
    public boolean isPseudonymizedOutput(String file) {
        if (!isIdentityEnabled() || isBlank(pseudonymizedFile) || isBlank(file)) {
            return false;
        }
        return Path.of(file).toAbsolutePath().normalize()
            .equals(Path.of(pseudonymizedFile).toAbsolutePath().normalize());
    }

    public boolean isIdentityEnabled() {
        return !isBlank(identitySourceFile);
    }

    public boolean isPanelEnabled() {
        return !isBlank(patientsFile) && !isBlank(encountersFile);
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getIdentitySourceFile() {
        return identitySourceFile;
    }

    public void setIdentitySourceFile(String identitySourceFile) {
        this.identitySourceFile = identitySourceFile;
    }

    public String getIdentitySourceIdColumn() {
        return identitySourceIdColumn;
    }

    public void setIdentitySourceIdColumn(String identitySourceIdColumn) {
        this.identitySourceIdColumn = identitySourceIdColumn;
    }

    public String getIdentityStoreFile() {
        return identityStoreFile;
    }

    public void setIdentityStoreFile(String identityStoreFile) {
        this.identityStoreFile = identityStoreFile;
    }

    public String getIdentitySaltFile() {
        return identitySaltFile;
    }

    public void setIdentitySaltFile(String identitySaltFile) {
        this.identitySaltFile = identitySaltFile;
    }

    public String getPseudonymizedFile() {
        return pseudonymizedFile;
    }

    public void setPseudonymizedFile(String pseudonymizedFile) {
        this.pseudonymizedFile = pseudonymizedFile;
    }

    public int getIdentityMaxRetries() {
        return identityMaxRetries;
    }

    public void setIdentityMaxRetries(int identityMaxRetries) {
        this.identityMaxRetries = identityMaxRetries;
    }

    public String getPatientsFile() {
        return patientsFile;
    }

    public void setPatientsFile(String patientsFile) {
        this.patientsFile = patientsFile;
    }

    public String getEncountersFile() {
        return encountersFile;
    }

    public void setEncountersFile(String encountersFile) {
        this.encountersFile = encountersFile;
    }

    public String getPanelOutputFile() {
        return panelOutputFile;
    }

    public void setPanelOutputFile(String panelOutputFile) {
        this.panelOutputFile = panelOutputFile;
    }

    public String getReferenceTime() {
        return referenceTime;
    }

    public void setReferenceTime(String referenceTime) {
        this.referenceTime = referenceTime;
    }

    public int getPanelThreads() {
        return panelThreads;
    }

    public void setPanelThreads(int panelThreads) {
        this.panelThreads = panelThreads;
    }

    public boolean isStripTrailingIds() {
        return stripTrailingIds;
    }

    public void setStripTrailingIds(boolean stripTrailingIds) {
        this.stripTrailingIds = stripTrailingIds;
    }

    public String getFailureFile() {
        return failureFile;
    }

    public void setFailureFile(String failureFile) {
        this.failureFile = failureFile;
    }

    public String getRunMetaFile() {
        return runMetaFile;
    }

    public void setRunMetaFile(String runMetaFile) {
        this.runMetaFile = runMetaFile;
    }
}
