package org.prw.processing.panel;

import org.prw.data.panel.PanelOutcome;
import org.prw.data.panel.PanelRule;
import org.prw.data.panel.PanelRules;
import org.prw.data.patient.Encounter;
import org.prw.data.patient.Patient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Recomputes the panel of every patient in a batch.
 * <p>
 * Settled patients are passed through unchanged. Every other patient runs through
 * {@link PediatricEmpanelment} and, if not empaneled there, {@link GeneralCutCascade}. The result
 * is a pure function of the patients, encounters, rules and reference time; the thread count only
 * changes how fast it is computed.
 */
public class PanelAssignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(PanelAssignmentEngine.class);

    /**
     * Outcomes in patient batch order, with the run summary.
     */
    public record Result(List<PanelOutcome> outcomes, PanelAssignmentSummary summary) {}

    private final PanelRules rules;
    private final EncounterFilter encounterFilter;
    private final EncounterNameCleaner nameCleaner;
    private final PediatricEmpanelment pediatricEmpanelment;
    private final GeneralCutCascade generalCutCascade;
    private final int threads;

    public PanelAssignmentEngine(PanelRules rules) {
        this(rules, false, 1);
    }

    /**
     * @param rules reference tables
     * @param stripTrailingIds remove trailing {@code " [id]"} from encounter and reference names before matching
     * @param threads worker threads for per-patient evaluation, 1 for sequential
     */
    public PanelAssignmentEngine(PanelRules rules, boolean stripTrailingIds, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.nameCleaner = stripTrailingIds ? new EncounterNameCleaner() : null;
        this.rules = stripTrailingIds ? rules.mapNames(nameCleaner::clean) : rules;
        this.encounterFilter = new EncounterFilter(this.rules);
        this.pediatricEmpanelment = new PediatricEmpanelment(this.rules);
        this.generalCutCascade = new GeneralCutCascade(this.rules);
        this.threads = threads;
    }

    public Result assign(List<Patient> patients, List<Encounter> encounters, LocalDateTime now) {
        log.info("Assigning panels for {} patients from {} encounters, reference time {}",
            patients.size(), encounters.size(), now);

        Map<String, Patient> patientsById = new LinkedHashMap<>();
        for (Patient patient : patients) {
            if (patientsById.putIfAbsent(patient.prwId(), patient) != null) {
                log.warn("Duplicate patient {} in batch, keeping first occurrence", patient.prwId());
            }
        }

        List<Encounter> cleaned = nameCleaner == null
            ? encounters
            : encounters.stream().map(nameCleaner::clean).toList();
        List<Encounter> eligible = encounterFilter.filter(cleaned, now);

        // Group per patient before any evaluation starts
        Map<String, List<Encounter>> byPatient = new HashMap<>();
        int orphans = 0;
        for (Encounter encounter : eligible) {
            if (!patientsById.containsKey(encounter.prwId())) {
                orphans++;
                continue;
            }
            byPatient.computeIfAbsent(encounter.prwId(), k -> new ArrayList<>()).add(encounter);
        }
        if (orphans > 0) {
            log.warn("Ignored {} eligible encounters for patients not in the patient batch", orphans);
        }

        List<Patient> unique = new ArrayList<>(patientsById.values());
        List<PanelOutcome> outcomes = threads == 1
            ? evaluateAll(unique, byPatient, now)
            : evaluateInParallel(unique, byPatient, now);

        PanelAssignmentSummary summary = PanelAssignmentSummary.of(outcomes, encounters.size(), eligible.size(), orphans);
        logSummary(summary);
        return new Result(outcomes, summary);
    }

    /**
     * Runs the cascade for a single patient.
     */
    public PanelOutcome evaluate(Patient patient, EncounterHistory history, LocalDateTime now) {
        if (patient.isSettled()) {
            return PanelOutcome.settled(patient.prwId(), patient.panelProvider(), patient.panelLocation());
        }
        Optional<PanelOutcome> pediatric = pediatricEmpanelment.evaluate(patient, history, now);
        if (pediatric.isPresent()) {
            return pediatric.get();
        }
        return generalCutCascade.evaluate(patient.prwId(), history, now);
    }

    private List<PanelOutcome> evaluateAll(List<Patient> patients, Map<String, List<Encounter>> byPatient, LocalDateTime now) {
        List<PanelOutcome> outcomes = new ArrayList<>(patients.size());
        for (Patient patient : patients) {
            List<Encounter> encounters = byPatient.get(patient.prwId());
            EncounterHistory history = encounters == null ? EncounterHistory.empty() : new EncounterHistory(encounters);
            outcomes.add(evaluate(patient, history, now));
        }
        return outcomes;
    }

    private List<PanelOutcome> evaluateInParallel(List<Patient> patients, Map<String, List<Encounter>> byPatient,
                                                  LocalDateTime now) {
        int chunkSize = Math.max(1, (patients.size() + threads - 1) / threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<PanelOutcome>>> futures = new ArrayList<>();
            for (int start = 0; start < patients.size(); start += chunkSize) {
                List<Patient> chunk = patients.subList(start, Math.min(start + chunkSize, patients.size()));
                futures.add(pool.submit(() -> evaluateAll(chunk, byPatient, now)));
            }

            List<PanelOutcome> outcomes = new ArrayList<>(patients.size());
            for (Future<List<PanelOutcome>> future : futures) {
                outcomes.addAll(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while assigning panels", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Panel evaluation failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void logSummary(PanelAssignmentSummary summary) {
        log.info("Number of patients: {}", summary.patientCount());
        log.info("Previously settled: {}", summary.count(PanelRule.PREVIOUSLY_SETTLED));
        log.info("Pediatric assignments: {}", summary.count(PanelRule.PEDIATRICS));
        log.info("1st cut assignments: {}", summary.count(PanelRule.CUT_1));
        log.info("2nd cut assignments: {}", summary.count(PanelRule.CUT_2));
        log.info("3rd cut assignments: {}", summary.count(PanelRule.CUT_3));
        log.info("4th cut assignments: {}", summary.count(PanelRule.CUT_4));
        log.info("Unassigned: {}", summary.count(PanelRule.UNASSIGNED));
        log.info("Total assigned: {} {}%", summary.assignedCount(), String.format("%.2f", summary.assignedPercent()));
    }
}
