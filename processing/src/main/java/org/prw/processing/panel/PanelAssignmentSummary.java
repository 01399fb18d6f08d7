package org.prw.processing.panel;

import org.prw.data.panel.PanelOutcome;
import org.prw.data.panel.PanelRule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-rule counts for one run.
 */
public record PanelAssignmentSummary(
    int patientCount,
    int encounterCount,
    int eligibleEncounterCount,
    int orphanEncounterCount,
    Map<PanelRule, Integer> countsByRule
) {

    public static PanelAssignmentSummary of(List<PanelOutcome> outcomes, int encounterCount,
                                            int eligibleEncounterCount, int orphanEncounterCount) {
        Map<PanelRule, Integer> counts = new EnumMap<>(PanelRule.class);
        for (PanelRule rule : PanelRule.values()) {
            counts.put(rule, 0);
        }
        for (PanelOutcome outcome : outcomes) {
            counts.merge(outcome.rule(), 1, Integer::sum);
        }
        return new PanelAssignmentSummary(outcomes.size(), encounterCount, eligibleEncounterCount,
            orphanEncounterCount, Collections.unmodifiableMap(counts));
    }

    public int count(PanelRule rule) {
        return countsByRule.getOrDefault(rule, 0);
    }

    /**
     * Patients holding a panel after this run, including those settled before it.
     */
    public int assignedCount() {
        return patientCount - count(PanelRule.UNASSIGNED);
    }

    public double assignedPercent() {
        return patientCount == 0 ? 0.0 : assignedCount() * 100.0 / patientCount;
    }
}
