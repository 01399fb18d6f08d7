package org.prw.processing.panel;

import org.prw.data.panel.PanelOutcome;
import org.prw.data.panel.PanelRule;
import org.prw.data.panel.PanelRules;
import org.prw.data.patient.Encounter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 2 of empanelment, the 4 cut method. Only encounters from the last two years with a
 * recognized provider count; everything else is invisible to this stage.
 * <ol>
 *   <li>Patients who have seen only one provider: assigned to that provider</li>
 *   <li>Patients who have seen one provider for a strict majority of visits: assigned to that provider</li>
 *   <li>Otherwise: assigned to the provider of the most recent well visit</li>
 *   <li>Otherwise: assigned to the last provider seen</li>
 * </ol>
 */
public class GeneralCutCascade {

    static final int LOOKBACK_YEARS = 2;

    private final PanelRules rules;

    public GeneralCutCascade(PanelRules rules) {
        this.rules = rules;
    }

    public PanelOutcome evaluate(String prwId, EncounterHistory history, LocalDateTime now) {
        List<Encounter> qualifying = history.since(now.minusYears(LOOKBACK_YEARS)).stream()
            .filter(e -> rules.isRecognizedProvider(e.serviceProvider()))
            .toList();
        if (qualifying.isEmpty()) {
            return PanelOutcome.unassigned(prwId);
        }

        // Visit counts per provider, most recently seen provider first
        Map<String, Integer> visits = new LinkedHashMap<>();
        for (Encounter encounter : qualifying) {
            visits.merge(encounter.serviceProvider(), 1, Integer::sum);
        }

        // 1st cut
        if (visits.size() == 1) {
            return assign(prwId, visits.keySet().iterator().next(), PanelRule.CUT_1);
        }

        // 2nd cut
        Map.Entry<String, Integer> top = null;
        for (Map.Entry<String, Integer> entry : visits.entrySet()) {
            if (top == null || entry.getValue() > top.getValue()) {
                top = entry;
            }
        }
        if (top.getValue() * 2 > qualifying.size()) {
            return assign(prwId, top.getKey(), PanelRule.CUT_2);
        }

        // 3rd cut
        for (Encounter encounter : qualifying) {
            if (rules.isWellVisit(encounter.encounterType(), encounter.diagnosisText())) {
                return assign(prwId, encounter.serviceProvider(), PanelRule.CUT_3);
            }
        }

        // 4th cut
        return assign(prwId, qualifying.get(0).serviceProvider(), PanelRule.CUT_4);
    }

    private PanelOutcome assign(String prwId, String provider, PanelRule rule) {
        return PanelOutcome.provider(prwId, provider, rules.locationFor(provider), rule);
    }
}
