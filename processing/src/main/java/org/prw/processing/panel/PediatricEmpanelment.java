package org.prw.processing.panel;

import org.prw.data.panel.PanelOutcome;
import org.prw.data.panel.PanelRule;
import org.prw.data.panel.PanelRules;
import org.prw.data.patient.Encounter;
import org.prw.data.patient.Patient;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stage 1 of empanelment. Decides whether a candidate patient belongs to the pediatrics panel.
 * <p>
 * Only encounters from the last three years are considered. A patient is empaneled when any of
 * the three inclusion rules match, unless the under-3 exclusion applies:
 * <ul>
 *   <li>{@link InclusionRule#RULE_1}: at least 3 peds encounters in the last 2 years and the 3
 *       most recent encounters are all peds</li>
 *   <li>{@link InclusionRule#RULE_2}: the most recent well visit in the last 2 years was peds and
 *       at least one of the 3 most recent encounters is peds</li>
 *   <li>{@link InclusionRule#RULE_3}: no well visit in the last 2 years, at least 3 encounters in
 *       the last year with peds a strict majority, and at least one of the 3 most recent
 *       encounters is peds</li>
 * </ul>
 * Exclusion: under age 3 with no peds encounter in the last 15 months.
 */
public class PediatricEmpanelment {

    public enum InclusionRule {
        RULE_1,
        RULE_2,
        RULE_3
    }

    static final int LOOKBACK_YEARS = 3;
    static final int RECENT_COUNT = 3;
    static final int EXCLUSION_AGE = 3;
    static final int EXCLUSION_LOOKBACK_MONTHS = 15;

    private final PanelRules rules;

    public PediatricEmpanelment(PanelRules rules) {
        this.rules = rules;
    }

    public Optional<PanelOutcome> evaluate(Patient patient, EncounterHistory history, LocalDateTime now) {
        Set<InclusionRule> matched = matchingRules(history, now);
        if (matched.isEmpty() || isExcluded(patient, history, now)) {
            return Optional.empty();
        }
        String trace = matched.stream().map(Enum::name).collect(Collectors.joining(",", "PEDS[", "]"));
        return Optional.of(new PanelOutcome(patient.prwId(), null, rules.getPediatricsSentinel(), PanelRule.PEDIATRICS, trace));
    }

    /**
     * @return inclusion rules satisfied by this history, ignoring the age exclusion
     */
    public Set<InclusionRule> matchingRules(EncounterHistory history, LocalDateTime now) {
        Set<InclusionRule> matched = EnumSet.noneOf(InclusionRule.class);

        List<Encounter> threeYears = history.since(now.minusYears(LOOKBACK_YEARS));
        if (threeYears.isEmpty()) {
            return matched;
        }
        List<Encounter> mostRecent = threeYears.subList(0, Math.min(RECENT_COUNT, threeYears.size()));
        boolean anyRecentPeds = mostRecent.stream().anyMatch(this::isPeds);

        LocalDateTime twoYearsAgo = now.minusYears(2);
        List<Encounter> twoYears = threeYears.stream()
            .filter(e -> !e.encounterDate().isBefore(twoYearsAgo))
            .toList();

        long pedsInTwoYears = twoYears.stream().filter(this::isPeds).count();
        if (pedsInTwoYears >= RECENT_COUNT
            && mostRecent.size() == RECENT_COUNT
            && mostRecent.stream().allMatch(this::isPeds)) {
            matched.add(InclusionRule.RULE_1);
        }

        Optional<Encounter> lastWell = twoYears.stream().filter(this::isWell).findFirst();
        if (lastWell.isPresent() && isPeds(lastWell.get()) && anyRecentPeds) {
            matched.add(InclusionRule.RULE_2);
        }

        if (lastWell.isEmpty() && anyRecentPeds) {
            LocalDateTime oneYearAgo = now.minusYears(1);
            List<Encounter> oneYear = twoYears.stream()
                .filter(e -> !e.encounterDate().isBefore(oneYearAgo))
                .toList();
            long pedsInOneYear = oneYear.stream().filter(this::isPeds).count();
            if (oneYear.size() >= RECENT_COUNT && pedsInOneYear * 2 > oneYear.size()) {
                matched.add(InclusionRule.RULE_3);
            }
        }

        return matched;
    }

    /**
     * Young children who have not been seen in a peds department recently are left to the
     * general cascade. An unknown age never excludes.
     */
    public boolean isExcluded(Patient patient, EncounterHistory history, LocalDateTime now) {
        if (patient.age() == null || patient.age() >= EXCLUSION_AGE) {
            return false;
        }
        return history.since(now.minusMonths(EXCLUSION_LOOKBACK_MONTHS)).stream().noneMatch(this::isPeds);
    }

    private boolean isPeds(Encounter encounter) {
        return rules.isPedsDepartment(encounter.department());
    }

    private boolean isWell(Encounter encounter) {
        return rules.isWellVisit(encounter.encounterType(), encounter.diagnosisText());
    }
}
