package org.prw.processing.panel;

import org.prw.data.panel.PanelOutcome;
import org.prw.data.panel.PanelRule;
import org.prw.data.patient.Patient;
import org.prw.processing.panel.PediatricEmpanelment.InclusionRule;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.prw.processing.panel.PanelFixtures.*;

class PediatricEmpanelmentTest {

    private final PediatricEmpanelment pediatrics = new PediatricEmpanelment(RULES);

    @Test
    void testRule1ThreeRecentPedsVisits() {
        EncounterHistory history = history(
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 100, PEDS, PEDS_PROVIDER),
            visit("1", 200, PEDS, PEDS_PROVIDER),
            wellVisit("1", 500, FAMILY, PROVIDER_A));

        assertEquals(EnumSet.of(InclusionRule.RULE_1), pediatrics.matchingRules(history, NOW));
    }

    @Test
    void testRule1RequiresAllThreeMostRecentPeds() {
        EncounterHistory history = history(
            visit("1", 5, FAMILY, PROVIDER_A),
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 100, PEDS, PEDS_PROVIDER),
            visit("1", 200, PEDS, PEDS_PROVIDER),
            wellVisit("1", 500, FAMILY, PROVIDER_A));

        assertFalse(pediatrics.matchingRules(history, NOW).contains(InclusionRule.RULE_1));
    }

    @Test
    void testRule2LastWellVisitWasPeds() {
        EncounterHistory history = history(
            visit("1", 10, FAMILY, PROVIDER_A),
            visit("1", 20, FAMILY, PROVIDER_A),
            wellVisit("1", 300, PEDS, PEDS_PROVIDER));

        assertEquals(EnumSet.of(InclusionRule.RULE_2), pediatrics.matchingRules(history, NOW));
    }

    @Test
    void testRule2RecognizesWellVisitByDiagnosis() {
        EncounterHistory history = history(
            visitWithDiagnosis("1", 30, PEDS, PEDS_PROVIDER, "Encounter for routine child health examination"),
            wellVisit("1", 400, FAMILY, PROVIDER_A));

        assertEquals(EnumSet.of(InclusionRule.RULE_2), pediatrics.matchingRules(history, NOW));
    }

    @Test
    void testRule2NotMatchedWhenLastWellVisitElsewhere() {
        EncounterHistory history = history(
            wellVisit("1", 10, FAMILY, PROVIDER_A),
            wellVisit("1", 300, PEDS, PEDS_PROVIDER));

        assertTrue(pediatrics.matchingRules(history, NOW).isEmpty());
    }

    @Test
    void testRule3PedsMajorityWithoutWellVisits() {
        EncounterHistory history = history(
            visit("1", 5, FAMILY, PROVIDER_A),
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 30, PEDS, PEDS_PROVIDER),
            visit("1", 60, PEDS, PEDS_PROVIDER));

        assertEquals(EnumSet.of(InclusionRule.RULE_3), pediatrics.matchingRules(history, NOW));
    }

    @Test
    void testRule3RequiresStrictMajority() {
        EncounterHistory history = history(
            visit("1", 5, FAMILY, PROVIDER_A),
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 30, PEDS, PEDS_PROVIDER),
            visit("1", 40, FAMILY, PROVIDER_A));

        assertTrue(pediatrics.matchingRules(history, NOW).isEmpty());
    }

    @Test
    void testRule3RequiresThreeVisitsInLastYear() {
        EncounterHistory history = history(
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 30, PEDS, PEDS_PROVIDER),
            visit("1", 500, FAMILY, PROVIDER_A));

        assertTrue(pediatrics.matchingRules(history, NOW).isEmpty());
    }

    @Test
    void testNoMatchWithoutRecentPedsVisit() {
        EncounterHistory history = history(
            visit("1", 10, FAMILY, PROVIDER_A),
            visit("1", 20, FAMILY, PROVIDER_A),
            visit("1", 30, FAMILY, PROVIDER_A),
            visit("1", 400, PEDS, PEDS_PROVIDER),
            visit("1", 500, PEDS, PEDS_PROVIDER),
            visit("1", 600, PEDS, PEDS_PROVIDER));

        assertTrue(pediatrics.matchingRules(history, NOW).isEmpty());
    }

    @Test
    void testIgnoresEncountersOlderThanThreeYears() {
        EncounterHistory history = history(
            visit("1", 1200, PEDS, PEDS_PROVIDER),
            visit("1", 1300, PEDS, PEDS_PROVIDER),
            wellVisit("1", 1400, PEDS, PEDS_PROVIDER));

        assertTrue(pediatrics.matchingRules(history, NOW).isEmpty());
    }

    @Test
    void testEmpanelsToPediatricsSentinelWithTrace() {
        Patient patient = Patient.candidate("1", 8);
        EncounterHistory history = history(
            visit("1", 10, PEDS, PEDS_PROVIDER),
            visit("1", 100, PEDS, PEDS_PROVIDER),
            visit("1", 200, PEDS, PEDS_PROVIDER));

        PanelOutcome outcome = pediatrics.evaluate(patient, history, NOW).orElseThrow();

        assertEquals(PanelRule.PEDIATRICS, outcome.rule());
        assertEquals(RULES.getPediatricsSentinel(), outcome.panelLocation());
        assertNull(outcome.panelProvider());
        assertEquals("PEDS[RULE_1,RULE_3]", outcome.ruleTrace());
    }

    @Test
    void testUnderThreeWithoutRecentPedsVisitIsExcluded() {
        // Rule 1 holds but every peds visit is older than 15 months
        EncounterHistory history = history(
            visit("1", 470, PEDS, PEDS_PROVIDER),
            visit("1", 500, PEDS, PEDS_PROVIDER),
            visit("1", 530, PEDS, PEDS_PROVIDER));
        Set<InclusionRule> matched = pediatrics.matchingRules(history, NOW);
        assertTrue(matched.contains(InclusionRule.RULE_1));

        assertEquals(Optional.empty(), pediatrics.evaluate(Patient.candidate("1", 2), history, NOW));
        assertTrue(pediatrics.evaluate(Patient.candidate("1", 3), history, NOW).isPresent());
        assertTrue(pediatrics.evaluate(Patient.candidate("1", null), history, NOW).isPresent());
    }

    @Test
    void testUnderThreeWithRecentPedsVisitIsEmpaneled() {
        EncounterHistory history = history(
            visit("1", 30, PEDS, PEDS_PROVIDER),
            visit("1", 60, PEDS, PEDS_PROVIDER),
            visit("1", 90, PEDS, PEDS_PROVIDER));

        assertFalse(pediatrics.isExcluded(Patient.candidate("1", 1), history, NOW));
        assertTrue(pediatrics.evaluate(Patient.candidate("1", 1), history, NOW).isPresent());
    }
}
