package org.prw.data.panel;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PanelRulesTest {

    private final PanelRules rules = PanelRules.builder()
        .pedsDepartments(List.of("CC WPL PALOUSE PEDIATRICS PULLMAN"))
        .wellVisitTypes(List.of("CC WELL CH [71511022]"))
        .wellVisitKeywords(List.of("well child", "Z00\\.1"))
        .providerToLocation(Map.of("Lee, Jonathan [X9162396]", "CC WPL PALOUSE PEDIATRICS PULLMAN"))
        .excludedEncounterTypes(List.of("LAB [101]"))
        .build();

    @Test
    void testWellVisitByTypeOrKeyword() {
        assertTrue(rules.isWellVisit("CC WELL CH [71511022]", null));
        assertTrue(rules.isWellVisit("OFFICE VISIT", "Encounter for WELL CHILD check"));
        assertTrue(rules.isWellVisit(null, "z00.121 routine exam"));
        assertFalse(rules.isWellVisit("OFFICE VISIT", "Acute otitis media"));
        assertFalse(rules.isWellVisit(null, null));
    }

    @Test
    void testUnknownReferenceValuesNeverMatch() {
        assertFalse(rules.isPedsDepartment("CC WPL PULLMAN FAMILY MEDICINE"));
        assertFalse(rules.isPedsDepartment(null));
        assertFalse(rules.isRecognizedProvider("Nobody [1]"));
        assertNull(rules.locationFor("Nobody [1]"));
        assertNull(rules.locationFor(null));
    }

    @Test
    void testMapNamesNormalizesLookupKeys() {
        PanelRules stripped = rules.mapNames(name -> name.replaceAll("\\s*\\[[^\\]]*\\]\\s*$", ""));

        assertTrue(stripped.isRecognizedProvider("Lee, Jonathan"));
        assertEquals("CC WPL PALOUSE PEDIATRICS PULLMAN", stripped.locationFor("Lee, Jonathan"));
        assertTrue(stripped.isWellVisit("CC WELL CH", null));
        assertTrue(stripped.isExcludedEncounterType("LAB"));
        assertTrue(stripped.isWellVisit(null, "well child"));
        assertEquals(PanelRules.DEFAULT_PEDIATRICS_SENTINEL, stripped.getPediatricsSentinel());
    }

    @Test
    void testBlankSentinelRejected() {
        assertThrows(IllegalArgumentException.class, () -> PanelRules.builder().pediatricsSentinel(" ").build());
    }
}
