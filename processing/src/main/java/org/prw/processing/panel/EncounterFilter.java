package org.prw.processing.panel;

import org.prw.data.panel.PanelRules;
import org.prw.data.patient.Encounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops encounters that never count toward empanelment: administrative or ancillary types
 * (lab-only, nurse-only, anticoagulation, vaccine-only, ...), appointments that were not
 * completed, undated rows and rows dated after the reference time.
 */
public class EncounterFilter {
    private static final Logger log = LoggerFactory.getLogger(EncounterFilter.class);

    private final PanelRules rules;

    public EncounterFilter(PanelRules rules) {
        this.rules = rules;
    }

    public boolean isEligible(Encounter encounter, LocalDateTime now) {
        if (encounter.encounterDate() == null || encounter.encounterDate().isAfter(now)) {
            return false;
        }
        if (!PanelRules.COMPLETED_STATUS.equalsIgnoreCase(trim(encounter.apptStatus()))) {
            return false;
        }
        return !rules.isExcludedEncounterType(encounter.encounterType());
    }

    public List<Encounter> filter(List<Encounter> encounters, LocalDateTime now) {
        List<Encounter> eligible = new ArrayList<>(encounters.size());
        for (Encounter encounter : encounters) {
            if (isEligible(encounter, now)) {
                eligible.add(encounter);
            }
        }
        log.info("Encounter preprocessing kept {} of {} encounters", eligible.size(), encounters.size());
        return eligible;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
