package org.prw.processing.panel;

import org.prw.data.patient.Encounter;

import java.util.regex.Pattern;

/**
 * Strips the trailing {@code " [<id>]"} that the EHR extract appends to department, encounter
 * type and provider names, e.g. {@code "Lee, Jonathan [X9162396]"} becomes {@code "Lee, Jonathan"}.
 */
public class EncounterNameCleaner {

    private static final Pattern TRAILING_ID = Pattern.compile("\\s*\\[[^\\]]*\\]\\s*$");

    public String clean(String name) {
        if (name == null) {
            return null;
        }
        return TRAILING_ID.matcher(name).replaceFirst("");
    }

    public Encounter clean(Encounter encounter) {
        return encounter.withNames(
            clean(encounter.department()),
            clean(encounter.serviceProvider()),
            clean(encounter.encounterType())
        );
    }
}
