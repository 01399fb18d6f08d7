package org.prw.data.panel;

/**
 * Which step of the empanelment cascade produced an outcome.
 */
public enum PanelRule {
    PREVIOUSLY_SETTLED("Panel fields already set before this run"),
    PEDIATRICS("Pediatric empanelment"),
    CUT_1("Only one recognized provider seen"),
    CUT_2("Majority provider"),
    CUT_3("Provider of most recent well visit"),
    CUT_4("Most recent provider seen"),
    UNASSIGNED("No qualifying encounters");

    private final String description;

    PanelRule(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAssigned() {
        return this != UNASSIGNED;
    }
}
