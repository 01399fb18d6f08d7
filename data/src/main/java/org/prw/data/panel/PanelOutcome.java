package org.prw.data.panel;

/**
 * Result of running the empanelment cascade for one patient. This is the row written to the
 * panel assignment output.
 *
 * @param prwId pseudonymous patient id
 * @param panelProvider assigned provider, null for pediatric or unassigned outcomes
 * @param panelLocation assigned location, null when unassigned
 * @param rule step that decided the outcome
 * @param ruleTrace human readable trace, e.g. {@code PEDS[RULE_1,RULE_3]}
 */
public record PanelOutcome(
    String prwId,
    String panelProvider,
    String panelLocation,
    PanelRule rule,
    String ruleTrace
) {

    public static PanelOutcome unassigned(String prwId) {
        return new PanelOutcome(prwId, null, null, PanelRule.UNASSIGNED, PanelRule.UNASSIGNED.name());
    }

    public static PanelOutcome settled(String prwId, String panelProvider, String panelLocation) {
        return new PanelOutcome(prwId, panelProvider, panelLocation, PanelRule.PREVIOUSLY_SETTLED,
            PanelRule.PREVIOUSLY_SETTLED.name());
    }

    public static PanelOutcome provider(String prwId, String panelProvider, String panelLocation, PanelRule rule) {
        return new PanelOutcome(prwId, panelProvider, panelLocation, rule, rule.name());
    }

    public boolean isAssigned() {
        return rule.isAssigned();
    }
}
