package org.prw.data.patient;

/**
 * De-identified patient keyed by pseudonymous id.
 *
 * @param prwId pseudonymous id
 * @param age age in whole years, null when unknown
 * @param sex administrative sex code, may be null
 * @param panelProvider provider the patient is already empaneled with, null if none
 * @param panelLocation location the patient is already empaneled with, null if none
 */
public record Patient(
    String prwId,
    Integer age,
    String sex,
    String panelProvider,
    String panelLocation
) {

    public static Patient candidate(String prwId, Integer age) {
        return new Patient(prwId, age, null, null, null);
    }

    /**
     * A patient with either panel field populated is settled and is never reassigned.
     */
    public boolean isSettled() {
        return !isBlank(panelProvider) || !isBlank(panelLocation);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
