package org.prw.processing.panel;

import org.prw.data.patient.Encounter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One patient's eligible encounters, most recent first. Encounters sharing a date keep their
 * input order, so "most recent" is deterministic for a given batch.
 */
public class EncounterHistory {

    private static final Comparator<Encounter> MOST_RECENT_FIRST =
        Comparator.comparing(Encounter::encounterDate).reversed();

    private final List<Encounter> mostRecentFirst;

    public EncounterHistory(List<Encounter> encounters) {
        List<Encounter> sorted = new ArrayList<>(encounters);
        // List.sort is stable
        sorted.sort(MOST_RECENT_FIRST);
        this.mostRecentFirst = List.copyOf(sorted);
    }

    public static EncounterHistory empty() {
        return new EncounterHistory(List.of());
    }

    /**
     * @return encounters dated on or after {@code since}, most recent first
     */
    public List<Encounter> since(LocalDateTime since) {
        List<Encounter> window = new ArrayList<>();
        for (Encounter encounter : mostRecentFirst) {
            if (encounter.encounterDate().isBefore(since)) {
                break;
            }
            window.add(encounter);
        }
        return window;
    }

    public List<Encounter> all() {
        return mostRecentFirst;
    }

    public boolean isEmpty() {
        return mostRecentFirst.isEmpty();
    }
}
