package org.prw.processing.identity;

import org.prw.data.identity.IdentityMapping;

import java.util.List;
import java.util.Map;

/**
 * Converts source patient identifiers (MRNs) into pseudonymous ids.
 */
public interface PseudonymousIdResolver {

    /**
     * Result of resolving one batch.
     *
     * @param assignments source id to pseudonymous id for every accepted row, in batch order
     * @param newMappings rows the caller must append to the identity store before committing
     *                    anything that references them
     * @param reusedCount sources that already had an id in the existing mapping
     * @param collisionCount rehashes performed while minting new ids
     * @param rejectedPositions batch positions skipped because the source id was null or blank
     * @param duplicatePositions batch positions skipped because the source id appeared earlier
     */
    record BatchResolution(
        Map<String, String> assignments,
        List<IdentityMapping> newMappings,
        int reusedCount,
        int collisionCount,
        List<Integer> rejectedPositions,
        List<Integer> duplicatePositions
    ) {}

    /**
     * Computes the candidate id for a source id, ignoring any existing mapping.
     *
     * @param sourceId source identifier, e.g. an MRN
     * @return candidate pseudonymous id
     */
    String derive(String sourceId);

    /**
     * Resolves a batch against the existing mapping. The union of {@code existingMapping}
     * and the returned {@link BatchResolution#newMappings()} is injective.
     *
     * @param sourceIds source identifiers in batch order, may contain nulls and repeats
     * @param existingMapping persisted source id to pseudonymous id mapping
     * @return assignments and the new rows to persist
     */
    BatchResolution resolveBatch(List<String> sourceIds, Map<String, String> existingMapping);
}
