package org.prw.processing.identity;

import org.prw.common.exception.IdentityCollisionException;
import org.prw.data.identity.IdentityMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mints pseudonymous ids by hashing {@code salt + "#" + sourceId}.
 * <p>
 * Collisions, either with an id already in the store or with an id minted earlier in the same
 * batch, are resolved by rehashing {@code candidate + "-" + batchPosition} until the candidate is
 * free. The earlier row always keeps its id. After {@code maxRetries} rehashes of one row the
 * batch is abandoned with an {@link IdentityCollisionException}.
 * <p>
 * Source ids are never logged; collision messages carry only the candidate id and batch position.
 */
public class SaltedHashIdResolver implements PseudonymousIdResolver {
    private static final Logger log = LoggerFactory.getLogger(SaltedHashIdResolver.class);

    public static final int DEFAULT_MAX_RETRIES = 16;

    private final String salt;
    private final IdHashFunction hashFunction;
    private final int maxRetries;

    public SaltedHashIdResolver(String salt) {
        this(salt, new Fnv1aIdHashFunction(), DEFAULT_MAX_RETRIES);
    }

    public SaltedHashIdResolver(String salt, IdHashFunction hashFunction, int maxRetries) {
        if (salt == null || salt.isEmpty()) {
            throw new IllegalArgumentException("Salt must not be empty");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.salt = salt;
        this.hashFunction = hashFunction;
        this.maxRetries = maxRetries;
    }

    @Override
    public String derive(String sourceId) {
        return hashFunction.hash(salt + "#" + sourceId);
    }

    @Override
    public BatchResolution resolveBatch(List<String> sourceIds, Map<String, String> existingMapping) {
        Set<String> taken = new HashSet<>(existingMapping.values());
        Map<String, String> assignments = new LinkedHashMap<>();
        List<IdentityMapping> newMappings = new ArrayList<>();
        List<Integer> rejectedPositions = new ArrayList<>();
        List<Integer> duplicatePositions = new ArrayList<>();
        int reused = 0;
        int collisions = 0;

        for (int position = 0; position < sourceIds.size(); position++) {
            String sourceId = sourceIds.get(position);
            if (sourceId == null || sourceId.isBlank()) {
                rejectedPositions.add(position);
                continue;
            }
            if (assignments.containsKey(sourceId)) {
                duplicatePositions.add(position);
                continue;
            }

            // Previously seen: reuse, never recompute
            String existingId = existingMapping.get(sourceId);
            if (existingId != null) {
                assignments.put(sourceId, existingId);
                reused++;
                continue;
            }

            String candidate = derive(sourceId);
            int attempts = 0;
            while (taken.contains(candidate)) {
                if (attempts >= maxRetries) {
                    log.error("Giving up on batch row {} after {} rehash attempts", position, attempts);
                    throw new IdentityCollisionException(position, attempts);
                }
                attempts++;
                collisions++;
                log.warn("Updating pseudonymous id collision: {} (batch row {}, attempt {})", candidate, position, attempts);
                candidate = hashFunction.hash(candidate + "-" + position);
            }

            taken.add(candidate);
            assignments.put(sourceId, candidate);
            newMappings.add(new IdentityMapping(sourceId, candidate));
        }

        log.info("Resolved batch of {} source ids: {} reused, {} new, {} collisions, {} rejected, {} duplicates",
            sourceIds.size(), reused, newMappings.size(), collisions, rejectedPositions.size(), duplicatePositions.size());

        return new BatchResolution(assignments, newMappings, reused, collisions, rejectedPositions, duplicatePositions);
    }
}
