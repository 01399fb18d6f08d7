package org.prw.processing.identity;

import org.prw.common.exception.IdentityCollisionException;
import org.prw.data.identity.IdentityMapping;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SaltedHashIdResolverTest {

    private static final String SALT = "560f80d9-b01f-4bda-84fd-1b39c56c5be5";

    @Test
    void shouldDeriveSaltedFnvHash() {
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT);

        assertEquals("963751434", resolver.derive("12345"));
        assertEquals(resolver.derive("12345"), resolver.derive("12345"));
        assertNotEquals(resolver.derive("12345"), new SaltedHashIdResolver("other-salt").derive("12345"));
    }

    @Test
    void shouldMintDerivedIdsAgainstEmptyMapping() {
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT);

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(List.of("12345", "67890"), Map.of());

        assertEquals("963751434", resolution.assignments().get("12345"));
        assertEquals(resolver.derive("67890"), resolution.assignments().get("67890"));
        assertEquals(2, resolution.newMappings().size());
        assertEquals(0, resolution.reusedCount());
        assertEquals(0, resolution.collisionCount());
    }

    @Test
    void shouldReuseExistingIdWithoutRecomputing() {
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT);
        Map<String, String> existing = Map.of("12345", "42");

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(List.of("12345"), existing);

        assertEquals("42", resolution.assignments().get("12345"));
        assertTrue(resolution.newMappings().isEmpty());
        assertEquals(1, resolution.reusedCount());
    }

    @Test
    void shouldRehashWhenCandidateAlreadyInStore() {
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT);
        // Another source already holds the id "12345" would derive to
        Map<String, String> existing = Map.of("99999", resolver.derive("12345"));

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(List.of("12345"), existing);

        String minted = resolution.assignments().get("12345");
        assertNotEquals(resolver.derive("12345"), minted);
        assertEquals(new Fnv1aIdHashFunction().hash(resolver.derive("12345") + "-0"), minted);
        assertEquals(1, resolution.collisionCount());
        assertInjective(existing, resolution.newMappings());
    }

    @Test
    void shouldKeepEarlierRowOnInBatchCollision() {
        // Every source hashes to the same candidate until perturbed with its batch position
        IdHashFunction collidingHash = input -> input.contains("#") ? "7" : "7" + input;
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT, collidingHash, 4);

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(List.of("a", "b", "c"), Map.of());

        assertEquals("7", resolution.assignments().get("a"));
        assertEquals("77-1", resolution.assignments().get("b"));
        assertEquals("77-2", resolution.assignments().get("c"));
        assertEquals(2, resolution.collisionCount());
        assertInjective(Map.of(), resolution.newMappings());
    }

    @Test
    void shouldStayInjectiveUnderAdversarialHash() {
        // Only 50 distinct ids before perturbation, many more sources than that
        IdHashFunction coarse = input -> Integer.toString(Math.floorMod(input.hashCode(), 50));
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT, new IdHashFunction() {
            private final Fnv1aIdHashFunction fnv = new Fnv1aIdHashFunction();

            @Override
            public String hash(String input) {
                return input.contains("#") ? coarse.hash(input) : fnv.hash(input);
            }
        }, 16);
        Map<String, String> existing = new HashMap<>();
        for (int i = 0; i < 20; i++) {
            existing.put("old-" + i, Integer.toString(i));
        }
        List<String> batch = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            batch.add("mrn-" + i);
        }

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(batch, existing);

        assertEquals(500, resolution.newMappings().size());
        assertTrue(resolution.collisionCount() > 0);
        assertInjective(existing, resolution.newMappings());
    }

    @Test
    void shouldFailPastRetryCeiling() {
        IdHashFunction constant = input -> "1";
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT, constant, 3);

        IdentityCollisionException e = assertThrows(IdentityCollisionException.class,
            () -> resolver.resolveBatch(List.of("new"), Map.of("old", "1")));
        assertEquals(0, e.getBatchPosition());
        assertEquals(3, e.getAttempts());
    }

    @Test
    void shouldSkipBlankAndRepeatedSourceIds() {
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SALT);

        PseudonymousIdResolver.BatchResolution resolution =
            resolver.resolveBatch(Arrays.asList("12345", null, " ", "12345", "67890"), Map.of());

        assertEquals(2, resolution.assignments().size());
        assertEquals(2, resolution.newMappings().size());
        assertEquals(List.of(1, 2), resolution.rejectedPositions());
        assertEquals(List.of(3), resolution.duplicatePositions());
    }

    @Test
    void shouldPerturbCandidateWithBatchPosition() {
        IdHashFunction hash = mock(IdHashFunction.class);
        when(hash.hash("salt#a")).thenReturn("1");
        when(hash.hash("salt#b")).thenReturn("1");
        when(hash.hash("1-1")).thenReturn("2");
        SaltedHashIdResolver resolver = new SaltedHashIdResolver("salt", hash, 4);

        PseudonymousIdResolver.BatchResolution resolution = resolver.resolveBatch(List.of("a", "b"), Map.of());

        assertEquals(Map.of("a", "1", "b", "2"), resolution.assignments());
        assertEquals(1, resolution.collisionCount());
        verify(hash).hash("1-1");
        verify(hash, never()).hash("1-0");
    }

    @Test
    void shouldRejectInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new SaltedHashIdResolver(""));
        assertThrows(IllegalArgumentException.class, () -> new SaltedHashIdResolver(SALT, new Fnv1aIdHashFunction(), -1));
    }

    private static void assertInjective(Map<String, String> existing, List<IdentityMapping> newMappings) {
        Set<String> ids = new HashSet<>(existing.values());
        for (IdentityMapping mapping : newMappings) {
            assertTrue(ids.add(mapping.pseudonymousId()), "Duplicate pseudonymous id " + mapping.pseudonymousId());
        }
    }
}
