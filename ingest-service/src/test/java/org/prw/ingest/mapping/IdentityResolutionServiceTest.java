package org.prw.ingest.mapping;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.prw.common.exception.IdentityCollisionException;
import org.prw.common.salt.SaltLoader;
import org.prw.data.identity.IdentityMapping;
import org.prw.processing.identity.PseudonymousIdResolver;
import org.prw.processing.identity.PseudonymousIdResolver.BatchResolution;
import org.prw.processing.identity.SaltedHashIdResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdentityResolutionServiceTest {

    @Test
    void shouldAppendNewMappingsAfterLoading(@TempDir Path testDir) throws IOException {
        IdentityMappingStore store = mock(IdentityMappingStore.class);
        when(store.load()).thenReturn(Map.of("100", "9001"));
        IdentityResolutionService service = new IdentityResolutionService(
            store, new SaltedHashIdResolver(SaltLoader.DEFAULT_SALT), testDir.resolve("mapping.csv.lock"));

        BatchResolution resolution = service.resolveAndCommit(List.of("100", "200"));

        Assertions.assertEquals("9001", resolution.assignments().get("100"));
        Assertions.assertEquals(1, resolution.reusedCount());
        Assertions.assertEquals(1, resolution.newMappings().size());
        Assertions.assertEquals("200", resolution.newMappings().get(0).sourceId());

        InOrder order = inOrder(store);
        order.verify(store).load();
        order.verify(store).append(resolution.newMappings());
        Assertions.assertTrue(Files.exists(testDir.resolve("mapping.csv.lock")));
    }

    @Test
    void shouldCommitNothingWhenResolutionFails(@TempDir Path testDir) throws IOException {
        IdentityMappingStore store = mock(IdentityMappingStore.class);
        when(store.load()).thenReturn(Map.of());
        PseudonymousIdResolver resolver = mock(PseudonymousIdResolver.class);
        when(resolver.resolveBatch(anyList(), anyMap())).thenThrow(new IdentityCollisionException(4, 16));
        IdentityResolutionService service = new IdentityResolutionService(store, resolver, testDir.resolve("lock"));

        Assertions.assertThrows(IdentityCollisionException.class, () -> service.resolveAndCommit(List.of("100")));

        verify(store, never()).append(any());
    }

    @Test
    void shouldKeepStoreInjectiveUnderConcurrentBatches(@TempDir Path testDir) throws Exception {
        Path storeFile = testDir.resolve("mapping.csv");
        DelimitedFileIdentityMappingStore store = new DelimitedFileIdentityMappingStore(storeFile);
        // every source hashes to the same candidate, forcing a rehash for each new row
        SaltedHashIdResolver resolver = new SaltedHashIdResolver(SaltLoader.DEFAULT_SALT,
            input -> input.startsWith(SaltLoader.DEFAULT_SALT) ? "1" : "r" + input, 64);
        IdentityResolutionService service = new IdentityResolutionService(
            store, resolver, IdentityResolutionService.lockFileFor(storeFile));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<BatchResolution>> futures = new ArrayList<>();
            for (int batch = 0; batch < 4; batch++) {
                List<String> sourceIds = new ArrayList<>();
                for (int i = 0; i < 5; i++) {
                    sourceIds.add("src-" + batch + "-" + i);
                }
                futures.add(pool.submit(() -> service.resolveAndCommit(sourceIds)));
            }
            for (Future<BatchResolution> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdown();
        }

        Map<String, String> stored = store.load();
        Assertions.assertEquals(20, stored.size());
        Assertions.assertEquals(20, new HashSet<>(stored.values()).size());
    }

    @Test
    void shouldPlaceLockFileNextToStore() {
        Assertions.assertEquals(Path.of("/data/identity/mapping.csv.lock"),
            IdentityResolutionService.lockFileFor(Path.of("/data/identity/mapping.csv")));
    }

    @Test
    void shouldReuseStoredIdsOnRerun(@TempDir Path testDir) throws IOException {
        Path storeFile = testDir.resolve("mapping.csv");
        IdentityResolutionService service = new IdentityResolutionService(
            new DelimitedFileIdentityMappingStore(storeFile),
            new SaltedHashIdResolver(SaltLoader.DEFAULT_SALT),
            IdentityResolutionService.lockFileFor(storeFile));

        BatchResolution first = service.resolveAndCommit(List.of("100", "200"));
        BatchResolution second = service.resolveAndCommit(List.of("200", "100", "300"));

        Assertions.assertEquals(first.assignments().get("100"), second.assignments().get("100"));
        Assertions.assertEquals(first.assignments().get("200"), second.assignments().get("200"));
        Assertions.assertEquals(2, second.reusedCount());
        Assertions.assertEquals(List.of("300"), second.newMappings().stream().map(IdentityMapping::sourceId).toList());
    }
}
