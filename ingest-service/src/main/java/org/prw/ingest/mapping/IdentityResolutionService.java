package org.prw.ingest.mapping;

import org.prw.processing.identity.PseudonymousIdResolver;
import org.prw.processing.identity.PseudonymousIdResolver.BatchResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves batches against the identity store and commits the new rows.
 * <p>
 * Load, resolve and append run under one exclusive lock: a {@link ReentrantLock} for threads in
 * this JVM and a {@link FileLock} on the lock file for other processes sharing the store.
 * Nothing is appended if resolution fails.
 */
public class IdentityResolutionService {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolutionService.class);

    private final IdentityMappingStore store;
    private final PseudonymousIdResolver resolver;
    private final Path lockFile;
    private final ReentrantLock lock = new ReentrantLock();

    public IdentityResolutionService(IdentityMappingStore store, PseudonymousIdResolver resolver, Path lockFile) {
        this.store = store;
        this.resolver = resolver;
        this.lockFile = lockFile;
    }

    /**
     * Lock file conventionally kept next to the store: {@code <store>.lock}.
     */
    public static Path lockFileFor(Path storeFile) {
        return storeFile.resolveSibling(storeFile.getFileName() + ".lock");
    }

    public BatchResolution resolveAndCommit(List<String> sourceIds) throws IOException {
        lock.lock();
        try {
            if (lockFile.toAbsolutePath().getParent() != null) {
                Files.createDirectories(lockFile.toAbsolutePath().getParent());
            }
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                Map<String, String> existing = store.load();
                BatchResolution resolution = resolver.resolveBatch(sourceIds, existing);
                store.append(resolution.newMappings());

                log.info("Committed {} new identity mappings for a batch of {} rows",
                    resolution.newMappings().size(), sourceIds.size());
                return resolution;
            }
        } finally {
            lock.unlock();
        }
    }
}
