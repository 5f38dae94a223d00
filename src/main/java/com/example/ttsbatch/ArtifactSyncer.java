package com.example.ttsbatch;

import java.nio.file.Path;

/**
 * Receives every file the run writes (segments and manifest rewrites) for mirroring elsewhere.
 * Implementations must not block the calling worker.
 */
@FunctionalInterface
public interface ArtifactSyncer extends AutoCloseable {
    void mirror(Path artifact);

    /**
     * Flushes outstanding work. Never throws.
     */
    @Override
    default void close() {
    }

    static ArtifactSyncer noop() {
        return artifact -> {
        };
    }
}
