package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes synthesized audio to the unit's output key under the output directory.
 */
public class SegmentWriter {
    private final Path outputDirectory;
    private final ArtifactSyncer syncer;

    public SegmentWriter(Path outputDirectory) {
        this(outputDirectory, ArtifactSyncer.noop());
    }

    public SegmentWriter(Path outputDirectory, ArtifactSyncer syncer) {
        this.outputDirectory = outputDirectory;
        this.syncer = syncer == null ? ArtifactSyncer.noop() : syncer;
    }

    /**
     * Writes through a temporary file so a partially written segment is never visible under its final name.
     */
    public Path write(WorkUnit unit, byte[] audio) throws IOException {
        Path target = outputDirectory.resolve(unit.outputKey());
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".part");
        Files.write(temp, audio);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        syncer.mirror(target);
        return target;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }
}
