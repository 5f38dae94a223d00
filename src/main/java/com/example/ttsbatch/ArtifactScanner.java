package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Finds units whose audio is already present under the output directory.
 */
public class ArtifactScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactScanner.class);

    private final Path outputDirectory;
    private final Tika tika;

    /**
     * @param tika content detector used to reject non-audio files; null accepts any non-empty file
     */
    public ArtifactScanner(Path outputDirectory, Tika tika) {
        this.outputDirectory = outputDirectory;
        this.tika = tika;
    }

    public SortedSet<Integer> scan(List<WorkUnit> units) {
        SortedSet<Integer> produced = new TreeSet<>();
        for (WorkUnit unit : units) {
            if (isProduced(outputDirectory.resolve(unit.outputKey()))) {
                produced.add(unit.index());
            }
        }
        return produced;
    }

    boolean isProduced(Path artifact) {
        try {
            if (!Files.isRegularFile(artifact) || Files.size(artifact) == 0) {
                return false;
            }
            if (tika == null) {
                return true;
            }
            String type = tika.detect(artifact);
            if (!type.startsWith("audio/")) {
                LOGGER.warn("Ignoring {}: detected {} instead of audio", artifact, type);
                return false;
            }
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Failed to inspect {}", artifact, ex);
            return false;
        }
    }
}
