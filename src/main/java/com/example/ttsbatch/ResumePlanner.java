package com.example.ttsbatch;

import com.example.ttsbatch.model.ManifestState;
import com.example.ttsbatch.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reconciles persisted progress with the full unit list.
 * <p>
 * The manifest is authoritative when it exists; without one, produced artifacts are
 * scanned instead. Calling {@link #plan(List)} repeatedly without new work yields the
 * same result.
 */
public final class ResumePlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResumePlanner.class);

    private final ManifestStore manifestStore;
    private final ArtifactScanner artifactScanner;

    public ResumePlanner(ManifestStore manifestStore, ArtifactScanner artifactScanner) {
        this.manifestStore = manifestStore;
        this.artifactScanner = artifactScanner;
    }

    /**
     * @throws ManifestCorruptionException if the manifest is unreadable or was written for a different input
     */
    public ResumePlan plan(List<WorkUnit> units) throws IOException {
        int totalUnits = units.size();
        Optional<ManifestState> manifest = manifestStore.load();
        if (manifest.isPresent()) {
            ManifestState state = manifest.get();
            if (state.totalUnits() != totalUnits) {
                throw new ManifestCorruptionException(manifestStore.path(),
                        "Manifest records " + state.totalUnits() + " units but the input has " + totalUnits);
            }
            ResumePlan plan = build(totalUnits, new TreeSet<>(state.completedIndices()),
                    new TreeSet<>(state.failedIndices()), ResumePlan.Source.MANIFEST);
            log(plan);
            return plan;
        }
        ResumePlan plan = build(totalUnits, artifactScanner.scan(units), new TreeSet<>(), ResumePlan.Source.ARTIFACTS);
        log(plan);
        return plan;
    }

    /**
     * Plan that ignores any earlier progress.
     */
    public ResumePlan fresh(List<WorkUnit> units) {
        return build(units.size(), new TreeSet<>(), new TreeSet<>(), ResumePlan.Source.FRESH);
    }

    private ResumePlan build(int totalUnits,
                             SortedSet<Integer> completed,
                             SortedSet<Integer> failed,
                             ResumePlan.Source source) {
        SortedSet<Integer> missing = new TreeSet<>();
        for (int index = 0; index < totalUnits; index++) {
            if (!completed.contains(index)) {
                missing.add(index);
            }
        }
        return new ResumePlan(
                totalUnits,
                Collections.unmodifiableSortedSet(completed),
                Collections.unmodifiableSortedSet(failed),
                Collections.unmodifiableSortedSet(missing),
                source
        );
    }

    private void log(ResumePlan plan) {
        LOGGER.info("Resume plan from {}: {} completed, {} previously failed, {} missing of {}",
                plan.source(), plan.completed().size(), plan.previouslyFailed().size(),
                plan.missing().size(), plan.totalUnits());
    }
}
