package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;
import com.example.ttsbatch.model.WorkUnit;
import com.example.ttsbatch.model.WorkerAssignment;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResumePlannerTest {
    static final byte[] MP3_BYTES = {'I', 'D', '3', 0x03, 0x00, 0x00, 0x00, 0x00, 0x00, 0x0A, 0, 0, 0, 0, 0, 0};

    @Test
    void resumesFromManifest() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        List<WorkUnit> units = units(636);
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 636, IntStream.range(0, 120).boxed().toList());

        ResumePlanner planner = new ResumePlanner(new ManifestStore(output.resolve("manifest.json")),
                new ArtifactScanner(output, null));
        ResumePlan plan = planner.plan(units);

        assertEquals(ResumePlan.Source.MANIFEST, plan.source());
        assertEquals(516, plan.missing().size());
        assertEquals(120, plan.missing().first());
        assertEquals(635, plan.missing().last());

        List<WorkUnit> pending = plan.pendingUnits(units);
        List<WorkerAssignment> assignments = ChunkDistributor.distribute(pending, 12);
        Set<Integer> assigned = new HashSet<>();
        assignments.forEach(assignment -> assigned.addAll(assignment.indices()));
        assertEquals(plan.missing(), new TreeSet<>(assigned));
    }

    @Test
    void planningIsIdempotent() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        List<WorkUnit> units = units(10);
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 10, List.of(1, 2, 3));
        ResumePlanner planner = new ResumePlanner(store, new ArtifactScanner(output, null));

        ResumePlan first = planner.plan(units);
        ResumePlan second = planner.plan(units);

        assertEquals(first.missing(), second.missing());
        assertEquals(first.completed(), second.completed());
    }

    @Test
    void previouslyFailedUnitsAreRetried() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        List<WorkUnit> units = units(4);
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 4, List.of(0, 1));
        store.markFailed(new FailedUnitRecord(
                2, 1, 3, 3, Instant.EPOCH, "boom", List.of()));

        ResumePlan plan = new ResumePlanner(store, new ArtifactScanner(output, null)).plan(units);

        assertEquals(Set.of(2), plan.previouslyFailed());
        assertEquals(List.of(2, 3), List.copyOf(plan.missing()));
    }

    @Test
    void completedRunHasNothingMissing() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        List<WorkUnit> units = units(3);
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 3, List.of(0, 1, 2));

        ResumePlan plan = new ResumePlanner(store, new ArtifactScanner(output, null)).plan(units);

        assertTrue(plan.isComplete());
        assertTrue(plan.pendingUnits(units).isEmpty());
    }

    @Test
    void fallsBackToValidatedArtifacts() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        List<WorkUnit> units = units(4);
        write(output.resolve(units.get(0).outputKey()), MP3_BYTES);
        write(output.resolve(units.get(2).outputKey()), MP3_BYTES);
        write(output.resolve(units.get(3).outputKey()), "<html>quota exceeded</html>".getBytes());
        write(output.resolve(units.get(1).outputKey()), new byte[0]);

        ResumePlanner planner = new ResumePlanner(new ManifestStore(output.resolve("manifest.json")),
                new ArtifactScanner(output, new Tika()));
        ResumePlan plan = planner.plan(units);

        assertEquals(ResumePlan.Source.ARTIFACTS, plan.source());
        assertEquals(List.of(0, 2), List.copyOf(plan.completed()));
        assertEquals(List.of(1, 3), List.copyOf(plan.missing()));
    }

    @Test
    void rejectsManifestForDifferentInput() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 5, List.of(0));

        ResumePlanner planner = new ResumePlanner(new ManifestStore(output.resolve("manifest.json")),
                new ArtifactScanner(output, null));

        assertThrows(ManifestCorruptionException.class, () -> planner.plan(units(7)));
    }

    @Test
    void freshPlanIgnoresProgress() throws Exception {
        Path output = Files.createTempDirectory("resume-output");
        ManifestStore store = new ManifestStore(output.resolve("manifest.json"));
        store.initialize(output, 3, List.of(0, 1, 2));

        ResumePlan plan = new ResumePlanner(store, new ArtifactScanner(output, null)).fresh(units(3));

        assertEquals(ResumePlan.Source.FRESH, plan.source());
        assertEquals(3, plan.missing().size());
    }

    static List<WorkUnit> units(int count) {
        return IntStream.range(0, count)
                .mapToObj(index -> WorkUnit.of(index, "book", "Sentence number " + index + "."))
                .toList();
    }

    private static void write(Path path, byte[] bytes) throws Exception {
        Files.createDirectories(path.getParent());
        Files.write(path, bytes);
    }
}
