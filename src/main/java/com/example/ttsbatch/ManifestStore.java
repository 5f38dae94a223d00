package com.example.ttsbatch;

import com.example.ttsbatch.model.FailedUnitRecord;
import com.example.ttsbatch.model.ManifestState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Single writer for the run manifest.
 * <p>
 * Workers mark units through this store; every mark is merged into the in-memory index
 * sets under the store's lock and the merged document is then written atomically, so
 * concurrent marks from different workers are never lost.
 */
public final class ManifestStore {
    private final ObjectMapper mapper;
    private final Path manifestPath;
    private final ArtifactSyncer syncer;
    private final Clock clock;

    private String outputDirectory;
    private int totalUnits = -1;
    private final SortedSet<Integer> completed = new TreeSet<>();
    private final SortedSet<Integer> failed = new TreeSet<>();
    private final Map<Integer, FailedUnitRecord> failures = new TreeMap<>();

    public ManifestStore(Path manifestPath) {
        this(manifestPath, ArtifactSyncer.noop(), Clock.systemUTC());
    }

    public ManifestStore(Path manifestPath, ArtifactSyncer syncer, Clock clock) {
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.manifestPath = manifestPath;
        this.syncer = syncer == null ? ArtifactSyncer.noop() : syncer;
        this.clock = clock;
    }

    /**
     * Reads the manifest if it exists and makes it the base state for later marks.
     *
     * @throws ManifestCorruptionException if the file is unreadable or inconsistent
     */
    public synchronized Optional<ManifestState> load() throws IOException {
        if (!Files.exists(manifestPath)) {
            return Optional.empty();
        }
        ManifestState state;
        try (Reader reader = Files.newBufferedReader(manifestPath)) {
            state = mapper.readValue(reader, ManifestState.class);
        } catch (JsonProcessingException ex) {
            throw new ManifestCorruptionException(manifestPath, "Manifest is not valid JSON", ex);
        }
        if (state == null) {
            throw new ManifestCorruptionException(manifestPath, "Manifest is empty");
        }
        validate(state);
        adopt(state);
        return Optional.of(snapshot());
    }

    /**
     * Starts a new manifest for {@code totalUnits} units, seeding it with already produced indices.
     */
    public synchronized void initialize(Path outputDirectory, int totalUnits, Collection<Integer> alreadyCompleted)
            throws IOException {
        if (totalUnits < 0) {
            throw new IllegalArgumentException("totalUnits must not be negative: " + totalUnits);
        }
        this.outputDirectory = outputDirectory.toAbsolutePath().toString();
        this.totalUnits = totalUnits;
        completed.clear();
        failed.clear();
        failures.clear();
        for (Integer index : alreadyCompleted) {
            checkRange(index);
            completed.add(index);
        }
        persist();
    }

    public synchronized void markCompleted(int index) throws IOException {
        checkOpen();
        checkRange(index);
        completed.add(index);
        failed.remove(index);
        failures.remove(index);
        persist();
    }

    /**
     * Records a permanent failure. A unit that is already completed stays completed.
     */
    public synchronized void markFailed(FailedUnitRecord record) throws IOException {
        checkOpen();
        checkRange(record.index());
        if (completed.contains(record.index())) {
            return;
        }
        failed.add(record.index());
        failures.put(record.index(), record);
        persist();
    }

    public synchronized ManifestState snapshot() {
        checkOpen();
        return new ManifestState(
                outputDirectory,
                totalUnits,
                new ArrayList<>(completed),
                new ArrayList<>(failed),
                new TreeMap<>(failures),
                clock.instant()
        );
    }

    public synchronized boolean isOpen() {
        return totalUnits >= 0;
    }

    public Path path() {
        return manifestPath;
    }

    private void adopt(ManifestState state) {
        outputDirectory = state.outputDirectory();
        totalUnits = state.totalUnits();
        completed.clear();
        completed.addAll(state.completedIndices());
        failed.clear();
        failed.addAll(state.failedIndices());
        failures.clear();
        if (state.failures() != null) {
            failures.putAll(state.failures());
        }
    }

    private void validate(ManifestState state) throws ManifestCorruptionException {
        if (state.totalUnits() < 0) {
            throw new ManifestCorruptionException(manifestPath, "Negative totalUnits " + state.totalUnits());
        }
        if (state.completedIndices() == null || state.failedIndices() == null) {
            throw new ManifestCorruptionException(manifestPath, "Manifest is missing its index lists");
        }
        SortedSet<Integer> seen = new TreeSet<>();
        for (Integer index : state.completedIndices()) {
            checkPersistedIndex(state, index);
            if (!seen.add(index)) {
                throw new ManifestCorruptionException(manifestPath, "Index " + index + " listed twice as completed");
            }
        }
        for (Integer index : state.failedIndices()) {
            checkPersistedIndex(state, index);
            if (!seen.add(index)) {
                throw new ManifestCorruptionException(manifestPath, "Index " + index + " is both completed and failed");
            }
        }
    }

    private void checkPersistedIndex(ManifestState state, Integer index) throws ManifestCorruptionException {
        if (index == null || index < 0 || index >= state.totalUnits()) {
            throw new ManifestCorruptionException(manifestPath,
                    "Index " + index + " outside 0.." + (state.totalUnits() - 1));
        }
    }

    private void checkOpen() {
        if (totalUnits < 0) {
            throw new IllegalStateException("Manifest has not been loaded or initialized: " + manifestPath);
        }
    }

    private void checkRange(int index) {
        if (index < 0 || index >= totalUnits) {
            throw new IllegalArgumentException("Index " + index + " outside 0.." + (totalUnits - 1));
        }
    }

    private void persist() throws IOException {
        Path parent = manifestPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, manifestPath.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot());
            Files.move(temp, manifestPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        syncer.mirror(manifestPath);
    }
}
