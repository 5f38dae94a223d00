package com.example.ttsbatch;

import com.example.ttsbatch.model.WorkUnit;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reads the chunked input: a JSON array of {@code {index, groupId, text}}.
 * <p>
 * Indices must be unique and dense. Input numbered from 1 is shifted to start at 0.
 */
public class WorkUnitLoader {
    private final ObjectMapper mapper;

    public WorkUnitLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<WorkUnit> load(Path path) throws IOException {
        RawUnit[] raw = mapper.readValue(path.toFile(), RawUnit[].class);
        return normalize(raw == null ? List.of() : Arrays.asList(raw));
    }

    private List<WorkUnit> normalize(List<RawUnit> raw) {
        List<RawUnit> sorted = new ArrayList<>(raw);
        for (RawUnit unit : sorted) {
            if (unit == null || unit.index == null) {
                throw new IllegalArgumentException("Every unit needs an index.");
            }
            if (unit.groupId == null || unit.groupId.isBlank()
                    || unit.groupId.contains("..") || unit.groupId.startsWith("/") || unit.groupId.contains("\\")) {
                throw new IllegalArgumentException("Unit " + unit.index + " has an invalid groupId: " + unit.groupId);
            }
            if (unit.text == null || unit.text.isBlank()) {
                throw new IllegalArgumentException("Unit " + unit.index + " has no text.");
            }
        }
        sorted.sort(Comparator.comparingInt(unit -> unit.index));
        if (sorted.isEmpty()) {
            return List.of();
        }
        int offset = sorted.get(0).index;
        if (offset != 0 && offset != 1) {
            throw new IllegalArgumentException("Unit indices must start at 0 or 1, found " + offset);
        }
        List<WorkUnit> units = new ArrayList<>(sorted.size());
        for (int position = 0; position < sorted.size(); position++) {
            RawUnit unit = sorted.get(position);
            int index = unit.index - offset;
            if (index != position) {
                throw new IllegalArgumentException("Unit indices must be unique and dense; expected "
                        + (position + offset) + " but found " + unit.index);
            }
            units.add(WorkUnit.of(index, unit.groupId, unit.text));
        }
        return List.copyOf(units);
    }

    private static class RawUnit {
        public Integer index;
        public String groupId;
        public String text;
    }
}
