package com.example.ttsbatch.model;

/**
 * One chunk of input text and the output slot its audio is written to.
 */
public record WorkUnit(
        int index,
        String groupId,
        String payload,
        String outputKey
) {
    /**
     * Creates a unit whose output key is derived from its group and global index.
     */
    public static WorkUnit of(int index, String groupId, String payload) {
        return new WorkUnit(index, groupId, payload, outputKeyFor(index, groupId));
    }

    public static String outputKeyFor(int index, String groupId) {
        return String.format("%s/chunk-%05d.mp3", groupId, index);
    }
}
