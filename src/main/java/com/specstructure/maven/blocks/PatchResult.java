package com.specstructure.maven.blocks;

import java.util.List;

/**
 * Patched buffer plus the per-method operation log.
 */
public class PatchResult {

    private final List<String> lines;
    private final PatchMode mode;
    private final ConflictPolicy conflictPolicy;
    private final List<PatchOperation> operations;

    public PatchResult(List<String> lines, PatchMode mode, ConflictPolicy conflictPolicy,
            List<PatchOperation> operations) {
        this.lines = List.copyOf(lines);
        this.mode = mode;
        this.conflictPolicy = conflictPolicy;
        this.operations = List.copyOf(operations);
    }

    public List<String> getLines() {
        return lines;
    }

    public PatchMode getMode() {
        return mode;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public List<PatchOperation> getOperations() {
        return operations;
    }

    /**
     * True if at least one block was inserted or replaced.
     */
    public boolean isModified() {
        return operations.stream().anyMatch(op -> op.getStatus() != PatchOperation.Status.SKIPPED);
    }
}
