package com.specstructure.maven.materialize;

import java.nio.file.Path;
import java.util.List;

import com.specstructure.maven.blocks.PatchOperation;

/**
 * What a materialize run did to one spec file.
 */
public class MaterializeResult {

    private final Path specPath;
    private final boolean created;
    private final List<String> lines;
    private final List<PatchOperation> operations;
    private final List<String> warnings;

    public MaterializeResult(Path specPath, boolean created, List<String> lines, List<PatchOperation> operations,
            List<String> warnings) {
        this.specPath = specPath;
        this.created = created;
        this.lines = List.copyOf(lines);
        this.operations = List.copyOf(operations);
        this.warnings = List.copyOf(warnings);
    }

    public Path getSpecPath() {
        return specPath;
    }

    /**
     * True if the spec file did not exist and a wrapper was generated for it.
     */
    public boolean isCreated() {
        return created;
    }

    /**
     * Final content of the spec, whether or not it was written.
     */
    public List<String> getLines() {
        return lines;
    }

    public List<PatchOperation> getOperations() {
        return operations;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
