package com.specstructure.maven.blocks;

/**
 * An insert hit an existing block under {@link ConflictPolicy#ERROR}. Callers report this
 * separately from other failures because it needs a human decision, not a fix.
 */
public class ConflictException extends ApplyException {

    private final String methodId;

    public ConflictException(String methodId) {
        super("target spec already contains method_id=" + methodId);
        this.methodId = methodId;
    }

    public String getMethodId() {
        return methodId;
    }
}
