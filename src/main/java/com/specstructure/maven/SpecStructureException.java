package com.specstructure.maven;

/**
 * Base class for fatal errors raised while generating or patching spec structure.
 * Every subclass aborts the current invocation; none is retried.
 */
public class SpecStructureException extends Exception {

    public SpecStructureException(String message) {
        super(message);
    }

    public SpecStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
