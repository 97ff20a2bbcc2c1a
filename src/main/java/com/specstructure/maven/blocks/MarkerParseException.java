package com.specstructure.maven.blocks;

import com.specstructure.maven.SpecStructureException;

/**
 * A line of the marker comment family whose attribute syntax is malformed.
 */
public class MarkerParseException extends SpecStructureException {

    private final int lineNumber;

    public MarkerParseException(String message, int lineNumber) {
        super(message + " at line " + lineNumber);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line number of the offending marker.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
