package com.specstructure.maven.metadata;

import com.specstructure.maven.SpecStructureException;

/**
 * Raised when a metadata document cannot be read or does not have the expected shape.
 */
public class MetadataException extends SpecStructureException {

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
