package com.specstructure.maven.blocks;

import com.specstructure.maven.SpecStructureException;

/**
 * A patch request that cannot be carried out against the given inputs.
 */
public class ApplyException extends SpecStructureException {

    public ApplyException(String message) {
        super(message);
    }
}
