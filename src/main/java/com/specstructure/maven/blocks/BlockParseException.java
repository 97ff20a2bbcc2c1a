package com.specstructure.maven.blocks;

import com.specstructure.maven.SpecStructureException;

/**
 * Method blocks cannot be located unambiguously: unmatched begin/end markers, a missing
 * describe or end line around them, or a method id that appears twice.
 */
public class BlockParseException extends SpecStructureException {

    public BlockParseException(String message) {
        super(message);
    }
}
