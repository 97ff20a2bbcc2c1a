package com.specstructure.maven.structure;

/**
 * One generated example.
 */
public class ItBlock {

    private final String description;
    private final boolean sideEffect;

    public ItBlock(String description, boolean sideEffect) {
        this.description = description;
        this.sideEffect = sideEffect;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSideEffect() {
        return sideEffect;
    }
}
