package com.specstructure.maven.structure;

/**
 * Tokens left in generated specs for a human (or a later stage) to fill in.
 */
public final class Placeholders {

    public static final String BEHAVIOR_DESCRIPTION = "{BEHAVIOR_DESCRIPTION}";
    public static final String CONTEXT_WORD = "{CONTEXT_WORD}";
    public static final String EXPECTATION = "{EXPECTATION}";
    public static final String SETUP_CODE = "{SETUP_CODE}";
    public static final String COMMON_SETUP = "{COMMON_SETUP}";
    public static final String THRESHOLD_VALUE = "{THRESHOLD_VALUE}";

    private Placeholders() {
    }
}
