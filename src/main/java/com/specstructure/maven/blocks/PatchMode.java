package com.specstructure.maven.blocks;

import java.util.Locale;

/**
 * How fragment blocks are merged into the target.
 */
public enum PatchMode {
    INSERT,
    REPLACE,
    /** Replace when present, insert when absent. */
    UPSERT;

    public static PatchMode fromString(String value) throws ApplyException {
        if (value != null) {
            for (PatchMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new ApplyException("Unknown mode: " + value + " (expected insert, replace or upsert)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
