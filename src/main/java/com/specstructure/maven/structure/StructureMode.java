package com.specstructure.maven.structure;

import java.util.Locale;

import com.specstructure.maven.SpecStructureException;

/**
 * Output shape of {@link SpecCodeGenerator}.
 */
public enum StructureMode {
    /** A complete spec file with the outer {@code RSpec.describe} wrapper. */
    FULL,
    /** Bare method blocks for the patcher. */
    FRAGMENT;

    public static StructureMode fromString(String value) throws SpecStructureException {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if ("full".equals(normalized)) {
                return FULL;
            }
            if ("fragment".equals(normalized) || "blocks".equals(normalized)) {
                return FRAGMENT;
            }
        }
        throw new SpecStructureException("Unknown structure mode: " + value + " (expected full or fragment)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
