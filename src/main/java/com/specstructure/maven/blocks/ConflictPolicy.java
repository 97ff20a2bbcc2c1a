package com.specstructure.maven.blocks;

import java.util.Locale;

/**
 * What an insert does when the target already holds the method block.
 */
public enum ConflictPolicy {
    ERROR,
    OVERWRITE,
    SKIP;

    public static ConflictPolicy fromString(String value) throws ApplyException {
        if (value != null) {
            for (ConflictPolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(value.trim())) {
                    return policy;
                }
            }
        }
        throw new ApplyException("Unknown conflict policy: " + value + " (expected error, overwrite or skip)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
