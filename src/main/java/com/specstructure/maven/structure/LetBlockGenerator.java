package com.specstructure.maven.structure;

import com.specstructure.maven.metadata.Characteristic;
import com.specstructure.maven.metadata.CharacteristicValue;

/**
 * Builds the {@code let} line that pins a characteristic to the state of its context.
 * Range thresholds are left as {@link Placeholders#THRESHOLD_VALUE}.
 */
public final class LetBlockGenerator {

    public static String generate(Characteristic characteristic, CharacteristicValue value) {
        String type = characteristic.getType();
        String name = characteristic.getName();
        if (type == null || name == null) {
            return null;
        }

        switch (type) {
            case Characteristic.BOOLEAN:
                return let(name, String.valueOf(value.getValue()));
            case Characteristic.PRESENCE:
                return let(name, "present".equals(value.getValue()) ? "true" : "nil");
            case Characteristic.ENUM:
            case Characteristic.SEQUENTIAL:
                return let(name, ":" + value.getValue());
            case Characteristic.RANGE:
                String line = let(name, Placeholders.THRESHOLD_VALUE);
                if (characteristic.getThresholdValue() != null && characteristic.getThresholdOperator() != null) {
                    line += "  # " + characteristic.getThresholdOperator() + " " + characteristic.getThresholdValue();
                }
                return line;
            default:
                return null;
        }
    }

    private static String let(String name, String rubyValue) {
        return "let(:" + name + ") { " + rubyValue + " }";
    }

    private LetBlockGenerator() {
    }
}
