package com.specstructure.maven.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.specstructure.maven.metadata.Characteristic;
import com.specstructure.maven.metadata.CharacteristicValue;

/**
 * Puts the happy path first. Only two-state types are reordered; enum, range and
 * sequential values keep the order the analyzer chose.
 */
public final class StateOrdering {

    private static final List<String> NEGATIVE_PREFIXES = List.of("not_", "no_", "invalid_", "missing_", "without_", "un");

    public static List<CharacteristicValue> order(Characteristic characteristic) {
        List<CharacteristicValue> values = characteristic.getValues();
        if (!characteristic.isBinary() || values.size() != 2) {
            return values;
        }

        if (isNegative(values.get(0).getValue())) {
            List<CharacteristicValue> swapped = new ArrayList<>(values.size());
            swapped.add(values.get(1));
            swapped.add(values.get(0));
            return swapped;
        }
        return values;
    }

    public static boolean isNegative(String value) {
        if (value == null || value.isEmpty()) {
            return true;
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (normalized.equals("false") || normalized.equals("nil")) {
            return true;
        }
        return NEGATIVE_PREFIXES.stream().anyMatch(normalized::startsWith);
    }

    private StateOrdering() {
    }
}
