package com.specstructure.maven.metadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions for loosely typed YAML scalars. Characteristic values may be written
 * as booleans, numbers or strings; they are compared by their string form.
 */
final class Scalars {

    static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    static Integer asInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(asString(item));
            }
        } else if (value != null) {
            result.add(asString(value));
        }
        return result;
    }

    private Scalars() {
    }
}
