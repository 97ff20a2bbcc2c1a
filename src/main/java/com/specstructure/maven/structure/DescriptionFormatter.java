package com.specstructure.maven.structure;

import java.util.regex.Pattern;

import com.specstructure.maven.metadata.Characteristic;
import com.specstructure.maven.metadata.CharacteristicValue;

/**
 * Turns a (characteristic, value) pair into a context description.
 * Binary types use the value description as is; other types read
 * {@code "<name> is <value>"}. A standalone "not" is upper-cased.
 */
public final class DescriptionFormatter {

    private static final Pattern NOT_WORD = Pattern.compile("\\bnot\\b", Pattern.CASE_INSENSITIVE);

    public static String format(Characteristic characteristic, CharacteristicValue value) {
        String description = value.getDescription() != null
                ? value.getDescription()
                : humanize(value.getValue());
        description = emphasizeNot(description);

        if (characteristic.isBinary()) {
            return description;
        }
        return humanize(characteristic.getName()) + " is " + description;
    }

    public static String humanize(String name) {
        return name == null ? "" : name.replace('_', ' ');
    }

    public static String emphasizeNot(String text) {
        return NOT_WORD.matcher(text).replaceAll("NOT");
    }

    private DescriptionFormatter() {
    }
}
