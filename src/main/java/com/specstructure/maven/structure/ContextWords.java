package com.specstructure.maven.structure;

import com.specstructure.maven.metadata.Characteristic;

/**
 * Chooses the word that opens a context description.
 * <ul>
 * <li>level 1: always {@code when}</li>
 * <li>enum / sequential: {@code and}</li>
 * <li>boolean / presence, and range with two values: {@code with} then {@code but}</li>
 * <li>range with three or more values: {@code and}</li>
 * </ul>
 * Anything else yields {@link Placeholders#CONTEXT_WORD} for manual disambiguation.
 */
public final class ContextWords {

    public static final String OPENING = "when";
    public static final String POSITIVE = "with";
    public static final String CONTRAST = "but";
    public static final String CONTINUATION = "and";

    public static String determine(Characteristic characteristic, int stateIndex, int level) {
        if (level == 1) {
            return OPENING;
        }

        String type = characteristic.getType();
        if (type == null) {
            return Placeholders.CONTEXT_WORD;
        }
        switch (type) {
            case Characteristic.ENUM:
            case Characteristic.SEQUENTIAL:
                return CONTINUATION;
            case Characteristic.BOOLEAN:
            case Characteristic.PRESENCE:
                return binaryWord(stateIndex);
            case Characteristic.RANGE:
                return characteristic.getValues().size() == 2 ? binaryWord(stateIndex) : CONTINUATION;
            default:
                return Placeholders.CONTEXT_WORD;
        }
    }

    private static String binaryWord(int stateIndex) {
        return stateIndex == 0 ? POSITIVE : CONTRAST;
    }

    private ContextWords() {
    }
}
