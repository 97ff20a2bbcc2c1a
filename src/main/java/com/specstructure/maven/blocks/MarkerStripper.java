package com.specstructure.maven.blocks;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes every {@code # rspec-testing:...} comment line, leaving the describe blocks as
 * plain hand-maintained code. Run once the generated skeleton has been filled in.
 */
public final class MarkerStripper {

    public static List<String> strip(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!MarkerParser.isMarkerLine(line)) {
                result.add(line);
            }
        }
        return result;
    }

    private MarkerStripper() {
    }
}
