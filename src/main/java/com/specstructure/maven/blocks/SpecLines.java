package com.specstructure.maven.blocks;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line buffer helpers. A file is read as its lines without the final newline and written
 * back with exactly one, so reading and writing an untouched buffer is byte-identical.
 */
public final class SpecLines {

    private static final char BOM = '\uFEFF';

    public static List<String> read(Path path) throws IOException {
        return split(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static void write(Path path, List<String> lines) throws IOException {
        Files.writeString(path, join(lines), StandardCharsets.UTF_8);
    }

    public static List<String> split(String text) {
        String content = text;
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        if (content.endsWith("\n")) {
            content = content.substring(0, content.length() - 1);
        }
        if (content.isEmpty() && !text.endsWith("\n")) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(content.split("\n", -1)));
    }

    public static String join(List<String> lines) {
        return String.join("\n", lines) + "\n";
    }

    /**
     * Index of the nearest non-blank line at or above {@code fromIndex}, or -1.
     */
    public static int findPrevNonBlank(List<String> lines, int fromIndex) {
        for (int i = Math.min(fromIndex, lines.size() - 1); i >= 0; i--) {
            if (!lines.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the nearest non-blank line at or below {@code fromIndex}, or -1.
     */
    public static int findNextNonBlank(List<String> lines, int fromIndex) {
        for (int i = Math.max(fromIndex, 0); i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private SpecLines() {
    }
}
