package com.specstructure.maven.blocks;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds marker-delimited method blocks in a line buffer.
 * <p>
 * A block is a {@code method_begin}/{@code method_end} pair with the same {@code method_id},
 * enclosed by a {@code describe ...} line (the nearest non-blank line above the begin marker)
 * and a bare {@code end} line (the nearest non-blank line below the end marker):
 * <pre>
 *   describe '#total' do
 *     # rspec-testing:method_begin method_id="Invoice#total" method="#total"
 *     ...
 *     # rspec-testing:method_end method_id="Invoice#total"
 *   end
 * </pre>
 * Extraction is a pure function of the buffer. Indices are positional, so callers
 * re-extract after every mutation instead of adjusting old results.
 */
public final class MethodBlockExtractor {

    private static final String CLOSER = "end";
    private static final String OPENER_KEYWORD = "describe";

    /**
     * Extracts every method block.
     *
     * @return blocks keyed by method id, in the order they appear in the text
     */
    public static Map<String, MethodBlock> extract(List<String> lines) throws MarkerParseException, BlockParseException {
        Map<String, MethodBlock> blocks = new LinkedHashMap<>();

        int i = 0;
        while (i < lines.size()) {
            Optional<Marker> parsed = MarkerParser.parse(lines.get(i), i + 1);
            if (parsed.isEmpty() || !parsed.get().isBegin()) {
                if (parsed.isPresent() && parsed.get().isEnd()) {
                    throw new BlockParseException("method_end for " + describeId(parsed.get())
                            + " without a preceding method_begin at line " + (i + 1));
                }
                i++;
                continue;
            }

            Marker begin = parsed.get();
            String methodId = begin.getMethodId();
            if (methodId == null || methodId.isBlank()) {
                throw new BlockParseException("method_begin missing method_id at line " + (i + 1));
            }
            if (blocks.containsKey(methodId)) {
                throw new BlockParseException("Duplicate method_id in input: " + methodId + " (again at line "
                        + (i + 1) + ")");
            }

            int beginIdx = i;
            int endIdx = findMatchingEnd(lines, beginIdx, methodId);

            int openIdx = SpecLines.findPrevNonBlank(lines, beginIdx - 1);
            if (openIdx < 0 || !isOpener(lines.get(openIdx))) {
                throw new BlockParseException("Cannot find describe line for " + methodId + " before line "
                        + (beginIdx + 1));
            }

            int closeIdx = SpecLines.findNextNonBlank(lines, endIdx + 1);
            if (closeIdx < 0 || !isCloser(lines.get(closeIdx))) {
                throw new BlockParseException("Cannot find closing end line for " + methodId + " after line "
                        + (endIdx + 1));
            }

            blocks.put(methodId, new MethodBlock(methodId, begin.getAttribute(Marker.METHOD), beginIdx, endIdx,
                    openIdx, closeIdx));
            i = endIdx + 1;
        }

        return blocks;
    }

    /**
     * True for a line that opens a method container: {@code describe} followed by
     * whitespace or an opening parenthesis.
     */
    public static boolean isOpener(String line) {
        String trimmed = line.stripLeading();
        if (!trimmed.startsWith(OPENER_KEYWORD)) {
            return false;
        }
        if (trimmed.length() == OPENER_KEYWORD.length()) {
            return false;
        }
        char next = trimmed.charAt(OPENER_KEYWORD.length());
        return Character.isWhitespace(next) || next == '(';
    }

    /**
     * True for a bare {@code end} line with nothing else on it.
     */
    public static boolean isCloser(String line) {
        return line.trim().equals(CLOSER);
    }

    private static int findMatchingEnd(List<String> lines, int beginIdx, String methodId)
            throws MarkerParseException, BlockParseException {
        for (int j = beginIdx + 1; j < lines.size(); j++) {
            Optional<Marker> parsed = MarkerParser.parse(lines.get(j), j + 1);
            if (parsed.isEmpty()) {
                continue;
            }
            Marker marker = parsed.get();
            if (marker.isBegin()) {
                throw new BlockParseException("Missing method_end for " + methodId + " (begin at line "
                        + (beginIdx + 1) + ") before method_begin for " + describeId(marker) + " at line " + (j + 1));
            }
            if (!marker.isEnd()) {
                continue;
            }
            String endMethodId = marker.getMethodId();
            if (endMethodId == null || endMethodId.isBlank()) {
                throw new BlockParseException("method_end missing method_id at line " + (j + 1));
            }
            if (!endMethodId.equals(methodId)) {
                throw new BlockParseException("method_end method_id mismatch (begin=" + methodId + " at line "
                        + (beginIdx + 1) + ", end=" + endMethodId + ") at line " + (j + 1));
            }
            return j;
        }
        throw new BlockParseException("Missing method_end for " + methodId + " (begin at line " + (beginIdx + 1) + ")");
    }

    private static String describeId(Marker marker) {
        return marker.getMethodId() != null ? marker.getMethodId() : "(no method_id)";
    }

    private MethodBlockExtractor() {
    }
}
