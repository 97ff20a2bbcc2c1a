package com.specstructure.maven.blocks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds hand-written {@code describe '<descriptor>' do ... end} blocks that carry no markers.
 * <p>
 * The block ends at the first {@code end} (or {@code }} for a brace block) sitting at the
 * same indentation as the {@code describe} line. Blocks found this way have no marker
 * indices; see {@link MethodBlock#isMarked()}.
 */
public final class DescribeBlockFinder {

    private static final Pattern INDENT = Pattern.compile("^(\\s*)");

    /**
     * @param descriptorsByMethodId descriptors to look for, e.g. {@code Cart#add -> #add}
     * @return blocks keyed by method id, for the descriptors that have a describe line
     * @throws BlockParseException if a descriptor has more than one describe line, or its block never closes
     */
    public static Map<String, MethodBlock> find(List<String> lines, Map<String, String> descriptorsByMethodId)
            throws BlockParseException {
        Map<String, MethodBlock> blocks = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : descriptorsByMethodId.entrySet()) {
            String methodId = entry.getKey();
            String descriptor = entry.getValue();
            if (descriptor == null || descriptor.isBlank()) {
                continue;
            }

            Pattern describeLine = describeLinePattern(descriptor);
            List<Integer> matches = new ArrayList<>();
            String closer = null;
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = describeLine.matcher(lines.get(i));
                if (matcher.find()) {
                    matches.add(i);
                    closer = "{".equals(matcher.group(1)) ? "}" : "end";
                }
            }
            if (matches.isEmpty()) {
                continue;
            }
            if (matches.size() > 1) {
                throw new BlockParseException("Multiple describe blocks found for method_id=" + methodId
                        + " (descriptor=" + descriptor + ")");
            }

            int openIdx = matches.get(0);
            int closeIdx = findClose(lines, openIdx, closer);
            if (closeIdx < 0) {
                throw new BlockParseException("Cannot find closing " + closer + " for describe '" + descriptor
                        + "' at line " + (openIdx + 1));
            }
            blocks.put(methodId, MethodBlock.unmarked(methodId, descriptor, openIdx, closeIdx));
        }

        return blocks;
    }

    static Pattern describeLinePattern(String descriptor) {
        return Pattern.compile("^\\s*describe(?:\\s+|\\s*\\()\\s*['\"]" + Pattern.quote(descriptor)
                + "['\"]\\s*\\)?\\s*(do\\b|\\{)");
    }

    private static int findClose(List<String> lines, int openIdx, String closer) {
        String indent = indentOf(lines.get(openIdx));
        for (int j = openIdx + 1; j < lines.size(); j++) {
            String line = lines.get(j);
            if (line.isBlank()) {
                continue;
            }
            String lineIndent = indentOf(line);
            if (lineIndent.length() < indent.length()) {
                return -1;
            }
            if (lineIndent.length() == indent.length()) {
                String rest = line.substring(lineIndent.length()).stripTrailing();
                return rest.equals(closer) || rest.startsWith(closer + " #") ? j : -1;
            }
        }
        return -1;
    }

    private static String indentOf(String line) {
        Matcher matcher = INDENT.matcher(line);
        return matcher.find() ? matcher.group(1) : "";
    }

    private DescribeBlockFinder() {
    }
}
