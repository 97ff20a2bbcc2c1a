package com.specstructure.maven.blocks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses marker comment lines.
 * <p>
 * Grammar:
 * <pre>
 * marker    := WS* '#' WS* 'rspec-testing:' directive (WS+ attribute)* (WS+ comment)? WS*
 * directive := [A-Za-z0-9_]+
 * attribute := key '=' '"' (escape | [^"\\])* '"'
 * key       := [A-Za-z0-9_]+
 * escape    := '\\' ('"' | '\\')
 * comment   := any text not starting with key '='
 * </pre>
 * A line that does not start with the {@code # rspec-testing:} prefix is not a marker.
 * Once the prefix is seen, any deviation from the grammar is a {@link MarkerParseException}.
 * A trailing comment is only allowed after at least one attribute.
 */
public final class MarkerParser {

    private static final String PREFIX = Marker.NAMESPACE + ":";

    /**
     * Parses one line.
     *
     * @param line       the raw line
     * @param lineNumber 1-based line number used in error messages
     * @return the marker, or empty when the line is not a marker comment
     */
    public static Optional<Marker> parse(String line, int lineNumber) throws MarkerParseException {
        int pos = markerBodyStart(line);
        if (pos < 0) {
            return Optional.empty();
        }

        int directiveStart = pos;
        while (pos < line.length() && isWordChar(line.charAt(pos))) {
            pos++;
        }
        if (pos == directiveStart) {
            throw new MarkerParseException("Marker is missing a directive after '" + PREFIX + "'", lineNumber);
        }
        String directive = line.substring(directiveStart, pos);

        Map<String, String> attributes = new LinkedHashMap<>();
        while (pos < line.length()) {
            int afterSpace = skipWhitespace(line, pos);
            if (afterSpace == line.length()) {
                break;
            }
            if (afterSpace == pos) {
                throw new MarkerParseException("Unexpected character '" + line.charAt(pos)
                        + "' after marker " + directive, lineNumber);
            }
            if (!attributes.isEmpty() && !startsAttribute(line, afterSpace)) {
                break;
            }
            pos = parseAttribute(line, afterSpace, lineNumber, attributes);
        }

        return Optional.of(new Marker(directive, attributes, lineNumber));
    }

    /**
     * True if the line belongs to the marker comment family, without validating attributes.
     */
    public static boolean isMarkerLine(String line) {
        return markerBodyStart(line) >= 0;
    }

    // index just past "rspec-testing:", or -1
    private static int markerBodyStart(String line) {
        if (line == null) {
            return -1;
        }
        int pos = skipWhitespace(line, 0);
        if (pos >= line.length() || line.charAt(pos) != '#') {
            return -1;
        }
        pos = skipWhitespace(line, pos + 1);
        if (!line.startsWith(PREFIX, pos)) {
            return -1;
        }
        return pos + PREFIX.length();
    }

    private static int parseAttribute(String line, int start, int lineNumber, Map<String, String> attributes)
            throws MarkerParseException {
        int pos = start;
        while (pos < line.length() && isWordChar(line.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            throw new MarkerParseException("Expected attribute name at column " + (start + 1), lineNumber);
        }
        String key = line.substring(start, pos);

        if (pos >= line.length() || line.charAt(pos) != '=') {
            throw new MarkerParseException("Expected '=' after attribute " + key, lineNumber);
        }
        pos++;
        if (pos >= line.length() || line.charAt(pos) != '"') {
            throw new MarkerParseException("Attribute " + key + " must be a double-quoted string", lineNumber);
        }
        pos++;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= line.length()) {
                throw new MarkerParseException("Unterminated value for attribute " + key, lineNumber);
            }
            char c = line.charAt(pos);
            if (c == '"') {
                pos++;
                break;
            }
            if (c == '\\') {
                if (pos + 1 >= line.length()) {
                    throw new MarkerParseException("Unterminated value for attribute " + key, lineNumber);
                }
                char escaped = line.charAt(pos + 1);
                if (escaped != '"' && escaped != '\\') {
                    throw new MarkerParseException("Invalid escape '\\" + escaped + "' in attribute " + key,
                            lineNumber);
                }
                value.append(escaped);
                pos += 2;
                continue;
            }
            value.append(c);
            pos++;
        }

        if (attributes.containsKey(key)) {
            throw new MarkerParseException("Duplicate attribute " + key, lineNumber);
        }
        attributes.put(key, value.toString());
        return pos;
    }

    // key followed by '='; anything else after the attributes is free-form comment text
    private static boolean startsAttribute(String line, int pos) {
        int end = pos;
        while (end < line.length() && isWordChar(line.charAt(end))) {
            end++;
        }
        return end > pos && end < line.length() && line.charAt(end) == '=';
    }

    private static int skipWhitespace(String line, int pos) {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private MarkerParser() {
    }
}
