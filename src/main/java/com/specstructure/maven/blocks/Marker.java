package com.specstructure.maven.blocks;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed marker comment such as
 * {@code # rspec-testing:method_begin method_id="Invoice#total" method="#total"}.
 */
public class Marker {

    public static final String NAMESPACE = "rspec-testing";
    public static final String METHOD_BEGIN = "method_begin";
    public static final String METHOD_END = "method_end";

    public static final String METHOD_ID = "method_id";
    public static final String METHOD = "method";

    private final String directive;
    private final Map<String, String> attributes;
    private final int lineNumber;

    public Marker(String directive, Map<String, String> attributes, int lineNumber) {
        this.directive = directive;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.lineNumber = lineNumber;
    }

    public String getDirective() {
        return directive;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public String getMethodId() {
        return attributes.get(METHOD_ID);
    }

    /**
     * 1-based line number the marker was read from.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public boolean isBegin() {
        return METHOD_BEGIN.equals(directive);
    }

    public boolean isEnd() {
        return METHOD_END.equals(directive);
    }

    /**
     * Renders a begin marker line (without indentation).
     */
    public static String begin(String methodId, String descriptor) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(NAMESPACE).append(':').append(METHOD_BEGIN);
        appendAttribute(sb, METHOD_ID, methodId);
        if (descriptor != null) {
            appendAttribute(sb, METHOD, descriptor);
        }
        return sb.toString();
    }

    /**
     * Renders an end marker line (without indentation).
     */
    public static String end(String methodId) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(NAMESPACE).append(':').append(METHOD_END);
        appendAttribute(sb, METHOD_ID, methodId);
        return sb.toString();
    }

    private static void appendAttribute(StringBuilder sb, String key, String value) {
        sb.append(' ').append(key).append("=\"").append(escape(value)).append('"');
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
