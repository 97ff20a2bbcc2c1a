package com.specstructure.maven.blocks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Formats a patch operation log as text lines or as a JSON document.
 */
public class PatchReport {

    public enum Format {
        TEXT,
        JSON;

        public static Format fromString(String value) throws ApplyException {
            if (value == null || value.isBlank()) {
                return TEXT;
            }
            for (Format format : values()) {
                if (format.name().equalsIgnoreCase(value.trim())) {
                    return format;
                }
            }
            throw new ApplyException("Unknown report format: " + value + " (expected text or json)");
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String mode;
    private final String conflict;
    private final List<PatchOperation> operations;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public PatchReport(String mode, String conflict, List<PatchOperation> operations) {
        this.mode = mode;
        this.conflict = conflict;
        this.operations = operations;
    }

    public static PatchReport of(PatchResult result) {
        return new PatchReport(result.getMode().label(), result.getConflictPolicy().label(), result.getOperations());
    }

    /**
     * Adds an extra top-level JSON field; {@code null} values are left out.
     */
    public PatchReport with(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }

    public String render(Format format) throws JsonProcessingException {
        return format == Format.JSON ? toJson() : toText();
    }

    /**
     * One line per operation, e.g. {@code skipped: Invoice#total (conflict_skip)}.
     */
    public String toText() {
        List<String> lines = new ArrayList<>();
        for (PatchOperation operation : operations) {
            lines.add(operation.toString());
        }
        return String.join("\n", lines);
    }

    public String toJson() throws JsonProcessingException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("mode", mode);
        document.put("conflict", conflict);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (PatchOperation operation : operations) {
            entries.add(operation.toMap());
        }
        document.put("operations", entries);
        document.putAll(details);
        return MAPPER.writeValueAsString(document);
    }
}
