package com.specstructure.maven.blocks;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one method id in a patch run.
 */
public class PatchOperation {

    public enum Status {
        INSERTED,
        REPLACED,
        SKIPPED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static final String CONFLICT_OVERWRITE = "conflict_overwrite";
    static final String CONFLICT_SKIP = "conflict_skip";

    private final String methodId;
    private final Status status;
    private final String reason;

    public PatchOperation(String methodId, Status status, String reason) {
        this.methodId = methodId;
        this.status = status;
        this.reason = reason;
    }

    public String getMethodId() {
        return methodId;
    }

    public Status getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Report entry: method_id, status and, when present, reason.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("method_id", methodId);
        map.put("status", status.label());
        if (reason != null) {
            map.put("reason", reason);
        }
        return map;
    }

    @Override
    public String toString() {
        return status.label() + ": " + methodId + (reason != null ? " (" + reason + ")" : "");
    }
}
