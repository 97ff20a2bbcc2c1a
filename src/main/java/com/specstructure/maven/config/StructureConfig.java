package com.specstructure.maven.config;

import java.util.Map;

/**
 * Project-level defaults from {@code .specstructure/config.yaml}.
 */
public class StructureConfig {
    private String helper;
    private String templateDir;
    private String mode;
    private String onConflict;
    private String reportFormat;

    public String getHelper() {
        return helper;
    }

    public void setHelper(String helper) {
        this.helper = helper;
    }

    public String getTemplateDir() {
        return templateDir;
    }

    public void setTemplateDir(String templateDir) {
        this.templateDir = templateDir;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getOnConflict() {
        return onConflict;
    }

    public void setOnConflict(String onConflict) {
        this.onConflict = onConflict;
    }

    public String getReportFormat() {
        return reportFormat;
    }

    public void setReportFormat(String reportFormat) {
        this.reportFormat = reportFormat;
    }

    /**
     * Returns {@code explicit} when set, otherwise {@code configured}, otherwise {@code fallback}.
     */
    public static String pick(String explicit, String configured, String fallback) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return fallback;
    }

    public static StructureConfig fromMap(Map<String, Object> map) {
        StructureConfig config = new StructureConfig();
        if (map == null) {
            return config;
        }
        config.setHelper(asString(map.get("helper")));
        config.setTemplateDir(asString(map.get("templateDir")));
        config.setMode(asString(map.get("mode")));
        config.setOnConflict(asString(map.get("onConflict")));
        config.setReportFormat(asString(map.get("reportFormat")));
        return config;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
