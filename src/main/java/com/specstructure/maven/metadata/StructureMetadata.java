package com.specstructure.maven.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Analysis document for one class: its methods and the shared behavior bank.
 */
public class StructureMetadata {
    private String className;
    private String sourceFile;
    private String specPath;
    private List<MethodDefinition> methods;
    private List<Behavior> behaviors;

    public StructureMetadata() {
        this.methods = new ArrayList<>();
        this.behaviors = new ArrayList<>();
    }

    public String getClassName() {
        return className;
    }

    public void setClassName(String className) {
        this.className = className;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public void setSourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    public String getSpecPath() {
        return specPath;
    }

    public void setSpecPath(String specPath) {
        this.specPath = specPath;
    }

    public List<MethodDefinition> getMethods() {
        return methods;
    }

    public void setMethods(List<MethodDefinition> methods) {
        this.methods = methods;
    }

    public List<Behavior> getBehaviors() {
        return behaviors;
    }

    public void setBehaviors(List<Behavior> behaviors) {
        this.behaviors = behaviors;
    }

    @SuppressWarnings("unchecked")
    public static StructureMetadata fromMap(Map<String, Object> map) {
        StructureMetadata metadata = new StructureMetadata();
        metadata.setClassName(Scalars.asString(map.get("class_name")));
        metadata.setSourceFile(Scalars.asString(map.get("source_file")));
        metadata.setSpecPath(Scalars.asString(map.get("spec_path")));

        if (map.get("methods") instanceof List) {
            for (Object methodObj : (List<Object>) map.get("methods")) {
                if (methodObj instanceof Map) {
                    metadata.getMethods().add(MethodDefinition.fromMap((Map<String, Object>) methodObj));
                }
            }
        }

        if (map.get("behaviors") instanceof List) {
            for (Object behaviorObj : (List<Object>) map.get("behaviors")) {
                if (behaviorObj instanceof Map) {
                    metadata.getBehaviors().add(Behavior.fromMap((Map<String, Object>) behaviorObj));
                }
            }
        }

        return metadata;
    }
}
