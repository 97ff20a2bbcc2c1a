package com.specstructure.maven.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A named branching dimension of a method. Dependencies are plain name references
 * ({@code depends_on} + {@code when_parent}); the tree is assembled by
 * {@link com.specstructure.maven.structure.ContextTreeBuilder}.
 */
public class Characteristic {

    public static final String BOOLEAN = "boolean";
    public static final String PRESENCE = "presence";
    public static final String ENUM = "enum";
    public static final String RANGE = "range";
    public static final String SEQUENTIAL = "sequential";

    public static final List<String> TYPES = List.of(BOOLEAN, PRESENCE, ENUM, RANGE, SEQUENTIAL);

    private String name;
    private String description;
    private String type;
    private List<CharacteristicValue> values;
    private String dependsOn;
    private List<String> whenParent;
    private Integer level;
    private String thresholdValue;
    private String thresholdOperator;
    private String sourceLine;

    public Characteristic() {
        this.values = new ArrayList<>();
        this.whenParent = new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<CharacteristicValue> getValues() {
        return values;
    }

    public void setValues(List<CharacteristicValue> values) {
        this.values = values;
    }

    public String getDependsOn() {
        return dependsOn;
    }

    public void setDependsOn(String dependsOn) {
        this.dependsOn = dependsOn;
    }

    public List<String> getWhenParent() {
        return whenParent;
    }

    public void setWhenParent(List<String> whenParent) {
        this.whenParent = whenParent;
    }

    public Integer getLevel() {
        return level;
    }

    public void setLevel(Integer level) {
        this.level = level;
    }

    public String getThresholdValue() {
        return thresholdValue;
    }

    public void setThresholdValue(String thresholdValue) {
        this.thresholdValue = thresholdValue;
    }

    public String getThresholdOperator() {
        return thresholdOperator;
    }

    public void setThresholdOperator(String thresholdOperator) {
        this.thresholdOperator = thresholdOperator;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    public void setSourceLine(String sourceLine) {
        this.sourceLine = sourceLine;
    }

    public boolean isRoot() {
        return dependsOn == null;
    }

    /**
     * True for the two-state types whose states are ordered affirmative-first.
     */
    public boolean isBinary() {
        return BOOLEAN.equals(type) || PRESENCE.equals(type);
    }

    public boolean hasValue(String candidate) {
        return values.stream().anyMatch(v -> candidate == null
                ? v.getValue() == null
                : candidate.equals(v.getValue()));
    }

    @SuppressWarnings("unchecked")
    public static Characteristic fromMap(Map<String, Object> map) {
        Characteristic characteristic = new Characteristic();
        characteristic.setName(Scalars.asString(map.get("name")));
        characteristic.setDescription(Scalars.asString(map.get("description")));
        characteristic.setType(Scalars.asString(map.get("type")));
        characteristic.setDependsOn(Scalars.asString(map.get("depends_on")));
        characteristic.setWhenParent(Scalars.asStringList(map.get("when_parent")));
        characteristic.setLevel(Scalars.asInteger(map.get("level")));
        characteristic.setThresholdValue(Scalars.asString(map.get("threshold_value")));
        characteristic.setThresholdOperator(Scalars.asString(map.get("threshold_operator")));
        characteristic.setSourceLine(Scalars.asString(map.get("source_line")));

        if (map.get("values") instanceof List) {
            for (Object valueObj : (List<Object>) map.get("values")) {
                if (valueObj instanceof Map) {
                    characteristic.getValues().add(CharacteristicValue.fromMap((Map<String, Object>) valueObj));
                }
            }
        }

        return characteristic;
    }
}
