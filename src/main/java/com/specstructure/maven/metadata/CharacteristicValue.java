package com.specstructure.maven.metadata;

import java.util.Map;

/**
 * One state of a characteristic.
 */
public class CharacteristicValue {
    private String value;
    private String description;
    private boolean terminal;
    private String behaviorId;
    private String behavior; // inline description, used when no behavior_id is given

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public void setTerminal(boolean terminal) {
        this.terminal = terminal;
    }

    public String getBehaviorId() {
        return behaviorId;
    }

    public void setBehaviorId(String behaviorId) {
        this.behaviorId = behaviorId;
    }

    public String getBehavior() {
        return behavior;
    }

    public void setBehavior(String behavior) {
        this.behavior = behavior;
    }

    public static CharacteristicValue fromMap(Map<String, Object> map) {
        CharacteristicValue value = new CharacteristicValue();
        value.setValue(Scalars.asString(map.get("value")));
        value.setDescription(Scalars.asString(map.get("description")));
        value.setTerminal(Boolean.TRUE.equals(map.get("terminal")));
        value.setBehaviorId(Scalars.asString(map.get("behavior_id")));
        value.setBehavior(Scalars.asString(map.get("behavior")));
        return value;
    }
}
