package com.specstructure.maven.metadata;

import java.util.Map;

/**
 * An observable effect of a method (a write, a sent mail, an enqueued job) that gets
 * its own example in every leaf context.
 */
public class SideEffect {
    private String type;
    private String behaviorId;
    private String description;

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getBehaviorId() {
        return behaviorId;
    }

    public void setBehaviorId(String behaviorId) {
        this.behaviorId = behaviorId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public static SideEffect fromMap(Map<String, Object> map) {
        SideEffect effect = new SideEffect();
        effect.setType(Scalars.asString(map.get("type")));
        effect.setBehaviorId(Scalars.asString(map.get("behavior_id")));
        effect.setDescription(Scalars.asString(map.get("description")));
        return effect;
    }
}
