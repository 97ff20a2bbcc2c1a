package com.specstructure.maven.metadata;

import java.util.Map;

/**
 * One entry of the shared behavior bank. Disabled behaviors are pruned from the
 * generated structure.
 */
public class Behavior {
    private String id;
    private String description;
    private boolean enabled = true;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public static Behavior fromMap(Map<String, Object> map) {
        Behavior behavior = new Behavior();
        behavior.setId(Scalars.asString(map.get("id")));
        behavior.setDescription(Scalars.asString(map.get("description")));
        // only an explicit false disables a behavior
        behavior.setEnabled(!Boolean.FALSE.equals(map.get("enabled")));
        return behavior;
    }
}
