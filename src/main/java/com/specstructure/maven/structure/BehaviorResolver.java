package com.specstructure.maven.structure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.specstructure.maven.metadata.Behavior;

/**
 * Resolves behavior bank references to example descriptions.
 * <p>
 * A {@code null} result means the behavior is disabled and the example (and any
 * context that only existed to reach it) must be omitted. Missing or unknown ids
 * never fail; they resolve to {@link Placeholders#BEHAVIOR_DESCRIPTION}.
 */
public class BehaviorResolver {

    private final Map<String, Behavior> behaviors = new LinkedHashMap<>();
    private final Set<String> unresolvedIds = new LinkedHashSet<>();

    public BehaviorResolver(List<Behavior> behaviorBank) {
        if (behaviorBank != null) {
            for (Behavior behavior : behaviorBank) {
                if (behavior.getId() != null) {
                    behaviors.put(behavior.getId(), behavior);
                }
            }
        }
    }

    public String resolve(String behaviorId) {
        if (behaviorId == null) {
            return Placeholders.BEHAVIOR_DESCRIPTION;
        }

        Behavior behavior = behaviors.get(behaviorId);
        if (behavior == null) {
            unresolvedIds.add(behaviorId);
            return Placeholders.BEHAVIOR_DESCRIPTION;
        }

        if (!behavior.isEnabled()) {
            return null;
        }

        return behavior.getDescription() != null ? behavior.getDescription() : Placeholders.BEHAVIOR_DESCRIPTION;
    }

    public boolean isEnabled(String behaviorId) {
        if (behaviorId == null) {
            return true;
        }
        Behavior behavior = behaviors.get(behaviorId);
        return behavior == null || behavior.isEnabled();
    }

    /**
     * Ids that were referenced but not found in the bank, in first-seen order.
     */
    public Set<String> getUnresolvedIds() {
        return Collections.unmodifiableSet(unresolvedIds);
    }
}
