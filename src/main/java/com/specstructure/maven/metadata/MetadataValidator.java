package com.specstructure.maven.metadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a metadata document before it is compiled into contexts.
 * <p>
 * Errors make the document unusable (dangling dependencies, cycles, inconsistent
 * levels). Warnings flag data that still generates but probably needs attention:
 * unknown behavior references and methods whose context tree would explode.
 */
public class MetadataValidator {

    static final int MAX_CHARACTERISTICS = 5;
    static final int MAX_LEAF_CONTEXTS = 25;
    static final int MAX_EXAMPLES = 50;

    public static class Result {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public List<String> getErrors() {
            return errors;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public Result validate(StructureMetadata metadata) {
        Result result = new Result();
        Set<String> behaviorIds = collectBehaviorIds(metadata, result);

        List<MethodDefinition> methods = metadata.getMethods();
        for (int i = 0; i < methods.size(); i++) {
            validateMethod(methods.get(i), "methods[" + i + "]", behaviorIds, result);
        }
        return result;
    }

    private Set<String> collectBehaviorIds(StructureMetadata metadata, Result result) {
        Set<String> ids = new HashSet<>();
        List<Behavior> behaviors = metadata.getBehaviors();
        for (int i = 0; i < behaviors.size(); i++) {
            Behavior behavior = behaviors.get(i);
            if (isBlank(behavior.getId())) {
                result.errors.add("behaviors[" + i + "].id must be a non-empty string");
            } else if (!ids.add(behavior.getId())) {
                result.errors.add("behaviors[].id must be unique; duplicate: " + behavior.getId());
            }
        }
        return ids;
    }

    private void validateMethod(MethodDefinition method, String label, Set<String> behaviorIds, Result result) {
        if (isBlank(method.getName())) {
            result.errors.add(label + ".name must be a non-empty string");
        }
        if (!MethodDefinition.INSTANCE.equals(method.getType()) && !MethodDefinition.CLASS.equals(method.getType())) {
            result.errors.add(label + ".type must be one of: instance, class");
        }

        List<Characteristic> characteristics = method.getCharacteristics();
        Set<String> names = new HashSet<>();
        for (int c = 0; c < characteristics.size(); c++) {
            Characteristic characteristic = characteristics.get(c);
            String charLabel = label + ".characteristics[" + c + "]";
            if (isBlank(characteristic.getName())) {
                result.errors.add(charLabel + ".name must be a non-empty string");
            } else if (!names.add(characteristic.getName())) {
                result.errors.add(charLabel + ".name must be unique within the method: " + characteristic.getName());
            }
            validateCharacteristic(method, characteristic, charLabel, behaviorIds, result);
        }

        detectCycles(method, label, result);

        List<SideEffect> sideEffects = method.getSideEffects();
        for (int e = 0; e < sideEffects.size(); e++) {
            String behaviorId = sideEffects.get(e).getBehaviorId();
            if (behaviorId != null && !behaviorIds.contains(behaviorId)) {
                result.warnings.add("Unknown behavior_id '" + behaviorId + "' in " + label + ".side_effects[" + e + "]");
            }
        }

        int leafContexts = countLeaves(method, null, null, 1);
        int estimatedExamples = leafContexts * (1 + sideEffects.size());
        if (characteristics.size() >= MAX_CHARACTERISTICS || leafContexts >= MAX_LEAF_CONTEXTS
                || estimatedExamples >= MAX_EXAMPLES) {
            result.warnings.add(String.format(
                    "Potential combinatorial explosion for method '%s': characteristics=%d, leaf_contexts≈%d, examples≈%d",
                    method.getName(), characteristics.size(), leafContexts, estimatedExamples));
        }
    }

    private void validateCharacteristic(MethodDefinition method, Characteristic characteristic, String label,
            Set<String> behaviorIds, Result result) {
        if (!Characteristic.TYPES.contains(characteristic.getType())) {
            result.errors.add(label + ".type must be one of: " + String.join(", ", Characteristic.TYPES));
        }
        if (characteristic.getValues().isEmpty()) {
            result.errors.add(label + ".values must not be empty");
        }

        Integer level = characteristic.getLevel();
        if (level == null || level < 1) {
            result.errors.add(label + ".level must be an integer >= 1");
        }

        for (int v = 0; v < characteristic.getValues().size(); v++) {
            String behaviorId = characteristic.getValues().get(v).getBehaviorId();
            if (behaviorId != null && !behaviorIds.contains(behaviorId)) {
                result.warnings.add("Unknown behavior_id '" + behaviorId + "' in " + label + ".values[" + v + "]");
            }
        }

        if (characteristic.isRoot()) {
            if (!characteristic.getWhenParent().isEmpty()) {
                result.errors.add(label + ".when_parent requires depends_on");
            }
            if (level != null && level != 1) {
                result.errors.add(label + ".level must be 1 for a characteristic without depends_on");
            }
            return;
        }

        Characteristic parent = method.findCharacteristic(characteristic.getDependsOn());
        if (parent == null) {
            result.errors.add(label + ".depends_on references unknown characteristic '"
                    + characteristic.getDependsOn() + "'");
            return;
        }
        if (characteristic.getWhenParent().isEmpty()) {
            result.errors.add(label + ".when_parent is required when depends_on is set");
        }
        for (String parentValue : characteristic.getWhenParent()) {
            if (!parent.hasValue(parentValue)) {
                result.errors.add(label + ".when_parent value '" + parentValue + "' is not a value of '"
                        + parent.getName() + "'");
            }
        }
        if (level != null && parent.getLevel() != null && level != parent.getLevel() + 1) {
            result.errors.add(label + ".level must be " + (parent.getLevel() + 1) + " (parent '"
                    + parent.getName() + "' is at level " + parent.getLevel() + ")");
        }
    }

    private void detectCycles(MethodDefinition method, String label, Result result) {
        for (Characteristic start : method.getCharacteristics()) {
            Set<String> seen = new LinkedHashSet<>();
            Characteristic current = start;
            while (current != null && !current.isRoot()) {
                if (!seen.add(current.getName())) {
                    result.errors.add(label + " has a depends_on cycle: " + String.join(" -> ", seen)
                            + " -> " + current.getName());
                    return;
                }
                current = method.findCharacteristic(current.getDependsOn());
            }
        }
    }

    private int countLeaves(MethodDefinition method, String parentName, String parentValue, int level) {
        int leaves = 0;
        for (Characteristic characteristic : method.getCharacteristics()) {
            if (characteristic.getLevel() == null || characteristic.getLevel() != level) {
                continue;
            }
            boolean attached = parentName == null
                    ? characteristic.isRoot()
                    : parentName.equals(characteristic.getDependsOn())
                            && characteristic.getWhenParent().contains(parentValue);
            if (!attached) {
                continue;
            }
            for (CharacteristicValue value : characteristic.getValues()) {
                if (value.isTerminal()) {
                    leaves++;
                    continue;
                }
                int children = countLeaves(method, characteristic.getName(), value.getValue(), level + 1);
                leaves += children == 0 ? 1 : children;
            }
        }
        return leaves;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
