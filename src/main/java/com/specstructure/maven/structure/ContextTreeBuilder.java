package com.specstructure.maven.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.specstructure.maven.metadata.Characteristic;
import com.specstructure.maven.metadata.CharacteristicValue;
import com.specstructure.maven.metadata.MethodDefinition;
import com.specstructure.maven.metadata.SideEffect;

/**
 * Compiles the flat characteristic list of each method into a forest of {@link ContextNode}s.
 * <p>
 * Recursion is driven by {@code level}: at every level the characteristics attached to the
 * current parent state are expanded in happy-path-first order. Terminal states and states
 * without dependents become leaves and receive examples: side effects first, then the
 * state's own behavior. A disabled behavior turns the leaf into a skipped placeholder.
 */
public class ContextTreeBuilder {

    static final String BEHAVIOR_DISABLED = "behavior disabled";

    private final String className;
    private final BehaviorResolver behaviorResolver;
    private final List<String> warnings = new ArrayList<>();

    public ContextTreeBuilder(String className, BehaviorResolver behaviorResolver) {
        this.className = className;
        this.behaviorResolver = behaviorResolver;
    }

    public List<MethodTree> build(List<MethodDefinition> methods) {
        List<MethodTree> trees = new ArrayList<>();
        for (MethodDefinition method : methods) {
            trees.add(buildMethodTree(method));
        }
        for (String behaviorId : behaviorResolver.getUnresolvedIds()) {
            warnings.add("Unknown behavior_id '" + behaviorId + "' rendered as " + Placeholders.BEHAVIOR_DESCRIPTION);
        }
        return trees;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    private MethodTree buildMethodTree(MethodDefinition method) {
        List<ItBlock> sideEffects = resolveSideEffects(method.getSideEffects());

        if (method.getCharacteristics().isEmpty()) {
            warnings.add("Method '" + method.getName() + "' has no characteristics; generated a placeholder example");
        }

        List<ContextNode> contexts = buildContexts(method.getCharacteristics(), 1, null, null, sideEffects);
        return new MethodTree(method.getName(), method.getType(), method.methodId(className),
                method.descriptor(), sideEffects, contexts);
    }

    private List<ItBlock> resolveSideEffects(List<SideEffect> sideEffects) {
        List<ItBlock> resolved = new ArrayList<>();
        for (SideEffect effect : sideEffects) {
            String description = effect.getBehaviorId() != null
                    ? behaviorResolver.resolve(effect.getBehaviorId())
                    : fallback(effect.getDescription());
            if (description != null) {
                resolved.add(new ItBlock(description, true));
            }
        }
        return resolved;
    }

    private List<ContextNode> buildContexts(List<Characteristic> characteristics, int level,
            String parentName, String parentValue, List<ItBlock> sideEffects) {
        List<ContextNode> contexts = new ArrayList<>();

        for (Characteristic characteristic : characteristics) {
            if (!attachedTo(characteristic, level, parentName, parentValue)) {
                continue;
            }

            List<CharacteristicValue> ordered = StateOrdering.order(characteristic);
            for (int index = 0; index < ordered.size(); index++) {
                contexts.add(buildContext(characteristic, ordered.get(index), index, level, characteristics,
                        sideEffects));
            }
        }

        return contexts;
    }

    private static boolean attachedTo(Characteristic characteristic, int level, String parentName,
            String parentValue) {
        if (characteristic.getLevel() == null || characteristic.getLevel() != level) {
            return false;
        }
        if (parentName == null) {
            return characteristic.isRoot();
        }
        return parentName.equals(characteristic.getDependsOn())
                && characteristic.getWhenParent().contains(parentValue);
    }

    private ContextNode buildContext(Characteristic characteristic, CharacteristicValue value, int stateIndex,
            int level, List<Characteristic> characteristics, List<ItBlock> sideEffects) {
        ContextNode node = new ContextNode(
                ContextWords.determine(characteristic, stateIndex, level),
                DescriptionFormatter.format(characteristic, value),
                characteristic.getName(),
                value.getValue(),
                LetBlockGenerator.generate(characteristic, value),
                characteristic.getSourceLine(),
                value.isTerminal());

        if (value.isTerminal()) {
            // terminal states never grow children, whatever declares them as parent
            String behavior = resolveLeafBehavior(value);
            if (behavior == null) {
                node.skip(BEHAVIOR_DISABLED);
            } else {
                node.addItBlock(new ItBlock(behavior, false));
            }
            return node;
        }

        node.addChildren(buildContexts(characteristics, level + 1, characteristic.getName(), value.getValue(),
                sideEffects));

        if (node.isLeaf()) {
            String behavior = resolveLeafBehavior(value);
            if (behavior == null) {
                node.skip(BEHAVIOR_DISABLED);
            } else {
                sideEffects.forEach(node::addItBlock);
                node.addItBlock(new ItBlock(behavior, false));
            }
        }

        return node;
    }

    private String resolveLeafBehavior(CharacteristicValue value) {
        if (value.getBehaviorId() != null) {
            return behaviorResolver.resolve(value.getBehaviorId());
        }
        return fallback(value.getBehavior());
    }

    private static String fallback(String inlineDescription) {
        return inlineDescription != null ? inlineDescription : Placeholders.BEHAVIOR_DESCRIPTION;
    }
}
