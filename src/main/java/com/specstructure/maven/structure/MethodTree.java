package com.specstructure.maven.structure;

import java.util.List;

/**
 * The compiled context forest of one method, with its side effects already resolved.
 */
public class MethodTree {

    private final String name;
    private final String type;
    private final String methodId;
    private final String descriptor;
    private final List<ItBlock> sideEffects;
    private final List<ContextNode> contexts;

    public MethodTree(String name, String type, String methodId, String descriptor,
            List<ItBlock> sideEffects, List<ContextNode> contexts) {
        this.name = name;
        this.type = type;
        this.methodId = methodId;
        this.descriptor = descriptor;
        this.sideEffects = List.copyOf(sideEffects);
        this.contexts = List.copyOf(contexts);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getMethodId() {
        return methodId;
    }

    public String getDescriptor() {
        return descriptor;
    }

    public boolean isClassMethod() {
        return "class".equals(type);
    }

    public List<ItBlock> getSideEffects() {
        return sideEffects;
    }

    public List<ContextNode> getContexts() {
        return contexts;
    }
}
