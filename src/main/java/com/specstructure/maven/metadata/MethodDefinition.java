package com.specstructure.maven.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An analyzed method: its characteristics and side effects.
 */
public class MethodDefinition {

    public static final String INSTANCE = "instance";
    public static final String CLASS = "class";

    private String name;
    private String type;
    private String methodMode; // new, modified or unchanged
    private List<Characteristic> characteristics;
    private List<SideEffect> sideEffects;

    public MethodDefinition() {
        this.characteristics = new ArrayList<>();
        this.sideEffects = new ArrayList<>();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMethodMode() {
        return methodMode;
    }

    public void setMethodMode(String methodMode) {
        this.methodMode = methodMode;
    }

    public List<Characteristic> getCharacteristics() {
        return characteristics;
    }

    public void setCharacteristics(List<Characteristic> characteristics) {
        this.characteristics = characteristics;
    }

    public List<SideEffect> getSideEffects() {
        return sideEffects;
    }

    public void setSideEffects(List<SideEffect> sideEffects) {
        this.sideEffects = sideEffects;
    }

    public boolean isClassMethod() {
        return CLASS.equals(type);
    }

    public boolean isNew() {
        return "new".equals(methodMode);
    }

    /**
     * Display descriptor used in the describe line: {@code .name} for class methods,
     * {@code #name} otherwise.
     */
    public String descriptor() {
        return (isClassMethod() ? "." : "#") + name;
    }

    /**
     * Stable identifier carried by the block markers, e.g. {@code Billing::Invoice#total}.
     */
    public String methodId(String className) {
        return className + descriptor();
    }

    public Characteristic findCharacteristic(String characteristicName) {
        for (Characteristic characteristic : characteristics) {
            if (characteristic.getName() != null && characteristic.getName().equals(characteristicName)) {
                return characteristic;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static MethodDefinition fromMap(Map<String, Object> map) {
        MethodDefinition method = new MethodDefinition();
        method.setName(Scalars.asString(map.get("name")));
        method.setType(Scalars.asString(map.get("type")));
        method.setMethodMode(Scalars.asString(map.get("method_mode")));

        if (map.get("characteristics") instanceof List) {
            for (Object charObj : (List<Object>) map.get("characteristics")) {
                if (charObj instanceof Map) {
                    method.getCharacteristics().add(Characteristic.fromMap((Map<String, Object>) charObj));
                }
            }
        }

        if (map.get("side_effects") instanceof List) {
            for (Object effectObj : (List<Object>) map.get("side_effects")) {
                if (effectObj instanceof Map) {
                    method.getSideEffects().add(SideEffect.fromMap((Map<String, Object>) effectObj));
                }
            }
        }

        return method;
    }
}
