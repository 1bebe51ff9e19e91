package com.purchasingpower.emsflow.tool;

/**
 * Accumulator slots. A new result for a role replaces the previous one.
 * INFO lookups qualify the role with a rule id so different rules keep separate slots.
 */
public enum EntityRole {
    RULES("rules"),
    RULE("rule"),
    CONDITION("condition"),
    ACTION("action"),
    CONDITIONS("conditions"),
    ACTIONS("actions"),
    ACTIVATION("activation"),
    DEACTIVATION("deactivation"),
    TARGET_RULE("target_rule");

    private final String key;

    EntityRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String qualified(String qualifier) {
        return key + ":" + qualifier;
    }
}
