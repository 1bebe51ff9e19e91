package com.purchasingpower.emsflow.tool;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of tools the planner may call. The wire name is what the planner emits.
 */
public enum ToolName {

    LIST_AUTOMATION_RULES("list_automation_rules"),
    GET_AUTOMATION_RULE("get_automation_rule"),
    LIST_CONDITIONS_FOR_RULE("list_conditions_for_rule"),
    LIST_ACTIONS_FOR_RULE("list_actions_for_rule"),
    CREATE_AUTOMATION_RULE("create_automation_rule"),
    CREATE_RULE_CONDITION("create_rule_condition"),
    CREATE_RULE_ACTION("create_rule_action"),
    CREATE_RULE_CONDITION_ACTION("create_rule_condition_action"),
    ACTIVATE_AUTOMATION_RULE("activate_automation_rule"),
    DEACTIVATE_AUTOMATION_RULE("deactivate_automation_rule"),
    UPDATE_CONDITION("update_condition"),
    UPDATE_ACTION("update_action");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(tool -> tool.wireName.equals(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
