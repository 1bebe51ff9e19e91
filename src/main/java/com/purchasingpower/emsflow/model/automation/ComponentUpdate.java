package com.purchasingpower.emsflow.model.automation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Partial update of a rule's condition or action. Only {@code ruleId} is mandatory;
 * a null {@code componentId} targets the rule's first component.
 */
@Value
@Builder
public class ComponentUpdate {
    String ruleId;
    String componentId;
    String type;
    Map<String, Object> parameters;
    String description;

    @SuppressWarnings("unchecked")
    public static ComponentUpdate forCondition(Map<String, Object> parameters) {
        return ComponentUpdate.builder()
                .ruleId((String) parameters.get("rule_id"))
                .componentId((String) parameters.get("condition_id"))
                .type((String) parameters.get("condition_type"))
                .parameters((Map<String, Object>) parameters.getOrDefault("parameters", Map.of()))
                .description((String) parameters.get("description"))
                .build();
    }

    @SuppressWarnings("unchecked")
    public static ComponentUpdate forAction(Map<String, Object> parameters) {
        return ComponentUpdate.builder()
                .ruleId((String) parameters.get("rule_id"))
                .componentId((String) parameters.get("action_id"))
                .type((String) parameters.get("action_type"))
                .parameters((Map<String, Object>) parameters.getOrDefault("parameters", Map.of()))
                .description((String) parameters.get("description"))
                .build();
    }
}
