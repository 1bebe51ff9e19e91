package com.purchasingpower.emsflow.model.automation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Validated input for creating an action together with its rule.
 */
@Value
@Builder
public class ActionDraft {
    String actionType;
    Map<String, Object> parameters;
    String description;

    @SuppressWarnings("unchecked")
    public static ActionDraft fromParameters(Map<String, Object> parameters) {
        return ActionDraft.builder()
                .actionType((String) parameters.get("action_type"))
                .parameters((Map<String, Object>) parameters.getOrDefault("action_parameters", Map.of()))
                .description((String) parameters.get("action_description"))
                .build();
    }
}
