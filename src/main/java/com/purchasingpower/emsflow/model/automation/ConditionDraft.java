package com.purchasingpower.emsflow.model.automation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Validated input for creating a condition together with its rule.
 */
@Value
@Builder
public class ConditionDraft {
    String conditionType;
    Map<String, Object> parameters;
    String description;

    @SuppressWarnings("unchecked")
    public static ConditionDraft fromParameters(Map<String, Object> parameters) {
        return ConditionDraft.builder()
                .conditionType((String) parameters.get("condition_type"))
                .parameters((Map<String, Object>) parameters.getOrDefault("condition_parameters", Map.of()))
                .description((String) parameters.get("condition_description"))
                .build();
    }
}
