package com.purchasingpower.emsflow.model.automation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Validated input for creating a rule.
 */
@Value
@Builder
public class RuleDraft {
    String name;
    String description;
    boolean enabled;
    Integer maxExecutions;
    String startTime;
    String endTime;

    public static RuleDraft fromParameters(Map<String, Object> parameters) {
        return RuleDraft.builder()
                .name((String) parameters.get("name"))
                .description((String) parameters.get("description"))
                .enabled(Boolean.TRUE.equals(parameters.get("is_enabled")))
                .maxExecutions((Integer) parameters.get("max_executions"))
                .startTime((String) parameters.get("start_time"))
                .endTime((String) parameters.get("end_time"))
                .build();
    }
}
