package com.purchasingpower.emsflow.model.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Automation rule: a named container of conditions and actions that fires its
 * actions once every condition is satisfied while the rule is enabled.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationRule {

    private String id;
    private String name;
    private String description;
    private boolean enabled;

    /** Null means unlimited. */
    private Integer maxExecutions;
    private Integer executionsRemaining;

    private String startTime;
    private String endTime;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Wire form returned to the planner, keys as stored by the rule service.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("name", name);
        if (description != null) {
            map.put("description", description);
        }
        map.put("isEnabled", enabled);
        if (maxExecutions != null) {
            map.put("maxExecutions", maxExecutions);
            map.put("executionsRemaining", executionsRemaining);
        }
        if (startTime != null) {
            map.put("startTime", startTime);
        }
        if (endTime != null) {
            map.put("endTime", endTime);
        }
        map.put("createdAt", String.valueOf(createdAt));
        map.put("updatedAt", String.valueOf(updatedAt));
        return map;
    }
}
