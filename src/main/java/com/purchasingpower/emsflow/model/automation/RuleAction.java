package com.purchasingpower.emsflow.model.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Action executed when all of a rule's conditions are satisfied.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RuleAction {

    private String id;
    private String ruleId;
    private String actionType;
    private Map<String, Object> parameters;
    private String description;
    private Instant createdAt;
    private Instant updatedAt;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("rule_id", ruleId);
        map.put("actionType", actionType);
        map.put("parameters", new LinkedHashMap<>(parameters));
        if (description != null) {
            map.put("description", description);
        }
        map.put("createdAt", String.valueOf(createdAt));
        map.put("updatedAt", String.valueOf(updatedAt));
        return map;
    }
}
