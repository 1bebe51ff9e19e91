package com.purchasingpower.emsflow.model.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Condition attached to a rule, e.g. a signal detection in a frequency band.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    private String id;
    private String ruleId;
    private String conditionType;
    private Map<String, Object> parameters;
    private String description;
    private boolean satisfied;
    private Instant satisfiedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("rule_id", ruleId);
        map.put("conditionType", conditionType);
        map.put("parameters", new LinkedHashMap<>(parameters));
        if (description != null) {
            map.put("description", description);
        }
        map.put("isSatisfied", satisfied);
        if (satisfiedAt != null) {
            map.put("satisfiedAt", satisfiedAt.toString());
        }
        map.put("createdAt", String.valueOf(createdAt));
        map.put("updatedAt", String.valueOf(updatedAt));
        return map;
    }
}
