package com.purchasingpower.emsflow.tool.backend;

import com.purchasingpower.emsflow.model.automation.ActionDraft;
import com.purchasingpower.emsflow.model.automation.AutomationRule;
import com.purchasingpower.emsflow.model.automation.ComponentUpdate;
import com.purchasingpower.emsflow.model.automation.ConditionDraft;
import com.purchasingpower.emsflow.model.automation.RuleAction;
import com.purchasingpower.emsflow.model.automation.RuleCondition;
import com.purchasingpower.emsflow.model.automation.RuleDraft;
import com.purchasingpower.emsflow.tool.ToolBackend;
import com.purchasingpower.emsflow.tool.ToolResult;
import com.purchasingpower.emsflow.tool.schema.AutomationSchemas;
import com.purchasingpower.emsflow.tool.schema.ParameterSchema;
import com.purchasingpower.emsflow.tool.schema.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * In-memory rule store seeded with three demo rules.
 *
 * <p>All operations are synchronized on the store, so concurrent requests see each
 * change atomically. Composite creations either store every component or nothing.
 */
@Slf4j
@Component
public class InMemoryToolBackend implements ToolBackend {

    private final Supplier<String> idGenerator;
    private final Clock clock;

    private final Map<String, AutomationRule> rules = new LinkedHashMap<>();
    private final Map<String, List<RuleCondition>> conditions = new LinkedHashMap<>();
    private final Map<String, List<RuleAction>> actions = new LinkedHashMap<>();

    public InMemoryToolBackend() {
        this(() -> UUID.randomUUID().toString(), Clock.systemUTC());
    }

    public InMemoryToolBackend(Supplier<String> idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
        seed();
    }

    // ================================================================
    // READ
    // ================================================================

    @Override
    public synchronized ToolResult listRules() {
        List<Map<String, Object>> summaries = rules.values().stream()
                .map(AutomationRule::toMap)
                .toList();
        return ToolResult.success(summaries, "Found " + summaries.size() + " rules");
    }

    @Override
    public synchronized ToolResult getRule(String ruleId) {
        AutomationRule rule = rules.get(ruleId);
        if (rule == null) {
            return ruleNotFound(ruleId);
        }
        return ToolResult.success(rule.toMap(), "Found rule '" + rule.getName() + "'");
    }

    @Override
    public synchronized ToolResult listConditions(String ruleId) {
        if (!rules.containsKey(ruleId)) {
            return ruleNotFound(ruleId);
        }
        List<Map<String, Object>> result = conditions.getOrDefault(ruleId, List.of()).stream()
                .map(RuleCondition::toMap)
                .toList();
        return ToolResult.success(result, "Found " + result.size() + " conditions");
    }

    @Override
    public synchronized ToolResult listActions(String ruleId) {
        if (!rules.containsKey(ruleId)) {
            return ruleNotFound(ruleId);
        }
        List<Map<String, Object>> result = actions.getOrDefault(ruleId, List.of()).stream()
                .map(RuleAction::toMap)
                .toList();
        return ToolResult.success(result, "Found " + result.size() + " actions");
    }

    // ================================================================
    // CREATE
    // ================================================================

    @Override
    public synchronized ToolResult createRule(RuleDraft draft) {
        return createComposite(draft, null, null);
    }

    @Override
    public synchronized ToolResult createRuleWithCondition(RuleDraft draft, ConditionDraft condition) {
        return createComposite(draft, condition, null);
    }

    @Override
    public synchronized ToolResult createRuleWithAction(RuleDraft draft, ActionDraft action) {
        return createComposite(draft, null, action);
    }

    @Override
    public synchronized ToolResult createRuleWithConditionAndAction(RuleDraft draft, ConditionDraft condition,
                                                                     ActionDraft action) {
        return createComposite(draft, condition, action);
    }

    private ToolResult createComposite(RuleDraft draft, ConditionDraft conditionDraft, ActionDraft actionDraft) {
        if (draft.getName() == null || draft.getName().isBlank()) {
            return ToolResult.constraintViolation("Rule name cannot be empty");
        }

        Map<String, Object> conditionParameters = null;
        if (conditionDraft != null) {
            ValidationResult check = validateComponent(AutomationSchemas.conditionParameters(
                    conditionDraft.getConditionType()), conditionDraft.getParameters());
            if (!check.isValid()) {
                return ToolResult.constraintViolation("Invalid condition: " + describeType(
                        "condition_type", conditionDraft.getConditionType(), AutomationSchemas.CONDITION_TYPES, check));
            }
            conditionParameters = check.getParameters();
        }

        Map<String, Object> actionParameters = null;
        if (actionDraft != null) {
            ValidationResult check = validateComponent(AutomationSchemas.actionParameters(
                    actionDraft.getActionType()), actionDraft.getParameters());
            if (!check.isValid()) {
                return ToolResult.constraintViolation("Invalid action: " + describeType(
                        "action_type", actionDraft.getActionType(), AutomationSchemas.ACTION_TYPES, check));
            }
            actionParameters = check.getParameters();
        }

        Instant now = clock.instant();
        AutomationRule rule = AutomationRule.builder()
                .id(idGenerator.get())
                .name(draft.getName())
                .description(draft.getDescription())
                .enabled(draft.isEnabled())
                .maxExecutions(draft.getMaxExecutions())
                .executionsRemaining(draft.getMaxExecutions())
                .startTime(draft.getStartTime())
                .endTime(draft.getEndTime())
                .createdAt(now)
                .updatedAt(now)
                .build();
        rules.put(rule.getId(), rule);

        Map<String, Object> created = new LinkedHashMap<>();
        created.put("rule", rule.toMap());

        if (conditionDraft != null) {
            RuleCondition condition = RuleCondition.builder()
                    .id(idGenerator.get())
                    .ruleId(rule.getId())
                    .conditionType(conditionDraft.getConditionType())
                    .parameters(new LinkedHashMap<>(conditionParameters))
                    .description(conditionDraft.getDescription())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            conditions.computeIfAbsent(rule.getId(), id -> new ArrayList<>()).add(condition);
            created.put("condition", condition.toMap());
        }

        if (actionDraft != null) {
            RuleAction action = RuleAction.builder()
                    .id(idGenerator.get())
                    .ruleId(rule.getId())
                    .actionType(actionDraft.getActionType())
                    .parameters(new LinkedHashMap<>(actionParameters))
                    .description(actionDraft.getDescription())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            actions.computeIfAbsent(rule.getId(), id -> new ArrayList<>()).add(action);
            created.put("action", action.toMap());
        }

        log.info("✅ Created rule '{}' ({}) with {} condition(s) and {} action(s)", rule.getName(), rule.getId(),
                conditionDraft == null ? 0 : 1, actionDraft == null ? 0 : 1);
        return ToolResult.success(created, "Created rule '" + rule.getName() + "'");
    }

    // ================================================================
    // UPDATE
    // ================================================================

    @Override
    public synchronized ToolResult activateRule(String ruleId) {
        AutomationRule rule = rules.get(ruleId);
        if (rule == null) {
            return ruleNotFound(ruleId);
        }
        if (rule.isEnabled()) {
            return ToolResult.success(statusChange(rule, "already_active"),
                    "Rule '" + rule.getName() + "' (ID: " + ruleId + ") is already activated.");
        }

        rule.setEnabled(true);
        rule.setUpdatedAt(clock.instant());
        for (RuleCondition condition : conditions.getOrDefault(ruleId, List.of())) {
            condition.setSatisfied(false);
            condition.setSatisfiedAt(null);
        }
        log.info("✅ Activated rule '{}' ({})", rule.getName(), ruleId);
        return ToolResult.success(statusChange(rule, "activated"),
                "Rule '" + rule.getName() + "' (ID: " + ruleId + ") has been activated.");
    }

    @Override
    public synchronized ToolResult deactivateRule(String ruleId) {
        AutomationRule rule = rules.get(ruleId);
        if (rule == null) {
            return ruleNotFound(ruleId);
        }
        if (!rule.isEnabled()) {
            return ToolResult.success(statusChange(rule, "already_inactive"),
                    "Rule '" + rule.getName() + "' (ID: " + ruleId + ") is already deactivated.");
        }

        rule.setEnabled(false);
        rule.setUpdatedAt(clock.instant());
        log.info("✅ Deactivated rule '{}' ({})", rule.getName(), ruleId);
        return ToolResult.success(statusChange(rule, "deactivated"),
                "Rule '" + rule.getName() + "' (ID: " + ruleId + ") has been deactivated.");
    }

    @Override
    public synchronized ToolResult updateCondition(ComponentUpdate update) {
        if (!rules.containsKey(update.getRuleId())) {
            return ruleNotFound(update.getRuleId());
        }
        List<RuleCondition> ruleConditions = conditions.getOrDefault(update.getRuleId(), List.of());
        if (ruleConditions.isEmpty()) {
            return ToolResult.notFound("No conditions found for rule '" + update.getRuleId() + "'");
        }
        Optional<RuleCondition> found = update.getComponentId() == null
                ? Optional.of(ruleConditions.get(0))
                : ruleConditions.stream().filter(c -> c.getId().equals(update.getComponentId())).findFirst();
        if (found.isEmpty()) {
            return ToolResult.notFound("Condition with ID '" + update.getComponentId()
                    + "' not found for rule '" + update.getRuleId() + "'");
        }
        RuleCondition condition = found.get();

        String newType = update.getType() != null ? update.getType() : condition.getConditionType();
        Map<String, Object> merged = new LinkedHashMap<>(condition.getParameters());
        merged.putAll(update.getParameters());
        ValidationResult check = validateComponent(AutomationSchemas.conditionParameters(newType), merged);
        if (!check.isValid()) {
            return ToolResult.constraintViolation("Invalid condition update: " + describeType(
                    "condition_type", newType, AutomationSchemas.CONDITION_TYPES, check));
        }

        List<String> changes = describeChanges(condition.getConditionType(), newType, "conditionType",
                condition.getParameters(), check.getParameters(), condition.getDescription(), update.getDescription());
        if (!changes.isEmpty()) {
            condition.setConditionType(newType);
            condition.setParameters(new LinkedHashMap<>(check.getParameters()));
            if (update.getDescription() != null) {
                condition.setDescription(update.getDescription());
            }
            condition.setUpdatedAt(clock.instant());
            log.info("✅ Updated condition {} of rule {}: {}", condition.getId(), update.getRuleId(), changes);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("rule_id", update.getRuleId());
        result.put("condition_id", condition.getId());
        result.put("conditionType", condition.getConditionType());
        result.put("updates_made", changes);
        result.put("condition", condition.toMap());
        return ToolResult.success(result, changes.isEmpty()
                ? "No changes were made. Provide parameters to update."
                : "Condition '" + condition.getId() + "' updated. Changes: " + String.join(", ", changes));
    }

    @Override
    public synchronized ToolResult updateAction(ComponentUpdate update) {
        if (!rules.containsKey(update.getRuleId())) {
            return ruleNotFound(update.getRuleId());
        }
        List<RuleAction> ruleActions = actions.getOrDefault(update.getRuleId(), List.of());
        if (ruleActions.isEmpty()) {
            return ToolResult.notFound("No actions found for rule '" + update.getRuleId() + "'");
        }
        Optional<RuleAction> found = update.getComponentId() == null
                ? Optional.of(ruleActions.get(0))
                : ruleActions.stream().filter(a -> a.getId().equals(update.getComponentId())).findFirst();
        if (found.isEmpty()) {
            return ToolResult.notFound("Action with ID '" + update.getComponentId()
                    + "' not found for rule '" + update.getRuleId() + "'");
        }
        RuleAction action = found.get();

        String newType = update.getType() != null ? update.getType() : action.getActionType();
        Map<String, Object> merged = new LinkedHashMap<>(action.getParameters());
        merged.putAll(update.getParameters());
        ValidationResult check = validateComponent(AutomationSchemas.actionParameters(newType), merged);
        if (!check.isValid()) {
            return ToolResult.constraintViolation("Invalid action update: " + describeType(
                    "action_type", newType, AutomationSchemas.ACTION_TYPES, check));
        }

        List<String> changes = describeChanges(action.getActionType(), newType, "actionType",
                action.getParameters(), check.getParameters(), action.getDescription(), update.getDescription());
        if (!changes.isEmpty()) {
            action.setActionType(newType);
            action.setParameters(new LinkedHashMap<>(check.getParameters()));
            if (update.getDescription() != null) {
                action.setDescription(update.getDescription());
            }
            action.setUpdatedAt(clock.instant());
            log.info("✅ Updated action {} of rule {}: {}", action.getId(), update.getRuleId(), changes);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("rule_id", update.getRuleId());
        result.put("action_id", action.getId());
        result.put("actionType", action.getActionType());
        result.put("updates_made", changes);
        result.put("action", action.toMap());
        return ToolResult.success(result, changes.isEmpty()
                ? "No changes were made. Provide parameters to update."
                : "Action '" + action.getId() + "' updated. Changes: " + String.join(", ", changes));
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private static ValidationResult validateComponent(Optional<ParameterSchema> schema, Map<String, Object> parameters) {
        return schema
                .map(s -> s.validate(parameters))
                .orElseGet(() -> ValidationResult.failure(List.of(
                        new ValidationResult.Violation("type", "unsupported type"))));
    }

    private static String describeType(String field, String type, List<String> allowed, ValidationResult check) {
        if (type == null || !allowed.contains(type)) {
            return field + " must be one of " + allowed + " but got '" + type + "'";
        }
        return check.getSummary();
    }

    private static List<String> describeChanges(String oldType, String newType, String typeLabel,
                                                Map<String, Object> oldParameters, Map<String, Object> newParameters,
                                                String oldDescription, String newDescription) {
        List<String> changes = new ArrayList<>();
        if (!newType.equals(oldType)) {
            changes.add(typeLabel + " -> " + newType);
        }
        newParameters.forEach((key, value) -> {
            if (!sameValue(oldParameters.get(key), value)) {
                changes.add(key + " -> " + value);
            }
        });
        if (newDescription != null && !newDescription.equals(oldDescription)) {
            changes.add("description updated");
        }
        return changes;
    }

    private static boolean sameValue(Object previous, Object next) {
        if (previous instanceof Number a && next instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return previous != null && previous.equals(next);
    }

    private static Map<String, Object> statusChange(AutomationRule rule, String status) {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("rule_id", rule.getId());
        change.put("rule_name", rule.getName());
        change.put("status", status);
        change.put("isEnabled", rule.isEnabled());
        return change;
    }

    private static ToolResult ruleNotFound(String ruleId) {
        return ToolResult.notFound("Rule with ID '" + ruleId + "' not found");
    }

    private void seed() {
        addSeedRule("rule-001", "5G Monitor", "Monitors 5G signals in mid-band", true, "2024-01-15T10:30:00Z",
                seedCondition("cond-001", "rule-001", AutomationSchemas.SIGNAL_DETECTION,
                        Map.of("minFrequencyMHz", 3400, "maxFrequencyMHz", 3600, "signalType", "5G")),
                seedAction("act-001", "rule-001", AutomationSchemas.USER_NOTIFICATION,
                        Map.of("message", "5G signal detected in mid-band")));

        addSeedRule("rule-002", "LTE Detector", "Detects LTE signals", true, "2024-01-20T14:00:00Z",
                seedCondition("cond-002", "rule-002", AutomationSchemas.SIGNAL_DETECTION,
                        Map.of("minFrequencyMHz", 1800, "maxFrequencyMHz", 2100, "signalType", "LTE")),
                seedAction("act-002", "rule-002", AutomationSchemas.FREQUENCY_SCAN_REQUEST,
                        Map.of("sensorIds", List.of("sensor-01", "sensor-02"))));

        addSeedRule("rule-003", "Energy Threshold Alert", "Alerts when energy exceeds threshold", false,
                "2024-02-01T09:00:00Z",
                seedCondition("cond-003", "rule-003", AutomationSchemas.SPECTRAL_ENERGY,
                        Map.of("minFrequencyMHz", 2400, "maxFrequencyMHz", 2500, "threshold_dBm", -70)),
                seedAction("act-003", "rule-003", AutomationSchemas.GEOLOCATION_REQUEST,
                        Map.of("algorithm", "TDOA", "sensorIds", List.of("sensor-01", "sensor-02", "sensor-03"))));
    }

    private void addSeedRule(String id, String name, String description, boolean enabled, String createdAt,
                             RuleCondition condition, RuleAction action) {
        Instant created = Instant.parse(createdAt);
        rules.put(id, AutomationRule.builder()
                .id(id)
                .name(name)
                .description(description)
                .enabled(enabled)
                .createdAt(created)
                .updatedAt(created)
                .build());
        condition.setCreatedAt(created);
        condition.setUpdatedAt(created);
        action.setCreatedAt(created);
        action.setUpdatedAt(created);
        conditions.computeIfAbsent(id, key -> new ArrayList<>()).add(condition);
        actions.computeIfAbsent(id, key -> new ArrayList<>()).add(action);
    }

    private static RuleCondition seedCondition(String id, String ruleId, String type, Map<String, Object> parameters) {
        return RuleCondition.builder()
                .id(id)
                .ruleId(ruleId)
                .conditionType(type)
                .parameters(new LinkedHashMap<>(parameters))
                .build();
    }

    private static RuleAction seedAction(String id, String ruleId, String type, Map<String, Object> parameters) {
        return RuleAction.builder()
                .id(id)
                .ruleId(ruleId)
                .actionType(type)
                .parameters(new LinkedHashMap<>(parameters))
                .build();
    }
}
