package com.purchasingpower.emsflow.tool;

import com.purchasingpower.emsflow.model.automation.ActionDraft;
import com.purchasingpower.emsflow.model.automation.ComponentUpdate;
import com.purchasingpower.emsflow.model.automation.ConditionDraft;
import com.purchasingpower.emsflow.model.automation.RuleDraft;
import com.purchasingpower.emsflow.tool.schema.AutomationSchemas;
import com.purchasingpower.emsflow.tool.schema.ParameterSchema;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Tool definitions and the three fixed registries built from them.
 *
 * <p>Registries are created once at class initialisation and never change.
 */
public final class ToolCatalog {

    // ================================================================
    // READ TOOLS
    // ================================================================

    static final ToolDefinition LIST_AUTOMATION_RULES = ToolDefinition.builder()
            .name(ToolName.LIST_AUTOMATION_RULES)
            .description("List every automation rule with its id, name and enabled state. "
                    + "Use it to find a rule id when the request only names the rule.")
            .schema(ParameterSchema.empty())
            .example("{\"tool\": \"list_automation_rules\", \"parameters\": {}}")
            .invoker((backend, params) -> backend.listRules())
            .entityMapper(ToolCatalog::rulesWithTarget)
            .summarizer((params, data) -> "Retrieved " + asList(data).size() + " rules")
            .build();

    static final ToolDefinition GET_AUTOMATION_RULE = ToolDefinition.builder()
            .name(ToolName.GET_AUTOMATION_RULE)
            .description("Get one automation rule by id.")
            .schema(AutomationSchemas.ruleIdOnly())
            .example("{\"tool\": \"get_automation_rule\", \"parameters\": {\"rule_id\": \"rule-001\"}}")
            .invoker((backend, params) -> backend.getRule(ruleId(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.RULE.qualified(ruleId(params)), data))
            .summarizer((params, data) -> "Retrieved rule '" + asMap(data).get("name") + "' (ID: " + ruleId(params) + ")")
            .build();

    static final ToolDefinition LIST_CONDITIONS_FOR_RULE = ToolDefinition.builder()
            .name(ToolName.LIST_CONDITIONS_FOR_RULE)
            .description("List the conditions of a rule.")
            .schema(AutomationSchemas.ruleIdOnly())
            .example("{\"tool\": \"list_conditions_for_rule\", \"parameters\": {\"rule_id\": \"rule-001\"}}")
            .invoker((backend, params) -> backend.listConditions(ruleId(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.CONDITIONS.qualified(ruleId(params)), data))
            .summarizer((params, data) -> "Retrieved " + asList(data).size() + " conditions for rule " + ruleId(params))
            .build();

    static final ToolDefinition LIST_ACTIONS_FOR_RULE = ToolDefinition.builder()
            .name(ToolName.LIST_ACTIONS_FOR_RULE)
            .description("List the actions of a rule.")
            .schema(AutomationSchemas.ruleIdOnly())
            .example("{\"tool\": \"list_actions_for_rule\", \"parameters\": {\"rule_id\": \"rule-001\"}}")
            .invoker((backend, params) -> backend.listActions(ruleId(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.ACTIONS.qualified(ruleId(params)), data))
            .summarizer((params, data) -> "Retrieved " + asList(data).size() + " actions for rule " + ruleId(params))
            .build();

    // ================================================================
    // CREATE TOOLS
    // ================================================================

    static final ToolDefinition CREATE_AUTOMATION_RULE = ToolDefinition.builder()
            .name(ToolName.CREATE_AUTOMATION_RULE)
            .description("Create a rule without conditions or actions. Rules start disabled unless is_enabled is true.")
            .schema(AutomationSchemas.rule(List.of()))
            .example("{\"tool\": \"create_automation_rule\", \"parameters\": "
                    + "{\"name\": \"High Power Alert\", \"description\": \"Alert on strong emitters\"}}")
            .invoker((backend, params) -> backend.createRule(RuleDraft.fromParameters(params)))
            .entityMapper(ToolCatalog::createdComponents)
            .summarizer((params, data) -> {
                Map<String, Object> rule = asMap(asMap(data).get("rule"));
                return "Created rule '" + rule.get("name") + "' with ID " + rule.get("id");
            })
            .build();

    static final ToolDefinition CREATE_RULE_CONDITION = ToolDefinition.builder()
            .name(ToolName.CREATE_RULE_CONDITION)
            .description("Create a rule together with one condition.")
            .schema(AutomationSchemas.rule(AutomationSchemas.CONDITION_FIELDS))
            .example("{\"tool\": \"create_rule_condition\", \"parameters\": {\"name\": \"5G Watch\", "
                    + "\"condition_type\": \"signalDetection\", \"condition_parameters\": {\"signalType\": \"5G\", "
                    + "\"minFrequencyMHz\": 3400, \"maxFrequencyMHz\": 3600}}}")
            .invoker((backend, params) -> backend.createRuleWithCondition(
                    RuleDraft.fromParameters(params), ConditionDraft.fromParameters(params)))
            .entityMapper(ToolCatalog::createdComponents)
            .summarizer(ToolCatalog::describeCreation)
            .build();

    static final ToolDefinition CREATE_RULE_ACTION = ToolDefinition.builder()
            .name(ToolName.CREATE_RULE_ACTION)
            .description("Create a rule together with one action.")
            .schema(AutomationSchemas.rule(AutomationSchemas.ACTION_FIELDS))
            .example("{\"tool\": \"create_rule_action\", \"parameters\": {\"name\": \"Scan Request\", "
                    + "\"action_type\": \"frequencyScanRequest\", \"action_parameters\": {\"sensorIds\": [\"sensor-01\"]}}}")
            .invoker((backend, params) -> backend.createRuleWithAction(
                    RuleDraft.fromParameters(params), ActionDraft.fromParameters(params)))
            .entityMapper(ToolCatalog::createdComponents)
            .summarizer(ToolCatalog::describeCreation)
            .build();

    static final ToolDefinition CREATE_RULE_CONDITION_ACTION = ToolDefinition.builder()
            .name(ToolName.CREATE_RULE_CONDITION_ACTION)
            .description("Create a rule with one condition and one action in a single call. "
                    + "Preferred when the request describes both what to detect and what to do.")
            .schema(AutomationSchemas.rule(concat(AutomationSchemas.CONDITION_FIELDS, AutomationSchemas.ACTION_FIELDS)))
            .example("{\"tool\": \"create_rule_condition_action\", \"parameters\": {\"name\": \"5G Notifier\", "
                    + "\"condition_type\": \"signalDetection\", \"condition_parameters\": {\"signalType\": \"5G\"}, "
                    + "\"action_type\": \"userNotification\", \"action_parameters\": {\"message\": \"Signal found!\"}}}")
            .invoker((backend, params) -> backend.createRuleWithConditionAndAction(
                    RuleDraft.fromParameters(params),
                    ConditionDraft.fromParameters(params),
                    ActionDraft.fromParameters(params)))
            .entityMapper(ToolCatalog::createdComponents)
            .summarizer(ToolCatalog::describeCreation)
            .build();

    // ================================================================
    // UPDATE TOOLS
    // ================================================================

    static final ToolDefinition ACTIVATE_AUTOMATION_RULE = ToolDefinition.builder()
            .name(ToolName.ACTIVATE_AUTOMATION_RULE)
            .description("Enable a rule. Resets the satisfaction state of its conditions.")
            .schema(AutomationSchemas.ruleIdOnly())
            .example("{\"tool\": \"activate_automation_rule\", \"parameters\": {\"rule_id\": \"rule-003\"}}")
            .invoker((backend, params) -> backend.activateRule(ruleId(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.ACTIVATION.key(), data))
            .summarizer((params, data) -> describeStatusChange("Activated", data))
            .build();

    static final ToolDefinition DEACTIVATE_AUTOMATION_RULE = ToolDefinition.builder()
            .name(ToolName.DEACTIVATE_AUTOMATION_RULE)
            .description("Disable a rule. Its conditions and actions are kept.")
            .schema(AutomationSchemas.ruleIdOnly())
            .example("{\"tool\": \"deactivate_automation_rule\", \"parameters\": {\"rule_id\": \"rule-001\"}}")
            .invoker((backend, params) -> backend.deactivateRule(ruleId(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.DEACTIVATION.key(), data))
            .summarizer((params, data) -> describeStatusChange("Deactivated", data))
            .build();

    static final ToolDefinition UPDATE_CONDITION = ToolDefinition.builder()
            .name(ToolName.UPDATE_CONDITION)
            .description("Change a condition of a rule. Only rule_id is required; parameters are merged "
                    + "into the existing ones.")
            .schema(AutomationSchemas.conditionUpdate())
            .example("{\"tool\": \"update_condition\", \"parameters\": {\"rule_id\": \"rule-002\", "
                    + "\"parameters\": {\"minFrequencyMHz\": 1700}}}")
            .invoker((backend, params) -> backend.updateCondition(ComponentUpdate.forCondition(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.CONDITION.key(), data))
            .summarizer((params, data) -> describeComponentUpdate("condition", "condition_id", data))
            .build();

    static final ToolDefinition UPDATE_ACTION = ToolDefinition.builder()
            .name(ToolName.UPDATE_ACTION)
            .description("Change an action of a rule. Only rule_id is required; parameters are merged "
                    + "into the existing ones.")
            .schema(AutomationSchemas.actionUpdate())
            .example("{\"tool\": \"update_action\", \"parameters\": {\"rule_id\": \"rule-001\", "
                    + "\"parameters\": {\"message\": \"5G burst detected\"}}}")
            .invoker((backend, params) -> backend.updateAction(ComponentUpdate.forAction(params)))
            .entityMapper((query, params, data) -> entry(EntityRole.ACTION.key(), data))
            .summarizer((params, data) -> describeComponentUpdate("action", "action_id", data))
            .build();

    // ================================================================
    // REGISTRIES
    // ================================================================

    private static final ToolRegistry CREATE_REGISTRY = new ToolRegistry(WorkflowKind.CREATE, List.of(
            LIST_AUTOMATION_RULES,
            CREATE_AUTOMATION_RULE,
            CREATE_RULE_CONDITION,
            CREATE_RULE_ACTION,
            CREATE_RULE_CONDITION_ACTION));

    private static final ToolRegistry UPDATE_REGISTRY = new ToolRegistry(WorkflowKind.UPDATE, List.of(
            LIST_AUTOMATION_RULES,
            ACTIVATE_AUTOMATION_RULE,
            DEACTIVATE_AUTOMATION_RULE,
            UPDATE_CONDITION,
            UPDATE_ACTION));

    private static final ToolRegistry INFO_REGISTRY = new ToolRegistry(WorkflowKind.INFO, List.of(
            LIST_AUTOMATION_RULES,
            GET_AUTOMATION_RULE,
            LIST_CONDITIONS_FOR_RULE,
            LIST_ACTIONS_FOR_RULE));

    private ToolCatalog() {
    }

    public static ToolRegistry registryFor(WorkflowKind kind) {
        return switch (kind) {
            case CREATE -> CREATE_REGISTRY;
            case UPDATE -> UPDATE_REGISTRY;
            case INFO -> INFO_REGISTRY;
        };
    }

    // ================================================================
    // RESULT HELPERS
    // ================================================================

    /**
     * Lists rules and, when the request mentions one of them by name or id, records
     * it as the target of an update.
     */
    private static Map<String, Object> rulesWithTarget(String query, Map<String, Object> params, Object data) {
        Map<String, Object> entities = new LinkedHashMap<>();
        if (data != null) {
            entities.put(EntityRole.RULES.key(), data);
        }

        String normalizedQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (Object item : asList(data)) {
            Map<String, Object> rule = asMap(item);
            String name = String.valueOf(rule.get("name")).toLowerCase(Locale.ROOT);
            String id = String.valueOf(rule.get("id")).toLowerCase(Locale.ROOT);
            if (normalizedQuery.contains(name) || normalizedQuery.contains(id)) {
                entities.put(EntityRole.TARGET_RULE.key(), Map.of("id", rule.get("id"), "name", rule.get("name")));
                break;
            }
        }
        return entities;
    }

    private static Map<String, Object> entry(String role, Object data) {
        return data == null ? Map.of() : Map.of(role, data);
    }

    private static Map<String, Object> createdComponents(String query, Map<String, Object> params, Object data) {
        Map<String, Object> created = asMap(data);
        Map<String, Object> entities = new LinkedHashMap<>();
        if (created.get("rule") != null) {
            entities.put(EntityRole.RULE.key(), created.get("rule"));
        }
        if (created.get("condition") != null) {
            entities.put(EntityRole.CONDITION.key(), created.get("condition"));
        }
        if (created.get("action") != null) {
            entities.put(EntityRole.ACTION.key(), created.get("action"));
        }
        return entities;
    }

    private static String describeCreation(Map<String, Object> params, Object data) {
        Map<String, Object> created = asMap(data);
        Map<String, Object> rule = asMap(created.get("rule"));
        StringBuilder summary = new StringBuilder("Created rule '")
                .append(rule.get("name")).append("' (ID: ").append(rule.get("id")).append(")");
        if (created.containsKey("condition")) {
            Map<String, Object> condition = asMap(created.get("condition"));
            summary.append(" with ").append(condition.get("conditionType"))
                    .append(" condition (ID: ").append(condition.get("id")).append(")");
        }
        if (created.containsKey("action")) {
            Map<String, Object> action = asMap(created.get("action"));
            summary.append(created.containsKey("condition") ? " and " : " with ")
                    .append(action.get("actionType"))
                    .append(" action (ID: ").append(action.get("id")).append(")");
        }
        return summary.toString();
    }

    private static String describeStatusChange(String verb, Object data) {
        Map<String, Object> change = asMap(data);
        String status = String.valueOf(change.get("status"));
        if (status.startsWith("already_")) {
            return "Rule '" + change.get("rule_name") + "' (ID: " + change.get("rule_id") + ") was "
                    + status.replace('_', ' ');
        }
        return verb + " rule '" + change.get("rule_name") + "' (ID: " + change.get("rule_id") + ")";
    }

    private static String describeComponentUpdate(String component, String idKey, Object data) {
        Map<String, Object> update = asMap(data);
        List<Object> changes = asList(update.get("updates_made"));
        if (changes.isEmpty()) {
            return "No changes were made to " + component + " " + update.get(idKey);
        }
        return "Updated " + component + " " + update.get(idKey) + " of rule " + update.get("rule_id")
                + ": " + changes;
    }

    private static String ruleId(Map<String, Object> params) {
        return (String) params.get("rule_id");
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object data) {
        return data instanceof Map<?, ?> ? (Map<String, Object>) data : Map.of();
    }

    @SuppressWarnings("unchecked")
    static List<Object> asList(Object data) {
        return data instanceof List<?> ? (List<Object>) data : List.of();
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        return Stream.concat(first.stream(), second.stream()).toList();
    }
}
