package com.purchasingpower.emsflow.tool;

import com.purchasingpower.emsflow.model.automation.ActionDraft;
import com.purchasingpower.emsflow.model.automation.ComponentUpdate;
import com.purchasingpower.emsflow.model.automation.ConditionDraft;
import com.purchasingpower.emsflow.model.automation.RuleDraft;

/**
 * Persistence operations behind the tools, one per tool.
 *
 * <p>Implementations receive parameters that already passed schema validation and
 * report failures through {@link ToolResult#failure}. They may still throw on
 * infrastructure errors; the executor converts those to {@code BACKEND_UNAVAILABLE}.
 */
public interface ToolBackend {

    ToolResult listRules();

    ToolResult getRule(String ruleId);

    ToolResult listConditions(String ruleId);

    ToolResult listActions(String ruleId);

    ToolResult createRule(RuleDraft rule);

    ToolResult createRuleWithCondition(RuleDraft rule, ConditionDraft condition);

    ToolResult createRuleWithAction(RuleDraft rule, ActionDraft action);

    ToolResult createRuleWithConditionAndAction(RuleDraft rule, ConditionDraft condition, ActionDraft action);

    ToolResult activateRule(String ruleId);

    ToolResult deactivateRule(String ruleId);

    ToolResult updateCondition(ComponentUpdate update);

    ToolResult updateAction(ComponentUpdate update);
}
