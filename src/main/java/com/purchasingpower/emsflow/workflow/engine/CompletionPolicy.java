package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.tool.EntityRole;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;

import java.util.Map;
import java.util.Optional;

/**
 * Per-kind rules that end the planner loop without asking the reasoner, once the
 * accumulator shows the request has been carried out, and the hint added to each
 * planner prompt.
 */
public enum CompletionPolicy {

    CREATE {
        @Override
        public Optional<String> stopReason(WorkflowState state) {
            if (state.hasEntity(EntityRole.RULE.key())) {
                return Optional.of("A rule has been created");
            }
            return Optional.empty();
        }

        @Override
        public String plannerNote(WorkflowState state) {
            return "Create the rule in one call. Prefer create_rule_condition_action when the request "
                    + "describes both a detection and a reaction.";
        }
    },

    UPDATE {
        @Override
        public Optional<String> stopReason(WorkflowState state) {
            if (state.hasEntity(EntityRole.ACTIVATION.key())
                    || state.hasEntity(EntityRole.DEACTIVATION.key())
                    || state.hasEntity(EntityRole.CONDITION.key())
                    || state.hasEntity(EntityRole.ACTION.key())) {
                return Optional.of("Updates are complete");
            }
            if (state.hasEntity(EntityRole.RULES.key()) && !state.hasEntity(EntityRole.TARGET_RULE.key())) {
                return Optional.of("Unable to find the rule named in the request");
            }
            return Optional.empty();
        }

        @Override
        public String plannerNote(WorkflowState state) {
            Object target = state.getAccumulator().get(EntityRole.TARGET_RULE.key());
            if (target instanceof Map<?, ?> rule) {
                return "Target rule found: '" + rule.get("name") + "' (ID: " + rule.get("id") + "). "
                        + "Use this id with an update tool; do not list rules again.";
            }
            return "If the request does not contain a rule id, call list_automation_rules first.";
        }
    },

    INFO {
        @Override
        public Optional<String> stopReason(WorkflowState state) {
            return Optional.empty();
        }

        @Override
        public String plannerNote(WorkflowState state) {
            return "Respond as soon as the gathered data answers the question.";
        }
    };

    public abstract Optional<String> stopReason(WorkflowState state);

    public abstract String plannerNote(WorkflowState state);

    public static CompletionPolicy forKind(WorkflowKind kind) {
        return switch (kind) {
            case CREATE -> CREATE;
            case UPDATE -> UPDATE;
            case INFO -> INFO;
        };
    }
}
