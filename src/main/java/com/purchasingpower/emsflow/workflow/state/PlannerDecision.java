package com.purchasingpower.emsflow.workflow.state;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Decision returned by the planner for one turn.
 *
 * <p>{@code toolName} is the raw name the planner produced; it is only trusted after
 * the registry has resolved and validated it.
 */
@Value
@Builder
public class PlannerDecision {

    NextAction nextAction;
    String toolName;
    @Builder.Default
    Map<String, Object> parameters = Map.of();
    String reasoning;

    public static PlannerDecision callTool(String toolName, Map<String, Object> parameters, String reasoning) {
        return PlannerDecision.builder()
                .nextAction(NextAction.CALL_TOOL)
                .toolName(toolName)
                .parameters(parameters == null ? Map.of() : parameters)
                .reasoning(reasoning)
                .build();
    }

    public static PlannerDecision respond(String reasoning) {
        return PlannerDecision.builder()
                .nextAction(NextAction.RESPOND)
                .reasoning(reasoning)
                .build();
    }
}
