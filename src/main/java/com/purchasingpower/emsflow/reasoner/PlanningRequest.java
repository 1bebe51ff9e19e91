package com.purchasingpower.emsflow.reasoner;

import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a sub-workflow's state handed to the planner for one turn.
 */
@Value
@Builder
public class PlanningRequest {
    WorkflowKind kind;
    String query;
    int iteration;
    int maxIterations;
    String toolCatalog;
    List<ChatMessage> messages;
    List<String> toolHistory;
    Map<String, Object> accumulator;
    List<String> validationErrors;
    String plannerNote;
}
