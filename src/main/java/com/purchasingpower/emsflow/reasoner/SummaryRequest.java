package com.purchasingpower.emsflow.reasoner;

import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the responder needs to describe a finished run.
 * {@code completed} is false after degraded termination.
 */
@Value
@Builder
public class SummaryRequest {
    WorkflowKind kind;
    String query;
    List<String> toolHistory;
    Map<String, Object> accumulator;
    List<String> validationErrors;
    boolean completed;
}
