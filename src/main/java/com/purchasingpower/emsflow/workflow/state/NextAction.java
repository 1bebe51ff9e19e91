package com.purchasingpower.emsflow.workflow.state;

/**
 * Planner output: run a tool or produce the final response.
 */
public enum NextAction {
    CALL_TOOL,
    RESPOND
}
