package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.workflow.state.ToolCallRecord;

import java.util.List;

/**
 * Renders executed tool calls as one line each for prompts and fallback summaries.
 */
final class ToolHistory {

    private ToolHistory() {
    }

    static List<String> describe(List<ToolCallRecord> calls) {
        return calls.stream().map(ToolHistory::describe).toList();
    }

    static String describe(ToolCallRecord call) {
        StringBuilder line = new StringBuilder(call.getTool())
                .append(call.getParameters())
                .append(": ")
                .append(call.getSummary());
        if (!call.isSuccess()) {
            line.append(" [FAILED ").append(call.getErrorCode()).append("]");
        }
        if (call.isRepeated()) {
            line.append(" [repeated call]");
        }
        return line.toString();
    }
}
