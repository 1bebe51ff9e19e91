package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.tool.ToolBackend;
import com.purchasingpower.emsflow.tool.ToolDefinition;
import com.purchasingpower.emsflow.tool.ToolErrorCode;
import com.purchasingpower.emsflow.tool.ToolRegistry;
import com.purchasingpower.emsflow.tool.ToolResult;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.ToolCallRecord;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;

/**
 * Action node of the sub-workflow loop. Runs the pending call against the backend
 * and records the outcome; backend failures become data and never escape.
 */
@Slf4j
@RequiredArgsConstructor
public class ToolExecutor {

    private final ToolRegistry registry;
    private final ToolBackend backend;
    private final Clock clock;

    public void execute(WorkflowState state) {
        WorkflowState.PendingCall call = state.consumePendingCall();
        ToolDefinition tool = registry.find(call.tool().getWireName())
                .orElseThrow(() -> new IllegalStateException(call.tool() + " is not registered for " + state.getKind()));
        Map<String, Object> parameters = call.parameters();
        String toolName = tool.getName().getWireName();

        boolean repeated = state.hasCalled(toolName, parameters);
        if (repeated) {
            log.warn("🔁 [{}] Repeating identical call {}{}", state.getKind(), toolName, parameters);
        }

        ToolResult result = invoke(tool, parameters);

        String summary;
        if (result.isSuccess()) {
            try {
                Map<String, Object> entities = tool.entities(state.getQuery(), parameters, result.getData());
                summary = tool.summarize(parameters, result.getData());
                state.recordEntities(entities);
                log.info("✅ [{}] {} → {}", state.getKind(), toolName, summary);
            } catch (RuntimeException e) {
                log.error("🔴 [{}] Result of {} could not be mapped", state.getKind(), toolName, e);
                result = ToolResult.failure(ToolErrorCode.BACKEND_UNAVAILABLE,
                        "Unusable result: " + describe(e));
                summary = recordFailure(state, toolName, result);
            }
        } else {
            summary = recordFailure(state, toolName, result);
        }

        ToolCallRecord record = ToolCallRecord.builder()
                .tool(toolName)
                .parameters(parameters)
                .success(result.isSuccess())
                .data(result.getData())
                .errorCode(result.getErrorCode())
                .message(result.getMessage())
                .summary(summary)
                .repeated(repeated)
                .timestamp(clock.instant())
                .build();
        state.recordToolCall(record);
        state.appendMessage(ChatMessage.tool(ToolHistory.describe(record)));
    }

    private static String recordFailure(WorkflowState state, String toolName, ToolResult result) {
        state.addValidationError(toolName + " failed (" + result.getErrorCode() + "): " + result.getMessage());
        log.warn("❌ [{}] {} failed ({}): {}", state.getKind(), toolName, result.getErrorCode(), result.getMessage());
        return result.getMessage();
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private ToolResult invoke(ToolDefinition tool, Map<String, Object> parameters) {
        try {
            ToolResult result = tool.invoke(backend, parameters);
            if (result == null) {
                return ToolResult.failure(ToolErrorCode.BACKEND_UNAVAILABLE, "Backend returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("🔴 Backend call {} threw", tool.getName(), e);
            return ToolResult.failure(ToolErrorCode.BACKEND_UNAVAILABLE,
                    "Backend error: " + describe(e));
        }
    }
}
