package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.reasoner.SummaryRequest;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.ToolCallRecord;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Terminal node of the sub-workflow loop: writes the final response exactly once.
 *
 * <p>Degraded runs always carry {@link #INCOMPLETE_MARKER}, whatever the reasoner wrote.
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseGenerator {

    public static final String INCOMPLETE_MARKER = "⚠️ **Incomplete**";

    private final Reasoner reasoner;

    public void respond(WorkflowState state) {
        SummaryRequest request = SummaryRequest.builder()
                .kind(state.getKind())
                .query(state.getQuery())
                .toolHistory(ToolHistory.describe(state.getToolsCalled()))
                .accumulator(new LinkedHashMap<>(state.getAccumulator()))
                .validationErrors(List.copyOf(state.getValidationErrors()))
                .completed(state.isCompleted())
                .build();

        String text;
        try {
            text = reasoner.summarize(request);
            if (text == null || text.isBlank()) {
                log.warn("⚠️ [{}] Empty summary from reasoner, using fallback", state.getKind());
                text = fallbackSummary(state);
            }
        } catch (ReasonerOutputException e) {
            log.warn("⚠️ [{}] Summary output unusable, using fallback: {}", state.getKind(), e.getMessage());
            text = fallbackSummary(state);
        }

        text = text.trim();
        if (!state.isCompleted() && !text.startsWith(INCOMPLETE_MARKER)) {
            text = INCOMPLETE_MARKER + " The request could not be finished within "
                    + state.getMaxIterations() + " planning steps.\n\n" + text;
        }

        state.setFinalResponse(text);
        state.appendMessage(ChatMessage.assistant(text));
        log.info("📝 [{}] Final response ready ({} chars, {} tool calls)", state.getKind(), text.length(),
                state.getToolsCalled().size());
    }

    /**
     * Deterministic summary built from the tool log when the reasoner gives nothing usable.
     */
    static String fallbackSummary(WorkflowState state) {
        StringBuilder text = new StringBuilder();
        List<ToolCallRecord> calls = state.getToolsCalled();
        if (calls.isEmpty()) {
            text.append("No operations were performed for your request.");
        } else {
            text.append("Here is what was done:");
            for (ToolCallRecord call : calls) {
                text.append("\n- ").append(call.isSuccess() ? "✅ " : "❌ ").append(call.getSummary());
            }
        }
        if (!state.getValidationErrors().isEmpty()) {
            text.append("\n\nIssues encountered:");
            state.getValidationErrors().forEach(error -> text.append("\n- ").append(error));
        }
        return text.toString();
    }
}
