package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.reasoner.PlanningRequest;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.tool.ToolDefinition;
import com.purchasingpower.emsflow.tool.ToolRegistry;
import com.purchasingpower.emsflow.tool.schema.ValidationResult;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.NextAction;
import com.purchasingpower.emsflow.workflow.state.PlannerDecision;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Decision node of the sub-workflow loop.
 *
 * <p>Each call counts one iteration and leaves the state in one of three shapes:
 * a validated pending tool call, a respond decision, or no decision at all (the
 * planner named an unknown tool or bad parameters; a validation error is recorded
 * and the engine plans again).
 */
@Slf4j
@RequiredArgsConstructor
public class PlannerNode {

    static final String MALFORMED_PLAN_NOTE =
            "Sorry, I could not work out the next step for this request, so I stopped here.";

    private final Reasoner reasoner;
    private final ToolRegistry registry;
    private final CompletionPolicy completionPolicy;

    public void plan(WorkflowState state) {
        int iteration = state.incrementIteration();
        log.info("🤔 [{}] Planning iteration {}/{}", state.getKind(), iteration, state.getMaxIterations());

        Optional<String> stopReason = completionPolicy.stopReason(state);
        if (stopReason.isPresent()) {
            log.info("✅ [{}] {}; responding", state.getKind(), stopReason.get());
            state.appendMessage(ChatMessage.assistant("Plan: respond. " + stopReason.get()));
            state.planResponse();
            return;
        }

        PlannerDecision decision;
        try {
            decision = reasoner.plan(buildRequest(state, iteration));
        } catch (ReasonerOutputException e) {
            log.warn("⚠️ [{}] Planner output unusable, forcing response: {}", state.getKind(), e.getMessage());
            state.addValidationError(MALFORMED_PLAN_NOTE);
            state.appendMessage(ChatMessage.assistant("Plan: respond. Planner output could not be parsed."));
            state.planResponse();
            return;
        }

        if (decision.getNextAction() != NextAction.CALL_TOOL) {
            log.info("💬 [{}] Planner chose to respond: {}", state.getKind(), decision.getReasoning());
            state.appendMessage(ChatMessage.assistant("Plan: respond. " + nullToEmpty(decision.getReasoning())));
            state.planResponse();
            return;
        }

        ValidationResult validation = registry.validate(decision.getToolName(), decision.getParameters());
        if (!validation.isValid()) {
            String error = "Iteration " + iteration + ": call to '" + decision.getToolName()
                    + "' rejected: " + validation.getSummary();
            log.warn("⚠️ [{}] {}", state.getKind(), error);
            state.addValidationError(error);
            state.appendMessage(ChatMessage.assistant("Plan rejected. " + error));
            return;
        }

        ToolDefinition tool = registry.find(decision.getToolName()).orElseThrow();
        log.info("🔧 [{}] Planner selected {} with {}", state.getKind(), tool.getName(), validation.getParameters());
        state.appendMessage(ChatMessage.assistant("Plan: call " + tool.getName() + " with "
                + validation.getParameters() + ". " + nullToEmpty(decision.getReasoning())));
        state.planToolCall(tool.getName(), validation.getParameters());
    }

    private PlanningRequest buildRequest(WorkflowState state, int iteration) {
        return PlanningRequest.builder()
                .kind(state.getKind())
                .query(state.getQuery())
                .iteration(iteration)
                .maxIterations(state.getMaxIterations())
                .toolCatalog(registry.describeCatalog())
                .messages(List.copyOf(state.getMessages()))
                .toolHistory(ToolHistory.describe(state.getToolsCalled()))
                .accumulator(new LinkedHashMap<>(state.getAccumulator()))
                .validationErrors(List.copyOf(state.getValidationErrors()))
                .plannerNote(completionPolicy.plannerNote(state))
                .build();
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
