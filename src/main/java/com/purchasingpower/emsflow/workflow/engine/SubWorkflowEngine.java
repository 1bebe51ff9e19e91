package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.exception.ReasonerUnavailableException;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.tool.ToolBackend;
import com.purchasingpower.emsflow.tool.ToolRegistry;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.IntentRecord;
import com.purchasingpower.emsflow.workflow.state.NextAction;
import com.purchasingpower.emsflow.workflow.state.OutcomeStatus;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Bounded planner / executor / responder loop shared by CREATE, UPDATE and INFO.
 *
 * <p>The loop is iterative: {@code PLANNING -> EXECUTING -> PLANNING ... -> RESPONDING -> DONE}.
 * Before each planner turn the iteration cap is checked; once reached the run goes
 * straight to RESPONDING and is marked incomplete, so a run with cap N performs at
 * most N planner turns and exactly one response. The cancellation token is polled
 * at the top of every pass.
 */
@Slf4j
public class SubWorkflowEngine {

    private final WorkflowKind kind;
    private final int maxIterations;
    private final PlannerNode planner;
    private final ToolExecutor executor;
    private final ResponseGenerator responder;

    public SubWorkflowEngine(WorkflowKind kind, int maxIterations, ToolRegistry registry,
                             Reasoner reasoner, ToolBackend backend, Clock clock) {
        checkArgument(maxIterations >= 1, "maxIterations must be at least 1 but was %s", maxIterations);
        checkArgument(registry.getKind() == kind, "%s registry given to %s engine", registry.getKind(), kind);
        this.kind = kind;
        this.maxIterations = maxIterations;
        this.planner = new PlannerNode(reasoner, registry, CompletionPolicy.forKind(kind));
        this.executor = new ToolExecutor(registry, backend, clock);
        this.responder = new ResponseGenerator(reasoner);
    }

    public WorkflowKind getKind() {
        return kind;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Runs one request through the loop.
     *
     * @param priorMessages classification turns carried over from the router
     */
    public WorkflowOutcome run(String query, IntentRecord originalIntent, List<ChatMessage> priorMessages,
                               CancellationToken token) {
        WorkflowState state = new WorkflowState(kind, query, originalIntent, maxIterations);
        priorMessages.forEach(state::appendMessage);
        return execute(state, token);
    }

    /**
     * Drives an already initialised state to DONE.
     */
    public WorkflowOutcome execute(WorkflowState state, CancellationToken token) {
        log.info("🚀 [{}] Sub-workflow started (max {} iterations): {}", kind, maxIterations, state.getQuery());
        EngineStep step = EngineStep.PLANNING;

        try {
            while (step != EngineStep.DONE) {
                if (token.isCancelled()) {
                    log.warn("🛑 [{}] Request {} {} at {} after {} iterations", kind, token.getRequestId(),
                            token.reason(), step, state.getIterationCount());
                    return WorkflowOutcome.cancelled(intentOf(kind));
                }
                step = switch (step) {
                    case PLANNING -> plan(state);
                    case EXECUTING -> {
                        executor.execute(state);
                        yield EngineStep.PLANNING;
                    }
                    case RESPONDING -> {
                        responder.respond(state);
                        yield EngineStep.DONE;
                    }
                    case DONE -> throw new IllegalStateException("Loop entered with DONE");
                };
            }
        } catch (ReasonerUnavailableException e) {
            log.error("🔴 [{}] Reasoner unavailable during {}, aborting request", kind, e.getRole(), e);
            return WorkflowOutcome.failed(intentOf(kind));
        }

        OutcomeStatus status = state.isCompleted() ? OutcomeStatus.COMPLETED : OutcomeStatus.INCOMPLETE;
        log.info("🏁 [{}] Sub-workflow finished: status={}, iterations={}, toolCalls={}", kind, status,
                state.getIterationCount(), state.getToolsCalled().size());
        return WorkflowOutcome.builder()
                .status(status)
                .intent(intentOf(kind))
                .response(state.getFinalResponse().orElseThrow())
                .iterations(state.getIterationCount())
                .toolCalls(state.getToolsCalled().size())
                .build();
    }

    private EngineStep plan(WorkflowState state) {
        if (state.isAtIterationCap()) {
            log.warn("⚠️ [{}] Iteration cap {} reached, forcing response", kind, maxIterations);
            state.markIncomplete();
            return EngineStep.RESPONDING;
        }
        planner.plan(state);
        return state.consumeNextAction()
                .map(action -> action == NextAction.CALL_TOOL ? EngineStep.EXECUTING : EngineStep.RESPONDING)
                .orElse(EngineStep.PLANNING);
    }

    private static IntentLabel intentOf(WorkflowKind kind) {
        return switch (kind) {
            case CREATE -> IntentLabel.CREATE;
            case UPDATE -> IntentLabel.UPDATE;
            case INFO -> IntentLabel.INFO;
        };
    }
}
