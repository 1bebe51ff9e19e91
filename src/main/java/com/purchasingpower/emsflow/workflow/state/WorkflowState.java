package com.purchasingpower.emsflow.workflow.state;

import com.purchasingpower.emsflow.tool.ToolName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * State of one sub-workflow run (CREATE, UPDATE or INFO).
 *
 * <p>Merge rules per field:
 * <ul>
 *   <li>{@code messages}, {@code toolsCalled}, {@code validationErrors}: append-only</li>
 *   <li>accumulator: one entry per entity role, overwritten by newer results</li>
 *   <li>{@code iterationCount}: +1 per planner turn, never above {@code maxIterations}</li>
 *   <li>{@code nextAction} and the pending call: set by the planner, consumed once</li>
 *   <li>{@code finalResponse}: write-once</li>
 * </ul>
 *
 * <p>Owned by a single engine run and mutated in strict turn order, so no locking.
 */
public class WorkflowState {

    private final WorkflowKind kind;
    private final String query;
    private final IntentRecord originalIntent;
    private final int maxIterations;

    private final List<ChatMessage> messages = new ArrayList<>();
    private final List<ToolCallRecord> toolsCalled = new ArrayList<>();
    private final Map<String, Object> accumulator = new LinkedHashMap<>();
    private final List<String> validationErrors = new ArrayList<>();

    private int iterationCount;
    private boolean completed = true;

    private NextAction nextAction;
    private PendingCall pendingCall;

    private String finalResponse;

    public WorkflowState(WorkflowKind kind, String query, IntentRecord originalIntent, int maxIterations) {
        checkArgument(maxIterations >= 1, "maxIterations must be at least 1 but was %s", maxIterations);
        this.kind = checkNotNull(kind, "kind");
        this.query = checkNotNull(query, "query");
        this.originalIntent = originalIntent;
        this.maxIterations = maxIterations;
    }

    // ================================================================
    // IMMUTABLE FIELDS
    // ================================================================

    public WorkflowKind getKind() {
        return kind;
    }

    public String getQuery() {
        return query;
    }

    public IntentRecord getOriginalIntent() {
        return originalIntent;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    // ================================================================
    // APPEND-ONLY FIELDS
    // ================================================================

    public void appendMessage(ChatMessage message) {
        messages.add(checkNotNull(message, "message"));
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void recordToolCall(ToolCallRecord record) {
        toolsCalled.add(checkNotNull(record, "record"));
    }

    public List<ToolCallRecord> getToolsCalled() {
        return Collections.unmodifiableList(toolsCalled);
    }

    /**
     * True if the exact same tool and parameters were already executed in this run.
     */
    public boolean hasCalled(String tool, Map<String, Object> parameters) {
        return toolsCalled.stream().anyMatch(record -> record.sameCallAs(tool, parameters));
    }

    public void addValidationError(String error) {
        validationErrors.add(checkNotNull(error, "error"));
    }

    public List<String> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    // ================================================================
    // ACCUMULATOR (overwrite per role)
    // ================================================================

    public void recordEntity(String role, Object value) {
        accumulator.put(checkNotNull(role, "role"), checkNotNull(value, "value"));
    }

    /** Records every non-null entry; a role without a value keeps its previous entry. */
    public void recordEntities(Map<String, Object> entities) {
        entities.forEach((role, value) -> {
            if (value != null) {
                recordEntity(role, value);
            }
        });
    }

    public Map<String, Object> getAccumulator() {
        return Collections.unmodifiableMap(accumulator);
    }

    public boolean hasEntity(String role) {
        return accumulator.containsKey(role);
    }

    // ================================================================
    // ITERATION COUNTER
    // ================================================================

    public int getIterationCount() {
        return iterationCount;
    }

    public boolean isAtIterationCap() {
        return iterationCount >= maxIterations;
    }

    /**
     * Counts a planner turn.
     *
     * @throws IllegalStateException if the cap has already been reached
     */
    public int incrementIteration() {
        checkState(iterationCount < maxIterations,
                "Iteration cap %s reached for %s workflow", maxIterations, kind);
        return ++iterationCount;
    }

    /**
     * False when the run ended through the iteration cap instead of a respond decision.
     */
    public boolean isCompleted() {
        return completed;
    }

    public void markIncomplete() {
        this.completed = false;
    }

    // ================================================================
    // TRANSIENT PLANNER OUTPUT
    // ================================================================

    public void planToolCall(ToolName tool, Map<String, Object> parameters) {
        this.nextAction = NextAction.CALL_TOOL;
        this.pendingCall = new PendingCall(checkNotNull(tool, "tool"),
                Collections.unmodifiableMap(new LinkedHashMap<>(parameters)));
    }

    public void planResponse() {
        this.nextAction = NextAction.RESPOND;
        this.pendingCall = null;
    }

    /**
     * Reads and clears the planner's decision. Empty when the last turn produced no
     * usable decision and the planner must run again.
     */
    public Optional<NextAction> consumeNextAction() {
        NextAction action = nextAction;
        nextAction = null;
        return Optional.ofNullable(action);
    }

    /**
     * Reads and clears the validated call selected by the planner.
     *
     * @throws IllegalStateException if no call is pending
     */
    public PendingCall consumePendingCall() {
        checkState(pendingCall != null, "No tool call pending");
        PendingCall call = pendingCall;
        pendingCall = null;
        return call;
    }

    // ================================================================
    // FINAL RESPONSE (write-once)
    // ================================================================

    public void setFinalResponse(String response) {
        checkState(finalResponse == null, "Final response already set");
        this.finalResponse = checkNotNull(response, "response");
    }

    public Optional<String> getFinalResponse() {
        return Optional.ofNullable(finalResponse);
    }

    /**
     * Tool call validated by the planner and waiting for the executor.
     */
    public record PendingCall(ToolName tool, Map<String, Object> parameters) {
    }
}
