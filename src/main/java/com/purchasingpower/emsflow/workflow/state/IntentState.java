package com.purchasingpower.emsflow.workflow.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Top-level state for the intent graph.
 *
 * Every value stored here is Serializable. Nodes return a copy of {@link #data()} with
 * their own keys replaced; lists are rebuilt with the new element appended.
 */
public class IntentState extends AgentState {

    public static final String QUERY = "query";
    public static final String REQUEST_ID = "requestId";
    public static final String ANALYSIS = "analysis";
    public static final String ANALYSIS_NOTES = "analysisNotes";
    public static final String INTENT = "intent";
    public static final String MESSAGES = "messages";
    public static final String OUTCOME = "outcome";
    public static final String HANDLERS_INVOKED = "handlersInvoked";

    public IntentState(Map<String, Object> initData) {
        super(initData);
    }

    // ================================================================
    // GETTERS
    // ================================================================

    public String getQuery() {
        return this.<String>value(QUERY).orElse("");
    }

    public String getRequestId() {
        return this.<String>value(REQUEST_ID).orElse(null);
    }

    public QueryAnalysis getAnalysis() {
        return this.<QueryAnalysis>value(ANALYSIS).orElse(QueryAnalysis.empty());
    }

    public List<String> getAnalysisNotes() {
        return this.<List<String>>value(ANALYSIS_NOTES).orElse(List.of());
    }

    public IntentRecord getIntent() {
        return this.<IntentRecord>value(INTENT).orElse(null);
    }

    public List<ChatMessage> getMessages() {
        return this.<List<ChatMessage>>value(MESSAGES).orElse(List.of());
    }

    public WorkflowOutcome getOutcome() {
        return this.<WorkflowOutcome>value(OUTCOME).orElse(null);
    }

    /**
     * Names of the handler nodes that ran. Exactly one entry once the graph has finished.
     */
    public List<String> getHandlersInvoked() {
        return this.<List<String>>value(HANDLERS_INVOKED).orElse(List.of());
    }

    // ================================================================
    // APPEND HELPERS (return new lists for node updates)
    // ================================================================

    public ArrayList<ChatMessage> messagesWith(ChatMessage message) {
        ArrayList<ChatMessage> messages = new ArrayList<>(getMessages());
        messages.add(message);
        return messages;
    }

    public ArrayList<String> analysisNotesWith(String note) {
        ArrayList<String> notes = new ArrayList<>(getAnalysisNotes());
        notes.add(note);
        return notes;
    }

    public ArrayList<String> handlersInvokedWith(String handler) {
        ArrayList<String> handlers = new ArrayList<>(getHandlersInvoked());
        handlers.add(handler);
        return handlers;
    }
}
