package com.purchasingpower.emsflow.reasoner;

import com.purchasingpower.emsflow.workflow.state.IntentRecord;
import com.purchasingpower.emsflow.workflow.state.PlannerDecision;
import com.purchasingpower.emsflow.workflow.state.QueryAnalysis;

/**
 * Language-model inference used by the workflows.
 *
 * <p>Every method either returns a well-formed result or throws:
 * <ul>
 *   <li>{@link com.purchasingpower.emsflow.exception.ReasonerOutputException} when the
 *       answer is malformed; callers substitute a safe default</li>
 *   <li>{@link com.purchasingpower.emsflow.exception.ReasonerUnavailableException} when
 *       the backend cannot be reached; fatal for the current request</li>
 * </ul>
 */
public interface Reasoner {

    /**
     * Extracts coarse entities and decides which knowledge the classifier needs.
     */
    QueryAnalysis analyze(String query);

    /**
     * Assigns an intent label. {@code knowledgeContext} may be empty.
     */
    IntentRecord classify(String query, QueryAnalysis analysis, String knowledgeContext);

    /**
     * Chooses the next tool call or decides to respond.
     */
    PlannerDecision plan(PlanningRequest request);

    /**
     * Answers a general RF or schema question without tools.
     */
    String respondGeneric(String query, String knowledgeContext);

    /**
     * Writes the user-facing summary of a sub-workflow run.
     */
    String summarize(SummaryRequest request);
}
