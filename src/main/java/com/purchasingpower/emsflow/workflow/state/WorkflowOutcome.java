package com.purchasingpower.emsflow.workflow.state;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * What a handler returns to the router and the router returns to its caller.
 */
@Value
@Builder
public class WorkflowOutcome implements Serializable {

    public static final String CANCELLED_RESPONSE = "The request was cancelled before it completed.";
    public static final String FAILED_RESPONSE =
            "The assistant is temporarily unavailable. Please try again later.";

    OutcomeStatus status;
    IntentLabel intent;
    String response;
    int iterations;
    int toolCalls;

    public static WorkflowOutcome cancelled(IntentLabel intent) {
        return WorkflowOutcome.builder()
                .status(OutcomeStatus.CANCELLED)
                .intent(intent)
                .response(CANCELLED_RESPONSE)
                .build();
    }

    public static WorkflowOutcome failed(IntentLabel intent) {
        return WorkflowOutcome.builder()
                .status(OutcomeStatus.FAILED)
                .intent(intent)
                .response(FAILED_RESPONSE)
                .build();
    }

    public boolean isSuccessful() {
        return status == OutcomeStatus.COMPLETED || status == OutcomeStatus.INCOMPLETE;
    }
}
