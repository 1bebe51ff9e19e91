package com.purchasingpower.emsflow.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for the assistant endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssistantResponse {
    private boolean success;
    private String requestId;
    private String intent;
    private String status;
    private String response;
    private String error;

    public static AssistantResponse fromOutcome(String requestId, WorkflowOutcome outcome) {
        return AssistantResponse.builder()
                .success(outcome.isSuccessful())
                .requestId(requestId)
                .intent(outcome.getIntent() != null ? outcome.getIntent().name() : null)
                .status(outcome.getStatus().name())
                .response(outcome.getResponse())
                .build();
    }

    public static AssistantResponse error(String errorMessage) {
        return AssistantResponse.builder()
                .success(false)
                .error(errorMessage)
                .build();
    }
}
