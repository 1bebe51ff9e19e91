package com.purchasingpower.emsflow.exception;

import lombok.Getter;

/**
 * Raised when a request's cancellation token fires between workflow steps.
 */
@Getter
public class WorkflowCancelledException extends RuntimeException {

    private final String requestId;

    public WorkflowCancelledException(String requestId, String reason) {
        super("Request " + requestId + " cancelled: " + reason);
        this.requestId = requestId;
    }
}
