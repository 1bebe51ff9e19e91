package com.purchasingpower.emsflow.service;

import com.purchasingpower.emsflow.workflow.IntentRouter;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Process boundary: one natural-language request in, one response out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationAssistantService {

    private final IntentRouter intentRouter;

    /**
     * Handles a request and returns the final text only.
     */
    public String handle(String query) {
        return handle(query, null).getResponse();
    }

    /**
     * Handles a request under the given id, generating one when absent.
     * The id can be passed to {@link #cancel(String)} while the request runs.
     *
     * @throws com.purchasingpower.emsflow.exception.DuplicateRequestException if the id is already running
     */
    public WorkflowOutcome handle(String query, String requestId) {
        String id = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        return intentRouter.route(query, intentRouter.newToken(id));
    }

    public boolean cancel(String requestId) {
        return intentRouter.cancel(requestId);
    }
}
