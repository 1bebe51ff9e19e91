package com.purchasingpower.emsflow.workflow.handlers;

import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.exception.ReasonerUnavailableException;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.service.KnowledgeBaseService;
import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.OutcomeStatus;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Answers general RF or schema questions with a single Reasoner call. No tools, no loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenericIntentHandler {

    public static final String FALLBACK_RESPONSE =
            "Sorry, I could not put together an answer to that question. Please try rephrasing it.";

    private final Reasoner reasoner;
    private final KnowledgeBaseService knowledgeBase;

    public WorkflowOutcome handle(String query) {
        log.info("💬 [GENERIC] Answering directly: {}", query);
        try {
            String answer = reasoner.respondGeneric(query, knowledgeBase.fullContext());
            if (answer == null || answer.isBlank()) {
                log.warn("⚠️ [GENERIC] Empty answer, using fallback text");
                answer = FALLBACK_RESPONSE;
            }
            return outcome(answer);
        } catch (ReasonerOutputException e) {
            log.warn("⚠️ [GENERIC] Unusable answer ({}), using fallback text", e.getMessage());
            return outcome(FALLBACK_RESPONSE);
        } catch (ReasonerUnavailableException e) {
            log.error("🔴 [GENERIC] Reasoner unavailable", e);
            return WorkflowOutcome.failed(IntentLabel.GENERIC);
        }
    }

    private static WorkflowOutcome outcome(String response) {
        return WorkflowOutcome.builder()
                .status(OutcomeStatus.COMPLETED)
                .intent(IntentLabel.GENERIC)
                .response(response)
                .build();
    }
}
