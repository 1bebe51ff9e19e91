package com.purchasingpower.emsflow.workflow.handlers;

import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.OutcomeStatus;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * ERROR terminal. Returns a fixed message without touching the Reasoner or any tool.
 */
@Slf4j
@Component
public class UnknownIntentHandler {

    public static final String UNRECOGNIZED_RESPONSE =
            "Sorry, I could not understand your request or it is not related to RF spectrum automation rules.";

    public WorkflowOutcome handle(String query) {
        log.info("❓ [ERROR] Request not recognised: {}", query);
        return WorkflowOutcome.builder()
                .status(OutcomeStatus.UNRECOGNIZED)
                .intent(IntentLabel.UNKNOWN)
                .response(UNRECOGNIZED_RESPONSE)
                .build();
    }
}
