package com.purchasingpower.emsflow.exception;

import com.purchasingpower.emsflow.reasoner.ReasonerRole;

/**
 * The reasoning backend could not be reached or refused the call.
 * Fatal for the current request: workflows abort with a fixed degraded response.
 */
public class ReasonerUnavailableException extends ReasonerException {

    public ReasonerUnavailableException(ReasonerRole role, String message, Throwable cause) {
        super(role, message, cause);
    }
}
