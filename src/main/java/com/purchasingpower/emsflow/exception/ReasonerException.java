package com.purchasingpower.emsflow.exception;

import com.purchasingpower.emsflow.reasoner.ReasonerRole;
import lombok.Getter;

/**
 * Base class for failures of the reasoning collaborator.
 *
 * @see ReasonerUnavailableException
 * @see ReasonerOutputException
 */
@Getter
public class ReasonerException extends RuntimeException {

    private final ReasonerRole role;

    public ReasonerException(ReasonerRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }
}
