package com.purchasingpower.emsflow.exception;

import com.purchasingpower.emsflow.reasoner.ReasonerRole;
import lombok.Getter;

/**
 * The reasoning backend answered, but the answer could not be parsed into the
 * structure expected for its role. Callers substitute a safe default.
 */
@Getter
public class ReasonerOutputException extends ReasonerException {

    private final String rawOutput;

    public ReasonerOutputException(ReasonerRole role, String message, String rawOutput) {
        this(role, message, rawOutput, null);
    }

    public ReasonerOutputException(ReasonerRole role, String message, String rawOutput, Throwable cause) {
        super(role, message, cause);
        this.rawOutput = rawOutput;
    }
}
