package com.purchasingpower.emsflow.exception;

import lombok.Getter;

/**
 * Transport-level failure talking to an LLM provider.
 */
@Getter
public class LlmCallException extends RuntimeException {

    private final String provider;

    public LlmCallException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
