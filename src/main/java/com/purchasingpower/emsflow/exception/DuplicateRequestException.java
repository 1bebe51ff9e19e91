package com.purchasingpower.emsflow.exception;

import lombok.Getter;

/**
 * Raised when a request id is reused while a request with that id is still running.
 */
@Getter
public class DuplicateRequestException extends RuntimeException {

    private final String requestId;

    public DuplicateRequestException(String requestId) {
        super("Request " + requestId + " is already running");
        this.requestId = requestId;
    }
}
