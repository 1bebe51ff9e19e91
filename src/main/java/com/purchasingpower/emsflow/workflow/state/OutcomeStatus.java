package com.purchasingpower.emsflow.workflow.state;

/**
 * How a request ended.
 */
public enum OutcomeStatus {
    /** A handler produced its response normally. */
    COMPLETED,
    /** Iteration cap reached; response carries the incomplete marker. */
    INCOMPLETE,
    /** Intent could not be determined; fixed error response. */
    UNRECOGNIZED,
    /** Cancellation or deadline fired; no partial response. */
    CANCELLED,
    /** Reasoning backend unavailable or unexpected error; fixed degraded response. */
    FAILED
}
