package com.purchasingpower.emsflow.tool;

/**
 * Typed failure categories a backend may report.
 */
public enum ToolErrorCode {
    NOT_FOUND,
    CONSTRAINT_VIOLATION,
    BACKEND_UNAVAILABLE
}
