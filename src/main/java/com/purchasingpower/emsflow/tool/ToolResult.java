package com.purchasingpower.emsflow.tool;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Result of a backend operation. Failures are data: they carry an error code and
 * message instead of being thrown.
 *
 * <p>{@code data} holds JSON-shaped values only (maps, lists, strings, numbers,
 * booleans) so results can be rendered into prompts and copied between states.
 */
@Value
@Builder
public class ToolResult implements Serializable {

    boolean success;
    Object data;
    ToolErrorCode errorCode;
    String message;

    public static ToolResult success(Object data, String message) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .message(message)
                .build();
    }

    public static ToolResult failure(ToolErrorCode errorCode, String message) {
        return ToolResult.builder()
                .success(false)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    public static ToolResult notFound(String message) {
        return failure(ToolErrorCode.NOT_FOUND, message);
    }

    public static ToolResult constraintViolation(String message) {
        return failure(ToolErrorCode.CONSTRAINT_VIOLATION, message);
    }
}
