package com.purchasingpower.emsflow.workflow.state;

import com.purchasingpower.emsflow.tool.ToolErrorCode;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One executed tool call, successful or not.
 */
@Value
@Builder
public class ToolCallRecord implements Serializable {

    String tool;
    Map<String, Object> parameters;
    boolean success;
    Object data;
    ToolErrorCode errorCode;
    String message;
    String summary;

    /** Same tool and parameters as an earlier call in the same run. */
    boolean repeated;

    Instant timestamp;

    public boolean sameCallAs(String otherTool, Map<String, Object> otherParameters) {
        return tool.equals(otherTool) && parameters.equals(otherParameters);
    }
}
