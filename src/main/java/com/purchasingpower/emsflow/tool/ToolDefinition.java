package com.purchasingpower.emsflow.tool;

import com.purchasingpower.emsflow.tool.schema.ParameterSchema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Registry entry: parameter schema plus the invoker that maps validated parameters
 * onto a {@link ToolBackend} call, and the hooks that turn a successful result into
 * accumulator entries and a one-line summary.
 */
@Value
@Builder
public class ToolDefinition {

    ToolName name;
    String description;
    ParameterSchema schema;
    String example;
    Invoker invoker;
    EntityMapper entityMapper;
    Summarizer summarizer;

    public ToolResult invoke(ToolBackend backend, Map<String, Object> parameters) {
        return invoker.invoke(backend, parameters);
    }

    public Map<String, Object> entities(String query, Map<String, Object> parameters, Object data) {
        return entityMapper.entities(query, parameters, data);
    }

    public String summarize(Map<String, Object> parameters, Object data) {
        return summarizer.summarize(parameters, data);
    }

    public String describe() {
        StringBuilder text = new StringBuilder()
                .append("- ").append(name.getWireName()).append(": ").append(description).append('\n')
                .append("  Parameters:\n").append(schema.describe());
        if (example != null) {
            text.append("\n  Example: ").append(example);
        }
        return text.toString();
    }

    @FunctionalInterface
    public interface Invoker {
        ToolResult invoke(ToolBackend backend, Map<String, Object> parameters);
    }

    @FunctionalInterface
    public interface EntityMapper {
        Map<String, Object> entities(String query, Map<String, Object> parameters, Object data);
    }

    @FunctionalInterface
    public interface Summarizer {
        String summarize(Map<String, Object> parameters, Object data);
    }
}
