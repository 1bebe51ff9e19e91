package com.purchasingpower.emsflow.tool;

import com.purchasingpower.emsflow.tool.schema.ValidationResult;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable mapping from tool name to definition for one workflow kind.
 *
 * <p>Names are resolved against the closed {@link ToolName} enumeration first, so an
 * unknown or foreign tool is rejected before any side-effecting call.
 */
public final class ToolRegistry {

    private final WorkflowKind kind;
    private final Map<ToolName, ToolDefinition> tools;

    public ToolRegistry(WorkflowKind kind, List<ToolDefinition> definitions) {
        this.kind = kind;
        Map<ToolName, ToolDefinition> byName = new EnumMap<>(ToolName.class);
        for (ToolDefinition definition : definitions) {
            if (byName.put(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate tool " + definition.getName() + " in " + kind + " registry");
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public WorkflowKind getKind() {
        return kind;
    }

    public List<ToolName> toolNames() {
        return List.copyOf(tools.keySet());
    }

    public Optional<ToolDefinition> find(String toolName) {
        return ToolName.fromWireName(toolName).map(tools::get);
    }

    /**
     * Checks that the tool belongs to this registry and that the parameters satisfy
     * its schema. Pure: never touches the backend and never mutates {@code parameters}.
     */
    public ValidationResult validate(String toolName, Map<String, ?> parameters) {
        Optional<ToolDefinition> definition = find(toolName);
        if (definition.isEmpty()) {
            return ValidationResult.failure(List.of(new ValidationResult.Violation("tool",
                    "unknown tool '" + toolName + "'. Valid tools: " + toolNames())));
        }
        return definition.get().getSchema().validate(parameters);
    }

    /**
     * Tool catalogue rendered for the planner prompt.
     */
    public String describeCatalog() {
        return tools.values().stream()
                .map(ToolDefinition::describe)
                .collect(Collectors.joining("\n\n"));
    }
}
