package com.purchasingpower.emsflow.tool.schema;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of validating a planner-supplied parameter bag against a tool schema.
 *
 * <p>On success {@link #getParameters()} holds the cleaned parameters: unknown keys
 * and nulls removed, values coerced, defaults filled. Immutable and thread-safe.
 */
@Value
@Builder
public class ValidationResult {
    boolean valid;
    Map<String, Object> parameters;
    List<Violation> violations;
    String summary;

    public static ValidationResult success(Map<String, Object> parameters) {
        return ValidationResult.builder()
                .valid(true)
                .parameters(parameters)
                .violations(List.of())
                .summary("✅ Parameters valid")
                .build();
    }

    public static ValidationResult failure(List<Violation> violations) {
        return ValidationResult.builder()
                .valid(false)
                .parameters(Map.of())
                .violations(List.copyOf(violations))
                .summary(violations.stream()
                        .map(Violation::describe)
                        .collect(Collectors.joining("; ")))
                .build();
    }

    /**
     * Single parameter violation.
     */
    @Value
    public static class Violation {
        String field;       // e.g. "condition_parameters.minFrequencyMHz"
        String message;     // e.g. "must be between 10 and 6000"

        public String describe() {
            return field.isEmpty() ? message : field + ": " + message;
        }
    }
}
