package com.purchasingpower.emsflow.tool.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered set of parameter declarations plus cross-field rules.
 *
 * <p>Validation is pure. It reads the raw map, never mutates it and never contacts a
 * backend. Output keys follow declaration order, defaults are fixed constants, so
 * validating the same sparse input twice yields equal maps.
 */
public final class ParameterSchema {

    private static final ParameterSchema EMPTY = new ParameterSchema(List.of(), List.of());

    private final List<ParameterSpec> fields;
    private final List<CrossFieldRule> rules;

    private ParameterSchema(List<ParameterSpec> fields, List<CrossFieldRule> rules) {
        this.fields = List.copyOf(fields);
        this.rules = List.copyOf(rules);
    }

    public static ParameterSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ParameterSpec> getFields() {
        return fields;
    }

    /**
     * Same fields and rules with every parameter optional and no defaults.
     */
    public ParameterSchema partial() {
        return new ParameterSchema(
                fields.stream().map(ParameterSpec::relaxed).toList(),
                rules);
    }

    public ValidationResult validate(Map<String, ?> raw) {
        List<ValidationResult.Violation> violations = new ArrayList<>();
        Map<String, Object> cleaned = validateInto(raw == null ? Map.of() : raw, "", violations);
        return violations.isEmpty()
                ? ValidationResult.success(cleaned)
                : ValidationResult.failure(violations);
    }

    private Map<String, Object> validateInto(Map<?, ?> raw, String path,
                                             List<ValidationResult.Violation> violations) {
        Map<String, Object> cleaned = new LinkedHashMap<>();

        for (ParameterSpec spec : fields) {
            String fieldPath = path + spec.getName();
            Object value = raw.get(spec.getName());

            if (value == null) {
                if (spec.getDefaultValue() != null) {
                    cleaned.put(spec.getName(), spec.getDefaultValue());
                } else if (spec.isRequired()) {
                    violations.add(new ValidationResult.Violation(fieldPath, "is required"));
                }
                continue;
            }

            try {
                Object normalized = spec.normalize(value);
                if (spec.getType() == ParameterType.OBJECT) {
                    normalized = validateNested(spec, (Map<?, ?>) normalized, cleaned, fieldPath, violations);
                }
                if (normalized != null) {
                    cleaned.put(spec.getName(), normalized);
                }
            } catch (IllegalArgumentException e) {
                violations.add(new ValidationResult.Violation(fieldPath, e.getMessage()));
            }
        }

        for (CrossFieldRule rule : rules) {
            try {
                rule.check(cleaned).ifPresent(v -> violations.add(
                        new ValidationResult.Violation(path + v.getField(), v.getMessage())));
            } catch (IllegalArgumentException e) {
                violations.add(new ValidationResult.Violation(path, e.getMessage()));
            }
        }

        return Collections.unmodifiableMap(cleaned);
    }

    private Map<String, Object> validateNested(ParameterSpec spec, Map<?, ?> nested,
                                               Map<String, Object> siblings, String fieldPath,
                                               List<ValidationResult.Violation> violations) {
        if (spec.getDiscriminator() == null) {
            return Collections.unmodifiableMap(copyKeys(nested));
        }
        Object selector = siblings.get(spec.getDiscriminator());
        Optional<ParameterSchema> variant = spec.variantFor(selector);
        if (variant.isEmpty()) {
            violations.add(new ValidationResult.Violation(fieldPath,
                    "cannot be validated without a valid " + spec.getDiscriminator()));
            return null;
        }
        return variant.get().validateInto(nested, fieldPath + ".", violations);
    }

    private static Map<String, Object> copyKeys(Map<?, ?> nested) {
        Map<String, Object> copy = new LinkedHashMap<>();
        nested.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key.toString(), value);
            }
        });
        return copy;
    }

    /**
     * Multi-line rendering for the planner prompt, nested variants indented.
     */
    public String describe() {
        if (fields.isEmpty()) {
            return "  (no parameters)";
        }
        return describe("  ");
    }

    private String describe(String indent) {
        return fields.stream()
                .map(spec -> {
                    String line = indent + "- " + spec.describe();
                    if (spec.getVariants().isEmpty()) {
                        return line;
                    }
                    String variants = spec.getVariants().entrySet().stream()
                            .map(e -> indent + "    when " + spec.getDiscriminator() + " = " + e.getKey()
                                    + ":\n" + e.getValue().describe(indent + "      "))
                            .collect(Collectors.joining("\n"));
                    return line + "\n" + variants;
                })
                .collect(Collectors.joining("\n"));
    }

    public static final class Builder {
        private final List<ParameterSpec> fields = new ArrayList<>();
        private final List<CrossFieldRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder field(ParameterSpec spec) {
            fields.add(spec);
            return this;
        }

        public Builder fields(List<ParameterSpec> specs) {
            fields.addAll(specs);
            return this;
        }

        public Builder rule(CrossFieldRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder rules(List<CrossFieldRule> moreRules) {
            rules.addAll(moreRules);
            return this;
        }

        public ParameterSchema build() {
            return new ParameterSchema(fields, rules);
        }
    }
}
