package com.purchasingpower.emsflow.tool.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declaration of one tool parameter: type, requiredness, default and constraints.
 *
 * <p>{@code OBJECT} parameters are discriminated: the value of the sibling field named
 * by {@link #getDiscriminator()} selects one of {@link #getVariants()}. When the
 * discriminator is absent, {@link #getFallback()} is used if present.
 */
@Value
@Builder(toBuilder = true)
public class ParameterSpec {

    String name;
    ParameterType type;
    boolean required;
    Object defaultValue;
    String description;

    @Singular
    List<String> allowedValues;

    Double min;
    Double max;
    Integer minItems;
    boolean nonBlank;

    String discriminator;

    @Singular
    Map<String, ParameterSchema> variants;

    ParameterSchema fallback;

    /**
     * Copy with no requiredness and no default, used for partial updates.
     */
    ParameterSpec relaxed() {
        ParameterSpecBuilder copy = toBuilder().required(false).defaultValue(null);
        if (type == ParameterType.OBJECT) {
            copy.clearVariants();
            variants.forEach((key, schema) -> copy.variant(key, schema.partial()));
            copy.fallback(fallback == null ? null : fallback.partial());
        }
        return copy.build();
    }

    /**
     * Coerces a non-null raw value and checks every scalar constraint.
     *
     * @throws IllegalArgumentException with a user-facing message on violation
     */
    Object normalize(Object raw) {
        Object value = type.coerce(raw);

        if (!allowedValues.isEmpty()) {
            value = canonicalValue(value.toString());
        }
        if (nonBlank && value instanceof String text && text.isEmpty()) {
            throw new IllegalArgumentException("must not be blank");
        }
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if ((min != null && numeric < min) || (max != null && numeric > max)) {
                throw new IllegalArgumentException("must be between " + format(min) + " and " + format(max));
            }
        }
        if (minItems != null && value instanceof List<?> list && list.size() < minItems) {
            throw new IllegalArgumentException(minItems == 1
                    ? "must be a non-empty list"
                    : "must contain at least " + minItems + " entries");
        }
        return value;
    }

    Optional<ParameterSchema> variantFor(Object discriminatorValue) {
        if (discriminatorValue == null) {
            return Optional.ofNullable(fallback);
        }
        return Optional.ofNullable(variants.get(discriminatorValue.toString()));
    }

    /**
     * One-line description used in the planner's tool catalogue.
     */
    public String describe() {
        StringBuilder line = new StringBuilder()
                .append(name).append(" (").append(type.getWireName())
                .append(required ? ", required" : ", optional").append(")");
        if (description != null) {
            line.append(": ").append(description);
        }
        if (!allowedValues.isEmpty()) {
            line.append(" one of ").append(allowedValues);
        }
        if (min != null || max != null) {
            line.append(" range [").append(format(min)).append(", ").append(format(max)).append("]");
        }
        if (minItems != null) {
            line.append(" at least ").append(minItems).append(" entries");
        }
        if (defaultValue != null) {
            line.append(" default ").append(defaultValue);
        }
        return line.toString();
    }

    private String canonicalValue(String text) {
        for (String allowed : allowedValues) {
            if (allowed.toLowerCase(Locale.ROOT).equals(text.toLowerCase(Locale.ROOT))) {
                return allowed;
            }
        }
        throw new IllegalArgumentException("must be one of " + allowedValues + " but got '" + text + "'");
    }

    private static String format(Double bound) {
        if (bound == null) {
            return "∞";
        }
        return bound == Math.rint(bound) ? String.valueOf(bound.longValue()) : bound.toString();
    }
}
