package com.purchasingpower.emsflow.tool.schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wire types a tool parameter may declare.
 *
 * <p>Each type knows how to coerce the loosely typed JSON produced by the planner
 * into one canonical Java representation. Coercion is deterministic: the same raw
 * value always yields an equal result, and the raw value is never modified.
 */
public enum ParameterType {

    STRING("string") {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean) {
                return raw.toString().trim();
            }
            throw new IllegalArgumentException("expected a string");
        }
    },

    INTEGER("integer") {
        @Override
        Object coerce(Object raw) {
            BigDecimal value = toDecimal(raw, "an integer");
            try {
                return value.intValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("expected an integer but got " + raw);
            }
        }
    },

    NUMBER("number") {
        @Override
        Object coerce(Object raw) {
            return toDecimal(raw, "a number").doubleValue();
        }
    },

    BOOLEAN("boolean") {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Boolean) {
                return raw;
            }
            if (raw instanceof CharSequence) {
                String text = raw.toString().trim().toLowerCase(Locale.ROOT);
                if (text.equals("true") || text.equals("false")) {
                    return Boolean.valueOf(text);
                }
            }
            throw new IllegalArgumentException("expected true or false");
        }
    },

    /** ISO-8601 date-time, kept as its normalised text form. */
    DATETIME("datetime") {
        @Override
        Object coerce(Object raw) {
            if (!(raw instanceof CharSequence)) {
                throw new IllegalArgumentException("expected an ISO-8601 date-time string");
            }
            String text = raw.toString().trim();
            DateTimes.parse(text);
            return text;
        }
    },

    STRING_LIST("array<string>") {
        @Override
        Object coerce(Object raw) {
            Collection<?> items;
            if (raw instanceof Collection<?> collection) {
                items = collection;
            } else if (raw instanceof CharSequence) {
                items = List.of(raw);
            } else {
                throw new IllegalArgumentException("expected a list of strings");
            }
            List<String> values = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item == null) {
                    continue;
                }
                String text = STRING.coerce(item).toString();
                if (text.isEmpty()) {
                    throw new IllegalArgumentException("list entries must not be blank");
                }
                values.add(text);
            }
            return Collections.unmodifiableList(values);
        }
    },

    OBJECT("object") {
        @Override
        Object coerce(Object raw) {
            if (raw instanceof Map<?, ?>) {
                return raw;
            }
            throw new IllegalArgumentException("expected a JSON object");
        }
    };

    private final String wireName;

    ParameterType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Converts a raw JSON value into this type's canonical representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    abstract Object coerce(Object raw);

    private static BigDecimal toDecimal(Object raw, String expected) {
        try {
            if (raw instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            if (raw instanceof CharSequence) {
                return new BigDecimal(raw.toString().trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected " + expected + " but got '" + raw + "'");
        }
        throw new IllegalArgumentException("expected " + expected);
    }
}
