package com.purchasingpower.emsflow.tool.schema;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Constraint spanning several already-validated fields. Rules only fire when every
 * field they mention is present, so they work unchanged for partial updates.
 */
@FunctionalInterface
public interface CrossFieldRule {

    Optional<ValidationResult.Violation> check(Map<String, Object> parameters);

    static CrossFieldRule lessThan(String lowField, String highField) {
        return parameters -> {
            Object low = parameters.get(lowField);
            Object high = parameters.get(highField);
            if (low instanceof Number lowValue && high instanceof Number highValue
                    && lowValue.doubleValue() >= highValue.doubleValue()) {
                return Optional.of(new ValidationResult.Violation(lowField,
                        "must be less than " + highField));
            }
            return Optional.empty();
        };
    }

    static CrossFieldRule before(String startField, String endField) {
        return parameters -> {
            Object start = parameters.get(startField);
            Object end = parameters.get(endField);
            if (start == null || end == null) {
                return Optional.empty();
            }
            Instant startAt = DateTimes.parse(start.toString());
            Instant endAt = DateTimes.parse(end.toString());
            if (!startAt.isBefore(endAt)) {
                return Optional.of(new ValidationResult.Violation(startField,
                        "must be before " + endField));
            }
            return Optional.empty();
        };
    }
}
