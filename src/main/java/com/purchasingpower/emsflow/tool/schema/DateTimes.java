package com.purchasingpower.emsflow.tool.schema;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 parsing shared by parameter validation and the rule store.
 * Values without an offset are read as UTC.
 */
public final class DateTimes {

    private DateTimes() {
    }

    public static Instant parse(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid ISO-8601 date-time '" + text + "'");
            }
        }
    }
}
