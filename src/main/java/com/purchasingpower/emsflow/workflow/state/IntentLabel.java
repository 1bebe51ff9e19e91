package com.purchasingpower.emsflow.workflow.state;

import java.util.Locale;

/**
 * Top-level intent categories.
 */
public enum IntentLabel {
    CREATE,
    UPDATE,
    INFO,
    GENERIC,
    UNKNOWN;

    /**
     * Lenient parse of a classifier label; anything unrecognised is {@link #UNKNOWN}.
     */
    public static IntentLabel fromString(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
