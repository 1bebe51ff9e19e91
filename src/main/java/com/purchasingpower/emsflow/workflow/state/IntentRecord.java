package com.purchasingpower.emsflow.workflow.state;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Result of intent classification. Created once per request and read-only afterwards.
 * Confidence is advisory: routing uses the label alone.
 */
@Value
@Builder
public class IntentRecord implements Serializable {

    IntentLabel label;
    double confidence;
    String reasoning;
    @Builder.Default
    List<String> keyIndicators = List.of();
    @Builder.Default
    Map<String, Object> entities = Map.of();

    public static IntentRecord unknown(String reasoning) {
        return IntentRecord.builder()
                .label(IntentLabel.UNKNOWN)
                .confidence(0.0)
                .reasoning(reasoning)
                .build();
    }

    public static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
