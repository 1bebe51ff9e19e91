package com.purchasingpower.emsflow.client;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call options for {@link LLMProvider#chat}.
 */
@Value
@Builder
public class ChatOptions {

    @Builder.Default
    double temperature = 0.0;

    /**
     * Ask the provider to constrain output to a JSON object.
     */
    boolean jsonFormat;

    public static ChatOptions json(double temperature) {
        return ChatOptions.builder().temperature(temperature).jsonFormat(true).build();
    }

    public static ChatOptions text(double temperature) {
        return ChatOptions.builder().temperature(temperature).jsonFormat(false).build();
    }
}
