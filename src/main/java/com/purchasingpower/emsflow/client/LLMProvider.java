package com.purchasingpower.emsflow.client;

/**
 * Chat completion against a language model.
 *
 * Implementations handle provider-specific API details and report transport
 * failures as {@link com.purchasingpower.emsflow.exception.LlmCallException}.
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the LLM.
     *
     * @param prompt    The fully rendered prompt
     * @param agentName Name of the calling role (for logging)
     * @param options   Sampling and output-format options
     * @return The LLM's response text
     */
    String chat(String prompt, String agentName, ChatOptions options);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
