package com.purchasingpower.emsflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: create-planner
 * version: 1.0
 * temperature: 0.0
 * systemPrompt: |
 *   You plan the next step...
 * userPrompt: |
 *   User request: {{{query}}}
 * </pre>
 *
 * @see com.purchasingpower.emsflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;

    /** Sampling temperature; structured roles use 0. */
    private double temperature;
    private String systemPrompt;
    private String userPrompt;
}
