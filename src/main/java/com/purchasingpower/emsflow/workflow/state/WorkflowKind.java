package com.purchasingpower.emsflow.workflow.state;

/**
 * Sub-workflow kinds. Each runs the same bounded planner loop with its own tool
 * registry and iteration cap; the accumulator name only affects prompts and logs.
 */
public enum WorkflowKind {

    CREATE("created_entities", "create"),
    UPDATE("updated_entities", "update"),
    INFO("gathered_data", "info");

    private final String accumulatorName;
    private final String promptPrefix;

    WorkflowKind(String accumulatorName, String promptPrefix) {
        this.accumulatorName = accumulatorName;
        this.promptPrefix = promptPrefix;
    }

    public String getAccumulatorName() {
        return accumulatorName;
    }

    /** Prefix of this kind's planner and response templates, e.g. {@code create-planner}. */
    public String getPromptPrefix() {
        return promptPrefix;
    }
}
