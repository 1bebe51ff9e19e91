package com.purchasingpower.emsflow.reasoner;

/**
 * The distinct jobs the reasoner is asked to do. Each maps to one prompt template.
 */
public enum ReasonerRole {

    INITIAL_ANALYSIS("initial-analyzer", true),
    CLASSIFY("intent-classifier", true),
    PLAN("planner", true),
    RESPOND_GENERIC("generic-response", false),
    RESPOND_SUMMARY("response", false);

    private final String templateSuffix;
    private final boolean structured;

    ReasonerRole(String templateSuffix, boolean structured) {
        this.templateSuffix = templateSuffix;
        this.structured = structured;
    }

    public String getTemplateSuffix() {
        return templateSuffix;
    }

    /** Whether the role expects a JSON object back. */
    public boolean isStructured() {
        return structured;
    }
}
