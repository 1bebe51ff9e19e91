package com.purchasingpower.emsflow.workflow.engine;

/**
 * Steps of the sub-workflow loop. PLANNING is initial, DONE is terminal.
 */
public enum EngineStep {
    PLANNING,
    EXECUTING,
    RESPONDING,
    DONE
}
