package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.config.AgentConfig;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.tool.ToolBackend;
import com.purchasingpower.emsflow.tool.ToolCatalog;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One engine per workflow kind, built once from configuration.
 */
@Slf4j
@Component
public class SubWorkflowEngines {

    private final Map<WorkflowKind, SubWorkflowEngine> engines;

    public SubWorkflowEngines(AgentConfig config, Reasoner reasoner, ToolBackend backend) {
        Map<WorkflowKind, SubWorkflowEngine> byKind = new EnumMap<>(WorkflowKind.class);
        for (WorkflowKind kind : WorkflowKind.values()) {
            int maxIterations = config.settingsFor(kind).getMaxIterations();
            byKind.put(kind, new SubWorkflowEngine(kind, maxIterations, ToolCatalog.registryFor(kind),
                    reasoner, backend, Clock.systemUTC()));
            log.info("Configured {} sub-workflow with max {} iterations", kind, maxIterations);
        }
        this.engines = Collections.unmodifiableMap(byKind);
    }

    public SubWorkflowEngine engineFor(WorkflowKind kind) {
        return engines.get(kind);
    }
}
