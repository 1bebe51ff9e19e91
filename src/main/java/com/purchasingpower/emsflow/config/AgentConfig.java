package com.purchasingpower.emsflow.config;

import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the intent router and its sub-workflows.
 *
 * <p>Properties are loaded from the {@code app.workflows} namespace in application.yml:
 * <pre>
 * app:
 *   workflows:
 *     request-timeout: 5m
 *     create:
 *       max-iterations: 8
 *     update:
 *       max-iterations: 8
 *     info:
 *       max-iterations: 5
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "app.workflows")
@Data
public class AgentConfig {

    /**
     * Deadline for a whole request, checked between workflow steps.
     * Zero or negative disables the deadline. Default: 5 minutes
     */
    private Duration requestTimeout = Duration.ofMinutes(5);

    private WorkflowSettings create = new WorkflowSettings(8);

    private WorkflowSettings update = new WorkflowSettings(8);

    private WorkflowSettings info = new WorkflowSettings(5);

    public WorkflowSettings settingsFor(WorkflowKind kind) {
        return switch (kind) {
            case CREATE -> create;
            case UPDATE -> update;
            case INFO -> info;
        };
    }

    /**
     * Loop settings for one sub-workflow kind.
     */
    @Data
    public static class WorkflowSettings {

        /**
         * Maximum planner turns before the run is forced to respond.
         * Must be at least 1.
         */
        private int maxIterations;

        public WorkflowSettings() {
        }

        public WorkflowSettings(int maxIterations) {
            this.maxIterations = maxIterations;
        }
    }
}
