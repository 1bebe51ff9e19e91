package com.purchasingpower.emsflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Coarse context extracted before classification. Decides which knowledge blocks
 * are attached to the classification prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryAnalysis implements Serializable {

    private boolean requiresSchemaKnowledge;
    private boolean requiresRfKnowledge;
    private boolean requiresDatabaseQueries;

    @Builder.Default
    private List<String> frequencyRanges = new ArrayList<>();
    @Builder.Default
    private List<String> signalTypes = new ArrayList<>();
    @Builder.Default
    private List<String> actionTypes = new ArrayList<>();
    @Builder.Default
    private List<String> conditionTypes = new ArrayList<>();
    @Builder.Default
    private List<String> tableReferences = new ArrayList<>();

    public static QueryAnalysis empty() {
        return QueryAnalysis.builder().build();
    }
}
