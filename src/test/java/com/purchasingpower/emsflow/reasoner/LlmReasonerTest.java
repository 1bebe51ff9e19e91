package com.purchasingpower.emsflow.reasoner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.emsflow.client.ChatOptions;
import com.purchasingpower.emsflow.client.LLMProvider;
import com.purchasingpower.emsflow.exception.LlmCallException;
import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.exception.ReasonerUnavailableException;
import com.purchasingpower.emsflow.service.PromptLibraryService;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.IntentRecord;
import com.purchasingpower.emsflow.workflow.state.NextAction;
import com.purchasingpower.emsflow.workflow.state.PlannerDecision;
import com.purchasingpower.emsflow.workflow.state.QueryAnalysis;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmReasonerTest {

    private LLMProvider llmProvider;
    private LlmReasoner reasoner;

    @BeforeEach
    void setUp() {
        llmProvider = mock(LLMProvider.class);
        PromptLibraryService promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
        reasoner = new LlmReasoner(llmProvider, promptLibrary, new ObjectMapper());
    }

    private void answer(String response) {
        when(llmProvider.chat(anyString(), anyString(), any(ChatOptions.class))).thenReturn(response);
    }

    private String sentPrompt(String template) {
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmProvider).chat(prompt.capture(), eq(template), any(ChatOptions.class));
        return prompt.getValue();
    }

    @Nested
    @DisplayName("Initial analysis")
    class Analysis {

        @Test
        @DisplayName("Should read flags and detected entities")
        void analyze_shouldMapFields() {
            // Given
            answer("""
                    ```json
                    {"requires_schema_knowledge": false, "requires_rf_knowledge": true,
                     "requires_database_queries": true,
                     "detected_entities": {"frequency_ranges": ["3400-3600 MHz"], "signal_types": ["5G"]}}
                    ```""");

            // When
            QueryAnalysis analysis = reasoner.analyze("watch 5G at 3.5 GHz");

            // Then
            assertThat(analysis.isRequiresRfKnowledge()).isTrue();
            assertThat(analysis.isRequiresSchemaKnowledge()).isFalse();
            assertThat(analysis.isRequiresDatabaseQueries()).isTrue();
            assertThat(analysis.getFrequencyRanges()).containsExactly("3400-3600 MHz");
            assertThat(analysis.getSignalTypes()).containsExactly("5G");
            assertThat(analysis.getActionTypes()).isEmpty();
            assertThat(sentPrompt("initial-analyzer")).contains("watch 5G at 3.5 GHz");
        }

        @Test
        @DisplayName("Should ask for JSON output")
        void analyze_shouldRequestJson() {
            // Given
            answer("{}");

            // When
            reasoner.analyze("hello");

            // Then
            ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
            verify(llmProvider).chat(anyString(), eq("initial-analyzer"), options.capture());
            assertThat(options.getValue().isJsonFormat()).isTrue();
            assertThat(options.getValue().getTemperature()).isZero();
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Should parse label, clamp confidence and keep extracted info")
        void classify_shouldMapFields() {
            // Given
            answer("Here you go: {\"intent\": \"update\", \"confidence\": 1.7, \"reasoning\": \"enable verb\", "
                    + "\"key_indicators\": [\"enable\"], \"extracted_info\": {\"rule_id\": \"rule-001\"}}");

            // When
            IntentRecord intent = reasoner.classify("enable rule-001", QueryAnalysis.empty(), "RF SPECTRUM KNOWLEDGE:\nbands");

            // Then
            assertThat(intent.getLabel()).isEqualTo(IntentLabel.UPDATE);
            assertThat(intent.getConfidence()).isEqualTo(1.0);
            assertThat(intent.getKeyIndicators()).containsExactly("enable");
            assertThat(intent.getEntities()).containsEntry("rule_id", "rule-001");
            assertThat(sentPrompt("intent-classifier"))
                    .contains("enable rule-001")
                    .contains("RF SPECTRUM KNOWLEDGE:");
        }

        @Test
        @DisplayName("Should map an unrecognised label to UNKNOWN")
        void classify_shouldMapUnknownLabel() {
            answer("{\"intent\": \"DELETE\", \"confidence\": 0.8}");

            IntentRecord intent = reasoner.classify("delete rule-001", QueryAnalysis.empty(), "");

            assertThat(intent.getLabel()).isEqualTo(IntentLabel.UNKNOWN);
        }

        @Test
        @DisplayName("Should reject output without an intent")
        void classify_shouldRejectMissingIntent() {
            answer("{\"confidence\": 0.8}");

            assertThatThrownBy(() -> reasoner.classify("x", QueryAnalysis.empty(), ""))
                    .isInstanceOf(ReasonerOutputException.class)
                    .hasMessageContaining("intent");
        }
    }

    @Nested
    @DisplayName("Planning")
    class Planning {

        private PlanningRequest request() {
            return PlanningRequest.builder()
                    .kind(WorkflowKind.UPDATE)
                    .query("enable rule-003")
                    .iteration(2)
                    .maxIterations(8)
                    .toolCatalog("- activate_automation_rule: Enable a rule.")
                    .messages(List.of(ChatMessage.user("enable rule-003")))
                    .toolHistory(List.of())
                    .accumulator(Map.of())
                    .validationErrors(List.of("Iteration 1: call to 'activate_automation_rule' rejected: rule_id: is required"))
                    .plannerNote("Use the rule id from the request.")
                    .build();
        }

        @Test
        @DisplayName("Should parse a tool call and render the loop state into the prompt")
        void plan_shouldParseToolCall() {
            // Given
            answer("{\"next_action\": \"call_tool\", \"selected_tool\": \"activate_automation_rule\", "
                    + "\"tool_parameters\": {\"rule_id\": \"rule-003\"}, \"reasoning\": \"retry with id\"}");

            // When
            PlannerDecision decision = reasoner.plan(request());

            // Then
            assertThat(decision.getNextAction()).isEqualTo(NextAction.CALL_TOOL);
            assertThat(decision.getToolName()).isEqualTo("activate_automation_rule");
            assertThat(decision.getParameters()).isEqualTo(Map.of("rule_id", "rule-003"));
            assertThat(sentPrompt("update-planner"))
                    .contains("Iteration 2 of 8")
                    .contains("user: enable rule-003")
                    .contains("- Iteration 1: call to 'activate_automation_rule' rejected: rule_id: is required")
                    .contains("Use the rule id from the request.");
        }

        @Test
        @DisplayName("Should parse a respond decision")
        void plan_shouldParseRespond() {
            answer("{\"next_action\": \"RESPOND\", \"reasoning\": \"done\"}");

            PlannerDecision decision = reasoner.plan(request());

            assertThat(decision.getNextAction()).isEqualTo(NextAction.RESPOND);
            assertThat(decision.getReasoning()).isEqualTo("done");
        }

        @Test
        @DisplayName("Should reject unusable planner output")
        void plan_shouldRejectMalformedOutput() {
            answer("{\"next_action\": \"call_tool\", \"tool_parameters\": {}}");
            assertThatThrownBy(() -> reasoner.plan(request())).isInstanceOf(ReasonerOutputException.class);
        }

        @Test
        @DisplayName("Should reject non-object parameters")
        void plan_shouldRejectArrayParameters() {
            answer("{\"next_action\": \"call_tool\", \"selected_tool\": \"list_automation_rules\", "
                    + "\"tool_parameters\": [1, 2]}");
            assertThatThrownBy(() -> reasoner.plan(request())).isInstanceOf(ReasonerOutputException.class);
        }

        @Test
        @DisplayName("Should reject an unknown next_action")
        void plan_shouldRejectUnknownAction() {
            answer("{\"next_action\": \"think\"}");
            assertThatThrownBy(() -> reasoner.plan(request()))
                    .isInstanceOf(ReasonerOutputException.class)
                    .hasMessageContaining("think");
        }
    }

    @Nested
    @DisplayName("Text responses")
    class TextResponses {

        @Test
        @DisplayName("Should return the trimmed summary and flag degraded runs in the prompt")
        void summarize_shouldRenderIncompleteNote() {
            // Given
            answer("  Listed 3 rules.  \n");
            SummaryRequest request = SummaryRequest.builder()
                    .kind(WorkflowKind.INFO)
                    .query("list my rules")
                    .toolHistory(List.of("list_automation_rules{}: Retrieved 3 rules"))
                    .accumulator(Map.of("rules", List.of()))
                    .validationErrors(List.of())
                    .completed(false)
                    .build();

            // When
            String summary = reasoner.summarize(request);

            // Then
            assertThat(summary).isEqualTo("Listed 3 rules.");
            String prompt = sentPrompt("info-response");
            assertThat(prompt)
                    .contains("- list_automation_rules{}: Retrieved 3 rules")
                    .contains("gathered_data");
        }

        @Test
        @DisplayName("Should use plain text output for generic answers")
        void respondGeneric_shouldRequestText() {
            // Given
            answer("5G NR mid-band sits around 3.5 GHz.");

            // When
            String text = reasoner.respondGeneric("where is 5G mid-band?", "RF SPECTRUM KNOWLEDGE:\nbands");

            // Then
            assertThat(text).isEqualTo("5G NR mid-band sits around 3.5 GHz.");
            ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
            verify(llmProvider).chat(anyString(), eq("generic-response"), options.capture());
            assertThat(options.getValue().isJsonFormat()).isFalse();
        }
    }

    @Test
    @DisplayName("Should translate transport failures into ReasonerUnavailableException")
    void transportFailure_shouldBecomeUnavailable() {
        // Given
        when(llmProvider.chat(anyString(), anyString(), any(ChatOptions.class)))
                .thenThrow(new LlmCallException("ollama", "Connection refused", null));

        // Then
        assertThatThrownBy(() -> reasoner.analyze("hello"))
                .isInstanceOfSatisfying(ReasonerUnavailableException.class, e -> {
                    assertThat(e.getRole()).isEqualTo(ReasonerRole.INITIAL_ANALYSIS);
                    assertThat(e.getMessage()).contains("Connection refused");
                });
    }

    @Test
    @DisplayName("Should report empty answers as malformed output")
    void emptyAnswer_shouldBeMalformed() {
        answer("");

        assertThatThrownBy(() -> reasoner.classify("x", QueryAnalysis.empty(), ""))
                .isInstanceOf(ReasonerOutputException.class)
                .hasMessageContaining("Empty response");
    }
}
