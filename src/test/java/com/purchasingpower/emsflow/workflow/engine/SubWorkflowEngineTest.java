package com.purchasingpower.emsflow.workflow.engine;

import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.exception.ReasonerUnavailableException;
import com.purchasingpower.emsflow.reasoner.PlanningRequest;
import com.purchasingpower.emsflow.reasoner.ReasonerRole;
import com.purchasingpower.emsflow.reasoner.ScriptedReasoner;
import com.purchasingpower.emsflow.tool.ToolBackend;
import com.purchasingpower.emsflow.tool.ToolCatalog;
import com.purchasingpower.emsflow.tool.ToolDefinition;
import com.purchasingpower.emsflow.tool.ToolErrorCode;
import com.purchasingpower.emsflow.tool.ToolName;
import com.purchasingpower.emsflow.tool.ToolRegistry;
import com.purchasingpower.emsflow.tool.ToolResult;
import com.purchasingpower.emsflow.tool.backend.InMemoryToolBackend;
import com.purchasingpower.emsflow.tool.schema.ParameterSchema;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.IntentRecord;
import com.purchasingpower.emsflow.workflow.state.OutcomeStatus;
import com.purchasingpower.emsflow.workflow.state.PlannerDecision;
import com.purchasingpower.emsflow.workflow.state.ToolCallRecord;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import com.purchasingpower.emsflow.workflow.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("Sub-workflow engine")
class SubWorkflowEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private ScriptedReasoner reasoner;
    private InMemoryToolBackend backend;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        reasoner = new ScriptedReasoner();
        backend = spy(new InMemoryToolBackend(() -> "id-" + ids.incrementAndGet(), clock));
    }

    // ================================================================
    // SCENARIOS
    // ================================================================

    @Test
    @DisplayName("INFO: listing rules takes one tool call and one summary")
    void listMyRules_shouldCallListOnceAndRespond() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "need the rules"))
                .thenPlan(PlannerDecision.respond("rules retrieved"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.getIntent()).isEqualTo(IntentLabel.INFO);
        assertThat(outcome.getToolCalls()).isEqualTo(1);
        assertThat(outcome.getIterations()).isEqualTo(2);
        assertThat(state.getToolsCalled()).singleElement().satisfies(call -> {
            assertThat(call.getTool()).isEqualTo("list_automation_rules");
            assertThat(call.isSuccess()).isTrue();
            assertThat(call.getSummary()).isEqualTo("Retrieved 3 rules");
            assertThat(call.getTimestamp()).isEqualTo(NOW);
        });
        assertThat(state.getAccumulator()).containsKey("rules");
        assertThat(outcome.getResponse()).isEqualTo(state.getFinalResponse().orElseThrow())
                .contains("Retrieved 3 rules");
        assertThat(reasoner.summaryRequests).hasSize(1);
        verify(backend, times(1)).listRules();
    }

    @Test
    @DisplayName("UPDATE: 'enable rule-001' activates and stops without another planner call")
    void enableRule_shouldActivateAndRespond() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("activate_automation_rule", Map.of("rule_id", "rule-001"), "enable"));
        WorkflowState state = newState(WorkflowKind.UPDATE, "enable rule-001", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.UPDATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.getToolCalls()).isEqualTo(1);
        assertThat(reasoner.planningRequests).hasSize(1);
        assertThat(state.getAccumulator().get("activation")).isInstanceOfSatisfying(Map.class, activation -> {
            assertThat(activation.get("rule_id")).isEqualTo("rule-001");
            assertThat(activation.get("isEnabled")).isEqualTo(true);
        });
        assertThat(outcome.getResponse()).contains("rule-001");
    }

    @Test
    @DisplayName("UPDATE: activating a disabled rule enables it in the backend")
    void enableDisabledRule_shouldFlipEnabledFlag() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("activate_automation_rule", Map.of("rule_id", "rule-003"), "enable"));
        WorkflowState state = newState(WorkflowKind.UPDATE, "enable rule-003", 8);

        // When
        engine(WorkflowKind.UPDATE, 8, backend).execute(state, token());

        // Then
        assertThat(state.getToolsCalled().get(0).getSummary()).isEqualTo("Activated rule 'Energy Threshold Alert' (ID: rule-003)");
        @SuppressWarnings("unchecked")
        Map<String, Object> rule = (Map<String, Object>) backend.getRule("rule-003").getData();
        assertThat(rule.get("isEnabled")).isEqualTo(true);
    }

    @Test
    @DisplayName("CREATE: one combined call creates rule, condition and action")
    void createRuleWithConditionAndAction_shouldNameAllIdentifiers() {
        // Given
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("name", "5G Notifier");
        parameters.put("condition_type", "signalDetection");
        parameters.put("condition_parameters", Map.of("signalType", "5G"));
        parameters.put("action_type", "userNotification");
        parameters.put("action_parameters", Map.of("message", "Signal found!"));
        reasoner.thenPlan(PlannerDecision.callTool("create_rule_condition_action", parameters, "both described"));
        WorkflowState state = newState(WorkflowKind.CREATE, "create a rule to detect 5G and notify 'Signal found!'", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.CREATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.getToolCalls()).isEqualTo(1);
        assertThat(reasoner.planningRequests).hasSize(1);

        ToolCallRecord call = state.getToolsCalled().get(0);
        assertThat(call.getSummary()).isEqualTo("Created rule '5G Notifier' (ID: id-1) with signalDetection "
                + "condition (ID: id-2) and userNotification action (ID: id-3)");
        assertThat(call.getParameters())
                .containsEntry("is_enabled", false)
                .containsEntry("condition_parameters",
                        Map.of("signalType", "5G", "minFrequencyMHz", 10.0, "maxFrequencyMHz", 6000.0));
        assertThat(state.getAccumulator()).containsKeys("rule", "condition", "action");
        assertThat(outcome.getResponse()).contains("id-1", "id-2", "id-3");
    }

    @Test
    @DisplayName("Invalid tool names until the cap end in an incomplete response with no backend call")
    void invalidToolEveryTurn_shouldEndIncompleteWithoutBackendCalls() {
        // Given
        reasoner.planByDefault(PlannerDecision.callTool("drop_all_rules", Map.of(), "try this"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.INCOMPLETE);
        assertThat(outcome.getResponse()).startsWith(ResponseGenerator.INCOMPLETE_MARKER);
        assertThat(outcome.getIterations()).isEqualTo(5);
        assertThat(outcome.getToolCalls()).isZero();
        assertThat(reasoner.planningRequests).hasSize(5);
        assertThat(reasoner.summaryRequests).singleElement()
                .satisfies(request -> assertThat(request.isCompleted()).isFalse());
        assertThat(state.getValidationErrors()).hasSize(5)
                .allSatisfy(error -> assertThat(error).contains("unknown tool 'drop_all_rules'"));
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("A not-found failure is recorded and shown to the next planner turn")
    void notFoundRule_shouldBeRecordedAndVisibleToPlanner() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("get_automation_rule", Map.of("rule_id", "rule-999"), "lookup"))
                .thenPlan(PlannerDecision.respond("rule does not exist"));
        WorkflowState state = newState(WorkflowKind.INFO, "show rule-999", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(state.getToolsCalled()).singleElement().satisfies(call -> {
            assertThat(call.isSuccess()).isFalse();
            assertThat(call.getErrorCode()).isEqualTo(ToolErrorCode.NOT_FOUND);
            assertThat(call.getMessage()).isEqualTo("Rule with ID 'rule-999' not found");
        });
        PlanningRequest second = reasoner.planningRequests.get(1);
        assertThat(second.getValidationErrors())
                .containsExactly("get_automation_rule failed (NOT_FOUND): Rule with ID 'rule-999' not found");
        assertThat(second.getToolHistory().get(0)).contains("[FAILED NOT_FOUND]");
    }

    // ================================================================
    // TERMINATION
    // ================================================================

    @ParameterizedTest(name = "cap {0}")
    @ValueSource(ints = {1, 2, 3, 5})
    @DisplayName("A planner that never responds is stopped at the cap with exactly one response")
    void plannerThatNeverResponds_shouldStopAtCap(int cap) {
        // Given
        reasoner.planByDefault(PlannerDecision.callTool("list_automation_rules", Map.of(), "again"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", cap);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, cap, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.INCOMPLETE);
        assertThat(reasoner.planningRequests).hasSize(cap);
        assertThat(reasoner.summaryRequests).hasSize(1);
        assertThat(state.getIterationCount()).isEqualTo(cap);
        assertThat(state.getToolsCalled()).hasSize(cap);
        assertThat(state.getToolsCalled().subList(1, cap)).allMatch(ToolCallRecord::isRepeated);
        assertThatThrownBy(state::incrementIteration).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Message history only grows between planner turns")
    void messages_shouldOnlyBeAppended() {
        // Given
        reasoner.planByDefault(PlannerDecision.callTool("list_automation_rules", Map.of(), "again"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 4);
        state.appendMessage(ChatMessage.user("list my rules"));

        // When
        engine(WorkflowKind.INFO, 4, backend).execute(state, token());

        // Then
        List<PlanningRequest> requests = reasoner.planningRequests;
        for (int i = 1; i < requests.size(); i++) {
            List<ChatMessage> previous = requests.get(i - 1).getMessages();
            List<ChatMessage> current = requests.get(i).getMessages();
            assertThat(current.size()).isGreaterThan(previous.size());
            assertThat(current.subList(0, previous.size())).isEqualTo(previous);
        }
        assertThat(state.getMessages().get(0).getContent()).isEqualTo("list my rules");
    }

    // ================================================================
    // SELF-CORRECTION AND COMPLETION
    // ================================================================

    @Test
    @DisplayName("Rejected parameters are reported and the planner can correct them")
    void missingRuleId_shouldBeRejectedThenCorrected() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("activate_automation_rule", Map.of(), "enable"))
                .thenPlan(PlannerDecision.callTool("activate_automation_rule", Map.of("rule_id", "rule-003"), "retry"));
        WorkflowState state = newState(WorkflowKind.UPDATE, "enable rule-003", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.UPDATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.getToolCalls()).isEqualTo(1);
        assertThat(state.getValidationErrors()).singleElement().asString()
                .contains("'activate_automation_rule' rejected")
                .contains("rule_id: is required");
        assertThat(reasoner.planningRequests.get(1).getValidationErrors()).hasSize(1);
        verify(backend, times(1)).activateRule("rule-003");
    }

    @Test
    @DisplayName("UPDATE by rule name: the matched rule is handed to the next planner turn")
    void updateByName_shouldPassTargetRuleToPlanner() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "find the rule"))
                .thenPlan(PlannerDecision.callTool("deactivate_automation_rule", Map.of("rule_id", "rule-002"), "disable"));
        WorkflowState state = newState(WorkflowKind.UPDATE, "turn off the LTE Detector", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.UPDATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(reasoner.planningRequests).hasSize(2);
        assertThat(reasoner.planningRequests.get(1).getPlannerNote()).contains("rule-002");
        assertThat(state.getAccumulator()).containsKeys("rules", "target_rule", "deactivation");
    }

    @Test
    @DisplayName("UPDATE: listing rules without a match stops the loop")
    void updateUnknownRuleName_shouldStopAfterListing() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "find the rule"));
        WorkflowState state = newState(WorkflowKind.UPDATE, "enable the Foo rule", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.UPDATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(reasoner.planningRequests).hasSize(1);
        assertThat(state.getMessages()).anySatisfy(message ->
                assertThat(message.getContent()).contains("Unable to find the rule named in the request"));
        verify(backend, never()).activateRule(anyString());
    }

    // ================================================================
    // FAILURES
    // ================================================================

    @Test
    @DisplayName("Backend exceptions become BACKEND_UNAVAILABLE records")
    void backendException_shouldBeRecordedAsData() {
        // Given
        ToolBackend failing = mock(ToolBackend.class);
        when(failing.listRules()).thenThrow(new IllegalStateException("connection reset"));
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "list"))
                .thenPlan(PlannerDecision.respond("backend is down"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, failing).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(state.getToolsCalled()).singleElement().satisfies(call -> {
            assertThat(call.getErrorCode()).isEqualTo(ToolErrorCode.BACKEND_UNAVAILABLE);
            assertThat(call.getMessage()).contains("connection reset");
        });
        assertThat(state.getValidationErrors()).singleElement().asString().contains("BACKEND_UNAVAILABLE");
    }

    @Test
    @DisplayName("A successful result without data is recorded and leaves the accumulator untouched")
    void successWithoutData_shouldBeRecorded() {
        // Given
        ToolBackend sparse = mock(ToolBackend.class);
        when(sparse.listRules()).thenReturn(ToolResult.success(null, "no payload"));
        when(sparse.getRule(anyString())).thenReturn(ToolResult.success(null, "no payload"));
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "list"))
                .thenPlan(PlannerDecision.callTool("get_automation_rule", Map.of("rule_id", "rule-001"), "details"))
                .thenPlan(PlannerDecision.respond("nothing useful came back"));
        WorkflowState state = newState(WorkflowKind.INFO, "show rule-001", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, sparse).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(state.getToolsCalled()).extracting(ToolCallRecord::getTool)
                .containsExactly("list_automation_rules", "get_automation_rule");
        assertThat(state.getToolsCalled()).allSatisfy(call -> assertThat(call.isSuccess()).isTrue());
        assertThat(state.getAccumulator()).isEmpty();
        assertThat(state.getValidationErrors()).isEmpty();
    }

    @Test
    @DisplayName("CREATE: a creation result without a rule does not end the loop")
    void createWithoutRulePayload_shouldKeepPlanning() {
        // Given
        ToolBackend sparse = mock(ToolBackend.class);
        when(sparse.createRule(any())).thenReturn(ToolResult.success(Map.of(), "created"));
        reasoner.thenPlan(PlannerDecision.callTool("create_automation_rule", Map.of("name", "Watcher"), "create"))
                .thenPlan(PlannerDecision.respond("done"));
        WorkflowState state = newState(WorkflowKind.CREATE, "create a rule named Watcher", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.CREATE, 8, sparse).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(reasoner.planningRequests).hasSize(2);
        assertThat(state.getToolsCalled()).singleElement().satisfies(call -> assertThat(call.isSuccess()).isTrue());
        assertThat(state.getAccumulator()).doesNotContainKey("rule");
    }

    @Test
    @DisplayName("A result that cannot be mapped is recorded as a BACKEND_UNAVAILABLE failure")
    void unmappableResult_shouldBeRecordedAsFailure() {
        // Given
        ToolDefinition brokenListing = ToolDefinition.builder()
                .name(ToolName.LIST_AUTOMATION_RULES)
                .description("List rules.")
                .schema(ParameterSchema.empty())
                .invoker((toolBackend, params) -> toolBackend.listRules())
                .entityMapper((query, params, data) -> {
                    throw new IllegalStateException("unexpected payload shape");
                })
                .summarizer((params, data) -> "Retrieved rules")
                .build();
        ToolRegistry registry = new ToolRegistry(WorkflowKind.INFO, List.of(brokenListing));
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "list"))
                .thenPlan(PlannerDecision.respond("listing failed"));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = new SubWorkflowEngine(WorkflowKind.INFO, 5, registry, reasoner, backend, clock)
                .execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(state.getToolsCalled()).singleElement().satisfies(call -> {
            assertThat(call.isSuccess()).isFalse();
            assertThat(call.getErrorCode()).isEqualTo(ToolErrorCode.BACKEND_UNAVAILABLE);
            assertThat(call.getMessage()).isEqualTo("Unusable result: unexpected payload shape");
        });
        assertThat(state.getAccumulator()).isEmpty();
        assertThat(state.getValidationErrors()).containsExactly(
                "list_automation_rules failed (BACKEND_UNAVAILABLE): Unusable result: unexpected payload shape");
    }

    @Test
    @DisplayName("Malformed planner output leads to a response with an apology note")
    void malformedPlan_shouldRespondWithNote() {
        // Given
        reasoner.thenFailPlanning(new ReasonerOutputException(ReasonerRole.PLAN, "Invalid JSON", "{oops"));
        WorkflowState state = newState(WorkflowKind.CREATE, "create something", 8);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.CREATE, 8, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.COMPLETED);
        assertThat(outcome.getToolCalls()).isZero();
        assertThat(state.getValidationErrors()).containsExactly(PlannerNode.MALFORMED_PLAN_NOTE);
        assertThat(reasoner.summaryRequests.get(0).getValidationErrors()).contains(PlannerNode.MALFORMED_PLAN_NOTE);
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("Reasoner unavailable while planning aborts with the fixed degraded response")
    void reasonerUnavailableWhilePlanning_shouldFail() {
        // Given
        reasoner.thenFailPlanning(new ReasonerUnavailableException(ReasonerRole.PLAN, "connection refused", null));
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend).execute(state, token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.getResponse()).isEqualTo(WorkflowOutcome.FAILED_RESPONSE);
        assertThat(state.getFinalResponse()).isEmpty();
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("Reasoner unavailable while summarizing aborts with the fixed degraded response")
    void reasonerUnavailableWhileSummarizing_shouldFail() {
        // Given
        reasoner.thenPlan(PlannerDecision.respond("nothing to do"))
                .summarizeWith(request -> {
                    throw new ReasonerUnavailableException(ReasonerRole.RESPOND_SUMMARY, "timeout", null);
                });

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend)
                .execute(newState(WorkflowKind.INFO, "hi", 5), token());

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.getResponse()).isEqualTo(WorkflowOutcome.FAILED_RESPONSE);
    }

    @Test
    @DisplayName("A blank summary falls back to the tool log")
    void blankSummary_shouldUseFallback() {
        // Given
        reasoner.thenPlan(PlannerDecision.callTool("list_automation_rules", Map.of(), "list"))
                .thenPlan(PlannerDecision.respond("done"))
                .summarizeWith(request -> "   ");

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend)
                .execute(newState(WorkflowKind.INFO, "list my rules", 5), token());

        // Then
        assertThat(outcome.getResponse()).isEqualTo("Here is what was done:\n- ✅ Retrieved 3 rules");
    }

    // ================================================================
    // CANCELLATION
    // ================================================================

    @Test
    @DisplayName("A cancelled token stops the run before any reasoner or backend call")
    void preCancelledToken_shouldCancelImmediately() {
        // Given
        CancellationToken token = token();
        token.cancel();
        WorkflowState state = newState(WorkflowKind.INFO, "list my rules", 5);

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend).execute(state, token);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(outcome.getResponse()).isEqualTo(WorkflowOutcome.CANCELLED_RESPONSE);
        assertThat(reasoner.totalCalls()).isZero();
        assertThat(state.getFinalResponse()).isEmpty();
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("Cancelling between planning and execution prevents the tool call")
    void cancelAfterPlanning_shouldSkipExecution() {
        // Given
        CancellationToken token = token();
        reasoner.thenPlan(() -> {
            token.cancel();
            return PlannerDecision.callTool("list_automation_rules", Map.of(), "list");
        });

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend)
                .execute(newState(WorkflowKind.INFO, "list my rules", 5), token);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(reasoner.summaryRequests).isEmpty();
        verify(backend, never()).listRules();
    }

    @Test
    @DisplayName("An expired deadline cancels the run at the next step boundary")
    void expiredDeadline_shouldCancel() {
        // Given
        Clock ticking = mock(Clock.class);
        when(ticking.instant()).thenReturn(NOW, NOW.plusSeconds(10), NOW.plusSeconds(120));
        CancellationToken token = CancellationToken.withTimeout("req-deadline", Duration.ofSeconds(60), ticking);
        reasoner.planByDefault(PlannerDecision.callTool("list_automation_rules", Map.of(), "list"));

        // When
        WorkflowOutcome outcome = engine(WorkflowKind.INFO, 5, backend)
                .execute(newState(WorkflowKind.INFO, "list my rules", 5), token);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(OutcomeStatus.CANCELLED);
        assertThat(reasoner.planningRequests).hasSize(1);
        verify(backend, never()).listRules();
    }

    // ================================================================
    // CONSTRUCTION
    // ================================================================

    @Test
    @DisplayName("Engines reject a cap below one and a registry of another kind")
    void constructor_shouldValidateArguments() {
        assertThatThrownBy(() -> engine(WorkflowKind.INFO, 0, backend))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SubWorkflowEngine(WorkflowKind.INFO, 5,
                ToolCatalog.registryFor(WorkflowKind.UPDATE), reasoner, backend, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private SubWorkflowEngine engine(WorkflowKind kind, int cap, ToolBackend toolBackend) {
        return new SubWorkflowEngine(kind, cap, ToolCatalog.registryFor(kind), reasoner, toolBackend, clock);
    }

    private static WorkflowState newState(WorkflowKind kind, String query, int cap) {
        IntentRecord intent = IntentRecord.builder()
                .label(IntentLabel.valueOf(kind.name()))
                .confidence(0.9)
                .reasoning("test")
                .build();
        return new WorkflowState(kind, query, intent, cap);
    }

    private static CancellationToken token() {
        return CancellationToken.create("req-test");
    }
}
