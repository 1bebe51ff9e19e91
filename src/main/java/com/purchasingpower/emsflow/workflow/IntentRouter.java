package com.purchasingpower.emsflow.workflow;

import com.purchasingpower.emsflow.config.AgentConfig;
import com.purchasingpower.emsflow.exception.DuplicateRequestException;
import com.purchasingpower.emsflow.exception.ReasonerException;
import com.purchasingpower.emsflow.exception.ReasonerOutputException;
import com.purchasingpower.emsflow.exception.ReasonerUnavailableException;
import com.purchasingpower.emsflow.exception.WorkflowCancelledException;
import com.purchasingpower.emsflow.reasoner.Reasoner;
import com.purchasingpower.emsflow.service.KnowledgeBaseService;
import com.purchasingpower.emsflow.workflow.engine.CancellationToken;
import com.purchasingpower.emsflow.workflow.engine.SubWorkflowEngines;
import com.purchasingpower.emsflow.workflow.handlers.GenericIntentHandler;
import com.purchasingpower.emsflow.workflow.handlers.UnknownIntentHandler;
import com.purchasingpower.emsflow.workflow.state.ChatMessage;
import com.purchasingpower.emsflow.workflow.state.IntentLabel;
import com.purchasingpower.emsflow.workflow.state.IntentRecord;
import com.purchasingpower.emsflow.workflow.state.IntentState;
import com.purchasingpower.emsflow.workflow.state.QueryAnalysis;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import com.purchasingpower.emsflow.workflow.state.WorkflowOutcome;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Top-level intent graph: analysis, classification, then exactly one handler.
 *
 * <pre>
 * START -> initial_analyzer -> intent_classifier -> create_handler | update_handler |
 *          info_handler | generic_handler | error -> END
 * </pre>
 */
@Slf4j
@Component
public class IntentRouter {

    static final String INITIAL_ANALYZER = "initial_analyzer";
    static final String INTENT_CLASSIFIER = "intent_classifier";
    static final String CREATE_HANDLER = "create_handler";
    static final String UPDATE_HANDLER = "update_handler";
    static final String INFO_HANDLER = "info_handler";
    static final String GENERIC_HANDLER = "generic_handler";
    static final String ERROR_HANDLER = "error";

    private final Reasoner reasoner;
    private final KnowledgeBaseService knowledgeBase;
    private final SubWorkflowEngines engines;
    private final GenericIntentHandler genericHandler;
    private final UnknownIntentHandler unknownHandler;
    private final AgentConfig config;

    /**
     * Tokens of in-flight requests, so they can be cancelled by id. Only the run that
     * registered a token removes it.
     */
    private final Map<String, CancellationToken> activeRequests = new ConcurrentHashMap<>();

    private CompiledGraph<IntentState> compiledGraph;

    public IntentRouter(Reasoner reasoner,
                        KnowledgeBaseService knowledgeBase,
                        SubWorkflowEngines engines,
                        GenericIntentHandler genericHandler,
                        UnknownIntentHandler unknownHandler,
                        AgentConfig config) {
        this.reasoner = reasoner;
        this.knowledgeBase = knowledgeBase;
        this.engines = engines;
        this.genericHandler = genericHandler;
        this.unknownHandler = unknownHandler;
        this.config = config;
    }

    @PostConstruct
    public void initialize() throws GraphStateException {
        log.info("🚀 Initializing intent routing graph...");
        StateGraph<IntentState> graph = new StateGraph<>(IntentState::new);

        graph.addNode(INITIAL_ANALYZER, node_async(this::analyze));
        graph.addNode(INTENT_CLASSIFIER, node_async(this::classify));
        graph.addNode(CREATE_HANDLER, node_async(s -> runSubWorkflow(s, WorkflowKind.CREATE, CREATE_HANDLER)));
        graph.addNode(UPDATE_HANDLER, node_async(s -> runSubWorkflow(s, WorkflowKind.UPDATE, UPDATE_HANDLER)));
        graph.addNode(INFO_HANDLER, node_async(s -> runSubWorkflow(s, WorkflowKind.INFO, INFO_HANDLER)));
        graph.addNode(GENERIC_HANDLER, node_async(this::respondGeneric));
        graph.addNode(ERROR_HANDLER, node_async(this::respondUnrecognized));

        graph.addEdge(START, INITIAL_ANALYZER);
        graph.addEdge(INITIAL_ANALYZER, INTENT_CLASSIFIER);

        graph.addConditionalEdges(INTENT_CLASSIFIER,
                edge_async(s -> {
                    IntentRecord intent = s.getIntent();
                    String target = handlerFor(intent == null ? IntentLabel.UNKNOWN : intent.getLabel());
                    log.info("🔀 Routing {} → {}", intent == null ? IntentLabel.UNKNOWN : intent.getLabel(), target);
                    return target;
                }),
                Map.of(
                        CREATE_HANDLER, CREATE_HANDLER,
                        UPDATE_HANDLER, UPDATE_HANDLER,
                        INFO_HANDLER, INFO_HANDLER,
                        GENERIC_HANDLER, GENERIC_HANDLER,
                        ERROR_HANDLER, ERROR_HANDLER
                )
        );

        graph.addEdge(CREATE_HANDLER, END);
        graph.addEdge(UPDATE_HANDLER, END);
        graph.addEdge(INFO_HANDLER, END);
        graph.addEdge(GENERIC_HANDLER, END);
        graph.addEdge(ERROR_HANDLER, END);

        this.compiledGraph = graph.compile();
    }

    /**
     * Handler node for a label. Adding a label without a case here fails to compile.
     */
    static String handlerFor(IntentLabel label) {
        return switch (label) {
            case CREATE -> CREATE_HANDLER;
            case UPDATE -> UPDATE_HANDLER;
            case INFO -> INFO_HANDLER;
            case GENERIC -> GENERIC_HANDLER;
            case UNKNOWN -> ERROR_HANDLER;
        };
    }

    // ================================================================
    // ENTRY POINTS
    // ================================================================

    /**
     * Routes a request under a fresh id, with the configured deadline.
     */
    public WorkflowOutcome route(String query) {
        return route(query, newToken(UUID.randomUUID().toString()));
    }

    /**
     * Token for a caller-chosen request id, with the configured deadline.
     */
    public CancellationToken newToken(String requestId) {
        return CancellationToken.withTimeout(requestId, config.getRequestTimeout(), Clock.systemUTC());
    }

    /**
     * Runs one request to its outcome.
     *
     * @throws DuplicateRequestException if a request with the token's id is still running
     */
    public WorkflowOutcome route(String query, CancellationToken token) {
        String requestId = token.getRequestId();
        if (activeRequests.putIfAbsent(requestId, token) != null) {
            log.warn("⚠️ Rejecting request {}: id already in flight", requestId);
            throw new DuplicateRequestException(requestId);
        }
        log.info("🚀 Routing request {}: {}", requestId, query);

        Map<String, Object> initialData = new HashMap<>();
        initialData.put(IntentState.QUERY, query);
        initialData.put(IntentState.REQUEST_ID, requestId);

        try {
            Optional<IntentState> result = compiledGraph.invoke(initialData);
            WorkflowOutcome outcome = result.map(IntentState::getOutcome)
                    .orElseThrow(() -> new IllegalStateException("Intent graph finished without an outcome"));
            log.info("✅ Request {} finished: intent={}, status={}", requestId, outcome.getIntent(),
                    outcome.getStatus());
            return outcome;
        } catch (Exception e) {
            return abortedOutcome(requestId, e);
        } finally {
            activeRequests.remove(requestId, token);
        }
    }

    /**
     * Cancels an in-flight request. The run stops at its next step boundary.
     *
     * @return false if no request with this id is running
     */
    public boolean cancel(String requestId) {
        CancellationToken token = activeRequests.get(requestId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("🛑 Cancellation requested for {}", requestId);
        return true;
    }

    private WorkflowOutcome abortedOutcome(String requestId, Exception e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof WorkflowCancelledException) {
                log.warn("🛑 Request {} cancelled: {}", requestId, cause.getMessage());
                return WorkflowOutcome.cancelled(null);
            }
            if (cause instanceof ReasonerUnavailableException unavailable) {
                log.error("🔴 Request {} aborted, reasoner unavailable during {}", requestId,
                        unavailable.getRole(), e);
                return WorkflowOutcome.failed(null);
            }
        }
        log.error("🔴 Request {} failed", requestId, e);
        return WorkflowOutcome.failed(null);
    }

    // ================================================================
    // NODES
    // ================================================================

    private Map<String, Object> analyze(IntentState state) {
        checkCancelled(state, INITIAL_ANALYZER);
        Map<String, Object> updates = new HashMap<>(state.data());
        try {
            QueryAnalysis analysis = reasoner.analyze(state.getQuery());
            updates.put(IntentState.ANALYSIS, analysis);
            log.info("🔍 Analysis: schema={}, rf={}, db={}", analysis.isRequiresSchemaKnowledge(),
                    analysis.isRequiresRfKnowledge(), analysis.isRequiresDatabaseQueries());
        } catch (ReasonerException e) {
            log.warn("⚠️ Initial analysis failed, continuing without it: {}", e.getMessage());
            updates.put(IntentState.ANALYSIS, QueryAnalysis.empty());
            updates.put(IntentState.ANALYSIS_NOTES, state.analysisNotesWith("Initial analysis failed: " + e.getMessage()));
        }
        updates.put(IntentState.MESSAGES, state.messagesWith(ChatMessage.user(state.getQuery())));
        return updates;
    }

    private Map<String, Object> classify(IntentState state) {
        checkCancelled(state, INTENT_CLASSIFIER);
        String context = knowledgeBase.contextFor(state.getAnalysis());
        IntentRecord intent;
        try {
            intent = reasoner.classify(state.getQuery(), state.getAnalysis(), context);
        } catch (ReasonerOutputException e) {
            log.warn("⚠️ Classification output unusable, treating as UNKNOWN: {}", e.getMessage());
            intent = IntentRecord.unknown("Classification failed: " + e.getMessage());
        }
        if (intent == null || intent.getLabel() == null) {
            intent = IntentRecord.unknown("Classifier returned no label");
        }
        log.info("🏷️ Intent: {} (confidence {})", intent.getLabel(), intent.getConfidence());

        Map<String, Object> updates = new HashMap<>(state.data());
        updates.put(IntentState.INTENT, intent);
        updates.put(IntentState.MESSAGES, state.messagesWith(ChatMessage.assistant(
                "Classified intent: " + intent.getLabel() + " (" + nullToEmpty(intent.getReasoning()) + ")")));
        return updates;
    }

    private Map<String, Object> runSubWorkflow(IntentState state, WorkflowKind kind, String node) {
        CancellationToken token = checkCancelled(state, node);
        WorkflowOutcome outcome = engines.engineFor(kind)
                .run(state.getQuery(), state.getIntent(), state.getMessages(), token);
        return finish(state, node, outcome);
    }

    private Map<String, Object> respondGeneric(IntentState state) {
        checkCancelled(state, GENERIC_HANDLER);
        return finish(state, GENERIC_HANDLER, genericHandler.handle(state.getQuery()));
    }

    private Map<String, Object> respondUnrecognized(IntentState state) {
        checkCancelled(state, ERROR_HANDLER);
        return finish(state, ERROR_HANDLER, unknownHandler.handle(state.getQuery()));
    }

    private static Map<String, Object> finish(IntentState state, String node, WorkflowOutcome outcome) {
        Map<String, Object> updates = new HashMap<>(state.data());
        updates.put(IntentState.OUTCOME, outcome);
        updates.put(IntentState.HANDLERS_INVOKED, state.handlersInvokedWith(node));
        updates.put(IntentState.MESSAGES, state.messagesWith(ChatMessage.assistant(outcome.getResponse())));
        return updates;
    }

    private CancellationToken checkCancelled(IntentState state, String node) {
        CancellationToken token = activeRequests.get(state.getRequestId());
        if (token == null) {
            throw new IllegalStateException("No active request " + state.getRequestId());
        }
        if (token.isCancelled()) {
            throw new WorkflowCancelledException(token.getRequestId(), token.reason() + " before " + node);
        }
        return token;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
