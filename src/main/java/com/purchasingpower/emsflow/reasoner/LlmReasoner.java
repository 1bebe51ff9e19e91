package com.purchasingpower.emsflow.reasoner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
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
import com.purchasingpower.emsflow.workflow.state.PlannerDecision;
import com.purchasingpower.emsflow.workflow.state.QueryAnalysis;
import com.purchasingpower.emsflow.workflow.state.WorkflowKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link Reasoner} backed by prompt templates and an {@link LLMProvider}.
 *
 * Transport failures become {@link ReasonerUnavailableException}; answers that cannot
 * be read into the expected structure become {@link ReasonerOutputException}.
 */
@Slf4j
@Component
public class LlmReasoner implements Reasoner {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;
    private final JsonResponseParser parser;

    public LlmReasoner(LLMProvider llmProvider, PromptLibraryService promptLibrary, ObjectMapper objectMapper) {
        this.llmProvider = llmProvider;
        this.promptLibrary = promptLibrary;
        this.objectMapper = objectMapper;
        this.parser = new JsonResponseParser(objectMapper);
    }

    // ================================================================
    // INITIAL ANALYSIS
    // ================================================================

    @Override
    public QueryAnalysis analyze(String query) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);

        JsonNode json = callForJson(ReasonerRole.INITIAL_ANALYSIS, ReasonerRole.INITIAL_ANALYSIS.getTemplateSuffix(),
                variables);
        JsonNode entities = json.path("detected_entities");

        return QueryAnalysis.builder()
                .requiresSchemaKnowledge(json.path("requires_schema_knowledge").asBoolean(false))
                .requiresRfKnowledge(json.path("requires_rf_knowledge").asBoolean(false))
                .requiresDatabaseQueries(json.path("requires_database_queries").asBoolean(false))
                .frequencyRanges(textList(entities.path("frequency_ranges")))
                .signalTypes(textList(entities.path("signal_types")))
                .actionTypes(textList(entities.path("action_types")))
                .conditionTypes(textList(entities.path("condition_types")))
                .tableReferences(textList(entities.path("table_references")))
                .build();
    }

    // ================================================================
    // CLASSIFICATION
    // ================================================================

    @Override
    public IntentRecord classify(String query, QueryAnalysis analysis, String knowledgeContext) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("knowledge", knowledgeContext == null ? "" : knowledgeContext);

        JsonNode json = callForJson(ReasonerRole.CLASSIFY, ReasonerRole.CLASSIFY.getTemplateSuffix(), variables);
        if (!json.hasNonNull("intent") || !json.get("intent").isTextual()) {
            throw new ReasonerOutputException(ReasonerRole.CLASSIFY, "Missing 'intent' field", json.toString());
        }

        IntentLabel label = IntentLabel.fromString(json.get("intent").asText());
        if (label == IntentLabel.UNKNOWN && !"UNKNOWN".equalsIgnoreCase(json.get("intent").asText().trim())) {
            log.warn("⚠️ Unrecognised intent label '{}', using UNKNOWN", json.get("intent").asText());
        }

        return IntentRecord.builder()
                .label(label)
                .confidence(IntentRecord.clampConfidence(json.path("confidence").asDouble(0.0)))
                .reasoning(json.path("reasoning").asText(""))
                .keyIndicators(textList(json.path("key_indicators")))
                .entities(toMap(json.path("extracted_info")))
                .build();
    }

    // ================================================================
    // PLANNING
    // ================================================================

    @Override
    public PlannerDecision plan(PlanningRequest request) {
        WorkflowKind kind = request.getKind();
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", request.getQuery());
        variables.put("iteration", request.getIteration());
        variables.put("max_iterations", request.getMaxIterations());
        variables.put("tool_catalog", request.getToolCatalog());
        variables.put("conversation", renderConversation(request.getMessages()));
        variables.put("tool_history", bulletsOrNone(request.getToolHistory()));
        variables.put("accumulator_name", kind.getAccumulatorName());
        variables.put("accumulator", renderJson(request.getAccumulator()));
        variables.put("validation_errors", bulletsOrNone(request.getValidationErrors()));
        variables.put("planner_note", request.getPlannerNote() == null ? "" : request.getPlannerNote());

        String template = kind.getPromptPrefix() + "-" + ReasonerRole.PLAN.getTemplateSuffix();
        JsonNode json = callForJson(ReasonerRole.PLAN, template, variables);

        String nextAction = json.path("next_action").asText("").trim().toLowerCase(Locale.ROOT);
        String reasoning = json.path("reasoning").asText("");
        switch (nextAction) {
            case "respond":
                return PlannerDecision.respond(reasoning);
            case "call_tool": {
                JsonNode tool = json.get("selected_tool");
                if (tool == null || !tool.isTextual() || tool.asText().isBlank()) {
                    throw new ReasonerOutputException(ReasonerRole.PLAN,
                            "'call_tool' without a selected_tool", json.toString());
                }
                JsonNode parameters = json.path("tool_parameters");
                if (!parameters.isMissingNode() && !parameters.isNull() && !parameters.isObject()) {
                    throw new ReasonerOutputException(ReasonerRole.PLAN,
                            "tool_parameters must be an object", json.toString());
                }
                return PlannerDecision.callTool(tool.asText().trim(), toMap(parameters), reasoning);
            }
            default:
                throw new ReasonerOutputException(ReasonerRole.PLAN,
                        "Unknown next_action '" + nextAction + "'", json.toString());
        }
    }

    // ================================================================
    // TEXT RESPONSES
    // ================================================================

    @Override
    public String respondGeneric(String query, String knowledgeContext) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("knowledge", knowledgeContext == null ? "" : knowledgeContext);
        return call(ReasonerRole.RESPOND_GENERIC, ReasonerRole.RESPOND_GENERIC.getTemplateSuffix(), variables).strip();
    }

    @Override
    public String summarize(SummaryRequest request) {
        WorkflowKind kind = request.getKind();
        Map<String, Object> variables = new HashMap<>();
        variables.put("query", request.getQuery());
        variables.put("tool_history", bulletsOrNone(request.getToolHistory()));
        variables.put("accumulator_name", kind.getAccumulatorName());
        variables.put("accumulator", renderJson(request.getAccumulator()));
        variables.put("validation_errors", bulletsOrNone(request.getValidationErrors()));
        variables.put("completed", request.isCompleted());

        String template = kind.getPromptPrefix() + "-" + ReasonerRole.RESPOND_SUMMARY.getTemplateSuffix();
        return call(ReasonerRole.RESPOND_SUMMARY, template, variables).strip();
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private JsonNode callForJson(ReasonerRole role, String template, Map<String, Object> variables) {
        return parser.parseObject(call(role, template, variables), role);
    }

    private String call(ReasonerRole role, String template, Map<String, Object> variables) {
        String prompt = promptLibrary.render(template, variables);
        double temperature = promptLibrary.getTemplate(template).getTemperature();
        ChatOptions options = role.isStructured() ? ChatOptions.json(temperature) : ChatOptions.text(temperature);
        try {
            String response = llmProvider.chat(prompt, template, options);
            return response == null ? "" : response;
        } catch (LlmCallException e) {
            throw new ReasonerUnavailableException(role,
                    "LLM provider " + e.getProvider() + " unavailable: " + e.getMessage(), e);
        }
    }

    private List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(element -> {
                if (element.isValueNode() && !element.isNull()) {
                    values.add(element.asText());
                }
            });
        }
        return values;
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private String renderJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return "None";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not render accumulator as JSON: {}", e.getMessage());
            return value.toString();
        }
    }

    private static String renderConversation(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "None";
        }
        return messages.stream()
                .map(message -> message.getRole() + ": " + message.getContent())
                .collect(Collectors.joining("\n"));
    }

    private static String bulletsOrNone(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return "None";
        }
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }
}
