package com.purchasingpower.emsflow.reasoner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.emsflow.exception.ReasonerOutputException;

/**
 * Extracts the JSON object from a model answer.
 *
 * Models sometimes wrap JSON in markdown fences or add a sentence around it, so the
 * text between the first '{' and the last '}' is parsed.
 */
class JsonResponseParser {

    private final ObjectMapper objectMapper;

    JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    JsonNode parseObject(String response, ReasonerRole role) {
        if (response == null || response.isBlank()) {
            throw new ReasonerOutputException(role, "Empty response", response);
        }
        String json = extractJson(response);
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new ReasonerOutputException(role, "Response is not a JSON object", response);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ReasonerOutputException(role, "Invalid JSON: " + e.getOriginalMessage(), response, e);
        }
    }

    static String extractJson(String response) {
        String cleaned = response.trim();

        // Check for ```json ... ``` wrapper
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return cleaned.substring(start, end + 1);
        }
        return cleaned.trim();
    }
}
