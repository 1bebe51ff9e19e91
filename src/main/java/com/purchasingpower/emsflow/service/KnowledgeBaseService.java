package com.purchasingpower.emsflow.service;

import com.purchasingpower.emsflow.workflow.state.QueryAnalysis;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Static reference text attached to classification and generic-answer prompts.
 *
 * Loaded once from {@code classpath:knowledge/} and never modified.
 */
@Slf4j
@Service
public class KnowledgeBaseService {

    static final String SCHEMA_RESOURCE = "knowledge/schema-knowledge.txt";
    static final String RF_RESOURCE = "knowledge/rf-spectrum-knowledge.txt";

    private String schemaKnowledge = "";
    private String rfKnowledge = "";

    @PostConstruct
    public void loadKnowledge() {
        this.schemaKnowledge = read(new ClassPathResource(SCHEMA_RESOURCE));
        this.rfKnowledge = read(new ClassPathResource(RF_RESOURCE));
        log.info("Loaded knowledge base: schema={} chars, rf={} chars",
                schemaKnowledge.length(), rfKnowledge.length());
    }

    public String getSchemaKnowledge() {
        return schemaKnowledge;
    }

    public String getRfKnowledge() {
        return rfKnowledge;
    }

    /**
     * Knowledge blocks requested by the initial analysis, empty when none are.
     */
    public String contextFor(QueryAnalysis analysis) {
        List<String> blocks = new ArrayList<>();
        if (analysis.isRequiresSchemaKnowledge()) {
            blocks.add("DATABASE SCHEMA KNOWLEDGE:\n" + schemaKnowledge);
        }
        if (analysis.isRequiresRfKnowledge()) {
            blocks.add("RF SPECTRUM KNOWLEDGE:\n" + rfKnowledge);
        }
        return String.join("\n\n", blocks);
    }

    /**
     * Both knowledge blocks, used for direct answers.
     */
    public String fullContext() {
        return "DATABASE SCHEMA KNOWLEDGE:\n" + schemaKnowledge
                + "\n\nRF SPECTRUM KNOWLEDGE:\n" + rfKnowledge;
    }

    private static String read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load knowledge file: " + resource.getDescription(), e);
        }
    }
}
