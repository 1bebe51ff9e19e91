package com.purchasingpower.emsflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.emsflow.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Reasoner prompts for every role (analysis, classification, per-kind planning and
 * summaries, generic answers), read from {@code classpath:prompts/*.yaml}.
 *
 * <p>Each template's system and user parts are joined and compiled once at start-up;
 * the library is read-only afterwards. Values are inserted with triple mustaches in the
 * templates, so rule names and JSON payloads reach the model unescaped:
 * <pre>
 * promptLibrary.render("update-planner", Map.of("query", query, "tool_catalog", catalog, ...));
 * </pre>
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();

    private volatile Map<String, PromptTemplate> templates = Map.of();
    private volatile Map<String, Mustache> compiled = Map.of();

    @PostConstruct
    public void loadPrompts() {
        Map<String, PromptTemplate> loaded = new HashMap<>();
        Map<String, Mustache> compiledPrompts = new HashMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(PROMPT_LOCATION);
            for (Resource resource : resources) {
                PromptTemplate template = read(resource);
                if (loaded.putIfAbsent(template.getName(), template) != null) {
                    throw new IllegalStateException("Duplicate prompt template '" + template.getName()
                            + "' in " + resource.getFilename());
                }
                String prompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
                compiledPrompts.put(template.getName(),
                        mustacheFactory.compile(new StringReader(prompt), template.getName()));
                log.debug("📄 Prompt {} v{} (temperature {})", template.getName(), template.getVersion(),
                        template.getTemperature());
            }
        } catch (IOException e) {
            log.error("Failed to read prompt templates from {}", PROMPT_LOCATION, e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }

        this.templates = Map.copyOf(loaded);
        this.compiled = Map.copyOf(compiledPrompts);
        log.info("✅ Loaded {} prompt templates", loaded.size());
    }

    private PromptTemplate read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            PromptTemplate template = yamlMapper.readValue(in, PromptTemplate.class);
            if (template.getName() == null || template.getName().isBlank()) {
                throw new IllegalStateException("Prompt template without a name: " + resource.getFilename());
            }
            return template;
        }
    }

    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    /**
     * Template metadata; the reasoner takes its sampling temperature from here.
     */
    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }
}
