package com.purchasingpower.emsflow.service;

import com.purchasingpower.emsflow.model.prompt.PromptTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptLibraryServiceTest {

    private PromptLibraryService promptLibrary;

    @BeforeEach
    void setUp() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "initial-analyzer", "intent-classifier", "generic-response",
            "create-planner", "update-planner", "info-planner",
            "create-response", "update-response", "info-response"})
    @DisplayName("Should load every template the reasoner uses")
    void loadPrompts_shouldRegisterTemplate(String name) {
        PromptTemplate template = promptLibrary.getTemplate(name);

        assertThat(template.getName()).isEqualTo(name);
        assertThat(template.getSystemPrompt()).isNotBlank();
        assertThat(template.getUserPrompt()).isNotBlank();
    }

    @Test
    @DisplayName("Should insert variables without HTML escaping")
    void render_shouldNotEscapeText() {
        String prompt = promptLibrary.render("generic-response", Map.of(
                "query", "is <3400 MHz> & 'LTE' \"fine\"?",
                "knowledge", "RF SPECTRUM KNOWLEDGE:\n5G n78 = 3300-3800 MHz"));

        assertThat(prompt)
                .contains("is <3400 MHz> & 'LTE' \"fine\"?")
                .contains("5G n78 = 3300-3800 MHz");
    }

    @Test
    @DisplayName("Should render the same text after the library is reloaded")
    void loadPromptsTwice_shouldKeepTemplates() {
        Map<String, Object> variables = Map.of("query", "what is LTE?", "knowledge", "");
        String before = promptLibrary.render("generic-response", variables);

        promptLibrary.loadPrompts();

        assertThat(promptLibrary.render("generic-response", variables)).isEqualTo(before);
        assertThat(promptLibrary.getTemplate("create-planner").getName()).isEqualTo("create-planner");
    }

    @Test
    @DisplayName("Should fail clearly for unknown templates")
    void unknownTemplate_shouldThrow() {
        assertThatThrownBy(() -> promptLibrary.render("delete-planner", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prompt template not found: delete-planner");
        assertThatThrownBy(() -> promptLibrary.getTemplate("delete-planner"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
