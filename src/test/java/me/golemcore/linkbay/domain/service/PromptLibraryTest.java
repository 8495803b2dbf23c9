package me.golemcore.linkbay.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptLibraryTest {

    @Test
    void render_substitutesAllPlaceholders() {
        String prompt = PromptLibrary.render("Hello ${name}, you have ${count} messages",
                Map.of("name", "Ada", "count", 3));

        assertEquals("Hello Ada, you have 3 messages", prompt);
    }

    @Test
    void render_keepsSpecialCharactersLiteral() {
        String prompt = PromptLibrary.render("Price: ${amount}", Map.of("amount", "$5 \\ each"));

        assertEquals("Price: $5 \\ each", prompt);
    }

    @Test
    void render_failsOnMissingParameter() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> PromptLibrary.render(PromptLibrary.TRANSLATE, Map.of("text", "ciao")));

        assertEquals("Missing template parameter: language", exception.getMessage());
    }

    @Test
    void summarize_includesTextAndWordLimit() {
        String prompt = PromptLibrary.summarize("Long article body", 50);

        assertTrue(prompt.contains("at most 50 words"));
        assertTrue(prompt.endsWith("Long article body"));
        assertFalse(prompt.contains("${"));
    }

    @Test
    void fillForm_listsFields() {
        String prompt = PromptLibrary.fillForm("I'm Ada, ada@example.com", List.of("name", "email"));

        assertTrue(prompt.contains("name, email"));
        assertTrue(prompt.contains("I'm Ada, ada@example.com"));
    }

    @Test
    void analyzeData_namesDataType() {
        String prompt = PromptLibrary.analyzeData("date,amount\n2026-01-01,10", "sales");

        assertTrue(prompt.startsWith("Analyze the following sales data."));
    }

    @Test
    void template_lookupByName() {
        assertEquals(PromptLibrary.CLASSIFY, PromptLibrary.template("classify"));
        assertEquals(PromptLibrary.EXTRACT_JSON, PromptLibrary.template("extract_json"));
        assertThrows(IllegalArgumentException.class, () -> PromptLibrary.template("poem"));
    }
}
