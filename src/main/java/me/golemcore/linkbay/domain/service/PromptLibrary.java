package me.golemcore.linkbay.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named prompt templates with {@code ${name}} placeholders.
 */
public final class PromptLibrary {

    public static final String SUMMARIZE = "Summarize the following text in at most ${max_words} words, "
            + "keeping the key facts:\n\n${text}";

    public static final String TRANSLATE = "Translate the following text into ${language}. "
            + "Return only the translation:\n\n${text}";

    public static final String EXTRACT_JSON = "Extract the following fields from the text and return them as a "
            + "JSON object with exactly these keys: ${fields}. Use null for missing values. "
            + "Return only the JSON.\n\nText:\n${text}";

    public static final String CLASSIFY = "Classify the following text into exactly one of these categories: "
            + "${categories}. Return only the category name.\n\nText:\n${text}";

    public static final String GENERATE_HTML = "Generate a complete, responsive HTML snippet styled with "
            + "Tailwind CSS utility classes for: ${description}. Return only the HTML.";

    public static final String FILL_FORM = "Fill the form fields ${fields} from the user input below. "
            + "Return a JSON object mapping each field name to its value, or null when the input does not mention it. "
            + "Return only the JSON.\n\nUser input:\n${input}";

    public static final String ANALYZE_DATA = "Analyze the following ${data_type} data. Identify the main "
            + "trends, anomalies and actionable insights.\n\n${data}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-zA-Z_][a-zA-Z0-9_]*)}");

    private static final Map<String, String> TEMPLATES = Map.of(
            "summarize", SUMMARIZE,
            "translate", TRANSLATE,
            "extract_json", EXTRACT_JSON,
            "classify", CLASSIFY,
            "generate_html", GENERATE_HTML,
            "fill_form", FILL_FORM,
            "analyze_data", ANALYZE_DATA);

    private PromptLibrary() {
    }

    public static String template(String name) {
        String template = TEMPLATES.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Unknown prompt template: " + name);
        }
        return template;
    }

    /**
     * Substitutes every {@code ${name}} placeholder.
     *
     * @throws IllegalArgumentException
     *             if a placeholder has no value
     */
    public static String render(String template, Map<String, ?> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = parameters != null ? parameters.get(name) : null;
            if (value == null) {
                throw new IllegalArgumentException("Missing template parameter: " + name);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static String summarize(String text, int maxWords) {
        return render(SUMMARIZE, Map.of("text", text, "max_words", maxWords));
    }

    public static String translate(String text, String language) {
        return render(TRANSLATE, Map.of("text", text, "language", language));
    }

    public static String extractJson(String text, Iterable<String> fields) {
        return render(EXTRACT_JSON, Map.of("text", text, "fields", String.join(", ", fields)));
    }

    public static String classify(String text, Iterable<String> categories) {
        return render(CLASSIFY, Map.of("text", text, "categories", String.join(", ", categories)));
    }

    public static String generateHtml(String description) {
        return render(GENERATE_HTML, Map.of("description", description));
    }

    public static String fillForm(String input, Iterable<String> fields) {
        return render(FILL_FORM, Map.of("input", input, "fields", String.join(", ", fields)));
    }

    public static String analyzeData(String data, String dataType) {
        return render(ANALYZE_DATA, Map.of("data", data, "data_type", dataType));
    }
}
