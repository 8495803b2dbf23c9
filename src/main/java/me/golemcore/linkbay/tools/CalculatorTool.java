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

package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Tool evaluating arithmetic expressions.
 *
 * <p>
 * Only numbers, whitespace, {@code + - * /} and parentheses are accepted. The
 * expression is parsed by a small recursive-descent parser; nothing is handed
 * to a script engine.
 */
@Component
public class CalculatorTool implements ToolComponent {

    private static final Pattern ALLOWED = Pattern.compile("[\\d\\s+\\-*/().]+");
    private static final int MAX_EXPRESSION_LENGTH = 500;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("calculate")
                .description("Evaluate an arithmetic expression with + - * / and parentheses.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "expression", Map.of(
                                        "type", "string",
                                        "description", "Expression to evaluate, e.g. '(2 + 3) * 4'")),
                        "required", List.of("expression")))
                .build();
    }

    @Override
    public Object handle(ToolArguments arguments) {
        String expression = arguments.getString("expression");
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is required");
        }
        if (expression.length() > MAX_EXPRESSION_LENGTH) {
            throw new IllegalArgumentException("Expression is too long");
        }
        if (!ALLOWED.matcher(expression).matches()) {
            throw new IllegalArgumentException("Expression contains unsupported characters: " + expression);
        }

        double value = new Parser(expression).parse();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("expression", expression);
        result.put("result", toNumber(value));
        return result;
    }

    private static Number toNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }

    /**
     * Grammar:
     *
     * <pre>
     * expression := term (('+' | '-') term)*
     * term       := factor (('*' | '/') factor)*
     * factor     := ('+' | '-') factor | number | '(' expression ')'
     * </pre>
     */
    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
        }

        double parse() {
            double value = expression();
            skipWhitespace();
            if (pos < input.length()) {
                throw error("Unexpected '" + input.charAt(pos) + "'");
            }
            return value;
        }

        private double expression() {
            double value = term();
            while (true) {
                if (consume('+')) {
                    value += term();
                } else if (consume('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        private double term() {
            double value = factor();
            while (true) {
                if (consume('*')) {
                    value *= factor();
                } else if (consume('/')) {
                    double divisor = factor();
                    if (divisor == 0) {
                        throw new IllegalArgumentException("Division by zero");
                    }
                    value /= divisor;
                } else {
                    return value;
                }
            }
        }

        private double factor() {
            if (consume('+')) {
                return factor();
            }
            if (consume('-')) {
                return -factor();
            }
            if (consume('(')) {
                double value = expression();
                if (!consume(')')) {
                    throw error("Missing ')'");
                }
                return value;
            }
            return number();
        }

        private double number() {
            skipWhitespace();
            int start = pos;
            while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw error(pos < input.length() ? "Unexpected '" + input.charAt(pos) + "'" : "Unexpected end");
            }
            try {
                return Double.parseDouble(input.substring(start, pos));
            } catch (NumberFormatException e) {
                throw error("Invalid number '" + input.substring(start, pos) + "'");
            }
        }

        private boolean consume(char expected) {
            skipWhitespace();
            if (pos < input.length() && input.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at position " + pos + " in expression: " + input);
        }
    }
}
