/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.nexaflow.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.nexaflow.core.agent.AgentStep;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses replies written as THOUGHT / ACTION / ACTION_INPUT blocks. Marker keywords are matched case-insensitively.
 */
@Slf4j
public class MarkerResponseParser implements ParsingStrategy {
    public static final String FINISH_ACTION = "FINISH";
    public static final String ANSWER_FIELD = "answer";
    public static final String RAW_INPUT_KEY = "raw";

    private static final Pattern THOUGHT_PATTERN
            = Pattern.compile("THOUGHT:\\s*(.*?)(?=ACTION:|$)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ACTION_PATTERN
            = Pattern.compile("ACTION:\\s*(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTION_INPUT_PATTERN
            = Pattern.compile("ACTION_INPUT:", Pattern.CASE_INSENSITIVE);

    private static final String FORMAT_INSTRUCTIONS = """
            ## How to respond:

            For EACH step, you MUST use this EXACT format:

            THOUGHT: [Your reasoning about what to do next]
            ACTION: [tool_name]
            ACTION_INPUT: {"param": "value"}

            After getting results, continue thinking:

            THOUGHT: [Your reasoning about the observation]
            ACTION: [next_tool or FINISH]
            ACTION_INPUT: {"param": "value"}

            When you have the final answer, use:

            THOUGHT: [Your final reasoning]
            ACTION: FINISH
            ACTION_INPUT: {"answer": "Your complete final answer here"}

            ## Rules:
            1. ALWAYS start with THOUGHT
            2. Use tools when you need real data
            3. You can use multiple tools in sequence
            4. ALWAYS end with ACTION: FINISH
            5. Be thorough but efficient
            6. If a tool fails, try a different approach
            """;

    private final ObjectMapper mapper;

    public MarkerResponseParser(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public AgentStep parse(String reply, int stepNumber) {
        final var text = Objects.requireNonNullElse(reply, "");
        final var thought = extractThought(text);
        final var action = extractAction(text);
        final var actionInput = extractActionInput(text);
        final var isFinal = FINISH_ACTION.equalsIgnoreCase(action);
        return AgentStep.builder()
                .stepNumber(stepNumber)
                .thought(thought)
                .action(action)
                .actionInput(actionInput)
                .finalStep(isFinal)
                .finalAnswer(isFinal ? finalAnswer(actionInput, thought, text) : null)
                .build();
    }

    @Override
    public String formatInstructions() {
        return FORMAT_INSTRUCTIONS;
    }

    @Override
    public String observationPrompt(AgentStep step, String observation) {
        return "OBSERVATION: %s\n\nContinue your reasoning.".formatted(observation);
    }

    @Override
    public String retryPrompt(AgentStep step) {
        return "Please follow the format: THOUGHT, ACTION, ACTION_INPUT";
    }

    private static String extractThought(String text) {
        final var matcher = THOUGHT_PATTERN.matcher(text);
        return matcher.find() ? matcher.group(1).strip() : "";
    }

    private static String extractAction(String text) {
        final var matcher = ACTION_PATTERN.matcher(text);
        return matcher.find() ? matcher.group(1).strip() : null;
    }

    private Map<String, String> extractActionInput(String text) {
        final var marker = ACTION_INPUT_PATTERN.matcher(text);
        if (!marker.find()) {
            return null;
        }
        final var json = firstObject(text, marker.end());
        if (null == json) {
            return null;
        }
        try {
            final var node = mapper.readTree(json);
            if (node != null && node.isObject()) {
                return JsonUtils.toStringMap(node);
            }
        }
        catch (JsonProcessingException e) {
            log.debug("Action input is not valid JSON, keeping raw text: {}", e.getOriginalMessage());
        }
        return Map.of(RAW_INPUT_KEY, json);
    }

    /**
     * Finds the first brace delimited object starting at or after {@code from}. Braces inside string literals are
     * ignored. If braces never balance, everything up to the last closing brace is returned.
     */
    static String firstObject(String text, int from) {
        final var start = text.indexOf('{', from);
        if (start < 0) {
            return null;
        }
        var depth = 0;
        var inString = false;
        var escaped = false;
        for (int i = start; i < text.length(); i++) {
            final var ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                }
                else if (ch == '\\') {
                    escaped = true;
                }
                else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            switch (ch) {
                case '"' -> inString = true;
                case '{' -> depth++;
                case '}' -> {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
                default -> {
                    //Nothing to do
                }
            }
        }
        final var end = text.lastIndexOf('}');
        return end > start ? text.substring(start, end + 1) : null;
    }

    private static String finalAnswer(Map<String, String> actionInput, String thought, String reply) {
        final var answer = null != actionInput ? actionInput.get(ANSWER_FIELD) : null;
        if (!Strings.isNullOrEmpty(answer) && !answer.isBlank()) {
            return answer;
        }
        if (!thought.isBlank()) {
            return thought;
        }
        return reply.strip();
    }
}
