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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.nexaflow.core.agent.AgentStep;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import lombok.NonNull;

import java.util.Locale;
import java.util.Objects;

/**
 * Parses replies where the model responds with a JSON object such as
 * <code>{"action": "tool", "tool_name": "calculator", "parameters": {"expression": "2+2"}}</code>.
 * Replies that are not JSON at all are treated as the final answer.
 */
public class JsonResponseParser implements ParsingStrategy {
    public static final String ACTION_FIELD = "action";
    public static final String CONTENT_FIELD = "content";
    public static final String TOOL_NAME_FIELD = "tool_name";
    public static final String PARAMETERS_FIELD = "parameters";

    private static final String ACTION_TOOL = "tool";
    private static final String ACTION_ANSWER = "answer";
    private static final String ACTION_THINK = "think";

    private static final String FORMAT_INSTRUCTIONS = """
            To use a tool, respond with EXACTLY this JSON format:
            {"action": "tool", "tool_name": "tool_name_here", "parameters": {"param1": "value1"}}

            When you have the final answer:
            {"action": "answer", "content": "your final answer here"}

            When you need to think:
            {"action": "think", "content": "your thought process"}

            Rules:
            1. Always respond with valid JSON
            2. Think before answering
            3. If you don't know, say so honestly
            4. Use tools when they can help
            """;

    private final ObjectMapper mapper;

    public JsonResponseParser(@NonNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public AgentStep parse(String reply, int stepNumber) {
        final var text = Objects.requireNonNullElse(reply, "");
        final var node = decode(text);
        if (null == node) {
            return answer(stepNumber, "", text);
        }
        final var action = node.hasNonNull(ACTION_FIELD)
                           ? node.get(ACTION_FIELD).asText().strip().toLowerCase(Locale.ROOT)
                           : ACTION_ANSWER;
        final var content = JsonUtils.asText(node.get(CONTENT_FIELD));
        return switch (action) {
            case ACTION_ANSWER -> answer(stepNumber, content, content.isBlank() ? text : content);
            case ACTION_TOOL -> {
                final var toolName = JsonUtils.asText(node.get(TOOL_NAME_FIELD)).strip();
                yield AgentStep.builder()
                        .stepNumber(stepNumber)
                        .thought(content)
                        .action(toolName.isEmpty() ? null : toolName)
                        .actionInput(JsonUtils.toStringMap(node.get(PARAMETERS_FIELD)))
                        .build();
            }
            default -> AgentStep.builder()
                    .stepNumber(stepNumber)
                    .thought(content)
                    .build();
        };
    }

    @Override
    public String formatInstructions() {
        return FORMAT_INSTRUCTIONS;
    }

    @Override
    public String observationPrompt(AgentStep step, String observation) {
        return "Tool %s result: %s\nNow continue based on this result.".formatted(step.getAction(), observation);
    }

    @Override
    public String retryPrompt(AgentStep step) {
        if (!step.getThought().isBlank()) {
            return "Good, continue.";
        }
        return "Please respond with valid JSON using one of the formats described.";
    }

    private static AgentStep answer(int stepNumber, String thought, String answer) {
        return AgentStep.builder()
                .stepNumber(stepNumber)
                .thought(thought)
                .finalStep(true)
                .finalAnswer(answer)
                .build();
    }

    private JsonNode decode(String text) {
        final var whole = tryDecode(text);
        if (null != whole) {
            return whole;
        }
        final var start = text.indexOf('{');
        final var end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return tryDecode(text.substring(start, end + 1));
    }

    private JsonNode tryDecode(String text) {
        try {
            final var node = mapper.readTree(text);
            return null != node && node.isObject() ? node : null;
        }
        catch (JsonProcessingException e) {
            return null;
        }
    }
}
