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

package com.phonepe.nexaflow.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.phonepe.nexaflow.core.errors.TransportException;
import com.phonepe.nexaflow.core.memory.AgentMemory;
import com.phonepe.nexaflow.core.memory.MemoryCategories;
import com.phonepe.nexaflow.core.memory.ShortTermMemory;
import com.phonepe.nexaflow.core.model.ConversationMessage;
import com.phonepe.nexaflow.core.model.ModelGateway;
import com.phonepe.nexaflow.core.parser.ParsingMode;
import com.phonepe.nexaflow.core.parser.ParsingStrategy;
import com.phonepe.nexaflow.core.tools.ToolCatalog;
import com.phonepe.nexaflow.core.utils.AgentUtils;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An agent that works on tasks using the ReAct pattern: think, act using a tool, observe the result and repeat till
 * a final answer is produced or the step budget runs out. A run never throws, it always produces a string.
 */
@Slf4j
public class Agent implements TaskAgent {
    public static final String DEFAULT_NAME = "NexaAgent";
    public static final String DEFAULT_ROLE = "A helpful AI assistant";
    public static final int DEFAULT_MAX_STEPS = 10;

    public static final String EXHAUSTED_ANSWER = "Could not complete the task";
    public static final String NO_RESULT = "No result";
    public static final String CHAT_FALLBACK = "I couldn't generate a response.";

    private static final double TASK_IMPORTANCE = 0.8;
    private static final double ANSWER_IMPORTANCE = 0.9;
    private static final int MAX_REMEMBERED_OBSERVATION = 500;

    private final String name;
    private final String role;
    private final ModelGateway gateway;
    @Getter
    private final ToolCatalog toolCatalog;
    @Getter
    private final AgentMemory memory;
    @Getter
    private final int maxSteps;
    private final ParsingStrategy parsingStrategy;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<AgentStep> history = new ArrayList<>();
    private final List<ConversationMessage> transcript = new ArrayList<>();
    private volatile AgentState state = AgentState.THINKING;

    @Builder
    public Agent(
            String name,
            String role,
            @NonNull ModelGateway gateway,
            ToolCatalog toolCatalog,
            AgentMemory memory,
            Integer maxSteps,
            ParsingMode parsingMode,
            ParsingStrategy parsingStrategy,
            ObjectMapper mapper) {
        Preconditions.checkArgument(null == maxSteps || maxSteps > 0, "Max steps must be positive");
        this.name = Strings.isNullOrEmpty(name) ? DEFAULT_NAME : name;
        this.role = Strings.isNullOrEmpty(role) ? DEFAULT_ROLE : role;
        this.gateway = gateway;
        this.toolCatalog = Objects.requireNonNullElseGet(toolCatalog, ToolCatalog::new);
        this.memory = Objects.requireNonNullElseGet(memory, ShortTermMemory::new);
        this.maxSteps = Objects.requireNonNullElse(maxSteps, DEFAULT_MAX_STEPS);
        this.parsingStrategy = Objects.requireNonNullElseGet(
                parsingStrategy,
                () -> Objects.requireNonNullElse(parsingMode, ParsingMode.MARKER)
                        .strategy(Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper)));
    }

    @Override
    public String name() {
        return name;
    }

    public String role() {
        return role;
    }

    /**
     * Run the reasoning loop on a task
     *
     * @param task Task to work on
     * @return Final answer, or the best partial result if the loop ended without one
     */
    @Override
    public String run(@NonNull String task) {
        lock.lock();
        try {
            return runLoop(task);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Single model call without tools or the reasoning loop
     *
     * @param message Message from the user
     * @return Model reply verbatim
     */
    public String chat(@NonNull String message) {
        lock.lock();
        try {
            memory.remember("User: " + message, MemoryCategories.CONVERSATION);
            final var messages = List.of(
                    ConversationMessage.system("You are %s, %s.\n%s".formatted(name, role, memory.context())),
                    ConversationMessage.user(message));
            final var reply = callModel(messages).orElse(null);
            if (Strings.isNullOrEmpty(reply)) {
                return CHAT_FALLBACK;
            }
            memory.remember("Assistant: " + reply, MemoryCategories.CONVERSATION);
            return reply;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return Steps of the last run
     */
    public List<AgentStep> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return Conversation of the last run
     */
    public List<ConversationMessage> transcript() {
        lock.lock();
        try {
            return List.copyOf(transcript);
        }
        finally {
            lock.unlock();
        }
    }

    public AgentState state() {
        return state;
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            history.clear();
            transcript.clear();
            memory.clearShortTerm();
            state = AgentState.THINKING;
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Agent(name='%s', tools=%s)".formatted(name, toolCatalog.names());
    }

    private String runLoop(String task) {
        log.info("Agent {} starting task: {}", name, task);
        history.clear();
        transcript.clear();
        state = AgentState.THINKING;
        transcript.add(ConversationMessage.system(systemPrompt()));
        transcript.add(ConversationMessage.user(userPrompt(task)));
        memory.remember("Task: " + task, MemoryCategories.TASK, TASK_IMPORTANCE);

        for (int stepNumber = 1; stepNumber <= maxSteps; stepNumber++) {
            log.debug("Agent {} step {}/{}", name, stepNumber, maxSteps);
            final var reply = callModel(transcript).orElse(null);
            if (Strings.isNullOrEmpty(reply) || reply.isBlank()) {
                log.warn("No response from model for agent {} at step {}. Stopping.", name, stepNumber);
                break;
            }
            final var step = parsingStrategy.parse(reply, stepNumber);
            history.add(step);
            log.debug("Thought: {}", step.getThought());

            if (step.isFinalStep()) {
                state = AgentState.DONE;
                memory.remember("Completed: %s -> %s".formatted(task, step.getFinalAnswer()),
                                MemoryCategories.ANSWER,
                                ANSWER_IMPORTANCE);
                log.info("Agent {} finished in {} steps", name, stepNumber);
                return step.getFinalAnswer();
            }
            transcript.add(ConversationMessage.assistant(reply));
            if (step.hasAction()) {
                state = AgentState.ACTING_ON_TOOL;
                final var observation = act(step);
                history.set(history.size() - 1, step.withObservation(observation));
                transcript.add(ConversationMessage.user(parsingStrategy.observationPrompt(step, observation)));
                memory.remember("Tool %s: %s".formatted(step.getAction(),
                                                        AgentUtils.truncate(observation, MAX_REMEMBERED_OBSERVATION)),
                                MemoryCategories.TOOL_RESULT);
            }
            else {
                state = AgentState.AWAITING_RETRY;
                log.debug("No action found in reply at step {}, asking model to retry", stepNumber);
                transcript.add(ConversationMessage.user(parsingStrategy.retryPrompt(step)));
            }
            state = AgentState.THINKING;
        }
        state = AgentState.EXHAUSTED;
        log.warn("Agent {} could not reach an answer within {} steps", name, maxSteps);
        return exhaustedAnswer();
    }

    private String act(AgentStep step) {
        final var toolName = resolveToolName(step.getAction()).orElse(null);
        if (null == toolName) {
            log.warn("Model requested unknown tool: {}", step.getAction());
            return "Error: Tool '%s' not found. Available tools: %s".formatted(step.getAction(),
                                                                             toolCatalog.names());
        }
        log.debug("Running tool {} with {}", toolName, step.getActionInput());
        final var arguments = Objects.requireNonNullElseGet(step.getActionInput(), Map::<String, String>of);
        final var result = toolCatalog.invoke(toolName, arguments);
        return result.isSuccess()
               ? "Result: " + result.getOutput()
               : "Error: " + result.getErrorMessage();
    }

    private Optional<String> resolveToolName(String requested) {
        if (toolCatalog.lookup(requested).isPresent()) {
            return Optional.of(requested);
        }
        final var lowered = requested.toLowerCase(Locale.ROOT);
        return toolCatalog.lookup(lowered).map(tool -> lowered);
    }

    private Optional<String> callModel(List<ConversationMessage> messages) {
        try {
            return Optional.ofNullable(gateway.send(List.copyOf(messages)));
        }
        catch (TransportException e) {
            log.error("Model call failed for agent {}: {}", name, e.getMessage());
        }
        catch (RuntimeException e) {
            log.error("Unexpected error calling model for agent %s".formatted(name), e);
        }
        return Optional.empty();
    }

    private String exhaustedAnswer() {
        if (history.isEmpty()) {
            return NO_RESULT;
        }
        final var last = history.get(history.size() - 1);
        if (!Strings.isNullOrEmpty(last.getFinalAnswer())) {
            return last.getFinalAnswer();
        }
        if (!Strings.isNullOrEmpty(last.getThought()) && !last.getThought().isBlank()) {
            return last.getThought();
        }
        return EXHAUSTED_ANSWER;
    }

    private String systemPrompt() {
        return """
                You are %s, %s.

                You operate using the ReAct pattern (Reasoning and Acting).

                %s

                %s
                %s""".formatted(name, role, toolCatalog.describe(), parsingStrategy.formatInstructions(),
                                memory.context());
    }

    private String userPrompt(String task) {
        return """
                Task: %s

                %s

                Begin your reasoning.""".formatted(task, memory.context());
    }
}
