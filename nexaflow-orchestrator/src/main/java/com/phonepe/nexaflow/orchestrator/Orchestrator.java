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

package com.phonepe.nexaflow.orchestrator;

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.nexaflow.core.agent.Agent;
import com.phonepe.nexaflow.core.agent.TaskAgent;
import com.phonepe.nexaflow.core.errors.ErrorType;
import com.phonepe.nexaflow.core.errors.NexaError;
import com.phonepe.nexaflow.core.memory.AgentMemory;
import com.phonepe.nexaflow.core.memory.MemoryCategories;
import com.phonepe.nexaflow.core.memory.ShortTermMemory;
import com.phonepe.nexaflow.core.model.ModelGateway;
import com.phonepe.nexaflow.core.tools.ToolCatalog;
import com.phonepe.nexaflow.core.utils.AgentUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs tasks across a set of agents. Tasks run one at a time in the order given, each getting the results of its
 * dependencies as extra context. A failing task never stops the rest of the workflow.
 */
@Slf4j
public class Orchestrator {
    public static final String NO_RESULT = "No result";
    public static final String NO_RESULTS_SUMMARY = "No results to summarize";
    public static final String DEBATE_NEEDS_AGENTS = "Need at least 2 agents for debate";
    public static final String DEBATE_NEEDS_ROUNDS = "Need at least 1 round for debate";
    public static final int DEFAULT_DEBATE_ROUNDS = 2;
    public static final int MAX_SUMMARY_RESULT_CHARS = 200;

    static final String SINGLE_TASK_ID = "main";

    private static final double TASK_RESULT_IMPORTANCE = 0.8;

    private final Map<String, TaskAgent> agents = new LinkedHashMap<>();
    private final TaskGraph taskGraph;
    private final AgentMemory sharedMemory;
    private final List<WorkflowResult> workflowHistory = new ArrayList<>();

    public Orchestrator() {
        this(null, null);
    }

    @Builder
    public Orchestrator(AgentMemory sharedMemory, Clock clock) {
        this.sharedMemory = Objects.requireNonNullElseGet(sharedMemory, ShortTermMemory::new);
        this.taskGraph = new TaskGraph(Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone));
    }

    public synchronized Orchestrator addAgent(@NonNull TaskAgent agent) {
        if (null != agents.put(agent.name(), agent)) {
            log.debug("Agent {} has been replaced", agent.name());
        }
        log.info("Agent '{}' added", agent.name());
        return this;
    }

    /**
     * Build an agent with its own short term memory and register it
     *
     * @param name        Name of the agent, also the key it is registered under
     * @param role        Role description used in prompts
     * @param gateway     Gateway to the model
     * @param toolCatalog Tools available to the agent. Can be null.
     * @return The registered agent
     */
    public Agent createAgent(String name, String role, @NonNull ModelGateway gateway, ToolCatalog toolCatalog) {
        final var agent = Agent.builder()
                .name(name)
                .role(role)
                .gateway(gateway)
                .toolCatalog(toolCatalog)
                .memory(new ShortTermMemory())
                .build();
        addAgent(agent);
        return agent;
    }

    public synchronized Optional<TaskAgent> agent(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public synchronized List<String> agentNames() {
        return List.copyOf(agents.keySet());
    }

    public synchronized boolean removeAgent(String name) {
        return null != agents.remove(name);
    }

    public Task addTask(@NonNull String id, @NonNull String description) {
        return addTask(id, description, null, List.of());
    }

    /**
     * Add a task to the current workflow
     *
     * @param id           Unique id of the task
     * @param description  What needs to be done
     * @param agentName    Agent to run it. Can be null.
     * @param dependencies Ids of tasks whose results this task needs. Can be null.
     * @return The registered task
     */
    public Task addTask(
            @NonNull String id,
            @NonNull String description,
            String agentName,
            List<String> dependencies) {
        return taskGraph.add(Task.builder()
                                     .id(id)
                                     .description(description)
                                     .assignedAgent(agentName)
                                     .dependencies(Objects.requireNonNullElseGet(dependencies, List::<String>of))
                                     .build());
    }

    public TaskGraph taskGraph() {
        return taskGraph;
    }

    public AgentMemory sharedMemory() {
        return sharedMemory;
    }

    /**
     * Run all registered tasks in registration order
     */
    public WorkflowResult runSequential() {
        return runSequential(null);
    }

    /**
     * Run tasks one after the other in the given order. Tasks are not reordered: a task whose dependencies have not
     * completed by the time its turn comes is failed.
     *
     * @param taskIds Ids of tasks to run. All registered tasks, in registration order, if null or empty.
     * @return Outcome of the run. Also added to the workflow history.
     */
    public synchronized WorkflowResult runSequential(List<String> taskIds) {
        final var stopwatch = Stopwatch.createStarted();
        final var ids = null == taskIds || taskIds.isEmpty() ? taskGraph.ids() : List.copyOf(taskIds);
        log.info("Sequential workflow starting. Agents: {} Tasks: {}", agents.keySet(), ids);
        var completed = 0;
        var failed = 0;
        final var results = new LinkedHashMap<String, String>();
        for (final var id : ids) {
            final var task = taskGraph.get(id).orElse(null);
            if (null == task) {
                log.warn(NexaError.error(ErrorType.UNKNOWN_TASK, id).getMessage());
                failed++;
                continue;
            }
            final var outcome = switch (task.getStatus()) {
                case PENDING -> runIfReady(task);
                case COMPLETED, FAILED -> {
                    log.warn("Task '{}' already finished with status {}. Not running it again.",
                             id, task.getStatus());
                    yield task;
                }
                case RUNNING -> throw new IllegalStateException("Task %s is already running".formatted(id));
            };
            if (outcome.getStatus() == TaskStatus.COMPLETED) {
                completed++;
                results.put(id, Objects.requireNonNullElse(outcome.getResult(), ""));
            }
            else {
                failed++;
            }
        }
        final var result = WorkflowResult.builder()
                .success(failed == 0)
                .tasksCompleted(completed)
                .tasksFailed(failed)
                .totalTasks(ids.size())
                .results(results)
                .summary(summarize(results))
                .duration(stopwatch.elapsed())
                .build();
        workflowHistory.add(result);
        log.info("Workflow complete. Completed: {} Failed: {} Duration: {}",
                 completed, failed, result.getDuration());
        return result;
    }

    /**
     * Replace the current tasks with a chain where each step gets the result of the previous one, then run it
     *
     * @param descriptions What each step needs to do
     * @param agentNames   Agent for each step, by position. Steps without an entry use the first agent. Can be
     *                     null.
     */
    public synchronized WorkflowResult runPipeline(@NonNull List<String> descriptions, List<String> agentNames) {
        log.info("Pipeline workflow starting with {} steps", descriptions.size());
        taskGraph.clear();
        final var names = Objects.requireNonNullElseGet(agentNames, List::<String>of);
        for (int i = 0; i < descriptions.size(); i++) {
            addTask(stepId(i + 1),
                    descriptions.get(i),
                    i < names.size() ? names.get(i) : null,
                    i > 0 ? List.of(stepId(i)) : List.of());
        }
        return runSequential(null);
    }

    public String runSingle(@NonNull String task) {
        return runSingle(task, null);
    }

    /**
     * Replace the current tasks with a single one and run it
     *
     * @return Result of the task, or {@value #NO_RESULT} if it did not complete
     */
    public synchronized String runSingle(@NonNull String task, String agentName) {
        taskGraph.clear();
        addTask(SINGLE_TASK_ID, task, agentName, List.of());
        return runSequential(List.of(SINGLE_TASK_ID)).getResults().getOrDefault(SINGLE_TASK_ID, NO_RESULT);
    }

    public WorkflowResult runDebate(@NonNull String question, List<String> agentNames) {
        return runDebate(question, agentNames, DEFAULT_DEBATE_ROUNDS);
    }

    /**
     * Agents take turns arguing about a question. Every turn depends on the one before it, across agents and rounds.
     *
     * @param question   Topic of the debate
     * @param agentNames Participants in speaking order. All registered agents if null or empty.
     * @param rounds     Number of times every participant speaks
     * @return Outcome of the debate. Unsuccessful without running anything if there are fewer than two participants.
     */
    public synchronized WorkflowResult runDebate(@NonNull String question, List<String> agentNames, int rounds) {
        final var names = null == agentNames || agentNames.isEmpty() ? agentNames() : List.copyOf(agentNames);
        log.info("Debate starting on: {} Participants: {}", question, names);
        if (names.size() < 2) {
            log.warn("Debate needs at least 2 agents, got {}", names.size());
            return debateNotStarted(DEBATE_NEEDS_AGENTS);
        }
        if (rounds < 1) {
            log.warn("Debate needs at least 1 round, got {}", rounds);
            return debateNotStarted(DEBATE_NEEDS_ROUNDS);
        }
        taskGraph.clear();
        String previous = null;
        for (int round = 1; round <= rounds; round++) {
            for (final var name : names) {
                final var id = "round%d_%s".formatted(round, name);
                final var description = null == previous
                                        ? "Share your perspective on: %s\nYou are starting the debate."
                                                .formatted(question)
                                        : ("Continue the debate on: %s\nRespond to the previous arguments. "
                                                + "Add new insights or respectfully counter.").formatted(question);
                addTask(id, description, name, null == previous ? List.of() : List.of(previous));
                previous = id;
            }
        }
        return runSequential(null);
    }

    public synchronized WorkflowStatus status() {
        return new WorkflowStatus(agentNames(), taskGraph.tasks(), workflowHistory.size());
    }

    public synchronized List<WorkflowResult> workflowHistory() {
        return List.copyOf(workflowHistory);
    }

    /**
     * Drop all tasks and reset every agent. Workflow history is kept.
     */
    public synchronized void reset() {
        taskGraph.clear();
        agents.values().forEach(TaskAgent::reset);
    }

    @Override
    public synchronized String toString() {
        return "Orchestrator(agents=%s, tasks=%d)".formatted(agents.keySet(), taskGraph.size());
    }

    private Task runIfReady(Task task) {
        if (!taskGraph.canRun(task)) {
            log.warn("Task '{}' waiting for dependencies {}", task.getId(), task.getDependencies());
            return taskGraph.markFailed(task.getId(), ErrorType.DEPENDENCY_UNMET.getMessage());
        }
        return execute(task);
    }

    private Task execute(Task task) {
        final var agentName = resolveAgent(task.getAssignedAgent()).orElse(null);
        if (null == agentName) {
            log.warn("No agents available to run task '{}'", task.getId());
            return taskGraph.markFailed(task.getId(), ErrorType.NO_AGENTS_AVAILABLE.getMessage());
        }
        final var agent = agents.get(agentName);
        taskGraph.markRunning(task.getId(), agentName);
        log.info("Running task '{}' with agent '{}'", task.getId(), agentName);
        final var context = taskGraph.dependencyContext(task);
        final var fullTask = context.isEmpty()
                             ? task.getDescription()
                             : task.getDescription() + "\n\n" + context;
        final String result;
        try {
            result = Objects.requireNonNullElse(agent.run(fullTask), "");
        }
        catch (Exception e) {
            final var message = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());
            log.error("Task '%s' failed: %s".formatted(task.getId(), message), e);
            return taskGraph.markFailed(task.getId(),
                                        NexaError.error(ErrorType.TASK_EXECUTION_ERROR, message).getMessage());
        }
        final var done = taskGraph.markCompleted(task.getId(), result);
        log.info("Task '{}' completed", task.getId());
        shareResult(task.getId(), result);
        return done;
    }

    /**
     * A failure here is logged only, the task stays completed.
     */
    private void shareResult(String taskId, String result) {
        try {
            sharedMemory.remember("Task '%s' completed: %s".formatted(taskId,
                                                                     AgentUtils.truncate(result,
                                                                                         MAX_SUMMARY_RESULT_CHARS)),
                                  MemoryCategories.TASK,
                                  TASK_RESULT_IMPORTANCE);
        }
        catch (Exception e) {
            log.error("Could not record result of task '%s' in shared memory: %s"
                              .formatted(taskId, AgentUtils.rootCauseMessage(e)), e);
        }
    }

    private static WorkflowResult debateNotStarted(String reason) {
        return WorkflowResult.builder()
                .success(false)
                .tasksCompleted(0)
                .tasksFailed(1)
                .totalTasks(1)
                .results(Map.of())
                .summary(reason)
                .build();
    }

    private Optional<String> resolveAgent(String requested) {
        if (!Strings.isNullOrEmpty(requested) && agents.containsKey(requested)) {
            return Optional.of(requested);
        }
        return agents.keySet().stream().findFirst();
    }

    private static String summarize(Map<String, String> results) {
        if (results.isEmpty()) {
            return NO_RESULTS_SUMMARY;
        }
        final var lines = new ArrayList<String>();
        lines.add("Workflow Summary:");
        results.forEach((id, result) -> lines.add(
                "  [%s]: %s".formatted(id,
                                       result.isEmpty()
                                       ? "No output"
                                       : AgentUtils.truncate(result, MAX_SUMMARY_RESULT_CHARS))));
        return String.join("\n", lines);
    }

    private static String stepId(int position) {
        return "step_" + position;
    }
}
