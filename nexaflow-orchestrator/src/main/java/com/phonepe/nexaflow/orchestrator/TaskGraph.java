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

import com.google.common.base.Preconditions;
import com.phonepe.nexaflow.core.errors.ErrorType;
import com.phonepe.nexaflow.core.utils.AgentUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Tasks by id in registration order, along with readiness checks. Status changes go through the package private mark
 * methods, which only allow forward transitions.
 */
@Slf4j
public class TaskGraph {
    public static final int MAX_DEPENDENCY_RESULT_CHARS = 500;

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Clock clock;

    public TaskGraph() {
        this(Clock.systemDefaultZone());
    }

    public TaskGraph(@NonNull Clock clock) {
        this.clock = clock;
    }

    /**
     * Add a task. A task with the same id is replaced and its position kept.
     *
     * @return The stored task, in PENDING state with a creation timestamp
     */
    public synchronized Task add(@NonNull Task task) {
        final var stored = task.withStatus(TaskStatus.PENDING)
                .withResult(null)
                .withCompletedAt(null)
                .withCreatedAt(Objects.requireNonNullElseGet(task.getCreatedAt(), () -> LocalDateTime.now(clock)));
        if (null != tasks.put(stored.getId(), stored)) {
            log.debug("Task {} has been replaced", stored.getId());
        }
        return stored;
    }

    public synchronized Optional<Task> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public synchronized boolean contains(String id) {
        return tasks.containsKey(id);
    }

    public synchronized List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized List<String> ids() {
        return List.copyOf(tasks.keySet());
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized void clear() {
        tasks.clear();
    }

    /**
     * @return true iff every dependency is a known task that has completed
     */
    public synchronized boolean canRun(@NonNull Task task) {
        return task.getDependencies()
                .stream()
                .allMatch(dependency -> {
                    final var found = tasks.get(dependency);
                    return null != found && found.getStatus() == TaskStatus.COMPLETED;
                });
    }

    /**
     * Results of the dependencies of a task, for use as extra context when running it.
     *
     * @return Empty string if the task has no dependencies
     */
    public synchronized String dependencyContext(@NonNull Task task) {
        if (task.getDependencies().isEmpty()) {
            return "";
        }
        final var lines = new ArrayList<String>();
        lines.add("Previous results:");
        task.getDependencies().forEach(dependency -> {
            final var found = tasks.get(dependency);
            if (null != found && null != found.getResult() && !found.getResult().isEmpty()) {
                lines.add("- [%s]: %s".formatted(dependency,
                                                 AgentUtils.truncate(found.getResult(), MAX_DEPENDENCY_RESULT_CHARS)));
            }
        });
        return String.join("\n", lines);
    }

    synchronized Task markRunning(String id, String agentName) {
        return transition(id, TaskStatus.RUNNING, task -> task.withAssignedAgent(agentName));
    }

    synchronized Task markCompleted(String id, String result) {
        return transition(id, TaskStatus.COMPLETED, task -> task.withResult(result)
                .withCompletedAt(LocalDateTime.now(clock)));
    }

    synchronized Task markFailed(String id, String reason) {
        return transition(id, TaskStatus.FAILED, task -> task.withResult(reason)
                .withCompletedAt(LocalDateTime.now(clock)));
    }

    private Task transition(String id, TaskStatus next, UnaryOperator<Task> update) {
        final var current = tasks.get(id);
        Preconditions.checkArgument(null != current, ErrorType.UNKNOWN_TASK.getMessage(), id);
        Preconditions.checkState(current.getStatus().canMoveTo(next),
                                 "Task %s cannot move from %s to %s", id, current.getStatus(), next);
        final var updated = update.apply(current.withStatus(next));
        tasks.put(id, updated);
        return updated;
    }
}
