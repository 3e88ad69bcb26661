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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one orchestrator run
 */
@Value
public class WorkflowResult {
    /**
     * True iff no task failed
     */
    boolean success;
    int tasksCompleted;
    int tasksFailed;
    int totalTasks;

    /**
     * Task id to result for completed tasks, in execution order. Read only.
     */
    Map<String, String> results;

    String summary;

    Duration duration;

    @Builder
    public WorkflowResult(
            boolean success,
            int tasksCompleted,
            int tasksFailed,
            int totalTasks,
            Map<String, String> results,
            String summary,
            Duration duration) {
        this.success = success;
        this.tasksCompleted = tasksCompleted;
        this.tasksFailed = tasksFailed;
        this.totalTasks = totalTasks;
        this.results = null == results
                       ? Map.of()
                       : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.summary = summary;
        this.duration = Objects.requireNonNullElse(duration, Duration.ZERO);
    }
}
