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
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A unit of work for an agent. Instances are immutable, the {@link TaskGraph} swaps in updated copies as the task
 * progresses.
 */
@Value
@Builder
@With
public class Task {
    @NonNull
    String id;

    @NonNull
    String description;

    /**
     * Name of the agent to run this task. The first registered agent is used if this is absent or unknown.
     */
    String assignedAgent;

    @Builder.Default
    TaskStatus status = TaskStatus.PENDING;

    String result;

    /**
     * Ids of tasks that must complete before this one can run, in declared order
     */
    @Singular
    List<String> dependencies;

    LocalDateTime createdAt;

    LocalDateTime completedAt;
}
