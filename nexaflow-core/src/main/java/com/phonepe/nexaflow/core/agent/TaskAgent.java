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

/**
 * Anything that can take up a task in a workflow
 */
public interface TaskAgent {
    String name();

    /**
     * Work on a task till an answer is found
     *
     * @param task Full text of the task
     * @return Answer. Implementations are expected to return a string even on failure, exceptions are tolerated by
     * callers but treated as task failure.
     */
    String run(String task);

    /**
     * Forget state from earlier runs
     */
    default void reset() {
        //Nothing to forget by default
    }
}
