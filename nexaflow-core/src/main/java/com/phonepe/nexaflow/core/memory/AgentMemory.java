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

package com.phonepe.nexaflow.core.memory;

import java.util.List;

/**
 * Memory used by agents to seed prompts with context and to record what happened during runs
 */
public interface AgentMemory {
    double DEFAULT_IMPORTANCE = 0.5;

    /**
     * Record something
     *
     * @param content    What to remember
     * @param category   Kind of memory, see {@link MemoryCategories}
     * @param importance Importance between 0.0 and 1.0
     */
    void remember(String content, String category, double importance);

    default void remember(String content, String category) {
        remember(content, category, DEFAULT_IMPORTANCE);
    }

    /**
     * @return Context string to include in prompts
     */
    String context();

    /**
     * Find memories containing the query text
     *
     * @param query Text to look for, case-insensitive
     * @param limit Maximum number of items to return
     * @return Matching items, most important first
     */
    List<MemoryItem> recall(String query, int limit);

    /**
     * Forget working memory. Persistent memories, if any, are kept.
     */
    void clearShortTerm();
}
