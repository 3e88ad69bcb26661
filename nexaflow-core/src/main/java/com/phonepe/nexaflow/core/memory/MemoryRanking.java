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

import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordering shared by memory implementations when recalling
 */
@UtilityClass
public class MemoryRanking {
    /**
     * De-duplicates by exact content (first occurrence wins) and sorts by importance, highest first. Sorting is
     * stable, so equally important items keep their relative order.
     */
    public static List<MemoryItem> mostImportantFirst(List<MemoryItem> candidates, int limit) {
        final Map<String, MemoryItem> unique = new LinkedHashMap<>();
        candidates.forEach(item -> unique.putIfAbsent(item.getContent(), item));
        return unique.values()
                .stream()
                .sorted(Comparator.comparingDouble(MemoryItem::getImportance).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
