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

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Bounded working memory. When full, the least important item is dropped (the oldest one among equals).
 * Items are always kept in the order they were added.
 */
@Slf4j
public class ShortTermMemory implements AgentMemory {
    public static final int DEFAULT_CAPACITY = 20;
    public static final int DEFAULT_CONTEXT_ITEMS = 10;

    private final int capacity;
    private final int contextItems;
    private final Clock clock;
    private final List<MemoryItem> items = new ArrayList<>();

    public ShortTermMemory() {
        this(DEFAULT_CAPACITY, DEFAULT_CONTEXT_ITEMS, Clock.systemDefaultZone());
    }

    public ShortTermMemory(int capacity, int contextItems, Clock clock) {
        Preconditions.checkArgument(capacity > 0, "Capacity must be positive");
        Preconditions.checkArgument(contextItems > 0, "Number of context items must be positive");
        this.capacity = capacity;
        this.contextItems = contextItems;
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public void remember(String content, String category, double importance) {
        add(MemoryItem.builder()
                    .content(content)
                    .category(category)
                    .importance(importance)
                    .timestamp(LocalDateTime.now(clock))
                    .tags(List.of())
                    .build());
    }

    public synchronized void add(MemoryItem item) {
        items.add(Objects.requireNonNull(item));
        if (items.size() > capacity) {
            final var leastImportant = IntStream.range(0, items.size())
                    .boxed()
                    .min(Comparator.<Integer>comparingDouble(i -> items.get(i).getImportance())
                                 .thenComparingInt(i -> i))
                    .orElseThrow();
            final var evicted = items.remove(leastImportant.intValue());
            log.trace("Evicted memory: {}", evicted.getContent());
        }
    }

    /**
     * @param count Number of items
     * @return The most recently added items, oldest first
     */
    public synchronized List<MemoryItem> recent(int count) {
        final var from = Math.max(0, items.size() - count);
        return List.copyOf(items.subList(from, items.size()));
    }

    public synchronized List<MemoryItem> items() {
        return List.copyOf(items);
    }

    public synchronized List<MemoryItem> byCategory(String category) {
        return items.stream()
                .filter(item -> Objects.equals(category, item.getCategory()))
                .toList();
    }

    public synchronized List<MemoryItem> search(String keyword) {
        final var needle = Objects.requireNonNullElse(keyword, "").toLowerCase(Locale.ROOT);
        return items.stream()
                .filter(item -> Objects.requireNonNullElse(item.getContent(), "")
                        .toLowerCase(Locale.ROOT)
                        .contains(needle))
                .toList();
    }

    public synchronized void replaceAll(List<MemoryItem> newItems) {
        items.clear();
        Objects.requireNonNullElseGet(newItems, List::<MemoryItem>of).forEach(this::add);
    }

    public synchronized int size() {
        return items.size();
    }

    @Override
    public String context() {
        final var recent = recent(contextItems);
        if (recent.isEmpty()) {
            return "No previous context.";
        }
        final var lines = new ArrayList<String>();
        lines.add("Previous context:");
        recent.forEach(item -> lines.add("  [%s] %s".formatted(item.getCategory(), item.getContent())));
        return String.join("\n", lines);
    }

    @Override
    public List<MemoryItem> recall(String query, int limit) {
        return MemoryRanking.mostImportantFirst(search(query), limit);
    }

    @Override
    public synchronized void clearShortTerm() {
        items.clear();
    }
}
