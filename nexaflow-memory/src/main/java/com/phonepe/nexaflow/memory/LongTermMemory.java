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

package com.phonepe.nexaflow.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.nexaflow.core.memory.AgentMemory;
import com.phonepe.nexaflow.core.memory.MemoryItem;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import com.phonepe.nexaflow.memory.utils.FileUtils;
import lombok.Builder;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Categorised memory that survives restarts. When a storage directory is configured, the full store is written to
 * {@value #STORAGE_FILE_NAME} in that directory after every change and read back on construction.
 */
@Slf4j
public class LongTermMemory {
    public static final String STORAGE_FILE_NAME = "long_term.json";

    public static final String FACTS = "facts";
    public static final String LEARNINGS = "learnings";
    public static final String PREFERENCES = "preferences";
    public static final String TASKS = "tasks";

    private static final List<String> DEFAULT_CATEGORIES = List.of(FACTS, LEARNINGS, PREFERENCES, TASKS);
    private static final TypeReference<LinkedHashMap<String, List<MemoryItem>>> STORE_TYPE = new TypeReference<>() {
    };

    private final Path storageFile;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, List<MemoryItem>> memories = new LinkedHashMap<>();

    /**
     * In-memory only store
     */
    public LongTermMemory() {
        this(null, null, null);
    }

    /**
     * @param storageDir Directory to persist to. Nothing is persisted if null.
     * @param mapper     Mapper used to read and write the store
     * @param clock      Clock used to timestamp memories
     */
    @Builder
    public LongTermMemory(Path storageDir, ObjectMapper mapper, Clock clock) {
        this.storageFile = null == storageDir
                           ? null
                           : FileUtils.ensurePath(storageDir, true).resolve(STORAGE_FILE_NAME);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
        DEFAULT_CATEGORIES.forEach(category -> memories.put(category, new ArrayList<>()));
        load();
    }

    /**
     * Add a memory. Content already present in the category is ignored.
     *
     * @return true if the memory was added
     */
    public boolean add(String content, String category, double importance, List<String> tags) {
        return add(MemoryItem.builder()
                           .content(content)
                           .category(category)
                           .importance(importance)
                           .timestamp(LocalDateTime.now(clock))
                           .tags(List.copyOf(Objects.requireNonNullElseGet(tags, List::<String>of)))
                           .build());
    }

    public boolean add(String content, String category, double importance) {
        return add(content, category, importance, List.of());
    }

    public boolean add(String content, String category) {
        return add(content, category, AgentMemory.DEFAULT_IMPORTANCE);
    }

    public synchronized boolean add(MemoryItem item) {
        final var items = memories.computeIfAbsent(item.getCategory(), key -> new ArrayList<>());
        if (items.stream().anyMatch(existing -> Objects.equals(existing.getContent(), item.getContent()))) {
            log.trace("Ignoring duplicate memory in category {}: {}", item.getCategory(), item.getContent());
            return false;
        }
        items.add(item);
        save();
        return true;
    }

    /**
     * @return Items in the category in insertion order. Empty for unknown categories.
     */
    public synchronized List<MemoryItem> category(String category) {
        return List.copyOf(memories.getOrDefault(category, List.of()));
    }

    public synchronized List<String> categories() {
        return List.copyOf(memories.keySet());
    }

    /**
     * Case-insensitive substring search across all categories
     */
    public synchronized List<MemoryItem> search(String keyword) {
        final var needle = Objects.requireNonNullElse(keyword, "").toLowerCase(Locale.ROOT);
        return memories.values()
                .stream()
                .flatMap(List::stream)
                .filter(item -> Objects.requireNonNullElse(item.getContent(), "")
                        .toLowerCase(Locale.ROOT)
                        .contains(needle))
                .toList();
    }

    /**
     * @return Items at or above the given importance, most important first
     */
    public synchronized List<MemoryItem> important(double minImportance) {
        return memories.values()
                .stream()
                .flatMap(List::stream)
                .filter(item -> item.getImportance() >= minImportance)
                .sorted(Comparator.comparingDouble(MemoryItem::getImportance).reversed())
                .toList();
    }

    public synchronized void clearCategory(String category) {
        final var items = memories.get(category);
        if (null != items) {
            items.clear();
            save();
        }
    }

    /**
     * @return Copy of the whole store, category to items
     */
    public synchronized Map<String, List<MemoryItem>> snapshot() {
        final var copy = new LinkedHashMap<String, List<MemoryItem>>();
        memories.forEach((category, items) -> copy.put(category, List.copyOf(items)));
        return copy;
    }

    /**
     * Replace the whole store. Default categories are always present afterwards.
     */
    public synchronized void replaceAll(Map<String, List<MemoryItem>> categories) {
        memories.clear();
        DEFAULT_CATEGORIES.forEach(category -> memories.put(category, new ArrayList<>()));
        Objects.requireNonNullElseGet(categories, Map::<String, List<MemoryItem>>of)
                .forEach((category, items) -> memories.put(
                        category, new ArrayList<>(Objects.requireNonNullElseGet(items, List::<MemoryItem>of))));
        save();
    }

    public synchronized int size() {
        return memories.values().stream().mapToInt(List::size).sum();
    }

    @SneakyThrows
    private void save() {
        if (null == storageFile) {
            return;
        }
        FileUtils.write(storageFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(memories));
        log.trace("Saved {} long term memories to {}", size(), storageFile);
    }

    private void load() {
        if (null == storageFile || !Files.exists(storageFile)) {
            return;
        }
        try {
            final var stored = mapper.readValue(storageFile.toFile(), STORE_TYPE);
            stored.forEach((category, items) -> memories.put(
                    category, new ArrayList<>(Objects.requireNonNullElseGet(items, List::<MemoryItem>of))));
            log.info("Loaded {} long term memories from {}", size(), storageFile);
        }
        catch (Exception e) {
            log.error("Could not read long term memory from {}, starting fresh: {}", storageFile, e.getMessage());
        }
    }
}
