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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.nexaflow.core.memory.AgentMemory;
import com.phonepe.nexaflow.core.memory.MemoryItem;
import com.phonepe.nexaflow.core.memory.MemoryRanking;
import com.phonepe.nexaflow.core.memory.ShortTermMemory;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import com.phonepe.nexaflow.memory.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Two tier memory. Everything goes to short term memory, anything important enough is also kept in the long term
 * {@link LongTermMemory#FACTS} category.
 */
@Slf4j
public class MemoryManager implements AgentMemory {
    public static final double DEFAULT_LONG_TERM_THRESHOLD = 0.7;

    private final ShortTermMemory shortTerm;
    private final LongTermMemory longTerm;
    private final double longTermThreshold;
    private final ObjectMapper mapper;

    public MemoryManager() {
        this(null, null, null, null);
    }

    @Builder
    public MemoryManager(
            ShortTermMemory shortTerm,
            LongTermMemory longTerm,
            Double longTermThreshold,
            ObjectMapper mapper) {
        this.shortTerm = Objects.requireNonNullElseGet(shortTerm, ShortTermMemory::new);
        this.longTerm = Objects.requireNonNullElseGet(longTerm, LongTermMemory::new);
        this.longTermThreshold = Objects.requireNonNullElse(longTermThreshold, DEFAULT_LONG_TERM_THRESHOLD);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public void remember(String content, String category, double importance) {
        shortTerm.remember(content, category, importance);
        if (importance >= longTermThreshold) {
            longTerm.add(content, LongTermMemory.FACTS, importance);
        }
    }

    @Override
    public String context() {
        return shortTerm.context();
    }

    /**
     * Searches both tiers. Items with the same content are reported once, short term first.
     */
    @Override
    public List<MemoryItem> recall(String query, int limit) {
        final var candidates = new ArrayList<MemoryItem>(shortTerm.search(query));
        candidates.addAll(longTerm.search(query));
        return MemoryRanking.mostImportantFirst(candidates, limit);
    }

    @Override
    public void clearShortTerm() {
        shortTerm.clearShortTerm();
    }

    public ShortTermMemory shortTerm() {
        return shortTerm;
    }

    public LongTermMemory longTerm() {
        return longTerm;
    }

    public synchronized MemorySnapshot snapshot() {
        return MemorySnapshot.builder()
                .shortTerm(shortTerm.items())
                .longTerm(longTerm.snapshot())
                .build();
    }

    /**
     * Write both tiers to a JSON file
     *
     * @param file File to write to. Parent directories are created if needed.
     * @return Absolute path of the written file
     */
    @SneakyThrows
    public synchronized Path save(@NonNull Path file) {
        final var written = FileUtils.write(file, mapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(snapshot()));
        log.info("Saved memory snapshot to {}", written);
        return written;
    }

    /**
     * Replace the contents of both tiers with a snapshot written by {@link #save(Path)}
     *
     * @param file File to read from
     */
    @SneakyThrows
    public synchronized void load(@NonNull Path file) {
        final var snapshot = mapper.readValue(file.toFile(), MemorySnapshot.class);
        shortTerm.replaceAll(snapshot.getShortTerm());
        longTerm.replaceAll(snapshot.getLongTerm());
        log.info("Loaded memory snapshot from {}", file);
    }
}
