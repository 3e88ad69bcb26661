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

import com.phonepe.nexaflow.core.memory.MemoryItem;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link MemoryManager} knows, as written by {@link MemoryManager#save(java.nio.file.Path)}
 */
@Value
@Builder
@Jacksonized
public class MemorySnapshot {
    /**
     * Working memory, oldest first
     */
    List<MemoryItem> shortTerm;

    /**
     * Long term memory by category
     */
    Map<String, List<MemoryItem>> longTerm;
}
