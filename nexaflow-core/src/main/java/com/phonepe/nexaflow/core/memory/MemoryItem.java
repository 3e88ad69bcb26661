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

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A single remembered item
 */
@Value
@Builder
@With
@Jacksonized
public class MemoryItem {
    @JsonPropertyDescription("The actual content of the memory")
    String content;

    @JsonPropertyDescription("Kind of memory. For example conversation, fact, task, tool_result or answer")
    String category;

    @JsonPropertyDescription("How important the memory is. Ranges from 0.0 to 1.0")
    double importance;

    @JsonPropertyDescription("When the memory was created")
    LocalDateTime timestamp;

    @JsonPropertyDescription("Free-form tags associated with the memory")
    List<String> tags;
}
