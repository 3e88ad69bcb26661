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

/**
 * Categories used by agents and the orchestrator when recording memories
 */
@UtilityClass
public class MemoryCategories {
    public static final String CONVERSATION = "conversation";
    public static final String FACT = "fact";
    public static final String TASK = "task";
    public static final String TOOL_RESULT = "tool_result";
    public static final String ANSWER = "answer";
}
