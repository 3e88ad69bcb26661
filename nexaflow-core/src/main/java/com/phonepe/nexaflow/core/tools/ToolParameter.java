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

package com.phonepe.nexaflow.core.tools;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Parameter to a tool that will be called by the LLM
 */
@Value
@Builder
public class ToolParameter {
    @NonNull
    String name;
    @NonNull
    String description;
    @Builder.Default
    String type = "string";
    @Builder.Default
    boolean required = true;

    public static ToolParameter required(String name, String description) {
        return ToolParameter.builder().name(name).description(description).build();
    }

    public static ToolParameter optional(String name, String description) {
        return ToolParameter.builder().name(name).description(description).required(false).build();
    }
}
