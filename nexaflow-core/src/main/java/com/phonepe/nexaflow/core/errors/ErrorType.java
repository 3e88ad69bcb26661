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

package com.phonepe.nexaflow.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kinds of failures that can happen while agents and workflows run
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    NO_RESPONSE("No response from model", true),
    MODEL_CALL_COMMUNICATION_ERROR("Network error: %s", true),
    MODEL_CALL_HTTP_FAILURE("Error making HTTP call. Status: %d", true),
    MODEL_CALL_REJECTED("Model call rejected. Status: %d Body: %s", false),
    MALFORMED_MODEL_RESPONSE("Malformed model response: %s", false),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    TOOL_NOT_FOUND("Tool '%s' not found", false),
    TOOL_EXECUTION_ERROR("Error running tool %s: %s", false),
    UNKNOWN_TASK("Task '%s' not found", false),
    DEPENDENCY_UNMET("Dependencies not met", false),
    NO_AGENTS_AVAILABLE("No agents available", false),
    TASK_EXECUTION_ERROR("Error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
