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

import com.phonepe.nexaflow.core.errors.ErrorType;
import com.phonepe.nexaflow.core.errors.NexaError;
import lombok.Value;

/**
 * Result of invoking a tool. Tool failures are reported through this and never thrown.
 */
@Value
public class ToolResult {
    boolean success;
    String output;
    ErrorType error;
    String errorMessage;

    public static ToolResult success(String output) {
        return new ToolResult(true, output, ErrorType.SUCCESS, null);
    }

    public static ToolResult failure(NexaError error) {
        return new ToolResult(false, "", error.getErrorType(), error.getMessage());
    }
}
