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

import java.util.Map;

/**
 * The code that actually runs when a tool is invoked
 */
@FunctionalInterface
public interface ToolFunction {
    /**
     * Run the tool
     *
     * @param arguments Arguments as decoded from the model output, keyed by parameter name
     * @return Output to be fed back to the model
     * @throws Exception Any failure. Callers convert this to a failed {@link ToolResult}
     */
    @SuppressWarnings("java:S112")
    String call(Map<String, String> arguments) throws Exception;
}
