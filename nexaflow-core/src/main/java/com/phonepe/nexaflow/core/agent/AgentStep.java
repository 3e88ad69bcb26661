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

package com.phonepe.nexaflow.core.agent;

import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * One think-act-observe iteration of an agent run
 */
@Value
@Builder
@With
public class AgentStep {
    /**
     * 1 based, increases monotonically within a run
     */
    int stepNumber;

    /**
     * Reasoning provided by the model. Empty if none was found.
     */
    @Builder.Default
    String thought = "";

    /**
     * Name of the tool requested by the model. Null if no action could be parsed.
     */
    String action;

    /**
     * Arguments for the action
     */
    Map<String, String> actionInput;

    /**
     * Result of running the action, fed back to the model
     */
    String observation;

    boolean finalStep;

    /**
     * Present iff this is the final step
     */
    String finalAnswer;

    public boolean hasAction() {
        return !Strings.isNullOrEmpty(action);
    }
}
