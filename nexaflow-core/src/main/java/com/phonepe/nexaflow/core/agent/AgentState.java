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

/**
 * States of the reasoning loop
 */
public enum AgentState {
    /**
     * Waiting for the model to think about the next step
     */
    THINKING,
    /**
     * A tool requested by the model is being run
     */
    ACTING_ON_TOOL,
    /**
     * Model reply could not be understood, it has been asked to stick to the format
     */
    AWAITING_RETRY,
    /**
     * A final answer has been produced
     */
    DONE,
    /**
     * Run ended without a final answer, either due to step budget or model failure
     */
    EXHAUSTED,
}
