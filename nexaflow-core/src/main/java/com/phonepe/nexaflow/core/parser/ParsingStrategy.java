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

package com.phonepe.nexaflow.core.parser;

import com.phonepe.nexaflow.core.agent.AgentStep;

/**
 * Converts raw model replies into structured steps and owns the prompting convention that goes with it.
 * Implementations must never throw on malformed replies, a reply without a usable action is a normal outcome.
 */
public interface ParsingStrategy {

    /**
     * Parse a reply. Pure, same input always yields the same step.
     *
     * @param reply      Raw reply from the model
     * @param stepNumber Step number to assign
     * @return Parsed step
     */
    AgentStep parse(String reply, int stepNumber);

    /**
     * @return Instructions for the system prompt telling the model how to format replies
     */
    String formatInstructions();

    /**
     * @param step        Step that requested the action
     * @param observation Result of the action
     * @return Message to send back to the model with the result of an action
     */
    String observationPrompt(AgentStep step, String observation);

    /**
     * @param step Step that did not have an action
     * @return Message to send back to the model when a reply had neither an action nor a final answer
     */
    String retryPrompt(AgentStep step);
}
