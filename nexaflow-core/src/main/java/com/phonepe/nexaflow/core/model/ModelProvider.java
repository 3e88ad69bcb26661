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

package com.phonepe.nexaflow.core.model;

import lombok.Getter;

/**
 * Known providers of OpenAI compatible chat completion endpoints
 */
@Getter
public enum ModelProvider {
    GROQ("https://api.groq.com/openai/v1/chat/completions"),
    OPENAI("https://api.openai.com/v1/chat/completions"),
    OLLAMA("http://localhost:11434/v1/chat/completions"),
    /**
     * Anything else. Base url must be provided in config.
     */
    CUSTOM(null),
    ;

    private final String defaultUrl;

    ModelProvider(String defaultUrl) {
        this.defaultUrl = defaultUrl;
    }
}
