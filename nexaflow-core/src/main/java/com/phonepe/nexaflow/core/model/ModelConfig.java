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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.phonepe.nexaflow.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings for connecting to and calling a model. The api key is resolved by the caller and passed in here, either
 * directly or through {@link #fromEnvironment()} while wiring things up.
 */
@Value
@With
public class ModelConfig {
    public static final String API_KEY_ENV_VARIABLE = "NEXAFLOW_API_KEY";
    public static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";
    public static final float DEFAULT_TEMPERATURE = 0.7f;
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    ModelProvider provider;

    String model;

    /**
     * Sent as a bearer token if present
     */
    String apiKey;

    /**
     * Full chat completions url. Overrides the provider url if present
     */
    String baseUrl;

    /**
     * Amount of randomness to inject in output. Lower generally means more predictable output
     */
    float temperature;

    /**
     * Maximum number of tokens to generate
     */
    int maxTokens;

    /**
     * Timeout for a full call. Timeouts are reported as transport errors
     */
    Duration timeout;

    RetrySetup retrySetup;

    @Builder
    public ModelConfig(
            ModelProvider provider,
            String model,
            String apiKey,
            String baseUrl,
            Float temperature,
            Integer maxTokens,
            Duration timeout,
            RetrySetup retrySetup) {
        this.provider = Objects.requireNonNullElse(provider, ModelProvider.GROQ);
        this.model = Strings.isNullOrEmpty(model) ? DEFAULT_MODEL : model;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.temperature = Objects.requireNonNullElse(temperature, DEFAULT_TEMPERATURE);
        this.maxTokens = Objects.requireNonNullElse(maxTokens, DEFAULT_MAX_TOKENS);
        this.timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
        this.retrySetup = Objects.requireNonNullElse(retrySetup, RetrySetup.DEFAULT);
    }

    /**
     * Default settings with the api key read from {@value #API_KEY_ENV_VARIABLE} (environment or <code>.env</code>
     * file). The key is left empty if the variable is not set.
     */
    public static ModelConfig fromEnvironment() {
        return fromEnvironment(EnvLoader::readEnv);
    }

    @VisibleForTesting
    static ModelConfig fromEnvironment(Function<String, Optional<String>> env) {
        return ModelConfig.builder()
                .apiKey(env.apply(API_KEY_ENV_VARIABLE).orElse(null))
                .build();
    }

    /**
     * Url to post chat completion requests to
     *
     * @return Base url if provided, else the provider default
     * @throws IllegalStateException if neither is available
     */
    public String endpointUrl() {
        if (!Strings.isNullOrEmpty(baseUrl)) {
            return baseUrl;
        }
        final var url = provider.getDefaultUrl();
        if (Strings.isNullOrEmpty(url)) {
            throw new IllegalStateException("Base url is mandatory for provider " + provider);
        }
        return url;
    }
}
