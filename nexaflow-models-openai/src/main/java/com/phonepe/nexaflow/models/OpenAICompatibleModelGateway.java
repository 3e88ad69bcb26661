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

package com.phonepe.nexaflow.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.net.HttpHeaders;
import com.phonepe.nexaflow.core.errors.ErrorType;
import com.phonepe.nexaflow.core.errors.NexaError;
import com.phonepe.nexaflow.core.errors.TransportException;
import com.phonepe.nexaflow.core.model.ConversationMessage;
import com.phonepe.nexaflow.core.model.ModelConfig;
import com.phonepe.nexaflow.core.model.ModelGateway;
import com.phonepe.nexaflow.core.utils.AgentUtils;
import com.phonepe.nexaflow.core.utils.JsonUtils;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ModelGateway} for any server exposing an OpenAI style chat completions endpoint (Groq, OpenAI, Ollama and
 * the like). Retryable failures are retried as per {@link ModelConfig#getRetrySetup()}.
 */
@Slf4j
public class OpenAICompatibleModelGateway implements ModelGateway {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY_CHARS = 500;

    @Getter
    private final ModelConfig config;
    private final String endpointUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final RetryPolicy<String> retryPolicy;

    /**
     * Gateway with default settings and the api key taken from the environment
     *
     * @see ModelConfig#fromEnvironment()
     */
    public OpenAICompatibleModelGateway() {
        this(ModelConfig.fromEnvironment());
    }

    public OpenAICompatibleModelGateway(@NonNull ModelConfig config) {
        this(config, null, null);
    }

    /**
     * @param config     Model and endpoint settings
     * @param httpClient Client to make calls with. Call timeout from config is applied on top. Can be null.
     * @param mapper     Mapper for request and response bodies. Can be null.
     * @throws IllegalStateException if the config has no usable endpoint url
     */
    @Builder
    public OpenAICompatibleModelGateway(@NonNull ModelConfig config, OkHttpClient httpClient, ObjectMapper mapper) {
        this.config = config;
        this.endpointUrl = config.endpointUrl();
        this.httpClient = Objects.requireNonNullElseGet(httpClient, OkHttpClient::new)
                .newBuilder()
                .callTimeout(config.getTimeout())
                .build();
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        final var retrySetup = config.getRetrySetup();
        this.retryPolicy = RetryPolicy.<String>builder()
                .withMaxAttempts(retrySetup.getStopAfterAttempt())
                .withDelay(retrySetup.getDelayAfterFailedAttempt())
                .handleIf(error -> error instanceof TransportException transportError
                        && retrySetup.shouldRetry(transportError.getError().getErrorType()))
                .onRetry(event -> log.warn("Retrying model call. Attempt: {} Last error: {}",
                                           event.getAttemptCount(),
                                           AgentUtils.rootCauseMessage(event.getLastException())))
                .build();
    }

    @Override
    public String send(@NonNull List<ConversationMessage> conversation) {
        final var request = buildRequest(conversation);
        return Failsafe.with(retryPolicy)
                .get(context -> {
                    log.debug("Model call attempt: {}", context.getAttemptCount() + 1);
                    return call(request);
                });
    }

    private Request buildRequest(List<ConversationMessage> conversation) {
        final byte[] body;
        try {
            body = mapper.writeValueAsBytes(ChatCompletionRequest.builder()
                                                    .model(config.getModel())
                                                    .messages(conversation)
                                                    .temperature(config.getTemperature())
                                                    .maxTokens(config.getMaxTokens())
                                                    .build());
        }
        catch (JsonProcessingException e) {
            throw new TransportException(NexaError.error(ErrorType.SERIALIZATION_ERROR, e), e);
        }
        final var builder = new Request.Builder()
                .url(endpointUrl)
                .post(RequestBody.create(body, JSON));
        if (!Strings.isNullOrEmpty(config.getApiKey())) {
            builder.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private String call(Request request) {
        try (final var response = httpClient.newCall(request).execute()) {
            final var body = bodyOf(response);
            if (!response.isSuccessful()) {
                throw failure(response.code(), body);
            }
            return extractContent(body);
        }
        catch (IOException e) {
            log.error("Error calling model at {}: {}", request.url(), AgentUtils.rootCauseMessage(e));
            throw new TransportException(NexaError.error(ErrorType.MODEL_CALL_COMMUNICATION_ERROR, e), e);
        }
    }

    private static TransportException failure(int status, String body) {
        if (status == 429 || status >= 500) {
            log.error("Model call failed with status {}", status);
            return TransportException.of(ErrorType.MODEL_CALL_HTTP_FAILURE, status);
        }
        log.error("Model call rejected with status {}: {}", status, body);
        return TransportException.of(ErrorType.MODEL_CALL_REJECTED,
                                     status,
                                     AgentUtils.truncate(body, MAX_ERROR_BODY_CHARS));
    }

    private String extractContent(String body) {
        final var content = readTree(body).at("/choices/0/message/content");
        if (content.isMissingNode() || !content.isTextual()) {
            throw TransportException.of(ErrorType.MALFORMED_MODEL_RESPONSE,
                                        "No content at choices[0].message.content");
        }
        final var text = content.asText();
        if (text.isBlank()) {
            throw TransportException.of(ErrorType.NO_RESPONSE);
        }
        return text;
    }

    private JsonNode readTree(String body) {
        try {
            return mapper.readTree(body);
        }
        catch (JsonProcessingException e) {
            throw new TransportException(NexaError.error(ErrorType.MALFORMED_MODEL_RESPONSE, e), e);
        }
    }

    private static String bodyOf(Response response) throws IOException {
        final var body = response.body();
        return null == body ? "" : body.string();
    }
}
