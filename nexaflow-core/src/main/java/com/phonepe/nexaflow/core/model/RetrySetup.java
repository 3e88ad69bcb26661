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

import com.phonepe.nexaflow.core.errors.ErrorType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * How a gateway retries failed model calls. Only errors in {@link #retryableErrors} are retried, by default the
 * ones flagged retryable in {@link ErrorType}.
 */
@Value
@With
public class RetrySetup {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);
    public static final RetrySetup DEFAULT = RetrySetup.builder().build();
    public static final RetrySetup NO_RETRY = RetrySetup.builder().stopAfterAttempt(1).build();

    /**
     * Total attempts including the first call
     */
    int stopAfterAttempt;

    Duration delayAfterFailedAttempt;

    Set<ErrorType> retryableErrors;

    @Builder
    public RetrySetup(int stopAfterAttempt, Duration delayAfterFailedAttempt, Set<ErrorType> retryableErrors) {
        this.stopAfterAttempt = stopAfterAttempt <= 0 ? DEFAULT_MAX_ATTEMPTS : stopAfterAttempt;
        this.delayAfterFailedAttempt = Objects.requireNonNullElse(delayAfterFailedAttempt, DEFAULT_RETRY_INTERVAL);
        this.retryableErrors = null == retryableErrors
                               ? defaultRetryableErrors()
                               : Set.copyOf(retryableErrors);
    }

    public boolean shouldRetry(ErrorType errorType) {
        return null != errorType && retryableErrors.contains(errorType);
    }

    private static Set<ErrorType> defaultRetryableErrors() {
        final var errors = EnumSet.noneOf(ErrorType.class);
        for (final var errorType : ErrorType.values()) {
            if (errorType.isRetryable()) {
                errors.add(errorType);
            }
        }
        return Set.copyOf(errors);
    }
}
