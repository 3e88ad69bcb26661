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

import lombok.Getter;

/**
 * Failure to get a reply from a model gateway. Raised by gateways only, the agent loop turns it into an early exit.
 */
@Getter
public class TransportException extends RuntimeException {
    private final transient NexaError error;

    public TransportException(NexaError error) {
        super(error.getMessage());
        this.error = error;
    }

    public TransportException(NexaError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static TransportException of(ErrorType errorType, Object... args) {
        return new TransportException(NexaError.error(errorType, args));
    }

    public boolean isRetryable() {
        return error.getErrorType().isRetryable();
    }
}
