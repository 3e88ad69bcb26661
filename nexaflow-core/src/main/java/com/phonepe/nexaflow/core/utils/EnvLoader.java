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

package com.phonepe.nexaflow.core.utils;

import com.google.common.annotations.VisibleForTesting;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Loads variables from environment, falling back to a <code>.env</code> file if present. The file name can be
 * changed using the <code>dotenv.file</code> system property. Meant to be called by host code while wiring things
 * up, library classes never read the environment themselves.
 */
@UtilityClass
public class EnvLoader {
    private static final Dotenv DOTENV = Dotenv.configure()
            .filename(System.getProperty("dotenv.file", ".env"))
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    /**
     * Reads an environment variable
     * @param variable the name of the variable
     * @return the value of the variable if set
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(readEnv(DOTENV, variable, null));
    }

    /**
     * Reads an environment variable
     * @param variable the name of the variable
     * @param defaultValue value to return if the variable is not set
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(DOTENV, variable, defaultValue);
    }

    @VisibleForTesting
    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromFile = dotenv.get(variable);
        if (null != fromFile) {
            return fromFile;
        }
        return Objects.requireNonNullElse(System.getenv(variable), defaultValue);
    }
}
