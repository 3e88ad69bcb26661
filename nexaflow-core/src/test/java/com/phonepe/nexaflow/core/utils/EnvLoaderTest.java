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

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class EnvLoaderTest {

    @Test
    void testReadEnvFromSystem() {
        // PATH is usually present in all environments
        assertNotNull(EnvLoader.readEnv("PATH", null));
    }

    @Test
    void testReadEnvWithDefault() {
        final var variable = "NON_EXISTENT_VAR_" + System.currentTimeMillis();
        assertEquals("default_value", EnvLoader.readEnv(variable, "default_value"));
        assertNull(EnvLoader.readEnv(variable, null));
        assertTrue(EnvLoader.readEnv(variable).isEmpty());
    }

    @Test
    void testReadEnvFromDotenv() {
        final var dotenv = Mockito.mock(Dotenv.class);
        when(dotenv.get("MOCK_VAR")).thenReturn("mock_value");
        assertEquals("mock_value", EnvLoader.readEnv(dotenv, "MOCK_VAR", "default"));

        final var variable = "REALLY_NON_EXISTENT_" + System.currentTimeMillis();
        when(dotenv.get(variable)).thenReturn(null);
        assertEquals("default", EnvLoader.readEnv(dotenv, variable, "default"));
    }
}
