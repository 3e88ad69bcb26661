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

package com.phonepe.nexaflow.core.tools;

import com.phonepe.nexaflow.core.errors.ErrorType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolCatalogTest {

    private static ExecutableTool echo() {
        return new ExecutableTool(ToolDefinition.builder()
                                          .name("echo")
                                          .description("Echoes the text back")
                                          .parameter(ToolParameter.required("text", "Text to echo"))
                                          .parameter(ToolParameter.optional("times", "Number of repetitions"))
                                          .build(),
                                  args -> args.get("text").repeat(Integer.parseInt(args.getOrDefault("times", "1"))));
    }

    @Test
    void testInvoke() {
        final var catalog = new ToolCatalog().register(echo());
        final var result = catalog.invoke("echo", Map.of("text", "ab", "times", "2"));
        assertTrue(result.isSuccess());
        assertEquals("abab", result.getOutput());
        assertEquals(ErrorType.SUCCESS, result.getError());
    }

    @Test
    void testUnknownTool() {
        final var result = new ToolCatalog().invoke("missing", Map.of());
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.TOOL_NOT_FOUND, result.getError());
        assertEquals("Tool 'missing' not found", result.getErrorMessage());
    }

    @Test
    void testToolFailureIsCaptured() {
        final var catalog = new ToolCatalog().register(echo());
        final var result = catalog.invoke("echo", Map.of("text", "ab", "times", "lots"));
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.TOOL_EXECUTION_ERROR, result.getError());
        assertTrue(result.getErrorMessage().startsWith("Error running tool echo: "));
    }

    @Test
    void testArgumentsAreNotModifiable() {
        final var catalog = new ToolCatalog()
                .register(new ExecutableTool(ToolDefinition.builder()
                                                     .name("mutate")
                                                     .description("Tries to change its arguments")
                                                     .build(),
                                             args -> args.put("x", "y")));
        final var arguments = new HashMap<String, String>();
        final var result = catalog.invoke("mutate", arguments);
        assertFalse(result.isSuccess());
        assertTrue(arguments.isEmpty());
    }

    @Test
    void testNullArgumentValuesAreAllowed() {
        final var catalog = new ToolCatalog()
                .register(new ExecutableTool(ToolDefinition.builder()
                                                     .name("count")
                                                     .description("Counts arguments")
                                                     .build(),
                                             args -> Integer.toString(args.size())));
        final var arguments = new HashMap<String, String>();
        arguments.put("a", null);
        assertEquals("1", catalog.invoke("count", arguments).getOutput());
        assertEquals("0", catalog.invoke("count", null).getOutput());
    }

    @Test
    void testRegisterOverwrites() {
        final var catalog = new ToolCatalog()
                .register(echo())
                .register(new ExecutableTool(echo().getToolDefinition().withDescription("Second"), args -> "2"));
        assertEquals(List.of("echo"), catalog.names());
        assertEquals("2", catalog.invoke("echo", Map.of()).getOutput());
        assertEquals("Second", catalog.definitions().get(0).getDescription());
    }

    @Test
    void testRegisterToolbox() {
        final var catalog = new ToolCatalog().registerToolbox(new ToolBox() {
            @Override
            public String name() {
                return "test";
            }

            @Override
            public List<ExecutableTool> tools() {
                return List.of(echo(),
                               new ExecutableTool(ToolDefinition.builder()
                                                          .name("noop")
                                                          .description("Does nothing")
                                                          .build(),
                                                  args -> null));
            }
        });
        assertEquals(List.of("echo", "noop"), catalog.names());
        assertEquals("", catalog.invoke("noop", Map.of()).getOutput());
    }

    @Test
    void testDescribe() {
        assertEquals("No tools available.", new ToolCatalog().describe());
        final var catalog = new ToolCatalog()
                .register(echo())
                .register(new ExecutableTool(ToolDefinition.builder()
                                                     .name("now")
                                                     .description("Current time")
                                                     .build(),
                                             args -> "noon"));
        assertEquals("""
                             Available Tools:
                               - echo: Echoes the text back (parameters: text: Text to echo, times (optional): Number of repetitions)
                               - now: Current time""",
                     catalog.describe());
    }
}
