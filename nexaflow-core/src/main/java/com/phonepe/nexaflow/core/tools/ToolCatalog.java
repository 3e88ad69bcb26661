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
import com.phonepe.nexaflow.core.errors.NexaError;
import com.phonepe.nexaflow.core.utils.AgentUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of tools available to an agent. Tools are looked up by name and invoked through here only.
 * Registration order is used for display, nothing else.
 */
@Slf4j
public class ToolCatalog {
    private final Map<String, ExecutableTool> tools = new LinkedHashMap<>();

    /**
     * Register a tool. A tool registered with an already known name replaces the old one.
     *
     * @param tool Tool to register
     * @return this
     */
    public synchronized ToolCatalog register(@NonNull ExecutableTool tool) {
        final var old = tools.put(tool.name(), tool);
        if (null != old) {
            log.debug("Tool {} has been overwritten", tool.name());
        }
        return this;
    }

    /**
     * Register all tools in a toolbox
     *
     * @param toolBox Toolbox to register
     * @return this
     */
    public ToolCatalog registerToolbox(@NonNull ToolBox toolBox) {
        final var boxTools = Objects.requireNonNullElseGet(toolBox.tools(), List::<ExecutableTool>of);
        boxTools.forEach(this::register);
        log.info("Registered {} tools from toolbox {}", boxTools.size(), toolBox.name());
        return this;
    }

    public synchronized Optional<ExecutableTool> lookup(String name) {
        return Optional.ofNullable(null == name ? null : tools.get(name));
    }

    /**
     * Invoke a tool. Never throws.
     *
     * @param name      Name of the tool
     * @param arguments Arguments for the tool
     * @return Success with tool output, or failure with {@link ErrorType#TOOL_NOT_FOUND} /
     * {@link ErrorType#TOOL_EXECUTION_ERROR}
     */
    public ToolResult invoke(String name, Map<String, String> arguments) {
        final var tool = lookup(name).orElse(null);
        if (null == tool) {
            log.warn("Invalid tool requested: {}", name);
            return ToolResult.failure(NexaError.error(ErrorType.TOOL_NOT_FOUND, name));
        }
        try {
            log.debug("Calling tool: {} Arguments: {}", name, arguments);
            final var output = tool.getFunction()
                    .call(Collections.unmodifiableMap(
                            new LinkedHashMap<>(Objects.requireNonNullElseGet(arguments, Map::<String, String>of))));
            return ToolResult.success(Objects.toString(output, ""));
        }
        catch (Exception e) {
            final var message = AgentUtils.rootCauseMessage(e);
            log.error("Error calling tool {}: {}", name, message);
            if (log.isDebugEnabled()) {
                log.error("Error stacktrace for tool %s".formatted(name), e);
            }
            return ToolResult.failure(NexaError.error(ErrorType.TOOL_EXECUTION_ERROR, name, message));
        }
    }

    public synchronized List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public synchronized List<ToolDefinition> definitions() {
        return tools.values()
                .stream()
                .map(ExecutableTool::getToolDefinition)
                .toList();
    }

    /**
     * Human-readable listing of the tools, used in prompts.
     */
    public String describe() {
        final var definitions = definitions();
        if (definitions.isEmpty()) {
            return "No tools available.";
        }
        final var lines = new ArrayList<String>();
        lines.add("Available Tools:");
        definitions.forEach(definition -> {
            final var params = Objects.requireNonNullElseGet(definition.getParameters(), List::<ToolParameter>of);
            if (params.isEmpty()) {
                lines.add("  - %s: %s".formatted(definition.getName(), definition.getDescription()));
            }
            else {
                lines.add("  - %s: %s (parameters: %s)"
                                  .formatted(definition.getName(),
                                             definition.getDescription(),
                                             params.stream()
                                                     .map(ToolCatalog::describe)
                                                     .collect(Collectors.joining(", "))));
            }
        });
        return String.join("\n", lines);
    }

    private static String describe(ToolParameter parameter) {
        return "%s%s: %s".formatted(parameter.getName(),
                                    parameter.isRequired() ? "" : " (optional)",
                                    parameter.getDescription());
    }
}
