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

package com.phonepe.nexaflow.toolbox.builtin;

import com.google.common.base.Strings;
import com.phonepe.nexaflow.core.tools.ExecutableTool;
import com.phonepe.nexaflow.core.tools.ToolBox;
import com.phonepe.nexaflow.core.tools.ToolDefinition;
import com.phonepe.nexaflow.core.tools.ToolFunction;
import com.phonepe.nexaflow.core.tools.ToolParameter;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * General purpose tools: a calculator, file access, the current time and simple text statistics. Tools report
 * problems by throwing, the tool catalog turns those into error results for the model.
 */
@Slf4j
public class BuiltinToolBox implements ToolBox {
    public static final String NAME = "builtin";
    public static final int MAX_READ_CHARS = 5000;
    public static final String TRUNCATION_MARKER = "\n... (truncated)";

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;

    public BuiltinToolBox() {
        this(null);
    }

    @Builder
    public BuiltinToolBox(Clock clock) {
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ExecutableTool> tools() {
        return List.of(
                tool("calculator",
                     "Calculate mathematical expressions. Supports +, -, *, /, %, ^, sqrt, sin, cos, etc.",
                     List.of(ToolParameter.required("expression",
                                                    "Math expression to evaluate, e.g., '2 + 2' or 'sqrt(16)'")),
                     args -> calculator(argument(args, "expression"))),
                tool("read_file",
                     "Read the contents of a file",
                     List.of(ToolParameter.required("filepath", "Path to the file to read")),
                     args -> readFile(argument(args, "filepath"))),
                tool("write_file",
                     "Write content to a file",
                     List.of(ToolParameter.required("filepath", "Path to the file to write"),
                             ToolParameter.required("content", "Content to write to the file")),
                     args -> writeFile(argument(args, "filepath"),
                                       Objects.requireNonNullElse(args.get("content"), ""))),
                tool("list_directory",
                     "List files and folders in a directory",
                     List.of(ToolParameter.optional("path", "Directory path to list")),
                     args -> listDirectory(Strings.isNullOrEmpty(args.get("path")) ? "." : args.get("path"))),
                tool("get_datetime",
                     "Get current date and time",
                     List.of(),
                     args -> currentDateTime()),
                tool("text_analysis",
                     "Analyze text - count words, characters, lines",
                     List.of(ToolParameter.required("text", "Text to analyze")),
                     args -> textAnalysis(Objects.requireNonNullElse(args.get("text"), ""))));
    }

    public String calculator(String expression) {
        final var value = ExpressionEvaluator.evaluate(expression);
        return "%s = %s".formatted(expression, ExpressionEvaluator.format(value));
    }

    public String readFile(String filepath) {
        final var path = Path.of(filepath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("File '%s' not found".formatted(filepath));
        }
        final String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error reading file %s".formatted(filepath), e);
        }
        if (content.length() > MAX_READ_CHARS) {
            log.debug("Truncating {} from {} characters", filepath, content.length());
            return content.substring(0, MAX_READ_CHARS) + TRUNCATION_MARKER;
        }
        return content;
    }

    public String writeFile(String filepath, String content) {
        final var path = Path.of(filepath).toAbsolutePath();
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error writing file %s".formatted(filepath), e);
        }
        log.debug("Wrote {} characters to {}", content.length(), path);
        return "Successfully wrote %d characters to %s".formatted(content.length(), filepath);
    }

    public String listDirectory(String directory) {
        final var path = Path.of(directory);
        if (!Files.isDirectory(path)) {
            throw new IllegalArgumentException("Directory '%s' not found".formatted(directory));
        }
        final List<Path> entries;
        try (final var listing = Files.list(path)) {
            entries = listing.sorted(Comparator.comparing(entry -> entry.getFileName().toString())).toList();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error listing directory %s".formatted(directory), e);
        }
        if (entries.isEmpty()) {
            return "Directory '%s' is empty".formatted(directory);
        }
        final var dirs = new ArrayList<String>();
        final var files = new ArrayList<String>();
        for (final var entry : entries) {
            final var name = entry.getFileName().toString();
            if (Files.isDirectory(entry)) {
                dirs.add("  [DIR]  %s/".formatted(name));
            }
            else {
                files.add("  [FILE] %s (%d bytes)".formatted(name, size(entry)));
            }
        }
        final var lines = new ArrayList<String>();
        lines.add("Contents of '%s':".formatted(directory));
        lines.addAll(dirs);
        lines.addAll(files);
        return String.join("\n", lines);
    }

    public String currentDateTime() {
        return LocalDateTime.now(clock).format(DATE_TIME_FORMAT);
    }

    public String textAnalysis(String text) {
        final var stripped = text.strip();
        final var words = stripped.isEmpty() ? new String[0] : WHITESPACE.split(stripped);
        final var lines = text.split("\n", -1).length;
        final var letters = Arrays.stream(words).mapToLong(String::length).sum();
        final var averageWordLength = (double) letters / Math.max(words.length, 1);
        return """
                Text Analysis:
                  Characters: %d
                  Words: %d
                  Lines: %d
                  Avg word length: %s""".formatted(text.length(),
                                                   words.length,
                                                   lines,
                                                   String.format(Locale.ROOT, "%.1f", averageWordLength));
    }

    private static ExecutableTool tool(
            String name,
            String description,
            List<ToolParameter> parameters,
            ToolFunction function) {
        return new ExecutableTool(ToolDefinition.builder()
                                          .name(name)
                                          .description(description)
                                          .parameters(parameters)
                                          .build(),
                                  function);
    }

    private static String argument(Map<String, String> args, String name) {
        final var value = args.get(name);
        if (Strings.isNullOrEmpty(value)) {
            throw new IllegalArgumentException("Missing required parameter '%s'".formatted(name));
        }
        return value;
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not read size of %s".formatted(file), e);
        }
    }
}
