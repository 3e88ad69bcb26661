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

import com.phonepe.nexaflow.core.errors.ErrorType;
import com.phonepe.nexaflow.core.tools.ToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link BuiltinToolBox} through a {@link ToolCatalog}, the way an agent calls it
 */
class BuiltinToolBoxTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:30:45Z"), ZoneOffset.UTC);

    @TempDir
    private Path tempDir;

    private ToolCatalog catalog;

    @BeforeEach
    void setup() {
        catalog = new ToolCatalog().registerToolbox(BuiltinToolBox.builder()
                                                            .clock(CLOCK)
                                                            .build());
    }

    @Test
    void testRegistersAllTools() {
        assertEquals(List.of("calculator", "read_file", "write_file", "list_directory", "get_datetime",
                             "text_analysis"),
                     catalog.names());
        assertTrue(catalog.describe().contains("path (optional)"));
    }

    @Test
    void testCalculator() {
        final var result = catalog.invoke("calculator", Map.of("expression", "2 + 2"));
        assertTrue(result.isSuccess());
        assertEquals("2 + 2 = 4", result.getOutput());
        assertEquals("sqrt(2) = 1.4142135623730951",
                     catalog.invoke("calculator", Map.of("expression", "sqrt(2)")).getOutput());
    }

    @Test
    void testCalculatorRejectsNames() {
        final var result = catalog.invoke("calculator", Map.of("expression", "x + 1"));
        assertFalse(result.isSuccess());
        assertEquals(ErrorType.TOOL_EXECUTION_ERROR, result.getError());
        assertTrue(result.getErrorMessage().contains("'x' is not allowed"));
    }

    @Test
    void testMissingParameter() {
        final var result = catalog.invoke("read_file", Map.of());
        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("Missing required parameter 'filepath'"));
    }

    @Test
    void testWriteThenRead() {
        final var file = tempDir.resolve("nested/dir/notes.txt").toString();
        final var written = catalog.invoke("write_file", Map.of("filepath", file, "content", "hello"));
        assertTrue(written.isSuccess());
        assertEquals("Successfully wrote 5 characters to " + file, written.getOutput());
        assertEquals("hello", catalog.invoke("read_file", Map.of("filepath", file)).getOutput());
    }

    @Test
    void testReadMissingFile() {
        final var file = tempDir.resolve("missing.txt").toString();
        final var result = catalog.invoke("read_file", Map.of("filepath", file));
        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("File '%s' not found".formatted(file)));
    }

    @Test
    void testReadTruncatesLargeFiles() throws Exception {
        final var file = tempDir.resolve("large.txt");
        Files.writeString(file, "x".repeat(BuiltinToolBox.MAX_READ_CHARS + 1000));
        final var output = catalog.invoke("read_file", Map.of("filepath", file.toString())).getOutput();
        assertEquals(BuiltinToolBox.MAX_READ_CHARS + BuiltinToolBox.TRUNCATION_MARKER.length(), output.length());
        assertTrue(output.endsWith(BuiltinToolBox.TRUNCATION_MARKER));
    }

    @Test
    void testListDirectory() throws Exception {
        Files.createDirectory(tempDir.resolve("b_dir"));
        Files.writeString(tempDir.resolve("a.txt"), "abc");
        final var dir = tempDir.toString();
        final var result = catalog.invoke("list_directory", Map.of("path", dir));
        assertEquals("""
                             Contents of '%s':
                               [DIR]  b_dir/
                               [FILE] a.txt (3 bytes)""".formatted(dir),
                     result.getOutput());
    }

    @Test
    void testListEmptyAndMissingDirectory() {
        final var dir = tempDir.toString();
        assertEquals("Directory '%s' is empty".formatted(dir),
                     catalog.invoke("list_directory", Map.of("path", dir)).getOutput());
        final var missing = catalog.invoke("list_directory", Map.of("path", tempDir.resolve("nope").toString()));
        assertFalse(missing.isSuccess());
        assertTrue(missing.getErrorMessage().contains("not found"));
    }

    @Test
    void testListDefaultsToWorkingDirectory() {
        final var result = catalog.invoke("list_directory", Map.of());
        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Contents of '.':"));
    }

    @Test
    void testDateTime() {
        assertEquals("2025-01-15 10:30:45", catalog.invoke("get_datetime", Map.of()).getOutput());
    }

    @Test
    void testTextAnalysis() {
        assertEquals("""
                             Text Analysis:
                               Characters: 15
                               Words: 3
                               Lines: 2
                               Avg word length: 4.3""",
                     catalog.invoke("text_analysis", Map.of("text", "hello world\nfoo")).getOutput());
        assertEquals("""
                             Text Analysis:
                               Characters: 0
                               Words: 0
                               Lines: 1
                               Avg word length: 0.0""",
                     catalog.invoke("text_analysis", Map.of("text", "")).getOutput());
    }
}
