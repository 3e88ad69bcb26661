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

package com.phonepe.nexaflow.core.parser;

import com.phonepe.nexaflow.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkerResponseParserTest {
    private final MarkerResponseParser parser = new MarkerResponseParser(JsonUtils.createMapper());

    @Test
    void testToolCall() {
        final var step = parser.parse("""
                                              THOUGHT: I need to compute this.
                                              ACTION: calculator
                                              ACTION_INPUT: {"expression": "2 + 2"}
                                              """, 1);
        assertEquals(1, step.getStepNumber());
        assertEquals("I need to compute this.", step.getThought());
        assertEquals("calculator", step.getAction());
        assertEquals(Map.of("expression", "2 + 2"), step.getActionInput());
        assertFalse(step.isFinalStep());
        assertNull(step.getFinalAnswer());
        assertTrue(step.hasAction());
    }

    @Test
    void testFinish() {
        final var step = parser.parse("""
                                              THOUGHT: I know the answer.
                                              ACTION: finish
                                              ACTION_INPUT: {"answer": "4"}
                                              """, 3);
        assertTrue(step.isFinalStep());
        assertEquals("4", step.getFinalAnswer());
    }

    @Test
    void testFinishWithoutAnswerFallsBackToThought() {
        final var step = parser.parse("THOUGHT: The answer is 4\nACTION: FINISH\nACTION_INPUT: {}", 1);
        assertTrue(step.isFinalStep());
        assertEquals("The answer is 4", step.getFinalAnswer());
    }

    @Test
    void testFinishWithoutAnswerOrThoughtUsesReply() {
        final var step = parser.parse("  ACTION: FINISH  ", 1);
        assertTrue(step.isFinalStep());
        assertEquals("ACTION: FINISH", step.getFinalAnswer());
    }

    @Test
    void testNoMarkers() {
        final var step = parser.parse("Just some text without structure", 2);
        assertEquals("", step.getThought());
        assertNull(step.getAction());
        assertNull(step.getActionInput());
        assertFalse(step.isFinalStep());
        assertFalse(step.hasAction());
    }

    @Test
    void testNestedAndBracesInStrings() {
        final var step = parser.parse("""
                                              THOUGHT: Write it
                                              ACTION: write_file
                                              ACTION_INPUT: {"path": "a.json", "content": {"x": "}{"}} trailing {"y": 1}
                                              """, 1);
        assertEquals("a.json", step.getActionInput().get("path"));
        assertEquals("{\"x\":\"}{\"}", step.getActionInput().get("content"));
    }

    @Test
    void testUndecodableInputIsKeptRaw() {
        final var step = parser.parse("THOUGHT: t\nACTION: search\nACTION_INPUT: {query: unquoted}", 1);
        assertEquals(Map.of(MarkerResponseParser.RAW_INPUT_KEY, "{query: unquoted}"), step.getActionInput());
    }

    @Test
    void testFinishWithUndecodableInputUsesThought() {
        final var step = parser.parse("THOUGHT: The answer is x\nACTION: FINISH\nACTION_INPUT: {answer: x}", 1);
        assertTrue(step.isFinalStep());
        assertEquals("The answer is x", step.getFinalAnswer());
        assertEquals(Map.of(MarkerResponseParser.RAW_INPUT_KEY, "{answer: x}"), step.getActionInput());
    }

    @Test
    void testParsingIsRepeatable() {
        final var reply = """
                THOUGHT: Checking the time.
                ACTION: get_datetime
                ACTION_INPUT: {"zone": "UTC", "nested": {"a": [1, 2]}}
                """;
        assertEquals(parser.parse(reply, 2), parser.parse(reply, 2));
        final var finish = "THOUGHT: done\nACTION: FINISH\nACTION_INPUT: {answer: broken}";
        assertEquals(parser.parse(finish, 1), parser.parse(finish, 1));
    }

    @Test
    void testMarkerGluedToPrecedingText() {
        final var step = parser.parse("THOUGHT: need maths fooACTION: calculator", 1);
        assertEquals("need maths foo", step.getThought());
        assertEquals("calculator", step.getAction());
    }

    @Test
    void testActionInputWithoutObject() {
        final var step = parser.parse("THOUGHT: t\nACTION: get_datetime\nACTION_INPUT: none", 1);
        assertEquals("get_datetime", step.getAction());
        assertNull(step.getActionInput());
    }

    @Test
    void testMarkersAreCaseInsensitive() {
        final var step = parser.parse("thought: lower\naction: calculator\naction_input: {\"expression\": \"1\"}", 1);
        assertEquals("lower", step.getThought());
        assertEquals("calculator", step.getAction());
        assertEquals("1", step.getActionInput().get("expression"));
    }

    @Test
    void testMultilineThought() {
        final var step = parser.parse("THOUGHT: line one\nline two\nACTION: calculator", 1);
        assertEquals("line one\nline two", step.getThought());
    }

    @Test
    void testFirstObject() {
        assertEquals("{\"a\": {\"b\": 1}}", MarkerResponseParser.firstObject("x {\"a\": {\"b\": 1}} y", 0));
        assertEquals("{\"a\": \"\\\"}\"}", MarkerResponseParser.firstObject("{\"a\": \"\\\"}\"}", 0));
        assertEquals("{\"a\": 1}", MarkerResponseParser.firstObject("{{\"a\": 1}", 1));
        assertEquals("{{\"a\": 1}", MarkerResponseParser.firstObject("{{\"a\": 1}", 0));
        assertNull(MarkerResponseParser.firstObject("no braces", 0));
        assertNull(MarkerResponseParser.firstObject("{ never closed", 0));
    }

    @Test
    void testPrompts() {
        final var step = parser.parse("THOUGHT: t\nACTION: calculator", 1);
        assertEquals("OBSERVATION: Result: 4\n\nContinue your reasoning.", parser.observationPrompt(step, "Result: 4"));
        assertEquals("Please follow the format: THOUGHT, ACTION, ACTION_INPUT", parser.retryPrompt(step));
        assertTrue(parser.formatInstructions().contains("ACTION: FINISH"));
    }
}
