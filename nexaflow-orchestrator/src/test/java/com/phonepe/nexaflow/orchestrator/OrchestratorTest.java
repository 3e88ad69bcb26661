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

package com.phonepe.nexaflow.orchestrator;

import com.phonepe.nexaflow.core.agent.TaskAgent;
import com.phonepe.nexaflow.core.memory.AgentMemory;
import com.phonepe.nexaflow.core.memory.ShortTermMemory;
import com.phonepe.nexaflow.core.model.ModelGateway;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrchestratorTest {

    /**
     * Agent that records the tasks it gets and answers with a fixed prefix
     */
    private static final class RecordingAgent implements TaskAgent {
        private final String name;
        private final List<String> received = new ArrayList<>();
        private int resets;

        private RecordingAgent(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String run(String task) {
            received.add(task);
            return name + " result " + received.size();
        }

        @Override
        public void reset() {
            resets++;
        }
    }

    @Test
    void testSequentialAllSucceed() {
        final var memory = new ShortTermMemory();
        final var orchestrator = Orchestrator.builder().sharedMemory(memory).build();
        final var agent = new RecordingAgent("writer");
        orchestrator.addAgent(agent);
        orchestrator.addTask("research", "Research topic");
        orchestrator.addTask("write", "Write article", "writer", List.of("research"));

        final var result = orchestrator.runSequential();
        assertTrue(result.isSuccess());
        assertEquals(2, result.getTasksCompleted());
        assertEquals(0, result.getTasksFailed());
        assertEquals(2, result.getTotalTasks());
        assertEquals(List.of("research", "write"), List.copyOf(result.getResults().keySet()));
        assertEquals("Research topic", agent.received.get(0));
        assertEquals("Write article\n\nPrevious results:\n- [research]: writer result 1", agent.received.get(1));
        assertEquals("Workflow Summary:\n  [research]: writer result 1\n  [write]: writer result 2",
                     result.getSummary());
        assertNotNull(result.getDuration());
        assertEquals(1, orchestrator.workflowHistory().size());
        assertEquals("Task 'research' completed: writer result 1", memory.items().get(0).getContent());
        assertEquals(0.8, memory.items().get(0).getImportance());

        final var research = orchestrator.taskGraph().get("research").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, research.getStatus());
        assertEquals("writer", research.getAssignedAgent());
        assertNotNull(research.getCompletedAt());
    }

    @Test
    void testUnmetDependencyDoesNotAbort() {
        final var orchestrator = new Orchestrator();
        final var agent = new RecordingAgent("a");
        orchestrator.addAgent(agent);
        orchestrator.addTask("child", "Needs parent", null, List.of("parent"));
        orchestrator.addTask("parent", "Parent");
        orchestrator.addTask("orphan", "Needs missing", null, List.of("missing"));

        final var result = orchestrator.runSequential();
        assertFalse(result.isSuccess());
        assertEquals(1, result.getTasksCompleted());
        assertEquals(2, result.getTasksFailed());
        assertEquals(3, result.getTotalTasks());
        final var child = orchestrator.taskGraph().get("child").orElseThrow();
        assertEquals(TaskStatus.FAILED, child.getStatus());
        assertEquals("Dependencies not met", child.getResult());
        assertEquals(List.of("Parent"), agent.received);
    }

    @Test
    void testChainOfFailures() {
        final var orchestrator = new Orchestrator();
        orchestrator.addAgent(new RecordingAgent("a"));
        orchestrator.addTask("b", "B", null, List.of("a"));
        orchestrator.addTask("c", "C", null, List.of("b"));
        final var result = orchestrator.runSequential(List.of("b", "c", "unknown"));
        assertEquals(3, result.getTasksFailed());
        assertEquals(0, result.getTasksCompleted());
        assertEquals("No results to summarize", result.getSummary());
        assertEquals("Dependencies not met", orchestrator.taskGraph().get("c").orElseThrow().getResult());
    }

    @Test
    void testAgentFailureIsContained() {
        final var orchestrator = new Orchestrator();
        final var failing = mock(TaskAgent.class);
        when(failing.name()).thenReturn("flaky");
        when(failing.run(anyString())).thenThrow(new IllegalStateException("model exploded"));
        orchestrator.addAgent(failing);
        orchestrator.addAgent(new RecordingAgent("steady"));
        orchestrator.addTask("one", "First");
        orchestrator.addTask("two", "Second", "steady", List.of());

        final var result = orchestrator.runSequential();
        assertEquals(1, result.getTasksFailed());
        assertEquals(1, result.getTasksCompleted());
        final var one = orchestrator.taskGraph().get("one").orElseThrow();
        assertEquals(TaskStatus.FAILED, one.getStatus());
        assertEquals("Error: model exploded", one.getResult());
        assertEquals("flaky", one.getAssignedAgent());
    }

    @Test
    void testSharedMemoryFailureKeepsTaskCompleted() {
        final var memory = mock(AgentMemory.class);
        doThrow(new IllegalStateException("disk full"))
                .when(memory).remember(anyString(), anyString(), anyDouble());
        final var orchestrator = Orchestrator.builder().sharedMemory(memory).build();
        final var agent = new RecordingAgent("a");
        orchestrator.addAgent(agent);
        orchestrator.addTask("t1", "First");
        orchestrator.addTask("t2", "Second", null, List.of("t1"));

        final var result = orchestrator.runSequential();
        assertTrue(result.isSuccess());
        assertEquals(2, result.getTasksCompleted());
        assertEquals(TaskStatus.COMPLETED, orchestrator.taskGraph().get("t1").orElseThrow().getStatus());
        assertEquals(TaskStatus.COMPLETED, orchestrator.taskGraph().get("t2").orElseThrow().getStatus());
        assertEquals(2, agent.received.size());
        assertEquals(1, orchestrator.workflowHistory().size());
    }

    @Test
    void testResultsAreReadOnly() {
        final var orchestrator = new Orchestrator();
        orchestrator.addAgent(new RecordingAgent("a"));
        orchestrator.addTask("t1", "First");
        final var result = orchestrator.runSequential();
        assertThrows(UnsupportedOperationException.class, () -> result.getResults().put("forged", "x"));
        assertEquals(List.of("t1"), List.copyOf(orchestrator.workflowHistory().get(0).getResults().keySet()));
    }

    @Test
    void testNoAgents() {
        final var orchestrator = new Orchestrator();
        orchestrator.addTask("lonely", "Nobody to do this");
        final var result = orchestrator.runSequential();
        assertFalse(result.isSuccess());
        assertEquals("No agents available", orchestrator.taskGraph().get("lonely").orElseThrow().getResult());
    }

    @Test
    void testUnknownAgentFallsBackToFirst() {
        final var orchestrator = new Orchestrator();
        final var first = new RecordingAgent("first");
        orchestrator.addAgent(first);
        orchestrator.addAgent(new RecordingAgent("second"));
        orchestrator.addTask("t", "Task", "ghost", List.of());
        orchestrator.runSequential();
        assertEquals(1, first.received.size());
    }

    @Test
    void testFinishedTasksAreNotRerun() {
        final var orchestrator = new Orchestrator();
        final var agent = new RecordingAgent("a");
        orchestrator.addAgent(agent);
        orchestrator.addTask("t", "Task");
        orchestrator.runSequential();
        final var second = orchestrator.runSequential();
        assertEquals(1, agent.received.size());
        assertEquals(1, second.getTasksCompleted());
        assertEquals("a result 1", second.getResults().get("t"));
        assertEquals(2, orchestrator.status().getWorkflowsCompleted());
    }

    @Test
    void testPipeline() {
        final var orchestrator = new Orchestrator();
        final var researcher = new RecordingAgent("researcher");
        final var writer = new RecordingAgent("writer");
        orchestrator.addAgent(researcher);
        orchestrator.addAgent(writer);
        orchestrator.addTask("stale", "Should be cleared");

        final var result = orchestrator.runPipeline(List.of("Find facts", "Write it up", "Proofread"),
                                                    List.of("researcher", "writer"));
        assertTrue(result.isSuccess());
        assertEquals(List.of("step_1", "step_2", "step_3"), orchestrator.taskGraph().ids());
        assertEquals(List.of("step_2"), orchestrator.taskGraph().get("step_3").orElseThrow().getDependencies());
        assertEquals(List.of("Find facts", "Proofread\n\nPrevious results:\n- [step_2]: writer result 1"),
                     researcher.received);
        assertEquals(1, writer.received.size());
    }

    @Test
    void testRunSingle() {
        final var orchestrator = new Orchestrator();
        assertEquals("No result", orchestrator.runSingle("Anything"));
        orchestrator.addAgent(new RecordingAgent("solo"));
        assertEquals("solo result 1", orchestrator.runSingle("Anything", "solo"));
        assertEquals(List.of("main"), orchestrator.taskGraph().ids());
    }

    @Test
    void testDebate() {
        final var orchestrator = new Orchestrator();
        final var pro = new RecordingAgent("pro");
        final var con = new RecordingAgent("con");
        orchestrator.addAgent(pro);
        orchestrator.addAgent(con);

        final var result = orchestrator.runDebate("Is Java verbose?", null);
        assertTrue(result.isSuccess());
        assertEquals(4, result.getTasksCompleted());
        assertEquals(List.of("round1_pro", "round1_con", "round2_pro", "round2_con"), orchestrator.taskGraph().ids());
        assertEquals(List.of("round1_con"),
                     orchestrator.taskGraph().get("round2_pro").orElseThrow().getDependencies());
        assertTrue(pro.received.get(0).startsWith("Share your perspective on: Is Java verbose?\n"
                                                          + "You are starting the debate."));
        assertTrue(con.received.get(0).startsWith("Continue the debate on: Is Java verbose?\n"));
        assertTrue(con.received.get(0).contains("- [round1_pro]: pro result 1"));
    }

    @Test
    void testDebateNeedsTwoAgents() {
        final var orchestrator = new Orchestrator();
        final var lonely = mock(TaskAgent.class);
        when(lonely.name()).thenReturn("A");
        orchestrator.addAgent(lonely);
        final var result = orchestrator.runDebate("X", List.of("A"), 2);
        assertFalse(result.isSuccess());
        assertEquals(0, result.getTasksCompleted());
        assertEquals(1, result.getTasksFailed());
        assertEquals(1, result.getTotalTasks());
        assertEquals("Need at least 2 agents for debate", result.getSummary());
        assertTrue(orchestrator.workflowHistory().isEmpty());
        verify(lonely, never()).run(anyString());
    }

    @Test
    void testDebateNeedsRounds() {
        final var orchestrator = new Orchestrator();
        final var pro = new RecordingAgent("pro");
        orchestrator.addAgent(pro);
        orchestrator.addAgent(new RecordingAgent("con"));
        final var result = orchestrator.runDebate("X", List.of("pro", "con"), 0);
        assertFalse(result.isSuccess());
        assertEquals(1, result.getTasksFailed());
        assertEquals(1, result.getTotalTasks());
        assertEquals("Need at least 1 round for debate", result.getSummary());
        assertTrue(pro.received.isEmpty());
        assertTrue(orchestrator.workflowHistory().isEmpty());
    }

    @Test
    void testAgentRegistry() {
        final var orchestrator = new Orchestrator();
        final ModelGateway gateway = messages -> "THOUGHT: ok\nACTION: FINISH\nACTION_INPUT: {\"answer\": \"done\"}";
        final var created = orchestrator.createAgent("analyst", "a data analyst", gateway, null);
        orchestrator.addAgent(new RecordingAgent("helper"));
        assertEquals(List.of("analyst", "helper"), orchestrator.agentNames());
        assertSame(created, orchestrator.agent("analyst").orElseThrow());
        assertEquals("done", orchestrator.runSingle("Analyse", "analyst"));
        assertTrue(orchestrator.removeAgent("helper"));
        assertFalse(orchestrator.removeAgent("helper"));
        assertEquals("Orchestrator(agents=[analyst], tasks=1)", orchestrator.toString());
    }

    @Test
    void testStatusAndReset() {
        final var orchestrator = new Orchestrator();
        final var agent = new RecordingAgent("a");
        orchestrator.addAgent(agent);
        orchestrator.addTask("t", "Task");
        orchestrator.runSequential();

        final var status = orchestrator.status();
        assertEquals(List.of("a"), status.getAgents());
        assertEquals(1, status.getTasks().size());
        assertEquals(TaskStatus.COMPLETED, status.getTasks().get(0).getStatus());
        assertEquals(1, status.getWorkflowsCompleted());

        orchestrator.reset();
        assertEquals(1, agent.resets);
        assertTrue(orchestrator.status().getTasks().isEmpty());
        assertEquals(1, orchestrator.workflowHistory().size());
    }
}
