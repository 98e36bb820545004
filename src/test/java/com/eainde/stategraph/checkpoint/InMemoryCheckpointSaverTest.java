package com.eainde.stategraph.checkpoint;

import com.eainde.stategraph.CompileOptions;
import com.eainde.stategraph.GraphBuilder;
import com.eainde.stategraph.GraphResult;
import com.eainde.stategraph.Workflow;
import com.eainde.stategraph.state.StateSchema;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.state.AgentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

class InMemoryCheckpointSaverTest {

    private final InMemoryCheckpointSaver saver = new InMemoryCheckpointSaver();

    private static RunnableConfig thread(String threadId) {
        return RunnableConfig.builder().threadId(threadId).build();
    }

    private static Checkpoint checkpoint(String nodeId, Map<String, Object> state) {
        return Checkpoint.builder()
                .nodeId(nodeId)
                .state(state)
                .nextNodeId(END)
                .build();
    }

    @Nested
    @DisplayName("Storage")
    class Storage {

        @Test
        @DisplayName("should keep checkpoints per run, newest first")
        void perRun() throws Exception {
            saver.put(thread("r1"), checkpoint("a", Map.of("total", 1)));
            saver.put(thread("r1"), checkpoint("b", Map.of("total", 3)));
            saver.put(thread("r2"), checkpoint("a", Map.of("total", 1)));

            assertThat(saver.list(thread("r1"))).extracting(Checkpoint::getNodeId).containsExactly("b", "a");
            assertThat(saver.get(thread("r1"))).hasValueSatisfying(c ->
                    assertThat(c.getState()).containsEntry("total", 3));
            assertThat(saver.runCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should look up and replace a checkpoint by its id")
        void byCheckpointId() throws Exception {
            RunnableConfig first = saver.put(thread("r1"), checkpoint("a", Map.of("total", 1)));
            saver.put(thread("r1"), checkpoint("b", Map.of("total", 3)));

            assertThat(saver.get(first)).hasValueSatisfying(c -> assertThat(c.getNodeId()).isEqualTo("a"));

            saver.put(first, checkpoint("a", Map.of("total", 2)));

            assertThat(saver.list(thread("r1"))).hasSize(2);
            assertThat(saver.get(first)).hasValueSatisfying(c ->
                    assertThat(c.getState()).containsEntry("total", 2));
        }

        @Test
        @DisplayName("should return nothing for an unknown run")
        void unknownRun() throws Exception {
            assertThat(saver.list(thread("nope"))).isEmpty();
            assertThat(saver.get(thread("nope"))).isEmpty();
            assertThat(saver.release(thread("nope")).checkpoints()).isEmpty();
        }

        @Test
        @DisplayName("should drop a released run and hand back its checkpoints")
        void release() throws Exception {
            saver.put(thread("r1"), checkpoint("a", Map.of()));

            BaseCheckpointSaver.Tag released = saver.release(thread("r1"));

            assertThat(released.threadId()).isEqualTo("r1");
            assertThat(released.checkpoints()).extracting(Checkpoint::getNodeId).containsExactly("a");
            assertThat(saver.list(thread("r1"))).isEmpty();
            assertThat(saver.runCount()).isZero();
        }

        @Test
        @DisplayName("should require a thread id")
        void threadIdRequired() {
            assertThatThrownBy(() -> saver.put(RunnableConfig.builder().build(), checkpoint("a", Map.of())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Thread ID is required");
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        private final InMemoryCheckpointSaver bounded = new InMemoryCheckpointSaver(2);

        @Test
        @DisplayName("should evict the oldest run once more than maxRuns are stored")
        void evictsOldestRun() throws Exception {
            bounded.put(thread("r1"), checkpoint("a", Map.of()));
            bounded.put(thread("r2"), checkpoint("a", Map.of()));
            bounded.put(thread("r1"), checkpoint("b", Map.of()));
            bounded.put(thread("r3"), checkpoint("a", Map.of()));

            assertThat(bounded.runCount()).isEqualTo(2);
            assertThat(bounded.list(thread("r1"))).isEmpty();
            assertThat(bounded.list(thread("r2"))).hasSize(1);
            assertThat(bounded.list(thread("r3"))).hasSize(1);
        }

        @Test
        @DisplayName("should keep the number of stored runs bounded across many runs")
        void boundedAcrossRuns() throws Exception {
            Workflow<AgentState> graph = linear(bounded);

            for (int i = 0; i < 10; i++) {
                graph.invoke(Map.of());
            }

            assertThat(bounded.runCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject a non-positive limit")
        void invalidLimit() {
            assertThatThrownBy(() -> new InMemoryCheckpointSaver(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static Workflow<AgentState> linear(BaseCheckpointSaver checkpointSaver) throws Exception {
        return new GraphBuilder<AgentState>(StateSchema.builder().appender("history").build(), AgentState::new)
                .addNode("a", s -> Map.of("history", List.of("a")))
                .addNode("b", s -> Map.of("history", List.of("b")))
                .addEdge(START, "a")
                .addEdge("a", "b")
                .addEdge("b", END)
                .compile(CompileOptions.builder().checkpointSaver(checkpointSaver).build());
    }

    @Test
    @DisplayName("should record the state after the nodes of a run, latest state first")
    void wiredIntoRuns() throws Exception {
        GraphResult<AgentState> result = linear(saver).run(Map.of());

        List<Checkpoint> checkpoints = List.copyOf(saver.list(thread(result.runId())));
        assertThat(checkpoints).extracting(Checkpoint::getNodeId).contains("a", "b");
        assertThat(checkpoints.get(0).getState())
                .containsEntry("history", result.state().data().get("history"));
    }
}
