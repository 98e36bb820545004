package com.eainde.stategraph.workflow;

import com.eainde.stategraph.CompileOptions;
import com.eainde.stategraph.GraphBuilder;
import com.eainde.stategraph.GraphResult;
import com.eainde.stategraph.RunOptions;
import com.eainde.stategraph.Workflow;
import com.eainde.stategraph.config.StateGraphConfig;
import com.eainde.stategraph.exception.GraphDefinitionException;
import com.eainde.stategraph.exception.RunCancelledException;
import com.eainde.stategraph.execution.CancellationToken;
import com.eainde.stategraph.state.StateSchema;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.state.AgentState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

class WorkflowEngineTest {

    @Configuration
    static class TestWorkflows {

        private static final StateSchema SCHEMA = StateSchema.builder()
                .appender("history")
                .counter("total")
                .value("thread", String.class)
                .build();

        @Bean
        public Workflow<AgentState> countingWorkflow(CompileOptions compileOptions) throws GraphDefinitionException {
            return new GraphBuilder<AgentState>(SCHEMA, AgentState::new)
                    .addNode("first", s -> Map.of("history", List.of("first"), "total", 1))
                    .addNode("second", s -> Map.of("history", List.of("second"), "total", 2,
                            "thread", Thread.currentThread().getName()))
                    .addEdge(START, "first")
                    .addEdge("first", "second")
                    .addEdge("second", END)
                    .compile(compileOptions);
        }
    }

    private AnnotationConfigApplicationContext context;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        context = new AnnotationConfigApplicationContext(StateGraphConfig.class, TestWorkflows.class,
                WorkflowEngine.class);
        engine = context.getBean(WorkflowEngine.class);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    @DisplayName("should register every workflow bean by name")
    void registry() {
        assertThat(engine.workflowNames()).containsExactly("countingWorkflow");
        assertThat(context.getBean(CompileOptions.class).getRecursionLimit()).isEqualTo(25);
    }

    @Test
    @DisplayName("should reject an unknown workflow name")
    void unknownWorkflow() {
        assertThatThrownBy(() -> engine.start("missing", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No workflow found with name: missing");
    }

    @Nested
    @DisplayName("Synchronous runs")
    class Sync {

        @Test
        @DisplayName("should run to END and keep the state retrievable by run id")
        void startAndLookup() {
            GraphResult<AgentState> result = engine.start("countingWorkflow", Map.of());

            assertThat(result.path()).containsExactly("first", "second");
            assertThat(result.state().data()).containsEntry("total", 3);
            assertThat(engine.getState(result.runId())).contains(result.state().data());
            assertThat(engine.getHistory(result.runId()))
                    .extracting(Checkpoint::getNodeId)
                    .contains("first", "second");
        }

        @Test
        @DisplayName("should drop the checkpoints of a released run")
        void release() {
            String runId = engine.start("countingWorkflow", Map.of()).runId();

            assertThat(engine.release(runId)).isTrue();
            assertThat(engine.getState(runId)).isEmpty();
            assertThat(engine.getHistory(runId)).isEmpty();
            assertThat(engine.release(runId)).isFalse();
        }

        @Test
        @DisplayName("should start a reused run id from its inputs, not from the earlier run")
        void reusedRunId() {
            RunOptions options = RunOptions.builder().threadId("nightly").build();

            engine.start("countingWorkflow", Map.of(), options);
            GraphResult<AgentState> second = engine.start("countingWorkflow", Map.of(), options);

            assertThat(second.state().data())
                    .containsEntry("total", 3)
                    .containsEntry("history", List.of("first", "second"));
            assertThat(engine.getState("nightly")).hasValueSatisfying(state ->
                    assertThat(state).containsEntry("total", 3));
        }

        @Test
        @DisplayName("should give every run its own id")
        void distinctRunIds() {
            String first = engine.start("countingWorkflow", Map.of()).runId();
            String second = engine.start("countingWorkflow", Map.of()).runId();

            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("should return nothing for an unknown run id")
        void unknownRun() {
            assertThat(engine.getState("nope")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Asynchronous runs")
    class Async {

        @Test
        @DisplayName("should run on the engine's pool")
        void runsOnPool() throws Exception {
            CompletableFuture<GraphResult<AgentState>> future =
                    engine.startAsync("countingWorkflow", Map.of(), new CancellationToken());

            GraphResult<AgentState> result = future.get(10, TimeUnit.SECONDS);

            assertThat(result.state().<String>value("thread")).hasValueSatisfying(
                    name -> assertThat(name).startsWith("stategraph-run-"));
        }

        @Test
        @DisplayName("should complete exceptionally when the run is cancelled")
        void cancelled() {
            CancellationToken token = new CancellationToken();
            token.cancel();

            CompletableFuture<GraphResult<AgentState>> future = engine.startAsync("countingWorkflow", Map.of(), token);

            assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(RunCancelledException.class);
        }
    }
}
