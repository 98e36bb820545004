package com.eainde.stategraph;

import com.eainde.stategraph.state.StateSchema;
import org.bsc.langgraph4j.state.AgentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

class ConcurrentRunsTest {

    @Test
    @DisplayName("one compiled graph should serve parallel runs without sharing state")
    void isolatedRuns() throws Exception {
        Workflow<AgentState> graph = new GraphBuilder<AgentState>(
                StateSchema.builder().value("id", Integer.class).counter("total").appender("history").build(),
                AgentState::new)
                .addNode("double", s -> Map.of("total", s.<Integer>value("id").orElseThrow()))
                .addNode("again", s -> Map.of("total", s.<Integer>value("id").orElseThrow(),
                        "history", List.of(s.<Integer>value("id").orElseThrow())))
                .addEdge(START, "double")
                .addEdge("double", "again")
                .addEdge("again", END)
                .compile();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<AgentState>> runs = new ArrayList<>();
            for (int i = 1; i <= 50; i++) {
                int id = i;
                runs.add(() -> graph.invoke(Map.of("id", id)));
            }

            List<Future<AgentState>> results = pool.invokeAll(runs);

            for (int i = 0; i < results.size(); i++) {
                int id = i + 1;
                AgentState state = results.get(i).get(10, TimeUnit.SECONDS);
                assertThat(state.data())
                        .containsEntry("total", 2 * id)
                        .containsEntry("history", List.of(id));
            }
            assertThat(graph.getActiveRuns().activeCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }
}
