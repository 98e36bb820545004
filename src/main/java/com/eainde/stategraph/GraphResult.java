package com.eainde.stategraph;

import org.bsc.langgraph4j.state.AgentState;

import java.util.List;

/**
 * Outcome of a run that reached END.
 *
 * @param runId  run id (the options' thread id, or the generated one)
 * @param state  final state
 * @param path   executed node ids, oldest first
 * @param <S>    typed state view
 */
public record GraphResult<S extends AgentState>(String runId, S state, List<String> path) {

    public GraphResult {
        path = List.copyOf(path);
    }

    public int stepCount() {
        return path.size();
    }
}
