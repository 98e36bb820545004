package com.eainde.stategraph.action;

import com.eainde.stategraph.RunOptions;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Step function that also receives the {@link RunOptions} of the run, e.g. to read
 * the run id or a collaborator passed through {@link RunOptions#metadata(String)}.
 * <p>
 * This is the form every node is normalised to when it is added to a graph.
 */
@FunctionalInterface
public interface NodeActionWithOptions<S extends AgentState> {

    Map<String, Object> apply(S state, RunOptions options) throws Exception;

    static <S extends AgentState> NodeActionWithOptions<S> of(NodeAction<S> action) {
        return (state, options) -> action.apply(state);
    }

    /**
     * Adapts an async action by blocking on its future. A failed future rethrows its cause;
     * {@link InterruptedException} propagates so the run is reported as cancelled.
     */
    static <S extends AgentState> NodeActionWithOptions<S> ofAsync(AsyncNodeAction<S> action) {
        return (state, options) -> {
            CompletableFuture<Map<String, Object>> future = action.apply(state);
            if (future == null) {
                return null;
            }
            try {
                return future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                throw e;
            }
        };
    }
}
