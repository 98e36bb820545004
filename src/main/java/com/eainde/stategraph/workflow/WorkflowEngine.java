package com.eainde.stategraph.workflow;

import com.eainde.stategraph.GraphResult;
import com.eainde.stategraph.RunOptions;
import com.eainde.stategraph.Workflow;
import com.eainde.stategraph.execution.CancellationSignal;
import com.eainde.stategraph.state.StateValues;
import com.eainde.stategraph.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.state.AgentState;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The central entry point for running the application's graphs by name.
 * <p>
 * Every {@link Workflow} bean in the context is registered under its bean name.
 * The engine assigns each run a unique id, which is also the thread id its checkpoints
 * are stored under, so a run's latest state can be looked up while or after it runs.
 * Checkpoints stay until the saver evicts them or the caller {@link #release releases} the run.
 * </p>
 *
 * <h3>Key Features:</h3>
 * <ul>
 * <li><strong>Auto-Discovery:</strong> finds and registers all {@link Workflow} beans.</li>
 * <li><strong>ID Management:</strong> generates a run id per invocation unless the caller supplies one.</li>
 * <li><strong>Async runs:</strong> {@link #startAsync} runs on a pool that propagates the MDC.</li>
 * </ul>
 */
@Log4j2
@Service
public class WorkflowEngine {

    private final Map<String, Workflow<?>> registry = new ConcurrentHashMap<>();
    private final BaseCheckpointSaver checkpointSaver;
    private final MdcAwareExecutor executor;

    // Key = bean name (e.g. "supportWorkflow"), value = the compiled workflow
    public WorkflowEngine(Map<String, Workflow<?>> allGraphs,
                          BaseCheckpointSaver checkpointSaver,
                          MdcAwareExecutor executor) {
        this.checkpointSaver = checkpointSaver;
        this.executor = executor;
        this.registry.putAll(allGraphs);
        log.info("Registered workflows: {}", registry.keySet());
    }

    /**
     * Runs a workflow to completion on the calling thread.
     *
     * @param name   bean name of the workflow
     * @param inputs initial state
     * @param <S>    state type of the graph
     * @return final state, path and the generated run id
     * @throws IllegalArgumentException if no workflow is registered under {@code name}
     * @throws com.eainde.stategraph.exception.GraphRunnerException if the run is aborted
     */
    public <S extends AgentState> GraphResult<S> start(String name, Map<String, Object> inputs) {
        return start(name, inputs, RunOptions.defaults());
    }

    public <S extends AgentState> GraphResult<S> start(String name, Map<String, Object> inputs, RunOptions options) {
        Workflow<S> graph = lookup(name);

        String runId = options.threadId().orElseGet(() -> UUID.randomUUID().toString());
        log.info("Starting workflow {} as run {}", name, runId);

        return graph.run(inputs, options.withThreadId(runId));
    }

    /**
     * Runs a workflow on the engine's executor.
     *
     * @param cancellationSignal polled before every node execution of the run
     * @return a future completed with the result, or exceptionally with the run's
     *         {@link com.eainde.stategraph.exception.GraphRunnerException}
     */
    public <S extends AgentState> CompletableFuture<GraphResult<S>> startAsync(String name,
                                                                               Map<String, Object> inputs,
                                                                               CancellationSignal cancellationSignal) {
        Workflow<S> graph = lookup(name);

        String runId = UUID.randomUUID().toString();
        RunOptions options = RunOptions.builder()
                .threadId(runId)
                .cancellationSignal(cancellationSignal)
                .build();

        log.info("Submitting workflow {} as run {}", name, runId);
        return CompletableFuture.supplyAsync(() -> graph.run(inputs, options), executor);
    }

    /**
     * @return the state recorded after the most recent node of the run, if any
     */
    public Optional<Map<String, Object>> getState(String runId) {
        return checkpointSaver.get(threadOf(runId))
                .map(checkpoint -> StateValues.withoutInternalKeys(checkpoint.getState()));
    }

    /**
     * @return the run's checkpoints, newest first
     */
    public List<Checkpoint> getHistory(String runId) {
        return List.copyOf(checkpointSaver.list(threadOf(runId)));
    }

    /**
     * Drops the checkpoints of a finished run.
     *
     * @return true if the run had checkpoints
     */
    public boolean release(String runId) {
        BaseCheckpointSaver.Tag tag;
        try {
            tag = checkpointSaver.release(threadOf(runId));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release checkpoints of run " + runId, e);
        }
        Collection<Checkpoint> released = tag == null ? List.of() : tag.checkpoints();
        log.debug("Released {} checkpoint(s) of run {}", released.size(), runId);
        return !released.isEmpty();
    }

    public Set<String> workflowNames() {
        return Set.copyOf(registry.keySet());
    }

    private static RunnableConfig threadOf(String runId) {
        return RunnableConfig.builder().threadId(runId).build();
    }

    @SuppressWarnings("unchecked")
    private <S extends AgentState> Workflow<S> lookup(String name) {
        Workflow<S> graph = (Workflow<S>) registry.get(name);
        if (graph == null) {
            throw new IllegalArgumentException("No workflow found with name: " + name);
        }
        return graph;
    }
}
