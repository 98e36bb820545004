package com.eainde.stategraph.execution;

import com.eainde.stategraph.CompileOptions;
import com.eainde.stategraph.GraphResult;
import com.eainde.stategraph.RunOptions;
import com.eainde.stategraph.Workflow;
import com.eainde.stategraph.exception.GraphRunnerException;
import com.eainde.stategraph.exception.RunCancelledException;
import com.eainde.stategraph.exception.StateMergeException;
import com.eainde.stategraph.exception.StepExecutionException;
import com.eainde.stategraph.state.StateStore;
import com.eainde.stategraph.state.StateValues;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.state.AgentState;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Drives one run of a {@link Workflow} on the graph runtime, from its start node to END.
 *
 * <pre>
 *   cancelled before start? ──yes──→ RunCancelledException
 *   seed store with inputs  ──fail─→ StateMergeException
 *   register run under its thread id
 *   CompiledGraph.invoke(inputs, RunnableConfig{threadId})
 *     └─ every node runs through its GuardedNodeAction
 *   unwrap the runtime's failure to the GraphRunnerException a wrapper raised
 * </pre>
 *
 * Execution is strictly sequential and blocks the calling thread. The engine keeps no
 * state between runs; everything a run mutates lives in its own {@link RunContext}.
 */
@Log4j2
public final class ExecutionEngine {

    public static final String MDC_RUN_ID = "runId";

    /**
     * Runs {@code workflow} on {@code inputs}.
     *
     * @return final state and path
     * @throws GraphRunnerException  if the run is aborted; no partial state is returned
     * @throws IllegalStateException if a run with the same thread id is already in progress on the workflow
     */
    public <S extends AgentState> GraphResult<S> run(Workflow<S> workflow,
                                                     Map<String, Object> inputs,
                                                     RunOptions options) {
        Objects.requireNonNull(workflow, "workflow must not be null");
        Objects.requireNonNull(options, "options must not be null");

        String runId = options.threadId().orElseGet(() -> UUID.randomUUID().toString());
        RunOptions runOptions = options.threadId().isPresent() ? options : options.withThreadId(runId);

        CompileOptions compileOptions = workflow.getOptions();
        IterationGuard guard = new IterationGuard(options.maxSteps().orElse(compileOptions.getRecursionLimit()));
        ExecutionContext context = new ExecutionContext(runId);
        StateStore store = new StateStore(workflow.getSchema());
        RunEvents events = new RunEvents(runId, compileOptions.getListeners());
        RunContext run = new RunContext(runOptions, guard, context, store, events);

        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        try {
            log.info("Run {} started at node '{}' (maxSteps={})", runId, workflow.getStartNodeId(), guard.getMaxSteps());
            if (runOptions.cancellationSignal().isCancelled()) {
                throw new RunCancelledException(runId, List.of());
            }
            Map<String, Object> seeded = seed(store, inputs, context);
            events.runStarted(store.snapshot());

            S finalState = execute(workflow, run, seeded);

            Map<String, Object> state = StateValues.withoutInternalKeys(finalState.data());
            log.info("Run {} reached END after {} step(s)", runId, context.getIterationCount());
            events.runCompleted(state, context);
            return new GraphResult<>(runId, workflow.wrap(state), context.getPath());
        } catch (GraphRunnerException e) {
            events.runFailed(e);
            throw e;
        } finally {
            if (previousRunId != null) {
                MDC.put(MDC_RUN_ID, previousRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    // =========================================================================
    //  Steps
    // =========================================================================

    private Map<String, Object> seed(StateStore store, Map<String, Object> inputs, ExecutionContext context) {
        Map<String, Object> copy = StateValues.immutableCopyOf(inputs);
        try {
            store.apply(copy);
            return copy;
        } catch (StateMergeException e) {
            throw e.withRunContext(null, context.getRunId(), context.getPath());
        }
    }

    private <S extends AgentState> S execute(Workflow<S> workflow, RunContext run, Map<String, Object> inputs) {
        RunRegistry runs = workflow.getActiveRuns();
        runs.register(run);

        Optional<S> result;
        try {
            RunnableConfig config = RunnableConfig.builder().threadId(run.runId()).build();
            releaseEarlierCheckpoints(workflow, config);
            result = workflow.getCompiledGraph().invoke(inputs, config);
        } catch (RuntimeException e) {
            throw unwrap(e, run.context());
        } finally {
            runs.remove(run.runId());
        }
        return result.orElseThrow(() -> new StepExecutionException(START,
                new IllegalStateException("graph runtime returned no final state"),
                run.runId(), run.context().getPath()));
    }

    /**
     * The runtime starts a thread from its latest checkpoint when one exists; a run that
     * reuses the id of a finished run starts from its inputs alone and replaces that history.
     */
    private static void releaseEarlierCheckpoints(Workflow<?> workflow, RunnableConfig config) {
        Optional<BaseCheckpointSaver> saver = workflow.getOptions().getCheckpointSaver();
        if (saver.isEmpty()) {
            return;
        }
        try {
            BaseCheckpointSaver.Tag released = saver.get().release(config);
            int dropped = released == null ? 0 : released.checkpoints().size();
            if (dropped > 0) {
                log.info("Run {} reuses an earlier run id; dropped {} checkpoint(s)", config.threadId().orElse(null), dropped);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Could not release earlier checkpoints of run " + config.threadId().orElse(null), e);
        }
    }

    /**
     * The runtime reports a failed node future wrapped in its own exceptions; the
     * first {@link GraphRunnerException} in the cause chain is the error a node wrapper raised.
     */
    static GraphRunnerException unwrap(Throwable error, ExecutionContext context) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof GraphRunnerException runError) {
                return runError;
            }
            if (t.getCause() == t) break;
        }
        String nodeId = context.getCurrentNode().orElse(START);
        return new StepExecutionException(nodeId, error, context.getRunId(), context.getPath());
    }
}
