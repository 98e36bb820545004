package com.eainde.stategraph.execution;

import com.eainde.stategraph.exception.RunCancelledException;
import com.eainde.stategraph.exception.StateMergeException;
import com.eainde.stategraph.exception.StepExecutionException;
import com.eainde.stategraph.graph.Edge;
import com.eainde.stategraph.graph.Node;
import com.eainde.stategraph.state.StateValues;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.bsc.langgraph4j.action.AsyncNodeActionWithConfig;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.AgentStateFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import static org.bsc.langgraph4j.StateGraph.END;

/**
 * The action registered with the graph runtime for one node. It runs the node's step
 * inside the run found through the runtime config's thread id:
 *
 * <pre>
 *   cancelled? ──yes──→ RunCancelledException
 *   run step           ──fail─→ StepExecutionException
 *   typed merge        ──fail─→ StateMergeException
 *   record node in path, iterationCount++
 *   resolve next node  ──fail─→ RoutingException
 *   next != END and guard exhausted? ──yes──→ IterationLimitExceededException
 *   return the update (plus the resolved route for a conditional edge)
 * </pre>
 *
 * The update is merged into the run's {@code StateStore} first, so a rejected update
 * never reaches the runtime's state. The runtime then merges the same copied update
 * through the same reducers. Failures are returned as failed futures.
 */
@Log4j2
public final class GuardedNodeAction<S extends AgentState> implements AsyncNodeActionWithConfig<S> {

    /** State key carrying the target the last conditional edge resolved to. */
    public static final String ROUTE_KEY = StateValues.INTERNAL_PREFIX + "route__";

    private static final Router ROUTER = new Router();

    private final Node<S> node;
    private final Edge edge;
    private final AgentStateFactory<S> stateFactory;
    private final RunRegistry runs;

    public GuardedNodeAction(Node<S> node, Edge edge, AgentStateFactory<S> stateFactory, RunRegistry runs) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.edge = Objects.requireNonNull(edge, "edge must not be null for node: " + node.id());
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory must not be null");
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
    }

    /**
     * Edge action for the runtime's conditional edges: reads back the target the node
     * wrapper already resolved, so the runtime's mapping is target → target.
     */
    public static <S extends AgentState> AsyncEdgeAction<S> routeReader() {
        return state -> CompletableFuture.completedFuture(state.<String>value(ROUTE_KEY)
                .orElseThrow(() -> new IllegalStateException("No route resolved before conditional edge")));
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(S state, RunnableConfig config) {
        try {
            return CompletableFuture.completedFuture(execute(state, runs.lookup(config)));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Map<String, Object> execute(S state, RunContext run) {
        ExecutionContext context = run.context();
        String nodeId = node.id();

        if (run.options().cancellationSignal().isCancelled()) {
            throw new RunCancelledException(context.getRunId(), context.getPath());
        }
        context.enter(nodeId);
        run.events().beforeNode(nodeId, context);

        S view = stateFactory.apply(StateValues.withoutInternalKeys(state.data()));
        Map<String, Object> update = StateValues.immutableCopyOf(executeStep(view, run));
        Map<String, Object> merged = merge(run, update, nodeId);
        context.recordExecution(nodeId);
        run.events().afterNode(nodeId, update, merged, context);

        String next = ROUTER.next(edge, stateFactory.apply(merged), context);
        if (!END.equals(next)) {
            run.guard().check(context, merged);
        }
        log.debug("Run {}: '{}' → '{}' (step {})", context.getRunId(), nodeId, next, context.getIterationCount());

        if (!edge.isConditional()) {
            return update;
        }
        Map<String, Object> routed = new LinkedHashMap<>(update);
        routed.put(ROUTE_KEY, next);
        return routed;
    }

    private Map<String, Object> executeStep(S view, RunContext run) {
        ExecutionContext context = run.context();
        try {
            return node.action().apply(view, run.options());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException(context.getRunId(), context.getPath(), e);
        } catch (Exception e) {
            throw new StepExecutionException(node.id(), e, context.getRunId(), context.getPath());
        }
    }

    private Map<String, Object> merge(RunContext run, Map<String, Object> update, String nodeId) {
        try {
            return run.store().apply(update);
        } catch (StateMergeException e) {
            throw e.withRunContext(nodeId, run.runId(), run.context().getPath());
        }
    }

    @Override
    public String toString() {
        return "GuardedNodeAction[" + node.id() + "]";
    }
}
