package com.eainde.stategraph;

import com.eainde.stategraph.execution.ExecutionEngine;
import com.eainde.stategraph.execution.RunRegistry;
import com.eainde.stategraph.graph.Edge;
import com.eainde.stategraph.graph.Node;
import com.eainde.stategraph.state.StateSchema;
import com.eainde.stategraph.state.StateValues;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.AgentStateFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled form of a {@link GraphBuilder}: the langgraph4j {@link CompiledGraph} that
 * drives the runs, together with the declarations it was built from.
 * <p>
 * A workflow holds no per-run data apart from the registry of runs in progress: every
 * {@code invoke} gets its own state store, iteration guard and execution context, so
 * one instance may serve any number of concurrent runs with distinct thread ids.
 *
 * @param <S> the typed state view handed to node actions and predicates
 */
public final class Workflow<S extends AgentState> {

    private static final ExecutionEngine ENGINE = new ExecutionEngine();

    private final CompiledGraph<S> compiledGraph;
    private final RunRegistry activeRuns;
    private final StateSchema schema;
    private final AgentStateFactory<S> stateFactory;
    private final Map<String, Node<S>> nodes;
    private final Map<String, Edge> edges;
    private final String startNodeId;
    private final CompileOptions options;

    Workflow(CompiledGraph<S> compiledGraph,
             RunRegistry activeRuns,
             StateSchema schema,
             AgentStateFactory<S> stateFactory,
             Map<String, Node<S>> nodes,
             Map<String, Edge> edges,
             String startNodeId,
             CompileOptions options) {
        this.compiledGraph = compiledGraph;
        this.activeRuns = activeRuns;
        this.schema = schema;
        this.stateFactory = stateFactory;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.startNodeId = startNodeId;
        this.options = options;
    }

    // =========================================================================
    //  Execution
    // =========================================================================

    /**
     * Runs the graph to END and returns the final state.
     *
     * @throws com.eainde.stategraph.exception.GraphRunnerException if the run is aborted
     */
    public S invoke(Map<String, Object> inputs) {
        return invoke(inputs, RunOptions.defaults());
    }

    public S invoke(Map<String, Object> inputs, RunOptions runOptions) {
        return run(inputs, runOptions).state();
    }

    /**
     * Runs the graph to END and returns the final state together with the executed path.
     */
    public GraphResult<S> run(Map<String, Object> inputs) {
        return run(inputs, RunOptions.defaults());
    }

    public GraphResult<S> run(Map<String, Object> inputs, RunOptions runOptions) {
        return ENGINE.run(this, inputs, runOptions);
    }

    // =========================================================================
    //  Accessors
    // =========================================================================

    /**
     * @return a typed view of {@code state} without the engine's internal keys
     */
    public S wrap(Map<String, Object> state) {
        return stateFactory.apply(StateValues.withoutInternalKeys(state));
    }

    /**
     * The runtime graph. Its nodes only run inside a run started through this workflow.
     */
    public CompiledGraph<S> getCompiledGraph() {
        return compiledGraph;
    }

    public RunRegistry getActiveRuns() {
        return activeRuns;
    }

    public StateSchema getSchema() {
        return schema;
    }

    public String getStartNodeId() {
        return startNodeId;
    }

    public Map<String, Node<S>> getNodes() {
        return nodes;
    }

    public Optional<Node<S>> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Map<String, Edge> getEdges() {
        return edges;
    }

    public Optional<Edge> getEdge(String fromNodeId) {
        return Optional.ofNullable(edges.get(fromNodeId));
    }

    public CompileOptions getOptions() {
        return options;
    }

    public GraphRepresentation getGraph() {
        return GraphRepresentation.of(this);
    }
}
