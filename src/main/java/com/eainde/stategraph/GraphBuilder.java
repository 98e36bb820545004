package com.eainde.stategraph;

import com.eainde.stategraph.action.NodeActionWithOptions;
import com.eainde.stategraph.exception.GraphDefinitionException;
import com.eainde.stategraph.execution.GuardedNodeAction;
import com.eainde.stategraph.execution.RunRegistry;
import com.eainde.stategraph.graph.ConditionalEdge;
import com.eainde.stategraph.graph.Edge;
import com.eainde.stategraph.graph.GraphValidator;
import com.eainde.stategraph.graph.Node;
import com.eainde.stategraph.graph.RoutingTable;
import com.eainde.stategraph.graph.StaticEdge;
import com.eainde.stategraph.state.StateSchema;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.action.EdgeAction;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.AgentStateFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Builder for a graph of nodes sharing one typed state, compiled onto the langgraph4j
 * {@link StateGraph} runtime.
 * <p>
 * Declaration methods never fail on a malformed graph; every structural problem is
 * reported at once by {@link #compile()} as a {@link GraphDefinitionException}, before
 * the runtime graph is built.
 *
 * <pre>
 * GraphBuilder&lt;SupportState&gt; workflow = new GraphBuilder&lt;&gt;(SupportState.SCHEMA, SupportState::new);
 *
 * workflow.addNode("classify", classifyNode);
 * workflow.addNode("review", reviewNode);
 * workflow.addNode("finalize", finalizeNode);
 *
 * workflow.addEdge(START, "classify");
 * workflow.addConditionalEdges("classify", priorityEdge,
 *         Map.of("high", "review", "default", "finalize"));
 * workflow.addEdge("review", "finalize");
 * workflow.addEdge("finalize", END);
 *
 * Workflow&lt;SupportState&gt; graph = workflow.compile(
 *         CompileOptions.builder().recursionLimit(10).build());
 * </pre>
 *
 * @param <S> the typed state view handed to node actions and predicates
 */
@Log4j2
public class GraphBuilder<S extends AgentState> {

    private final StateSchema schema;
    private final AgentStateFactory<S> stateFactory;
    private final List<Node<S>> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    public GraphBuilder(StateSchema schema, AgentStateFactory<S> stateFactory) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory must not be null");
    }

    // =========================================================================
    //  Nodes
    // =========================================================================

    public GraphBuilder<S> addNode(String id, NodeAction<S> action) {
        Objects.requireNonNull(action, "action must not be null for node: " + id);
        return addNode(id, NodeActionWithOptions.of(action));
    }

    public GraphBuilder<S> addNode(String id, NodeActionWithOptions<S> action) {
        nodes.add(new Node<>(id, action));
        return this;
    }

    public GraphBuilder<S> addAsyncNode(String id, AsyncNodeAction<S> action) {
        Objects.requireNonNull(action, "action must not be null for node: " + id);
        return addNode(id, NodeActionWithOptions.ofAsync(action));
    }

    // =========================================================================
    //  Edges
    // =========================================================================

    /**
     * Declares a static transition. {@code addEdge(START, id)} declares the entry node.
     */
    public GraphBuilder<S> addEdge(String from, String to) {
        edges.add(new StaticEdge(from, to));
        return this;
    }

    /**
     * Declares a data-dependent transition. A {@code "default"} key in {@code table}
     * declares the route taken for keys the table does not list.
     */
    public GraphBuilder<S> addConditionalEdges(String from, EdgeAction<S> predicate, Map<String, String> table) {
        return addConditionalEdges(from, predicate, RoutingTable.of(table));
    }

    public GraphBuilder<S> addConditionalEdges(String from, EdgeAction<S> predicate, RoutingTable table) {
        edges.add(new ConditionalEdge<>(from, predicate, table));
        return this;
    }

    // =========================================================================
    //  Compilation
    // =========================================================================

    public Workflow<S> compile() throws GraphDefinitionException {
        return compile(null, CompileOptions.defaults());
    }

    public Workflow<S> compile(CompileOptions options) throws GraphDefinitionException {
        return compile(null, options);
    }

    public Workflow<S> compile(String startNodeId) throws GraphDefinitionException {
        return compile(startNodeId, CompileOptions.defaults());
    }

    /**
     * Validates the declared nodes and edges, builds the runtime graph from them and
     * compiles it.
     *
     * @param startNodeId first node to run; {@code null} to take it from the edge leaving START
     * @param options     graph-wide run settings
     * @throws GraphDefinitionException if the graph is malformed or the runtime rejects it; nothing is compiled
     */
    public Workflow<S> compile(String startNodeId, CompileOptions options) throws GraphDefinitionException {
        Objects.requireNonNull(options, "options must not be null");

        GraphValidator.ValidatedGraph<S> validated = GraphValidator.validate(nodes, edges, startNodeId);

        if (!validated.unreachable().isEmpty()) {
            log.warn("Nodes unreachable from start node '{}': {}", validated.startNodeId(), validated.unreachable());
        }

        RunRegistry runs = new RunRegistry();
        CompiledGraph<S> compiled;
        try {
            compiled = buildRuntimeGraph(validated, runs).compile(options.toCompileConfig());
        } catch (GraphStateException e) {
            throw new GraphDefinitionException("Rejected by the graph runtime: " + e.getMessage(), e);
        }
        // the iteration guard in every node wrapper bounds the run
        compiled.setMaxIterations(Integer.MAX_VALUE);

        log.debug("Compiled graph: start={}, nodes={}, edges={}",
                validated.startNodeId(), validated.nodes().keySet(), validated.edges().size());

        return new Workflow<>(compiled, runs, schema, stateFactory, validated.nodes(), validated.edges(),
                validated.startNodeId(), options);
    }

    private StateGraph<S> buildRuntimeGraph(GraphValidator.ValidatedGraph<S> validated, RunRegistry runs)
            throws GraphStateException {
        StateGraph<S> graph = new StateGraph<>(schema.channels(), stateFactory);

        for (Node<S> node : validated.nodes().values()) {
            Edge edge = validated.edges().get(node.id());
            graph.addNode(node.id(), new GuardedNodeAction<>(node, edge, stateFactory, runs));
        }

        graph.addEdge(START, validated.startNodeId());
        for (Edge edge : validated.edges().values()) {
            if (edge instanceof StaticEdge staticEdge) {
                graph.addEdge(staticEdge.from(), staticEdge.to());
            } else {
                Map<String, String> mappings = new LinkedHashMap<>();
                edge.targets().forEach(target -> mappings.put(target, target));
                graph.addConditionalEdges(edge.from(), GuardedNodeAction.<S>routeReader(), mappings);
            }
        }
        return graph;
    }
}
