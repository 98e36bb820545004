package com.eainde.stategraph.graph;

import com.eainde.stategraph.action.NodeActionWithOptions;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Objects;

/**
 * A named unit of work in a graph.
 *
 * @param id     unique id within the graph
 * @param action step function run when the node executes
 */
public record Node<S extends AgentState>(String id, NodeActionWithOptions<S> action) {

    public Node {
        Objects.requireNonNull(id, "node id must not be null");
        Objects.requireNonNull(action, "action must not be null for node: " + id);
    }
}
