package com.eainde.stategraph.graph;

import org.bsc.langgraph4j.action.EdgeAction;
import org.bsc.langgraph4j.state.AgentState;

import java.util.Objects;
import java.util.Set;

/**
 * Edge whose target is picked at run time: {@code predicate} maps the state to a
 * routing key and {@code table} maps the key to a node id.
 */
public record ConditionalEdge<S extends AgentState>(String from, EdgeAction<S> predicate, RoutingTable table)
        implements Edge {

    public ConditionalEdge {
        Objects.requireNonNull(from, "edge source must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null for conditional edge from: " + from);
        Objects.requireNonNull(table, "routing table must not be null for conditional edge from: " + from);
    }

    @Override
    public Set<String> targets() {
        return table.targets();
    }

    @Override
    public boolean isConditional() {
        return true;
    }
}
