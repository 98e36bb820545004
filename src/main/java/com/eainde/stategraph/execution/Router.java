package com.eainde.stategraph.execution;

import com.eainde.stategraph.exception.RoutingException;
import com.eainde.stategraph.graph.ConditionalEdge;
import com.eainde.stategraph.graph.Edge;
import com.eainde.stategraph.graph.StaticEdge;
import org.bsc.langgraph4j.state.AgentState;

/**
 * Resolves the successor of a node from its outgoing edge and the post-merge state.
 */
public final class Router {

    /**
     * @param edge    outgoing edge of the node that just ran
     * @param state   state after that node's update was merged
     * @param context run context, for error reporting
     * @return the next node id, possibly END
     * @throws RoutingException if the predicate fails or its key is unmapped with no default route
     */
    @SuppressWarnings("unchecked")
    public <S extends AgentState> String next(Edge edge, S state, ExecutionContext context) {
        if (edge instanceof StaticEdge staticEdge) {
            return staticEdge.to();
        }

        ConditionalEdge<S> conditional = (ConditionalEdge<S>) edge;
        String key;
        try {
            key = conditional.predicate().apply(state);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException(edge.from(), e, context.getRunId(), context.getPath());
        } catch (Exception e) {
            throw new RoutingException(edge.from(), e, context.getRunId(), context.getPath());
        }

        String routingKey = key;
        return conditional.table().resolve(routingKey)
                .orElseThrow(() -> new RoutingException(edge.from(), routingKey, context.getRunId(), context.getPath()));
    }
}
