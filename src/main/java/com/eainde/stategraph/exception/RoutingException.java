package com.eainde.stategraph.exception;

import java.util.List;

/**
 * A conditional edge produced a routing key that its table does not map and the
 * table declares no default route, or the routing predicate itself failed.
 */
public class RoutingException extends GraphRunnerException {

    private final String nodeId;
    private final String routingKey;

    public RoutingException(String nodeId, String routingKey, String runId, List<String> path) {
        super("Unresolved routing key '" + routingKey + "' on conditional edge from node '" + nodeId
                + "' (path: " + path + ")", null, runId, path);
        this.nodeId = nodeId;
        this.routingKey = routingKey;
    }

    public RoutingException(String nodeId, Throwable cause, String runId, List<String> path) {
        super("Routing predicate failed on conditional edge from node '" + nodeId + "': "
                + cause.getMessage() + " (path: " + path + ")", cause, runId, path);
        this.nodeId = nodeId;
        this.routingKey = null;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * @return the key the predicate returned, {@code null} when the predicate failed
     */
    public String getRoutingKey() {
        return routingKey;
    }
}
