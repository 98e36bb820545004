package com.eainde.stategraph.exception;

import java.util.List;

/**
 * A partial update could not be merged into the run state: the field is not
 * declared, the value has the wrong type, or the field's reducer rejected it.
 * The state store keeps its previous snapshot when this is thrown.
 */
public class StateMergeException extends GraphRunnerException {

    private final String field;
    private final String currentType;
    private final String incomingType;
    private final String nodeId;
    private final String reason;

    public StateMergeException(String field, Object current, Object incoming, String reason, Throwable cause) {
        this(field, typeName(current), typeName(incoming), reason, cause, null, null, List.of());
    }

    private StateMergeException(String field, String currentType, String incomingType, String reason,
                                Throwable cause, String nodeId, String runId, List<String> path) {
        super(buildMessage(field, currentType, incomingType, reason, nodeId), cause, runId, path);
        this.field = field;
        this.currentType = currentType;
        this.incomingType = incomingType;
        this.reason = reason;
        this.nodeId = nodeId;
    }

    /**
     * Re-issues this error with the node and run that produced the rejected update.
     */
    public StateMergeException withRunContext(String nodeId, String runId, List<String> path) {
        StateMergeException enriched = new StateMergeException(
                field, currentType, incomingType, reason, getCause(), nodeId, runId, path);
        enriched.setStackTrace(getStackTrace());
        return enriched;
    }

    public String getField() {
        return field;
    }

    public String getCurrentType() {
        return currentType;
    }

    public String getIncomingType() {
        return incomingType;
    }

    /**
     * @return the node whose update was rejected, {@code null} for the initial input
     */
    public String getNodeId() {
        return nodeId;
    }

    public String getReason() {
        return reason;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String buildMessage(String field, String currentType, String incomingType,
                                       String reason, String nodeId) {
        return "Cannot merge field '" + field + "' (current: " + currentType + ", incoming: " + incomingType
                + "): " + reason + (nodeId != null ? " [node '" + nodeId + "']" : "");
    }
}
