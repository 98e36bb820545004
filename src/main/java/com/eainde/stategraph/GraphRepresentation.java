package com.eainde.stategraph;

import com.eainde.stategraph.graph.ConditionalEdge;
import com.eainde.stategraph.graph.Edge;
import com.eainde.stategraph.graph.RoutingTable;
import com.eainde.stategraph.graph.StaticEdge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Printable description of a compiled graph's topology.
 * <p>
 * In the Mermaid text every node gets a generated identifier and its id is a quoted
 * label, so ids with spaces or Mermaid keywords such as {@code end} stay valid.
 *
 * <pre>
 * flowchart TD
 *     __START__([START])
 *     n1["supervisor"]
 *     n2["researcher"]
 *     __END__([END])
 *     __START__ --> n1
 *     n1 -.->|"researcher"| n2
 *     n1 -.->|"finish"| __END__
 *     n2 --> n1
 * </pre>
 */
public final class GraphRepresentation {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private final String startNodeId;
    private final List<String> nodeIds;
    private final Map<String, Edge> edges;

    private GraphRepresentation(String startNodeId, List<String> nodeIds, Map<String, Edge> edges) {
        this.startNodeId = startNodeId;
        this.nodeIds = nodeIds;
        this.edges = edges;
    }

    static GraphRepresentation of(Workflow<?> graph) {
        return new GraphRepresentation(graph.getStartNodeId(), List.copyOf(graph.getNodes().keySet()), graph.getEdges());
    }

    // =========================================================================
    //  Mermaid
    // =========================================================================

    public String toMermaid() {
        Map<String, String> refs = new LinkedHashMap<>();
        refs.put(START, START);
        for (int i = 0; i < nodeIds.size(); i++) {
            refs.put(nodeIds.get(i), "n" + (i + 1));
        }
        refs.put(END, END);

        StringBuilder sb = new StringBuilder("flowchart TD\n");
        sb.append("    ").append(START).append("([START])\n");
        nodeIds.forEach(id -> sb.append("    ").append(refs.get(id)).append('[').append(quote(id)).append("]\n"));
        sb.append("    ").append(END).append("([END])\n");

        sb.append("    ").append(START).append(" --> ").append(refs.get(startNodeId)).append('\n');
        for (Edge edge : edges.values()) {
            String from = refs.get(edge.from());
            if (edge instanceof ConditionalEdge<?> conditional) {
                RoutingTable table = conditional.table();
                table.routes().forEach((key, target) -> sb.append("    ").append(from)
                        .append(" -.->|").append(quote(key)).append("| ").append(refs.get(target)).append('\n'));
                table.defaultTarget().ifPresent(target -> sb.append("    ").append(from)
                        .append(" -.->|").append(quote(RoutingTable.DEFAULT_KEY)).append("| ")
                        .append(refs.get(target)).append('\n'));
            } else if (edge instanceof StaticEdge staticEdge) {
                sb.append("    ").append(from).append(" --> ").append(refs.get(staticEdge.to())).append('\n');
            }
        }
        return sb.toString();
    }

    private static String quote(String label) {
        return '"' + label.replace("\"", "#quot;") + '"';
    }

    // =========================================================================
    //  JSON
    // =========================================================================

    /**
     * <pre>
     * {
     *   "start": "classify",
     *   "nodes": ["classify", "review", "finalize"],
     *   "edges": [
     *     {"from": "classify", "conditional": true, "routes": {"high": "review"}, "default": "finalize"},
     *     {"from": "review", "conditional": false, "to": "finalize"}
     *   ]
     * }
     * </pre>
     */
    public ObjectNode toJsonNode(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("start", startNodeId);

        ArrayNode nodes = root.putArray("nodes");
        nodeIds.forEach(nodes::add);

        ArrayNode edgeArray = root.putArray("edges");
        for (Edge edge : edges.values()) {
            ObjectNode json = edgeArray.addObject();
            json.put("from", edge.from());
            json.put("conditional", edge.isConditional());
            if (edge instanceof ConditionalEdge<?> conditional) {
                ObjectNode routes = json.putObject("routes");
                conditional.table().routes().forEach(routes::put);
                conditional.table().defaultTarget().ifPresent(target -> json.put(RoutingTable.DEFAULT_KEY, target));
            } else if (edge instanceof StaticEdge staticEdge) {
                json.put("to", staticEdge.to());
            }
        }
        return root;
    }

    public String toJson() {
        try {
            return DEFAULT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(DEFAULT_MAPPER));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise graph representation", e);
        }
    }

    @Override
    public String toString() {
        return toMermaid();
    }
}
