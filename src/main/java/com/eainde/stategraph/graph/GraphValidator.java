package com.eainde.stategraph.graph;

import com.eainde.stategraph.exception.GraphDefinitionException;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Static checks run by {@code GraphBuilder.compile(..)} before anything is handed to
 * the graph runtime.
 *
 * <h3>Rejected definitions:</h3>
 * <ul>
 *   <li>blank, reserved or duplicate node ids</li>
 *   <li>edges from or to unknown nodes, edges leaving END or entering START</li>
 *   <li>routing tables that are empty, target unknown nodes, or have blank keys or keys
 *       that collide once normalised</li>
 *   <li>a node with no outgoing edge, or with more than one</li>
 *   <li>a missing, unregistered or conflicting start node</li>
 *   <li>END not reachable from the start node through static and routing-table targets</li>
 * </ul>
 * All problems are collected and reported together.
 */
public final class GraphValidator {

    private GraphValidator() {
    }

    /**
     * @param nodes          nodes in registration order
     * @param edges          edges in declaration order, including the START edge if any
     * @param requestedStart start node passed to compile, or {@code null} to use the START edge
     * @return the validated, de-duplicated tables
     * @throws GraphDefinitionException listing every problem found
     */
    public static <S extends AgentState> ValidatedGraph<S> validate(List<Node<S>> nodes,
                                                                    List<Edge> edges,
                                                                    String requestedStart)
            throws GraphDefinitionException {

        List<String> problems = new ArrayList<>();
        Map<String, Node<S>> nodeTable = collectNodes(nodes, problems);

        String entry = null;
        Map<String, Edge> edgeTable = new LinkedHashMap<>();

        for (Edge edge : edges) {
            String from = edge.from();

            if (END.equals(from)) {
                problems.add("Edge cannot leave END (targets " + edge.targets() + ")");
                continue;
            }
            if (edge.targets().contains(START)) {
                problems.add("Edge from '" + from + "' cannot enter START");
            }

            if (START.equals(from)) {
                if (edge instanceof StaticEdge staticEdge) {
                    if (entry != null) {
                        problems.add("More than one edge leaves START ('" + entry + "', '" + staticEdge.to() + "')");
                    } else {
                        entry = staticEdge.to();
                    }
                } else {
                    problems.add("START supports only a static edge");
                }
                continue;
            }

            if (!nodeTable.containsKey(from)) {
                problems.add("Edge from unknown node '" + from + "'");
            } else if (edgeTable.putIfAbsent(from, edge) != null) {
                problems.add("Node '" + from + "' declares more than one outgoing edge");
            }
            checkTargets(edge, nodeTable, problems);
        }

        String start = resolveStart(requestedStart, entry, nodeTable, problems);

        for (String id : nodeTable.keySet()) {
            if (!edgeTable.containsKey(id)) {
                problems.add("Node '" + id + "' has no outgoing edge");
            }
        }

        Set<String> unreachable = Set.of();
        if (problems.isEmpty()) {
            Set<String> reached = reachableFrom(start, edgeTable);
            if (!reached.contains(END)) {
                problems.add("END is not reachable from start node '" + start + "'");
            }
            Set<String> missed = new LinkedHashSet<>(nodeTable.keySet());
            missed.removeAll(reached);
            unreachable = Collections.unmodifiableSet(missed);
        }

        if (!problems.isEmpty()) {
            throw new GraphDefinitionException(problems);
        }
        return new ValidatedGraph<>(start, nodeTable, edgeTable, unreachable);
    }

    private static <S extends AgentState> Map<String, Node<S>> collectNodes(List<Node<S>> nodes, List<String> problems) {
        Map<String, Node<S>> table = new LinkedHashMap<>();
        for (Node<S> node : nodes) {
            String id = node.id();
            if (id.isBlank()) {
                problems.add("Node id must not be blank");
            } else if (START.equals(id) || END.equals(id)) {
                problems.add("Node id '" + id + "' is reserved");
            } else if (table.putIfAbsent(id, node) != null) {
                problems.add("Duplicate node id '" + id + "'");
            }
        }
        return table;
    }

    private static void checkTargets(Edge edge, Map<String, ? extends Node<?>> nodeTable, List<String> problems) {
        if (edge instanceof ConditionalEdge<?> conditional) {
            RoutingTable table = conditional.table();
            if (table.isEmpty()) {
                problems.add("Conditional edge from '" + edge.from() + "' has an empty routing table");
            }
            table.problems().forEach(problem ->
                    problems.add("Routing table of '" + edge.from() + "': " + problem));
            table.routes().forEach((key, target) -> {
                if (target != null && isUnknownTarget(target, nodeTable)) {
                    problems.add("Routing table of '" + edge.from() + "' maps key '" + key
                            + "' to unknown node '" + target + "'");
                }
            });
            table.defaultTarget().ifPresent(target -> {
                if (isUnknownTarget(target, nodeTable)) {
                    problems.add("Routing table of '" + edge.from() + "' defaults to unknown node '" + target + "'");
                }
            });
        } else {
            for (String target : edge.targets()) {
                if (isUnknownTarget(target, nodeTable)) {
                    problems.add("Edge from '" + edge.from() + "' references unknown node '" + target + "'");
                }
            }
        }
    }

    private static boolean isUnknownTarget(String target, Map<String, ? extends Node<?>> nodeTable) {
        return !END.equals(target) && !START.equals(target) && !nodeTable.containsKey(target);
    }

    private static String resolveStart(String requested, String entry, Map<String, ? extends Node<?>> nodeTable,
                                       List<String> problems) {
        String start = requested != null ? requested : entry;
        if (start == null) {
            problems.add("No start node: add an edge from START or pass a start node to compile()");
            return null;
        }
        if (requested != null && entry != null && !requested.equals(entry)) {
            problems.add("Start node '" + requested + "' conflicts with the edge from START to '" + entry + "'");
        }
        if (END.equals(start)) {
            problems.add("Start node cannot be END");
        } else if (!nodeTable.containsKey(start)) {
            problems.add("Start node '" + start + "' is not registered");
        }
        return start;
    }

    private static Set<String> reachableFrom(String start, Map<String, Edge> edgeTable) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            Edge edge = edgeTable.get(queue.poll());
            if (edge == null) continue;
            for (String target : edge.targets()) {
                if (seen.add(target) && !END.equals(target)) {
                    queue.add(target);
                }
            }
        }
        return seen;
    }

    /**
     * Output of a successful validation.
     *
     * @param startNodeId  first node to execute
     * @param nodes        node id → node
     * @param edges        source node id → its single outgoing edge
     * @param unreachable  registered nodes no path from the start node leads to
     */
    public record ValidatedGraph<S extends AgentState>(String startNodeId,
                                                       Map<String, Node<S>> nodes,
                                                       Map<String, Edge> edges,
                                                       Set<String> unreachable) {
    }
}
