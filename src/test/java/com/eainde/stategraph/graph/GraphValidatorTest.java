package com.eainde.stategraph.graph;

import com.eainde.stategraph.GraphBuilder;
import com.eainde.stategraph.Workflow;
import com.eainde.stategraph.exception.GraphDefinitionException;
import com.eainde.stategraph.state.StateSchema;
import org.bsc.langgraph4j.state.AgentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Compile-time checks, driven through {@link GraphBuilder#compile()}.
 */
class GraphValidatorTest {

    private static final StateSchema SCHEMA = StateSchema.builder().value("route", String.class).build();

    private GraphBuilder<AgentState> graph;

    @BeforeEach
    void setUp() {
        graph = new GraphBuilder<>(SCHEMA, AgentState::new);
    }

    private static Map<String, Object> noop(AgentState state) {
        return Map.of();
    }

    private GraphDefinitionException compileFailure() {
        return catchThrowableOfType(() -> graph.compile(), GraphDefinitionException.class);
    }

    // =========================================================================
    //  Valid graphs
    // =========================================================================

    @Nested
    @DisplayName("Valid graphs")
    class Valid {

        @Test
        @DisplayName("should take the start node from the edge leaving START")
        void startFromEdge() throws Exception {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", END);

            Workflow<AgentState> compiled = graph.compile();

            assertThat(compiled.getStartNodeId()).isEqualTo("a");
            assertThat(compiled.getNodes()).containsOnlyKeys("a");
        }

        @Test
        @DisplayName("should accept the start node passed to compile()")
        void explicitStart() throws Exception {
            graph.addNode("a", GraphValidatorTest::noop).addEdge("a", END);

            assertThat(graph.compile("a").getStartNodeId()).isEqualTo("a");
        }

        @Test
        @DisplayName("should compile a graph with an unreachable node")
        void unreachableIsNotAnError() throws Exception {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("orphan", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", END)
                    .addEdge("orphan", END);

            assertThat(graph.compile().getNodes()).containsKeys("a", "orphan");
        }

        @Test
        @DisplayName("should not be affected by declarations made after compiling")
        void immutableAfterCompile() throws Exception {
            graph.addNode("a", GraphValidatorTest::noop).addEdge(START, "a").addEdge("a", END);
            Workflow<AgentState> compiled = graph.compile();

            graph.addNode("b", GraphValidatorTest::noop);

            assertThat(compiled.getNodes()).containsOnlyKeys("a");
            assertThatThrownBy(() -> compiled.getNodes().remove("a"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    // =========================================================================
    //  Definition errors
    // =========================================================================

    @Nested
    @DisplayName("Definition errors")
    class Invalid {

        @Test
        @DisplayName("should reject duplicate and reserved node ids")
        void nodeIds() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("a", GraphValidatorTest::noop)
                    .addNode(END, GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", END);

            assertThat(compileFailure().getProblems())
                    .anyMatch(p -> p.contains("Duplicate node id 'a'"))
                    .anyMatch(p -> p.contains("reserved"));
        }

        @Test
        @DisplayName("should reject edges that reference unknown nodes")
        void unknownNodes() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", "ghost")
                    .addEdge("phantom", END);

            assertThat(compileFailure().getProblems())
                    .anyMatch(p -> p.contains("unknown node 'ghost'"))
                    .anyMatch(p -> p.contains("Edge from unknown node 'phantom'"));
        }

        @Test
        @DisplayName("should reject a routing table entry with an unknown target")
        void unknownRoutingTarget() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addConditionalEdges("a", s -> "x", Map.of("x", END, "y", "ghost"));

            assertThat(compileFailure().getProblems())
                    .anyMatch(p -> p.contains("maps key 'y' to unknown node 'ghost'"));
        }

        @Test
        @DisplayName("should report routing keys that collide once normalised when compiling, not when declaring")
        void collidingRoutingKeys() {
            graph.addNode("a", GraphValidatorTest::noop).addEdge(START, "a");

            assertThatCode(() -> graph.addConditionalEdges("a", s -> "finish", Map.of("FINISH", END, "finish", "a")))
                    .doesNotThrowAnyException();
            assertThat(compileFailure().getProblems())
                    .anyMatch(p -> p.startsWith("Routing table of 'a'") && p.contains("collides"));
        }

        @Test
        @DisplayName("should report a blank routing key")
        void blankRoutingKey() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addConditionalEdges("a", s -> "x", Map.of("x", END, "  ", "a"));

            assertThat(compileFailure().getProblems())
                    .contains("Routing table of 'a': routing key must not be blank");
        }

        @Test
        @DisplayName("should reject an empty routing table")
        void emptyRoutingTable() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addConditionalEdges("a", s -> "x", Map.of());

            assertThat(compileFailure().getProblems()).anyMatch(p -> p.contains("empty routing table"));
        }

        @Test
        @DisplayName("should reject a node without an outgoing edge")
        void deadEnd() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("b", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", END);

            assertThat(compileFailure().getProblems()).contains("Node 'b' has no outgoing edge");
        }

        @Test
        @DisplayName("should reject a node with two outgoing edges")
        void fanOut() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("b", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", "b")
                    .addEdge("a", END)
                    .addEdge("b", END);

            assertThat(compileFailure().getProblems())
                    .contains("Node 'a' declares more than one outgoing edge");
        }

        @Test
        @DisplayName("should reject a graph without a start node")
        void noStart() {
            graph.addNode("a", GraphValidatorTest::noop).addEdge("a", END);

            assertThat(compileFailure().getMessage()).contains("No start node");
        }

        @Test
        @DisplayName("should reject a compile() start that contradicts the START edge")
        void conflictingStart() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("b", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", "b")
                    .addEdge("b", END);

            assertThatThrownBy(() -> graph.compile("b"))
                    .isInstanceOf(GraphDefinitionException.class)
                    .hasMessageContaining("conflicts");
        }

        @Test
        @DisplayName("should reject a graph whose start node cannot reach END")
        void endUnreachable() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("b", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", "b")
                    .addEdge("b", "a");

            assertThat(compileFailure().getProblems())
                    .containsExactly("END is not reachable from start node 'a'");
        }

        @Test
        @DisplayName("should reject edges leaving END or entering START")
        void reservedEdges() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", START)
                    .addEdge(END, "a");

            assertThat(compileFailure().getProblems())
                    .anyMatch(p -> p.contains("cannot enter START"))
                    .anyMatch(p -> p.contains("cannot leave END"));
        }

        @Test
        @DisplayName("should report every problem at once")
        void collectsAll() {
            graph.addNode("a", GraphValidatorTest::noop)
                    .addNode("a", GraphValidatorTest::noop)
                    .addNode("b", GraphValidatorTest::noop)
                    .addEdge(START, "a")
                    .addEdge("a", "ghost");

            GraphDefinitionException e = compileFailure();

            assertThat(e.getProblems()).hasSizeGreaterThanOrEqualTo(3);
            assertThat(e.getMessage()).startsWith("Invalid graph definition (");
        }
    }
}
