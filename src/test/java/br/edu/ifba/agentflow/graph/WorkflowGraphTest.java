package br.edu.ifba.agentflow.graph;

import br.edu.ifba.agentflow.exception.DuplicateNodeIdException;
import br.edu.ifba.agentflow.exception.NodeNotFoundException;
import br.edu.ifba.agentflow.exception.UnknownComponentTypeException;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for graph authoring and the document form of a graph.
 */
class WorkflowGraphTest {

    private WorkflowGraph graph;

    @BeforeEach
    void setUp() {
        graph = TestFixtures.graph();
        graph.addNode("begin", "Begin", Map.of("prologue", "Hello"));
        graph.addNode("answer:0", "Answer", null);
        graph.addNode("Retrieval:0", "Retrieval", Map.of("top_n", 4));
        graph.addNode("Generate:0", "Generate", Map.of("llm_id", "gpt-4o", "prompt", "Use {Retrieval:0}"));
    }

    // ========================================================================
    // Authoring
    // ========================================================================

    @Nested
    @DisplayName("Authoring")
    class AuthoringTests {

        @Test
        @DisplayName("should reject a duplicate node id")
        void shouldRejectDuplicateId() {
            assertThrows(DuplicateNodeIdException.class, () -> graph.addNode("begin", "Begin", null));
        }

        @Test
        @DisplayName("should reject an unregistered component type")
        void shouldRejectUnknownType() {
            assertThrows(UnknownComponentTypeException.class, () -> graph.addNode("x", "Switch", null));
            assertFalse(graph.containsNode("x"));
        }

        @Test
        @DisplayName("should keep both sides of an edge in sync")
        void shouldConnectBothSides() {
            graph.connect("Retrieval:0", "Generate:0");
            graph.connect("Retrieval:0", "Generate:0");

            assertEquals(List.of("Generate:0"), graph.getNode("Retrieval:0").getDownstream());
            assertEquals(List.of("Retrieval:0"), graph.getNode("Generate:0").getUpstream());
        }

        @Test
        @DisplayName("should remove an edge and tolerate a missing one")
        void shouldDisconnect() {
            graph.connect("Retrieval:0", "Generate:0");
            graph.disconnect("Retrieval:0", "Generate:0");
            graph.disconnect("Retrieval:0", "Generate:0");

            assertTrue(graph.getNode("Retrieval:0").getDownstream().isEmpty());
            assertTrue(graph.getNode("Generate:0").getUpstream().isEmpty());
        }

        @Test
        @DisplayName("should fail to connect a missing node")
        void shouldFailOnMissingNode() {
            assertThrows(NodeNotFoundException.class, () -> graph.connect("begin", "nowhere"));
        }

        @Test
        @DisplayName("should drop every edge and child scope of a removed node")
        void shouldRemoveNodeWithEdges() {
            graph.connect("answer:0", "Retrieval:0");
            graph.connect("Retrieval:0", "Generate:0");
            graph.setParent("Generate:0", "Retrieval:0");

            graph.removeNode("Retrieval:0");

            assertFalse(graph.containsNode("Retrieval:0"));
            assertTrue(graph.getNode("answer:0").getDownstream().isEmpty());
            assertTrue(graph.getNode("Generate:0").getUpstream().isEmpty());
            assertNull(graph.getNode("Generate:0").getParentId());
        }

        @Test
        @DisplayName("should shallow-merge parameters")
        void shouldMergeParameters() {
            graph.setParameters("Retrieval:0", Map.of("use_kg", true));

            Map<String, Object> params = graph.getNode("Retrieval:0").getParams();
            assertEquals(4, params.get("top_n"));
            assertEquals(true, params.get("use_kg"));
        }

        @Test
        @DisplayName("should refuse a parent cycle")
        void shouldRefuseParentCycle() {
            graph.setParent("Generate:0", "Retrieval:0");

            assertThrows(IllegalArgumentException.class, () -> graph.setParent("Retrieval:0", "Generate:0"));
            assertThrows(IllegalArgumentException.class, () -> graph.setParent("begin", "begin"));
            assertNull(graph.getNode("Retrieval:0").getParentId());
        }
    }

    // ========================================================================
    // Document form
    // ========================================================================

    @Nested
    @DisplayName("Document form")
    class DocumentTests {

        @Test
        @DisplayName("should round-trip nodes, edges, parameters and state")
        void shouldRoundTrip() {
            graph.connect("answer:0", "Retrieval:0");
            graph.connect("Retrieval:0", "Generate:0");
            graph.connect("Generate:0", "answer:0");
            graph.setParent("Generate:0", "Retrieval:0");
            graph.history().add(ChatMessage.user("hi"));
            graph.path().add("begin");

            WorkflowDocument document = graph.toDocument();
            WorkflowGraph copy = TestFixtures.graph();
            copy.fromDocument(document);

            assertEquals(4, copy.getNodes().size());
            for (WorkflowNode node : graph.getNodes()) {
                WorkflowNode other = copy.getNode(node.getId());
                assertEquals(node.getComponentName(), other.getComponentName());
                assertEquals(node.getParams(), other.getParams());
                assertEquals(node.getUpstream(), other.getUpstream());
                assertEquals(node.getDownstream(), other.getDownstream());
                assertEquals(node.getParentId(), other.getParentId());
            }
            assertEquals(List.of(ChatMessage.user("hi")), copy.history());
            assertEquals(List.of("begin"), copy.path());
        }

        @Test
        @DisplayName("should write an empty parent id for top-level nodes")
        void shouldWriteEmptyParent() {
            WorkflowDocument document = graph.toDocument();
            assertEquals("", document.components().get("begin").parentId());
        }

        @Test
        @DisplayName("should leave the graph untouched when an edge is dangling")
        void shouldRejectDanglingEdge() {
            WorkflowDocument bad = new WorkflowDocument(Map.of(
                "a", new WorkflowDocument.ComponentEntry(
                    new WorkflowDocument.ComponentObject("Answer", null), List.of("ghost"), List.of(), "")),
                null, null, null, null, null);

            assertThrows(NodeNotFoundException.class, () -> graph.fromDocument(bad));
            assertEquals(4, graph.getNodes().size());
        }

        @Test
        @DisplayName("should reject an unknown component type in a document")
        void shouldRejectUnknownTypeInDocument() {
            WorkflowDocument bad = new WorkflowDocument(Map.of(
                "a", new WorkflowDocument.ComponentEntry(
                    new WorkflowDocument.ComponentObject("Categorize", null), null, null, null)),
                null, null, null, null, null);

            assertThrows(UnknownComponentTypeException.class, () -> graph.fromDocument(bad));
        }

        @Test
        @DisplayName("should reject parent scopes that form a cycle")
        void shouldRejectParentCycleInDocument() {
            WorkflowDocument bad = new WorkflowDocument(Map.of(
                "a", new WorkflowDocument.ComponentEntry(
                    new WorkflowDocument.ComponentObject("Answer", null), null, null, "b"),
                "b", new WorkflowDocument.ComponentEntry(
                    new WorkflowDocument.ComponentObject("Answer", null), null, null, "a")),
                null, null, null, null, null);

            assertThrows(IllegalArgumentException.class, () -> graph.fromDocument(bad));
            assertEquals(4, graph.getNodes().size());
        }

        @Test
        @DisplayName("should require a components mapping")
        void shouldRequireComponents() {
            WorkflowDocument bad = new WorkflowDocument(null, null, null, null, null, null);
            assertThrows(IllegalArgumentException.class, () -> graph.fromDocument(bad));
        }
    }
}
