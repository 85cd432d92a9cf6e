package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.component.ComponentResult;
import br.edu.ifba.agentflow.component.ResultRow;
import br.edu.ifba.agentflow.engine.ConversationCanvas;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.retrieval.Reference;
import br.edu.ifba.agentflow.support.FakeGenerationBackend;
import br.edu.ifba.agentflow.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for placeholder resolution against a live canvas.
 */
class PromptVariableResolverTest {

    private ConversationCanvas canvas;
    private PromptVariableResolver resolver;

    @BeforeEach
    void setUp() {
        WorkflowGraph graph = TestFixtures.graph();
        graph.addNode("begin", "Begin", Map.of("query", List.of(
            Map.of("key", "lang", "name", "Language", "type", "line", "optional", false, "value", "Portuguese"))));
        graph.addNode("answer:0", "Answer", null);
        graph.addNode("Retrieval:0", "Retrieval", null);
        canvas = TestFixtures.canvas(graph, TestFixtures.services(new FakeGenerationBackend("unused")));
        resolver = new PromptVariableResolver(canvas);
    }

    @Test
    @DisplayName("should drop references to nodes that do not exist")
    void shouldDropUnknownNodes() {
        List<PromptInputElement> described = resolver.describe(
            PromptTemplate.extractInputElements("{Retrieval:0} {Ghost:1} {begin@lang}"));

        assertEquals(3, described.size());
        assertEquals("Retrieval", described.get(1).name());
        assertEquals("Language", described.get(2).name());
    }

    @Test
    @DisplayName("should resolve begin parameters, with empty text for a missing key")
    void shouldResolveBeginParams() {
        ResolvedInputs resolved = resolver.resolve(
            PromptTemplate.extractInputElements("{begin@lang} {begin@tone}"));

        assertEquals("Portuguese", resolved.values().get("begin@lang"));
        assertEquals("", resolved.values().get("begin@tone"));
        assertEquals(2, resolved.inputLog().size());
    }

    @Test
    @DisplayName("should resolve an answer node to the latest history entry")
    void shouldResolveAnswerToHistory() {
        canvas.addUserInput("What is RAG?");

        ResolvedInputs resolved = resolver.resolve(PromptTemplate.extractInputElements("Q: {answer:0}"));

        assertEquals("What is RAG?", resolved.values().get("answer:0"));
        assertTrue(resolved.retrievalResults().isEmpty());
    }

    @Test
    @DisplayName("should render retrieval output as bullets and keep it for citation")
    void shouldCollectRetrievalOutput() {
        ResultRow row = new ResultRow("chunk text", Reference.empty(), "[]", null);
        canvas.getComponent("Retrieval:0").setOutput(ComponentResult.of(row));

        ResolvedInputs resolved = resolver.resolve(PromptTemplate.extractInputElements("{Retrieval:0}"));

        assertEquals("  - chunk text", resolved.values().get("Retrieval:0"));
        assertEquals(List.of(row), resolved.mergedRetrieval().rows());
    }

    @Test
    @DisplayName("should resolve a node without output to empty text")
    void shouldResolveEmptyOutput() {
        ResolvedInputs resolved = resolver.resolve(PromptTemplate.extractInputElements("{Retrieval:0}"));

        assertEquals("", resolved.values().get("Retrieval:0"));
        assertFalse(resolved.mergedRetrieval().hasContent());
    }
}
