package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.ConversationCanvas;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.support.FakeGenerationBackend;
import br.edu.ifba.agentflow.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RewriteQuestionComponentTest {

    private FakeGenerationBackend backend;
    private ConversationCanvas canvas;

    @BeforeEach
    void setUp() {
        WorkflowGraph graph = TestFixtures.graph();
        graph.addNode("answer:0", "Answer", null);
        graph.addNode("RewriteQuestion:0", "RewriteQuestion", Map.of("llm_id", "gpt-4o", "language", "pt-br"));
        graph.connect("answer:0", "RewriteQuestion:0");
        backend = new FakeGenerationBackend("unused");
        canvas = TestFixtures.canvas(graph, TestFixtures.services(backend));
    }

    @Test
    @DisplayName("should pass the question through and make it the latest user turn")
    void shouldPassThrough() {
        canvas.addUserInput("what about rag");
        canvas.getComponent("answer:0").setOutput(Component.beOutput("What is RAG?"));

        StageOutput output = canvas.runComponent("RewriteQuestion:0", false);

        assertEquals("What is RAG?", ((StageOutput.Settled) output).result().first().content());
        assertEquals(List.of(ChatMessage.user("What is RAG?")), canvas.getHistory(10));
        assertTrue(backend.calls().isEmpty());
    }

    @Test
    @DisplayName("should append the question after an assistant turn")
    void shouldAppendAfterAssistant() {
        canvas.getGraph().history().add(ChatMessage.user("hi"));
        canvas.getGraph().history().add(ChatMessage.assistant("hello"));
        canvas.getComponent("answer:0").setOutput(Component.beOutput("What is RAG?"));

        canvas.runComponent("RewriteQuestion:0", false);

        assertEquals(ChatMessage.user("What is RAG?"), canvas.getHistory(1).get(0));
        assertEquals(3, canvas.getHistory(10).size());
    }

    @Test
    @DisplayName("should bind its parameters with a warmer default temperature")
    void shouldBindParameters() {
        RewriteQuestionParam param = (RewriteQuestionParam) canvas.getComponent("RewriteQuestion:0").getParam();

        assertEquals(0.9, param.getTemperature(), 1e-9);
        assertEquals("pt-br", param.getLanguage());
    }
}
