package br.edu.ifba.agentflow.engine;

import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.components.BuiltinComponents;
import br.edu.ifba.agentflow.exception.UnknownComponentTypeException;
import br.edu.ifba.agentflow.graph.WorkflowDocumentCodec;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.support.FakeGenerationBackend;
import br.edu.ifba.agentflow.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowServiceTest {

    private static final String WORKFLOW = """
        {
          "components": {
            "begin": {
              "obj": {"component_name": "Begin", "params": {"prologue": "Welcome!"}},
              "downstream": ["answer:0"],
              "upstream": []
            },
            "answer:0": {
              "obj": {"component_name": "Answer", "params": {}},
              "downstream": [],
              "upstream": ["begin"]
            }
          },
          "history": [],
          "path": []
        }
        """;

    private WorkflowService service;

    @BeforeEach
    void setUp() {
        service = new WorkflowService(BuiltinComponents.registry(),
            TestFixtures.services(new FakeGenerationBackend("unused")),
            new WorkflowDocumentCodec(new ObjectMapper()));
    }

    @Test
    @DisplayName("should load a document and run it")
    void shouldLoadAndRun() {
        WorkflowGraph graph = service.load("welcome", WORKFLOW);
        ConversationCanvas canvas = service.open(graph, "tenant-1");

        canvas.runComponent("begin", false);
        StageOutput output = canvas.runComponent("answer:0", false);

        assertEquals("Welcome!", ((StageOutput.Settled) output).result().first().content());
        assertEquals(List.of("Welcome!"), graph.answer());
    }

    @Test
    @DisplayName("should export what it loaded")
    void shouldExport() {
        WorkflowGraph graph = service.load("welcome", WORKFLOW);

        WorkflowGraph copy = service.load("copy", service.export(graph, true));

        assertEquals(List.of("begin"), copy.getNode("answer:0").getUpstream());
        assertEquals("Welcome!", copy.getNode("begin").getParams().get("prologue"));
    }

    @Test
    @DisplayName("should reject unknown component types while loading")
    void shouldRejectUnknownType() {
        String json = WORKFLOW.replace("\"Answer\"", "\"Switch\"");
        assertThrows(UnknownComponentTypeException.class, () -> service.load("bad", json));
    }

    @Test
    @DisplayName("should create empty graphs and list component types")
    void shouldCreate() {
        WorkflowGraph graph = service.create("new-flow", "Draft");

        assertTrue(graph.getNodes().isEmpty());
        assertEquals("Draft", graph.getDescription());
        assertTrue(service.componentTypes().contains("RewriteQuestion"));
    }
}
