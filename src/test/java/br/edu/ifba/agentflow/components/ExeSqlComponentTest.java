package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.Component;
import br.edu.ifba.agentflow.component.StageOutput;
import br.edu.ifba.agentflow.engine.ConversationCanvas;
import br.edu.ifba.agentflow.exception.ConfigurationException;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.support.FakeGenerationBackend;
import br.edu.ifba.agentflow.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the SQL stage with database access disabled.
 */
class ExeSqlComponentTest {

    private WorkflowGraph graph;

    @BeforeEach
    void setUp() {
        graph = TestFixtures.graph();
        graph.addNode("Generate:0", "Generate", Map.of("llm_id", "gpt-4o"));
        graph.addNode("ExeSQL:0", "ExeSQL", connection("sales", "db.internal", "s3cret"));
        graph.connect("Generate:0", "ExeSQL:0");
    }

    private static Map<String, Object> connection(String database, String host, String password) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("llm_id", "gpt-4o");
        params.put("database", database);
        params.put("username", "reader");
        params.put("host", host);
        params.put("password", password);
        return params;
    }

    private ConversationCanvas canvas() {
        return TestFixtures.canvas(graph, TestFixtures.services(new FakeGenerationBackend("unused")));
    }

    private String run(String upstream) {
        ConversationCanvas canvas = canvas();
        canvas.getComponent("Generate:0").setOutput(Component.beOutput(upstream));
        StageOutput output = canvas.runComponent("ExeSQL:0", false);
        return ((StageOutput.Settled) output).result().first().content();
    }

    // ========================================================================
    // Extraction
    // ========================================================================

    @Nested
    @DisplayName("SQL extraction")
    class ExtractionTests {

        @Test
        @DisplayName("should prefer a fenced sql block")
        void shouldUseFence() {
            assertEquals("SELECT * FROM orders;",
                ExeSqlComponent.extractSql("Here it is:\n```sql\nSELECT * FROM orders;\n```\nEnjoy."));
        }

        @Test
        @DisplayName("should cut leading prose, reasoning and trailing text")
        void shouldTrimProse() {
            assertEquals("SELECT id FROM orders;",
                ExeSqlComponent.extractSql("<think>need ids</think>Sure: SELECT id FROM orders; hope it helps"));
        }

        @Test
        @DisplayName("should keep consecutive statements separated")
        void shouldKeepSeveralStatements() {
            assertEquals("SELECT a FROM t; SELECT b FROM u;",
                ExeSqlComponent.extractSql("First SELECT a FROM t; then SELECT b FROM u; done"));
        }

        @Test
        @DisplayName("should fail when there is no statement")
        void shouldFailWithoutSelect() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExeSqlComponent.extractSql("I cannot answer that."));
            assertEquals("SQL statement not found!", e.getMessage());
        }
    }

    // ========================================================================
    // Run
    // ========================================================================

    @Nested
    @DisplayName("Run")
    class RunTests {

        @Test
        @DisplayName("should report the extracted statement without executing it")
        void shouldReportStatement() {
            String content = run("SELECT id FROM orders;");

            assertEquals("ExeSQL component is configured for 'mysql' but is non-functional as database access "
                + "is disabled in this environment. Received SQL (not executed): SELECT id FROM orders;", content);
        }

        @Test
        @DisplayName("should report extraction errors as output")
        void shouldReportExtractionError() {
            assertEquals("Error processing SQL input or component disabled: SQL statement not found!",
                run("no query here"));
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should refuse the reserved database on the bundled host")
        void shouldRefuseReservedDatabase() {
            graph.removeNode("ExeSQL:0");
            graph.addNode("ExeSQL:0", "ExeSQL", connection("rag_flow", "ragflow-mysql", "s3cret"));

            ConfigurationException e = assertThrows(ConfigurationException.class, ExeSqlComponentTest.this::canvas);
            assertEquals("For the security reason, it does not support database named rag_flow.", e.getMessage());
        }

        @Test
        @DisplayName("should refuse the reserved database with the bundled password")
        void shouldRefuseReservedPassword() {
            graph.removeNode("ExeSQL:0");
            graph.addNode("ExeSQL:0", "ExeSQL", connection("rag_flow", "db.internal", "infini_rag_flow"));

            assertThrows(ConfigurationException.class, ExeSqlComponentTest.this::canvas);
        }

        @Test
        @DisplayName("should reject an unsupported database type")
        void shouldRejectDbType() {
            graph.setParameters("ExeSQL:0", Map.of("db_type", "oracle"));

            ConfigurationException e = assertThrows(ConfigurationException.class, ExeSqlComponentTest.this::canvas);
            assertTrue(e.getMessage().startsWith("[ExeSQL] DB type oracle not supported"), e.getMessage());
        }

        @Test
        @DisplayName("should require the connection settings")
        void shouldRequireHost() {
            graph.setParameters("ExeSQL:0", Map.of("host", ""));

            ConfigurationException e = assertThrows(ConfigurationException.class, ExeSqlComponentTest.this::canvas);
            assertEquals("[ExeSQL] IP Address cannot be empty", e.getMessage());
        }
    }
}
