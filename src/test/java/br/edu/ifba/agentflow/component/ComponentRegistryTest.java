package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.components.BuiltinComponents;
import br.edu.ifba.agentflow.components.GenerateParam;
import br.edu.ifba.agentflow.components.RetrievalParam;
import br.edu.ifba.agentflow.engine.ConversationCanvas;
import br.edu.ifba.agentflow.exception.ConfigurationException;
import br.edu.ifba.agentflow.exception.UnknownComponentTypeException;
import br.edu.ifba.agentflow.graph.WorkflowGraph;
import br.edu.ifba.agentflow.support.FakeGenerationBackend;
import br.edu.ifba.agentflow.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for parameter binding and validation at activation.
 */
class ComponentRegistryTest {

    private ComponentRegistry registry;
    private ComponentServices services;
    private ConversationCanvas canvas;

    @BeforeEach
    void setUp() {
        registry = BuiltinComponents.registry();
        services = TestFixtures.services(new FakeGenerationBackend("ok"));
        WorkflowGraph graph = TestFixtures.graph();
        canvas = TestFixtures.canvas(graph, services);
    }

    private Component<?> activate(String componentName, Map<String, Object> params) {
        return registry.activate("node", componentName, params, canvas, services);
    }

    @Test
    @DisplayName("should register every built-in type")
    void shouldRegisterBuiltins() {
        assertEquals(Set.of("Begin", "Answer", "Generate", "Retrieval", "Relevant", "RewriteQuestion", "ExeSQL"),
            registry.componentNames());
        assertTrue(registry.isRegistered("Generate"));
        assertFalse(registry.isRegistered(null));
    }

    @Test
    @DisplayName("should fail on an unknown type")
    void shouldFailOnUnknownType() {
        assertThrows(UnknownComponentTypeException.class, () -> activate("Categorize", Map.of()));
    }

    // ========================================================================
    // Binding
    // ========================================================================

    @Nested
    @DisplayName("Binding")
    class BindingTests {

        @Test
        @DisplayName("should bind snake_case parameters over the defaults")
        void shouldBindParameters() {
            Component<?> component = activate("Retrieval", Map.of("top_n", 3, "use_kg", true, "unknown_key", "x"));

            RetrievalParam param = (RetrievalParam) component.getParam();
            assertEquals(3, param.getTopN());
            assertTrue(param.isUseKg());
            assertEquals(0.2, param.getSimilarityThreshold(), 1e-9);
            assertEquals(22, param.getMessageHistoryWindowSize());
        }

        @Test
        @DisplayName("should default the generation history window to 12")
        void shouldDefaultGenerateWindow() {
            Component<?> component = activate("Generate", Map.of("llm_id", "gpt-4o"));

            GenerateParam param = (GenerateParam) component.getParam();
            assertEquals(12, param.getMessageHistoryWindowSize());
            assertTrue(param.isCite());
            assertTrue(param.genConf().isEmpty());
        }

        @Test
        @DisplayName("should only pass positive generation settings")
        void shouldFilterGenerationSettings() {
            Component<?> component = activate("Generate",
                Map.of("llm_id", "gpt-4o", "temperature", 0.3, "max_tokens", 256, "top_p", 0));

            assertEquals(Map.of("temperature", 0.3, "max_tokens", 256),
                ((GenerateParam) component.getParam()).genConf());
        }

        @Test
        @DisplayName("should report a value of the wrong shape as a configuration error")
        void shouldRejectWrongShape() {
            assertThrows(ConfigurationException.class,
                () -> activate("Retrieval", Map.of("top_n", Map.of("nested", 1))));
        }
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should require an LLM id for generation")
        void shouldRequireLlmId() {
            ConfigurationException e = assertThrows(ConfigurationException.class, () -> activate("Generate", Map.of()));
            assertEquals("[Generate] LLM id cannot be empty", e.getMessage());
        }

        @Test
        @DisplayName("should reject a temperature outside [0, 1]")
        void shouldRejectTemperature() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> activate("Generate", Map.of("llm_id", "m", "temperature", 1.5)));
            assertTrue(e.getMessage().startsWith("[Generate] Temperature 1.5 not supported"), e.getMessage());
        }

        @ParameterizedTest(name = "{0}={1} on {2}")
        @CsvSource({
            "top_p, 1.01, Generate, '[Generate] Top P'",
            "presence_penalty, -0.1, Generate, '[Generate] Presence penalty'",
            "frequency_penalty, 2.0, Generate, '[Generate] Frequency penalty'",
            "similarity_threshold, 1.5, Retrieval, '[Retrieval] Similarity threshold'",
            "keywords_similarity_weight, -1.0, Retrieval, '[Retrieval] Keyword similarity weight'"
        })
        @DisplayName("should reject ratios outside [0, 1] with a field-qualified message")
        void shouldRejectRatios(String key, double value, String componentName, String label) {
            Map<String, Object> params = componentName.equals("Generate")
                ? Map.<String, Object>of("llm_id", "m", key, value)
                : Map.<String, Object>of(key, value);
            ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> activate(componentName, params));
            assertTrue(e.getMessage().startsWith(label + " " + value + " not supported"), e.getMessage());
        }

        @Test
        @DisplayName("should reject a non-positive retrieval top N")
        void shouldRejectTopN() {
            assertThrows(ConfigurationException.class, () -> activate("Retrieval", Map.of("top_n", 0)));
        }

        @Test
        @DisplayName("should require both grader outputs")
        void shouldRequireGraderOutputs() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> activate("Relevant", Map.of("llm_id", "m", "yes", "Generate:0")));
            assertEquals("[Relevant] 'No' cannot be empty", e.getMessage());
        }

        @Test
        @DisplayName("should accept an entry node without parameters")
        void shouldAcceptBegin() {
            assertDoesNotThrow(() -> activate("Begin", null));
        }
    }
}
