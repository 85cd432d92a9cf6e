package br.edu.ifba.agentflow.component;

import br.edu.ifba.agentflow.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Base class of per-type stage configuration.
 *
 * <p>Parameters are bound from the node's snake_case parameter mapping and validated
 * once, when the component is activated. Validation never mutates state.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE
)
public abstract class ComponentParam {

    @JsonProperty("message_history_window_size")
    protected int messageHistoryWindowSize = 22;

    @JsonProperty("debug_inputs")
    protected List<Map<String, Object>> debugInputs = new ArrayList<>();

    @JsonProperty("inputs")
    protected List<Map<String, Object>> inputs = new ArrayList<>();

    /**
     * Validates the parameters.
     *
     * @throws ConfigurationException on the first violation
     */
    public abstract void check();

    /**
     * Overlays the given node parameters onto this object.
     *
     * @throws ConfigurationException if a value has the wrong shape
     */
    public void update(@Nullable Map<String, Object> params, @NotNull ObjectMapper objectMapper) {
        if (params == null || params.isEmpty()) {
            return;
        }
        try {
            objectMapper.updateValue(this, params);
        } catch (JsonMappingException e) {
            throw new ConfigurationException(
                String.format("[%s] Invalid parameters: %s", getClass().getSimpleName(), e.getOriginalMessage()), e);
        }
    }

    public int getMessageHistoryWindowSize() {
        return messageHistoryWindowSize;
    }

    @NotNull
    public List<Map<String, Object>> getDebugInputs() {
        return debugInputs != null ? debugInputs : List.of();
    }

    @NotNull
    public List<Map<String, Object>> getInputs() {
        return inputs != null ? inputs : List.of();
    }

    /**
     * Records the inputs a run resolved, for diagnostics.
     */
    public void setInputs(@NotNull List<Map<String, Object>> inputs) {
        this.inputs = new ArrayList<>(inputs);
    }

    // ========================================================================
    // Validation primitives
    // ========================================================================

    protected static void checkEmpty(@Nullable String value, String description) {
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException(description + " cannot be empty");
        }
    }

    protected static void checkPositiveNumber(@Nullable Number value, String description) {
        if (value == null || value.doubleValue() <= 0) {
            throw new ConfigurationException(
                String.format("%s %s not supported, should be a positive number", description, value));
        }
    }

    protected static void checkNonNegativeNumber(@Nullable Number value, String description) {
        if (value == null || value.doubleValue() < 0) {
            throw new ConfigurationException(
                String.format("%s %s not supported, should be a non-negative number", description, value));
        }
    }

    protected static void checkPositiveInteger(@Nullable Number value, String description) {
        if (value == null || value.doubleValue() <= 0 || value.doubleValue() != Math.rint(value.doubleValue())) {
            throw new ConfigurationException(
                String.format("%s %s not supported, should be a positive integer", description, value));
        }
    }

    /**
     * Rejects anything outside [0, 1].
     */
    protected static void checkDecimalFloat(@Nullable Number value, String description) {
        if (value == null || value.doubleValue() < 0 || value.doubleValue() > 1) {
            throw new ConfigurationException(
                String.format("%s %s not supported, should be a float number in range [0, 1]", description, value));
        }
    }

    protected static void checkValidValue(@Nullable Object value, String description, Collection<?> choices) {
        if (value == null || !choices.contains(value)) {
            throw new ConfigurationException(
                String.format("%s %s not supported, should be one of %s", description, value, choices));
        }
    }
}
