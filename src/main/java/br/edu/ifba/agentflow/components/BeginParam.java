package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.component.ComponentParam;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of the entry node: the greeting and the values captured before the conversation.
 */
public class BeginParam extends ComponentParam {

    static final String DEFAULT_PROLOGUE = "Hi! I'm your smart assistant. What can I do for you?";

    private String prologue = DEFAULT_PROLOGUE;

    private List<QueryEntry> query = new ArrayList<>();

    /**
     * A value captured at the entry node and referenced as {@code {begin@key}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryEntry(
        String key,
        String name,
        String type,
        Boolean optional,
        Object value
    ) {
        @NotNull
        public String valueAsText() {
            return value != null ? value.toString() : "";
        }
    }

    @Override
    public void check() {
        // Nothing to validate
    }

    @NotNull
    public String getPrologue() {
        return prologue != null ? prologue : "";
    }

    @NotNull
    public List<QueryEntry> getQuery() {
        return query != null ? query : List.of();
    }

    @NotNull
    public Optional<QueryEntry> findQuery(@Nullable String key) {
        return getQuery().stream()
            .filter(entry -> entry != null && Objects.equals(entry.key(), key))
            .findFirst();
    }
}
