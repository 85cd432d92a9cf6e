package br.edu.ifba.agentflow.prompt;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * One dependency of a prompt template.
 *
 * @param kind what the key refers to
 * @param key placeholder text between the braces, e.g. {@code Retrieval:Docs} or {@code begin@lang}
 * @param name display name, filled in when the element is described against a graph
 */
public record PromptInputElement(
    @NotNull Kind kind,
    @NotNull String key,
    @Nullable String name
) {

    public static final String USER_KEY = "user";

    /**
     * The raw turn input. Always element zero; never resolved against the graph.
     */
    public static final PromptInputElement USER =
        new PromptInputElement(Kind.LITERAL, USER_KEY, "Input your question here:");

    public enum Kind {
        /** The raw turn input. */
        LITERAL,
        /** Output of another node. */
        NODE_REF,
        /** Parameter captured by the entry node, {@code beginNodeId@paramKey}. */
        BEGIN_PARAM_REF
    }

    public PromptInputElement {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(key, "key must not be null");
    }

    public PromptInputElement withName(@Nullable String name) {
        return new PromptInputElement(kind, key, name);
    }

    /**
     * @return id of the referenced node; for begin references, the entry node id
     */
    @NotNull
    public String nodeId() {
        if (kind == Kind.BEGIN_PARAM_REF) {
            return key.substring(0, key.indexOf('@'));
        }
        return key;
    }

    /**
     * @return parameter key of a begin reference, null otherwise
     */
    @Nullable
    public String paramKey() {
        if (kind != Kind.BEGIN_PARAM_REF) {
            return null;
        }
        return key.substring(key.indexOf('@') + 1);
    }

    /**
     * Answer and begin nodes are conversational anchors rather than data dependencies.
     */
    public boolean isSchedulingDependency() {
        if (kind == Kind.LITERAL) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return !lower.contains("answer") && !lower.contains("begin");
    }
}
