package br.edu.ifba.agentflow.llm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One conversational message. Serialized as a {@code [role, content]} pair,
 * which is how the workflow document stores its history.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"role", "content"})
public record ChatMessage(
    @NotNull Role role,
    @NotNull String content
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content != null ? content : "";
    }

    public static ChatMessage system(@NotNull String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(@NotNull String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(@NotNull String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }

    public enum Role {
        SYSTEM("system"),
        USER("user"),
        ASSISTANT("assistant");

        private final String wireName;

        Role(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Role fromString(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Message role must not be null");
            }
            for (Role role : values()) {
                if (role.wireName.equalsIgnoreCase(value)) {
                    return role;
                }
            }
            throw new IllegalArgumentException("Unknown message role: " + value);
        }
    }
}
