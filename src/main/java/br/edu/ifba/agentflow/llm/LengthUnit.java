package br.edu.ifba.agentflow.llm;

import br.edu.ifba.agentflow.utils.TokenUtil;
import org.jetbrains.annotations.NotNull;

/**
 * How a backend measures its context window.
 */
public enum LengthUnit {
    CHARACTERS,
    TOKENS;

    public int measure(@NotNull String text) {
        return switch (this) {
            case CHARACTERS -> text.length();
            case TOKENS -> TokenUtil.estimateTokens(text);
        };
    }

    public static LengthUnit fromString(String value) {
        if (value == null || value.isBlank()) {
            return TOKENS;
        }
        return switch (value.trim().toLowerCase()) {
            case "chars", "characters" -> CHARACTERS;
            case "tokens" -> TOKENS;
            default -> throw new IllegalArgumentException("Unknown length unit: " + value);
        };
    }
}
