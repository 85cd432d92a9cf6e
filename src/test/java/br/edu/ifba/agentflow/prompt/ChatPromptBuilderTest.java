package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.LengthUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatPromptBuilderTest {

    private final ChatPromptBuilder builder = new ChatPromptBuilder(0.97, "Output: ");

    @Test
    @DisplayName("should split off the system prompt and keep the history")
    void shouldSplitSystemPrompt() {
        FittedPrompt prompt = builder.build("You are helpful.",
            List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello"), ChatMessage.user("what is RAG?")),
            4096, LengthUnit.CHARACTERS);

        assertEquals("You are helpful.", prompt.systemPrompt());
        assertEquals(3, prompt.messages().size());
        assertEquals(ChatMessage.user("what is RAG?"), prompt.messages().get(2));
    }

    @Test
    @DisplayName("should drop a trailing assistant turn")
    void shouldDropTrailingAssistant() {
        FittedPrompt prompt = builder.build("sys",
            List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello")), 4096, LengthUnit.CHARACTERS);

        assertEquals(List.of(ChatMessage.user("hi")), prompt.messages());
    }

    @Test
    @DisplayName("should synthesize the default user turn for an empty history")
    void shouldSynthesizeUserTurn() {
        FittedPrompt prompt = builder.build("sys", List.of(), 4096, LengthUnit.CHARACTERS);

        assertEquals("sys", prompt.systemPrompt());
        assertEquals(List.of(ChatMessage.user("Output: ")), prompt.messages());
    }

    @Test
    @DisplayName("should never produce an empty message list when the prompt eats the budget")
    void shouldKeepOneTurnWhenOverBudget() {
        FittedPrompt prompt = builder.build("x".repeat(200),
            List.of(ChatMessage.user("older"), ChatMessage.user("latest")), 100, LengthUnit.CHARACTERS);

        assertFalse(prompt.messages().isEmpty());
        assertEquals(ChatMessage.user("latest"), prompt.messages().get(prompt.messages().size() - 1));
    }

    @Test
    @DisplayName("should reject a budget ratio outside (0, 1]")
    void shouldRejectRatio() {
        assertThrows(IllegalArgumentException.class, () -> new ChatPromptBuilder(0, "Output: "));
        assertThrows(IllegalArgumentException.class, () -> new ChatPromptBuilder(1.5, "Output: "));
    }
}
