package br.edu.ifba.agentflow.support;

import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.GenerationBackend;
import br.edu.ifba.agentflow.llm.LengthUnit;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic backend that answers with a fixed text and records every call.
 */
public class FakeGenerationBackend implements GenerationBackend {

    public record Call(String systemPrompt, List<ChatMessage> messages, Map<String, Object> config) {}

    private final String answer;
    private final List<String> increments;
    private final int maxLength;
    private final LengthUnit lengthUnit;
    private final List<Call> calls = new ArrayList<>();

    public FakeGenerationBackend(String answer) {
        this(answer, List.of(answer), 4096, LengthUnit.CHARACTERS);
    }

    public FakeGenerationBackend(String answer, List<String> increments, int maxLength, LengthUnit lengthUnit) {
        this.answer = answer;
        this.increments = increments;
        this.maxLength = maxLength;
        this.lengthUnit = lengthUnit;
    }

    @Override
    public CompletableFuture<String> chat(String systemPrompt, List<ChatMessage> messages, Map<String, Object> config) {
        calls.add(new Call(systemPrompt, List.copyOf(messages), Map.copyOf(config)));
        return CompletableFuture.completedFuture(answer);
    }

    @Override
    public Iterator<String> chatStreaming(String systemPrompt, List<ChatMessage> messages, Map<String, Object> config) {
        calls.add(new Call(systemPrompt, List.copyOf(messages), Map.copyOf(config)));
        return increments.iterator();
    }

    @Override
    public int maxLength() {
        return maxLength;
    }

    @Override
    public LengthUnit lengthUnit() {
        return lengthUnit;
    }

    public List<Call> calls() {
        return calls;
    }

    public Call lastCall() {
        return calls.get(calls.size() - 1);
    }
}
