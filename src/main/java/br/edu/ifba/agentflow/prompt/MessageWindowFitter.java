package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.LengthUnit;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy tail-first fitting of a message list into a length budget.
 *
 * <p>A leading system message is always kept and counts toward the budget. The remaining
 * messages are admitted from the most recent backward until the budget is exceeded.
 * The most recent message is admitted even when it alone exceeds the budget.</p>
 */
public class MessageWindowFitter {

    private final LengthUnit unit;

    public MessageWindowFitter(@NotNull LengthUnit unit) {
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    /**
     * @param messages candidate messages, oldest first
     * @param budget maximum total length
     * @return the admitted messages, oldest first
     */
    @NotNull
    public List<ChatMessage> fit(@NotNull List<ChatMessage> messages, int budget) {
        if (messages.isEmpty()) {
            return List.of();
        }

        List<ChatMessage> fitted = new ArrayList<>();
        List<ChatMessage> remaining = messages;
        int used = 0;

        if (messages.get(0).role() == ChatMessage.Role.SYSTEM) {
            ChatMessage system = messages.get(0);
            used += unit.measure(system.content());
            fitted.add(system);
            remaining = messages.subList(1, messages.size());
        }

        LinkedList<ChatMessage> admitted = new LinkedList<>();
        for (int i = remaining.size() - 1; i >= 0; i--) {
            ChatMessage message = remaining.get(i);
            used += unit.measure(message.content());
            if (used > budget && !admitted.isEmpty()) {
                break;
            }
            admitted.addFirst(message);
            if (used > budget) {
                break;
            }
        }

        fitted.addAll(admitted);
        return fitted;
    }
}
