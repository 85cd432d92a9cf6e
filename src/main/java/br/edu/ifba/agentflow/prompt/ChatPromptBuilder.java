package br.edu.ifba.agentflow.prompt;

import br.edu.ifba.agentflow.component.ComponentSettings;
import br.edu.ifba.agentflow.llm.ChatMessage;
import br.edu.ifba.agentflow.llm.LengthUnit;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the message list sent to a generation backend.
 *
 * <ol>
 *   <li>Candidate list: system prompt followed by the recent history, minus a trailing
 *       assistant entry.</li>
 *   <li>A default user turn is appended when only the system prompt remains.</li>
 *   <li>The list is fitted into {@code maxLength * budgetRatio}.</li>
 *   <li>The system prompt is split off; an empty chat list gets the default user turn.</li>
 * </ol>
 */
public class ChatPromptBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ChatPromptBuilder.class);

    private final double budgetRatio;
    private final String defaultUserTurn;

    public ChatPromptBuilder(@NotNull ComponentSettings settings) {
        this(settings.budgetRatio(), settings.defaultUserTurn());
    }

    public ChatPromptBuilder(double budgetRatio, @NotNull String defaultUserTurn) {
        if (budgetRatio <= 0 || budgetRatio > 1) {
            throw new IllegalArgumentException("budgetRatio must be in (0, 1], got: " + budgetRatio);
        }
        this.budgetRatio = budgetRatio;
        this.defaultUserTurn = Objects.requireNonNull(defaultUserTurn, "defaultUserTurn must not be null");
    }

    /**
     * @param systemPrompt rendered prompt template
     * @param history recent history, oldest first
     * @param maxLength backend context window
     * @param unit how the backend measures length
     */
    @NotNull
    public FittedPrompt build(@NotNull String systemPrompt, @NotNull List<ChatMessage> history,
                              int maxLength, @NotNull LengthUnit unit) {
        List<ChatMessage> candidates = candidates(systemPrompt, history);

        int budget = (int) (maxLength * budgetRatio);
        List<ChatMessage> fitted = new MessageWindowFitter(unit).fit(candidates, budget);
        if (fitted.isEmpty()) {
            fitted = List.of(ChatMessage.user(defaultUserTurn));
        }

        String system = "";
        List<ChatMessage> chat = new ArrayList<>(fitted);
        if (chat.get(0).role() == ChatMessage.Role.SYSTEM) {
            system = chat.remove(0).content();
        }
        if (chat.isEmpty()) {
            chat.add(ChatMessage.user(defaultUserTurn));
        }

        logger.debug("Fitted {} of {} candidate messages into budget {}", fitted.size(), candidates.size(), budget);
        return new FittedPrompt(system, chat);
    }

    /**
     * @return system prompt plus history; never ends on an assistant turn
     */
    @NotNull
    List<ChatMessage> candidates(@NotNull String systemPrompt, @NotNull List<ChatMessage> history) {
        List<ChatMessage> turns = new ArrayList<>(history);
        if (!turns.isEmpty() && turns.get(turns.size() - 1).role() == ChatMessage.Role.ASSISTANT) {
            turns.remove(turns.size() - 1);
        }

        List<ChatMessage> candidates = new ArrayList<>();
        candidates.add(ChatMessage.system(systemPrompt));
        candidates.addAll(turns);
        if (candidates.size() == 1) {
            candidates.add(ChatMessage.user(defaultUserTurn));
        }
        return candidates;
    }
}
