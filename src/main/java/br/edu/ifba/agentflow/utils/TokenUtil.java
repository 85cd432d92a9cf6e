package br.edu.ifba.agentflow.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for token counting.
 * Uses jtokkit for GPT-compatible token counting.
 *
 * <p>This implementation uses the cl100k_base encoding which is compatible with
 * GPT-4 and GPT-3.5-turbo models.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    /**
     * Fallback approximation when jtokkit is unavailable.
     * Average of ~4 characters per token for English text.
     */
    public static final double AVG_CHARS_PER_TOKEN = 4.0;

    private static volatile Encoding encoding;
    private static volatile boolean initializationFailed = false;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @Nullable
    private static Encoding getEncoding() {
        if (encoding == null && !initializationFailed) {
            synchronized (TokenUtil.class) {
                if (encoding == null && !initializationFailed) {
                    try {
                        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
                        encoding = registry.getEncoding(EncodingType.CL100K_BASE);
                        logger.info("Initialized jtokkit with cl100k_base encoding for token counting");
                    } catch (Exception e) {
                        initializationFailed = true;
                        logger.warn("Failed to initialize jtokkit, falling back to approximation: {}", e.getMessage());
                    }
                }
            }
        }
        return encoding;
    }

    /**
     * Counts tokens with jtokkit, falling back to a character-based approximation.
     *
     * @param text The input text
     * @return Token count (exact with jtokkit, approximate otherwise)
     */
    public static int estimateTokens(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }

        Encoding enc = getEncoding();
        if (enc != null) {
            try {
                return enc.countTokens(text);
            } catch (Exception e) {
                logger.debug("Token counting failed, using approximation: {}", e.getMessage());
            }
        }

        return estimateTokensApproximate(text);
    }

    public static int estimateTokensApproximate(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / AVG_CHARS_PER_TOKEN);
    }

    /**
     * Converts a token budget into a character budget.
     *
     * @param maxTokens token budget
     * @param charsPerToken assumed characters per token
     * @param reservedChars characters kept free for roles and framing
     * @return character budget, never negative and capped at {@link Integer#MAX_VALUE}
     */
    public static int charBudget(int maxTokens, int charsPerToken, int reservedChars) {
        long budget = (long) maxTokens * charsPerToken - reservedChars;
        return (int) Math.max(0L, Math.min(Integer.MAX_VALUE, budget));
    }
}
