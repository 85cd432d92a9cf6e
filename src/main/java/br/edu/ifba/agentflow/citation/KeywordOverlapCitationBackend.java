package br.edu.ifba.agentflow.citation;

import br.edu.ifba.agentflow.llm.EmbeddingBackend;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Citation backend that matches answer sentences to chunks.
 *
 * <p>Each sentence is scored against every chunk by the share of its terms the chunk contains.
 * When an embedding backend is available and the chunk carries a vector, the score blends that
 * term overlap with the cosine similarity of the sentence and chunk vectors:</p>
 * <pre>
 * score = (keywordWeight * overlap + vectorWeight * cosine) / (keywordWeight + vectorWeight)
 * </pre>
 * <p>The best chunk at or above the threshold is cited with an {@code [ID:n]} marker right after
 * the sentence. Everything else in the answer, including line breaks and list markup, is kept.</p>
 */
public class KeywordOverlapCitationBackend implements CitationBackend {

    private static final Logger logger = LoggerFactory.getLogger(KeywordOverlapCitationBackend.class);

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)|[。！？]+");
    private static final Pattern TERM = Pattern.compile("[\\p{L}\\p{N}]{3,}");

    private final double threshold;
    @Nullable
    private final EmbeddingBackend embeddings;

    public KeywordOverlapCitationBackend(double threshold) {
        this(threshold, null);
    }

    /**
     * @param threshold minimum score for a sentence to cite a chunk
     * @param embeddings sentence embedder, {@code null} to score by term overlap only
     */
    public KeywordOverlapCitationBackend(double threshold, @Nullable EmbeddingBackend embeddings) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.threshold = threshold;
        this.embeddings = embeddings;
    }

    @Override
    @NotNull
    public CitationResult insertCitations(
            @NotNull String answer,
            @NotNull List<String> chunkContents,
            @NotNull List<List<Double>> chunkVectors,
            @NotNull EmbeddingModelRef embeddingModel,
            double keywordWeight,
            double vectorWeight) {

        if (answer.isBlank() || chunkContents.isEmpty()) {
            return new CitationResult(answer, List.of());
        }

        List<Set<String>> chunkTerms = new ArrayList<>();
        for (String content : chunkContents) {
            chunkTerms.add(terms(content != null ? content : ""));
        }

        List<int[]> spans = sentenceSpans(answer);
        List<String> sentences = new ArrayList<>();
        for (int[] span : spans) {
            sentences.add(answer.substring(span[0], span[1]));
        }
        List<float[]> sentenceVectors = embedSentences(sentences, chunkVectors, embeddingModel, vectorWeight);

        Set<Integer> used = new LinkedHashSet<>();
        StringBuilder cited = new StringBuilder(answer.length() + spans.size() * 8);
        int copied = 0;

        for (int s = 0; s < spans.size(); s++) {
            Set<String> sentenceTerms = terms(sentences.get(s));
            float[] sentenceVector = sentenceVectors.isEmpty() ? null : sentenceVectors.get(s);

            int best = -1;
            double bestScore = 0;
            for (int i = 0; i < chunkTerms.size(); i++) {
                double score = score(sentenceTerms, chunkTerms.get(i), sentenceVector,
                    i < chunkVectors.size() ? chunkVectors.get(i) : null, keywordWeight, vectorWeight);
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }

            int end = spans.get(s)[1];
            cited.append(answer, copied, end);
            copied = end;
            if (best >= 0 && bestScore >= threshold) {
                cited.append(" [ID:").append(best).append(']');
                used.add(best);
            }
        }
        cited.append(answer, copied, answer.length());

        logger.debug("Cited {} of {} chunks (model: {}, vectors: {})",
            used.size(), chunkContents.size(), embeddingModel.modelId(), !sentenceVectors.isEmpty());
        return new CitationResult(cited.toString(), new ArrayList<>(used));
    }

    /**
     * Sentence bodies as {@code [start, end)} offsets, surrounding whitespace excluded.
     */
    static List<int[]> sentenceSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = SENTENCE_END.matcher(text);
        int start = 0;
        while (matcher.find()) {
            addSpan(spans, text, start, matcher.end());
            start = matcher.end();
        }
        addSpan(spans, text, start, text.length());
        return spans;
    }

    private static void addSpan(List<int[]> spans, String text, int start, int end) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            spans.add(new int[]{start, end});
        }
    }

    private List<float[]> embedSentences(List<String> sentences, List<List<Double>> chunkVectors,
                                         EmbeddingModelRef model, double vectorWeight) {
        if (embeddings == null || vectorWeight <= 0 || chunkVectors.stream().allMatch(v -> v == null || v.isEmpty())) {
            return List.of();
        }
        try {
            List<float[]> vectors = embeddings.embed(model.modelId(), sentences).join();
            if (vectors == null || vectors.size() != sentences.size()) {
                logger.warn("Embedding backend returned {} vectors for {} sentences, using term overlap only",
                    vectors != null ? vectors.size() : 0, sentences.size());
                return List.of();
            }
            return vectors;
        } catch (RuntimeException e) {
            logger.warn("Sentence embedding failed, using term overlap only: {}", e.getMessage());
            return List.of();
        }
    }

    private static double score(Set<String> sentenceTerms, Set<String> chunkTerms,
                                @Nullable float[] sentenceVector, @Nullable List<Double> chunkVector,
                                double keywordWeight, double vectorWeight) {
        double overlap = 0;
        if (!sentenceTerms.isEmpty()) {
            Set<String> shared = new HashSet<>(sentenceTerms);
            shared.retainAll(chunkTerms);
            overlap = (double) shared.size() / sentenceTerms.size();
        }
        double weights = keywordWeight + vectorWeight;
        if (sentenceVector == null || chunkVector == null || chunkVector.size() != sentenceVector.length
                || weights <= 0) {
            return overlap;
        }
        return (keywordWeight * overlap + vectorWeight * cosineSimilarity(sentenceVector, chunkVector)) / weights;
    }

    /**
     * Cosine similarity; 0 when either vector has no magnitude.
     */
    static double cosineSimilarity(@NotNull float[] a, @NotNull List<Double> b) {
        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double bi = b.get(i) != null ? b.get(i) : 0.0;
            dotProduct += a[i] * bi;
            normA += a[i] * a[i];
            normB += bi * bi;
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        Matcher matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            terms.add(matcher.group());
        }
        return terms;
    }
}
