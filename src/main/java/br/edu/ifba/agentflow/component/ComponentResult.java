package br.edu.ifba.agentflow.component;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Settled output of a stage: zero or more rows.
 */
public record ComponentResult(@NotNull List<ResultRow> rows) {

    private static final ComponentResult EMPTY = new ComponentResult(List.of());

    public ComponentResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public static ComponentResult empty() {
        return EMPTY;
    }

    public static ComponentResult of(@NotNull ResultRow row) {
        return new ComponentResult(List.of(row));
    }

    /**
     * Concatenates the rows of several results, keeping their order.
     */
    public static ComponentResult concat(@NotNull List<ComponentResult> results) {
        List<ResultRow> rows = new ArrayList<>();
        for (ComponentResult result : results) {
            rows.addAll(result.rows());
        }
        return new ComponentResult(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Nullable
    public ResultRow first() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    @NotNull
    public List<String> contents() {
        return rows.stream().map(ResultRow::content).collect(Collectors.toList());
    }

    /**
     * @return true when at least one row has non-blank content
     */
    public boolean hasContent() {
        return rows.stream().anyMatch(row -> !row.content().isBlank());
    }

    /**
     * @return true when some row carries retrieved text rather than a retrieval stage's empty reply
     */
    public boolean hasRetrievedContent() {
        return rows.stream().anyMatch(row -> row.emptyResponse() == null && !row.content().isBlank());
    }
}
