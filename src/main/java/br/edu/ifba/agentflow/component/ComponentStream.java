package br.edu.ifba.agentflow.component;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Pull-based producer returned by a stage that streams.
 *
 * <p>The caller pulls one event at a time; each pull may block on the backend.
 * The stage's settled output is committed only once the producer is drained.
 * Abandoning a stream, or a failure while pulling, leaves the stage without a settled
 * output for this run.</p>
 */
public final class ComponentStream implements Iterator<StreamEvent> {

    private static final Logger logger = LoggerFactory.getLogger(ComponentStream.class);

    public enum State {
        OPEN,
        DRAINED,
        ABANDONED,
        FAILED
    }

    private final Iterator<StreamEvent> source;
    private final Consumer<ResultRow> onDrained;
    private State state = State.OPEN;
    @Nullable
    private StreamEvent lastEvent;

    public ComponentStream(@NotNull Iterator<StreamEvent> source, @NotNull Consumer<ResultRow> onDrained) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.onDrained = Objects.requireNonNull(onDrained, "onDrained must not be null");
    }

    @Override
    public boolean hasNext() {
        if (state != State.OPEN) {
            return false;
        }
        if (pull(source::hasNext)) {
            return true;
        }
        state = State.DRAINED;
        onDrained.accept(lastRow());
        return false;
    }

    @Override
    public StreamEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream is " + state.name().toLowerCase());
        }
        lastEvent = pull(source::next);
        return lastEvent;
    }

    private <T> T pull(Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            state = State.FAILED;
            throw e;
        }
    }

    /**
     * Stops consumption. Nothing is committed.
     */
    public void abandon() {
        if (state == State.OPEN) {
            state = State.ABANDONED;
            logger.debug("Stream abandoned after {}", lastEvent != null ? "partial output" : "no output");
        }
    }

    /**
     * Pulls every remaining event.
     *
     * @return the final row
     * @throws IllegalStateException if the stream was abandoned
     */
    @NotNull
    public ResultRow drain() {
        while (hasNext()) {
            next();
        }
        if (state != State.DRAINED) {
            throw new IllegalStateException("Stream was " + state.name().toLowerCase() + " before completion");
        }
        return lastRow();
    }

    @NotNull
    public State state() {
        return state;
    }

    public boolean isDrained() {
        return state == State.DRAINED;
    }

    /**
     * @return the row built from the last event observed so far
     */
    @NotNull
    public ResultRow lastRow() {
        if (lastEvent == null) {
            return ResultRow.of("");
        }
        if (lastEvent instanceof StreamEvent.Final finalEvent) {
            return finalEvent.toRow();
        }
        return ResultRow.of(lastEvent.content());
    }
}
