package br.edu.ifba.agentflow.component;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * What a stage run returns: either a settled result or a stream still to be drained.
 */
public sealed interface StageOutput {

    static StageOutput settled(@NotNull ComponentResult result) {
        return new Settled(result);
    }

    static StageOutput streaming(@NotNull ComponentStream stream) {
        return new Streaming(stream);
    }

    record Settled(@NotNull ComponentResult result) implements StageOutput {
        public Settled {
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    record Streaming(@NotNull ComponentStream stream) implements StageOutput {
        public Streaming {
            Objects.requireNonNull(stream, "stream must not be null");
        }
    }
}
