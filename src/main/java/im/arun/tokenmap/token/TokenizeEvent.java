package im.arun.tokenmap.token;

import im.arun.tokenmap.model.TokenUpdate;
import lombok.Value;

import java.util.List;

/**
 * Event emitted while tokenizing one tree: any number of {@link Progress} and
 * {@link Partial} events, then exactly one {@link Done} or {@link Error}.
 */
public interface TokenizeEvent {

    enum Type {
        PROGRESS,
        PARTIAL,
        DONE,
        ERROR
    }

    Type getType();

    default boolean isTerminal() {
        return getType() == Type.DONE || getType() == Type.ERROR;
    }

    @Value
    class Progress implements TokenizeEvent {
        int processed;
        int total;

        @Override
        public Type getType() {
            return Type.PROGRESS;
        }
    }

    @Value
    class Partial implements TokenizeEvent {
        List<TokenUpdate> updates;

        @Override
        public Type getType() {
            return Type.PARTIAL;
        }
    }

    /**
     * Completion of a pass. {@code totalTokens} is the sum observed during this pass and
     * is advisory; the cache remains the source of truth.
     */
    @Value
    class Done implements TokenizeEvent {
        String modelId;
        long totalTokens;
        /** Nodes whose count was estimated or came from a heuristic tokenizer. */
        int approximateNodes;

        @Override
        public Type getType() {
            return Type.DONE;
        }
    }

    @Value
    class Error implements TokenizeEvent {
        String message;

        @Override
        public Type getType() {
            return Type.ERROR;
        }
    }
}
