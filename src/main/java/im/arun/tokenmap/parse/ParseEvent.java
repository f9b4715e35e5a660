package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.ParsedNode;
import lombok.Value;

/**
 * Event emitted while parsing one document. A request produces any number of
 * {@link Progress} and {@link Partial} events followed by exactly one {@link Done}
 * or {@link Error}.
 */
public interface ParseEvent {

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
    class Progress implements ParseEvent {
        long done;
        /** Input length in characters, or null when not known at this point. */
        Long total;
        ParseStage stage;

        @Override
        public Type getType() {
            return Type.PROGRESS;
        }
    }

    /**
     * A subtree that has just been finalized. Its root is not yet attached to a parent.
     */
    @Value
    class Partial implements ParseEvent {
        ParsedNode subtree;

        @Override
        public Type getType() {
            return Type.PARTIAL;
        }
    }

    @Value
    class Done implements ParseEvent {
        ParsedNode root;

        @Override
        public Type getType() {
            return Type.DONE;
        }
    }

    @Value
    class Error implements ParseEvent {
        String message;
        int line;
        int column;

        @Override
        public Type getType() {
            return Type.ERROR;
        }
    }
}
