package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural kind of a parsed element, derived from its tag, own text and child count.
 */
public enum NodeKind {
    TEXT("text"),
    CODE("code"),
    METADATA("metadata"),
    CONTAINER("container"),
    OTHER("other");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
