package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tokenizer family shared by one or more models. One adapter exists per family.
 */
public enum TokenizerType {
    CL100K_BASE("cl100k_base"),
    O200K_BASE("o200k_base"),
    CLAUDE("claude"),
    GEMINI("gemini"),
    CUSTOM("custom");

    private final String id;

    TokenizerType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static TokenizerType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Tokenizer type must not be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (TokenizerType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown tokenizer type: " + id);
    }
}
