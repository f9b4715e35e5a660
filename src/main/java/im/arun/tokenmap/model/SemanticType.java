package im.arun.tokenmap.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prompt-level meaning of an element (file contents, instructions, code map...).
 */
public enum SemanticType {
    FILES("files"),
    INSTRUCTIONS("instructions"),
    META_PROMPT("meta_prompt"),
    FILE_TREE("file_tree"),
    CODEMAP("codemap"),
    REFERENCES("references"),
    SUGGESTIONS("suggestions"),
    OTHER("other");

    private final String label;

    SemanticType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
