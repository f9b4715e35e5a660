package im.arun.tokenmap.parse;

public enum ParseStage {
    PARSING,
    HASHING
}
