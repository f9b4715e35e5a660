package im.arun.tokenmap.parse;

/**
 * Input is not well-formed markup. Carries the parser's own diagnostic and a
 * best-effort position; line and column are -1 when unknown.
 */
public class MarkupParseException extends Exception {
    private final int line;
    private final int column;

    public MarkupParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public MarkupParseException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
