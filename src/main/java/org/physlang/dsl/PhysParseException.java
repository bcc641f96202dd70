package org.physlang.dsl;

/**
 * Exception thrown when PhysLang parsing fails.
 * Includes the source span, 1-based line number and the text of the
 * offending line when a location is known.
 */
public class PhysParseException extends PhysLangException {

    private final String detail;
    private final Span span;
    private final int line;
    private final int column;
    private final String lineText;

    public PhysParseException(String message) {
        super(message);
        this.detail = message;
        this.span = null;
        this.line = -1;
        this.column = -1;
        this.lineText = null;
    }

    public PhysParseException(String message, Span span, int line, int column, String lineText) {
        super("line " + line + ":" + column + " " + message);
        this.detail = message;
        this.span = span;
        this.line = line;
        this.column = column;
        this.lineText = lineText;
    }

    /**
     * The message without the location prefix.
     */
    public String getDetail() {
        return detail;
    }

    public Span getSpan() {
        return span;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getLineText() {
        return lineText;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }

    /**
     * Renders the error with its line number and the offending source line,
     * with a caret under the reported column.
     */
    public String formatDetailed() {
        if (!hasLocation()) {
            return "Parse error: " + detail;
        }
        String gutter = String.valueOf(line);
        StringBuilder sb = new StringBuilder();
        sb.append("Parse error at line ").append(line).append(", column ").append(column)
                .append(": ").append(detail).append('\n');
        sb.append(gutter).append(" | ").append(lineText).append('\n');
        sb.append(" ".repeat(gutter.length())).append(" | ")
                .append(" ".repeat(Math.max(0, column - 1))).append('^');
        return sb.toString();
    }
}
