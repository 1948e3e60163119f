package org.pragmatica.versioning.syntax;

/**
 * Position inside surface text, one-based line and column.
 */
public record SourceLocation(int line, int column) {
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0);

    public static SourceLocation sourceLocation(int line, int column) {
        return new SourceLocation(line, column);
    }

    public static SourceLocation start() {
        return new SourceLocation(1, 1);
    }

    public boolean isKnown() {
        return line > 0;
    }

    /// Location reached after consuming the given text starting from this one.
    public SourceLocation advance(CharSequence text) {
        int currentLine = line;
        int currentColumn = column;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                currentLine++;
                currentColumn = 1;
            } else {
                currentColumn++;
            }
        }
        return new SourceLocation(currentLine, currentColumn);
    }

    public String asString() {
        return isKnown()
               ? line + ":" + column
               : "<unknown>";
    }

    @Override
    public String toString() {
        return asString();
    }
}
