package io.github.cyfko.reverhttp.core.lexer;

/**
 * Opaque snapshot of a {@link Lexer} cursor, used to rescan a token under a different mode.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class LexerState {

    final int position;
    final int readPosition;
    final char current;
    final int line;
    final int column;
    final int parenDepth;
    final int braceDepth;
    final int bracketDepth;

    LexerState(int position, int readPosition, char current, int line, int column,
               int parenDepth, int braceDepth, int bracketDepth) {
        this.position = position;
        this.readPosition = readPosition;
        this.current = current;
        this.line = line;
        this.column = column;
        this.parenDepth = parenDepth;
        this.braceDepth = braceDepth;
        this.bracketDepth = bracketDepth;
    }

    @Override
    public String toString() {
        return "LexerState[line=" + line + ", column=" + column + ", offset=" + position + "]";
    }
}
