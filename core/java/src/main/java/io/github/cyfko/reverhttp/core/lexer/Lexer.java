package io.github.cyfko.reverhttp.core.lexer;

import java.util.Objects;

/**
 * Pull-based tokenizer for ReverHTTP flow sources.
 * <p>
 * Each call to {@link #nextToken()} returns the next token in source order. Once the input is
 * exhausted an {@link TokenType#EOF} token is returned on every subsequent call.
 * </p>
 *
 * <h2>Context-sensitive rules</h2>
 * <ul>
 *   <li><strong>Newline suppression</strong>: newlines are significant, except while any of the
 *       three bracket depth counters ({@code ()}, {@code {}}, {@code []}) is above zero. Counters
 *       are clamped at zero so unbalanced closing brackets never make them negative.</li>
 *   <li><strong>Regex mode</strong>: by default {@code /} is a path separator. While regex mode is
 *       on (see {@link #enterRegexMode()}), {@code /} opens a regex literal that runs to the next
 *       unescaped {@code /}.</li>
 *   <li><strong>Hyphenated identifiers</strong>: a hyphen belongs to an identifier only when it is
 *       immediately followed by a letter or digit, so {@code max-age} is one token while a trailing
 *       hyphen is left out.</li>
 *   <li><strong>Two-character operators</strong>: {@code |>}, {@code ~>} and {@code ..} are matched
 *       greedily; a lone {@code |} or {@code ~} yields an {@link TokenType#ILLEGAL} token.</li>
 * </ul>
 *
 * <p>
 * Malformed input never throws: unknown characters become {@code ILLEGAL} tokens and unterminated
 * string or regex literals end at the line break with a best-effort literal.
 * </p>
 *
 * <p>
 * Instances are not thread-safe; use one lexer per source unit.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class Lexer {

    private static final char END = '\0';

    private final String input;
    private final String file;

    private int position;
    private int readPosition;
    private char current;
    private int line = 1;
    private int column;

    private int parenDepth;
    private int braceDepth;
    private int bracketDepth;

    private boolean regexMode;

    /**
     * Creates a lexer over the given source text.
     *
     * @param input source text
     * @param file  file identifier reported in token positions
     * @throws NullPointerException if any argument is null
     */
    public Lexer(String input, String file) {
        this.input = Objects.requireNonNull(input, "source text cannot be null");
        this.file = Objects.requireNonNull(file, "file identifier cannot be null");
        readChar();
    }

    /**
     * Switches regex mode on or off. Prefer {@link #enterRegexMode()} which guarantees restoration.
     *
     * @param on whether {@code /} should open a regex literal
     */
    public void setRegexMode(boolean on) {
        this.regexMode = on;
    }

    public boolean isRegexMode() {
        return regexMode;
    }

    /**
     * Turns regex mode on until the returned scope is closed.
     *
     * @return a scope restoring the previous mode on close
     */
    public RegexModeScope enterRegexMode() {
        RegexModeScope scope = new RegexModeScope(this, regexMode);
        setRegexMode(true);
        return scope;
    }

    /**
     * Captures the cursor, line/column and bracket depths.
     *
     * @return a snapshot usable with {@link #restore(LexerState)}
     */
    public LexerState snapshot() {
        return new LexerState(position, readPosition, current, line, column, parenDepth, braceDepth, bracketDepth);
    }

    /**
     * Rewinds this lexer to a previously captured state. Regex mode is not part of the state.
     *
     * @param state a snapshot taken from this lexer
     */
    public void restore(LexerState state) {
        Objects.requireNonNull(state, "lexer state cannot be null");
        this.position = state.position;
        this.readPosition = state.readPosition;
        this.current = state.current;
        this.line = state.line;
        this.column = state.column;
        this.parenDepth = state.parenDepth;
        this.braceDepth = state.braceDepth;
        this.bracketDepth = state.bracketDepth;
    }

    /**
     * Returns the next token from the input.
     *
     * @return the next token, {@link TokenType#EOF} once the input is exhausted
     */
    public Token nextToken() {
        while (true) {
            skipWhitespaceAndComments();
            Position pos = currentPosition();

            if (current == '\n') {
                line++;
                column = 0;
                readChar();
                if (insideBrackets()) {
                    continue;
                }
                return new Token(TokenType.NEWLINE, "\n", pos);
            }
            return readToken(pos);
        }
    }

    private Token readToken(Position pos) {
        switch (current) {
            case END:
                return new Token(TokenType.EOF, "", pos);
            case '|':
                return twoCharOperator('>', TokenType.PIPE, pos);
            case '~':
                return twoCharOperator('>', TokenType.ERROR, pos);
            case '.':
                if (peekChar() == '.') {
                    readChar();
                    readChar();
                    return new Token(TokenType.RANGE, "..", pos);
                }
                return single(TokenType.DOT, pos);
            case '&':
                return single(TokenType.AMPERSAND, pos);
            case ':':
                return single(TokenType.COLON, pos);
            case ',':
                return single(TokenType.COMMA, pos);
            case '!':
                return single(TokenType.BANG, pos);
            case '=':
                return single(TokenType.ASSIGN, pos);
            case '@':
                return single(TokenType.AT, pos);
            case '/':
                if (regexMode) {
                    return readDelimited(TokenType.REGEX, '/', pos);
                }
                return single(TokenType.SLASH, pos);
            case '(':
                parenDepth++;
                return single(TokenType.LPAREN, pos);
            case ')':
                parenDepth = Math.max(0, parenDepth - 1);
                return single(TokenType.RPAREN, pos);
            case '{':
                braceDepth++;
                return single(TokenType.LBRACE, pos);
            case '}':
                braceDepth = Math.max(0, braceDepth - 1);
                return single(TokenType.RBRACE, pos);
            case '[':
                bracketDepth++;
                return single(TokenType.LBRACKET, pos);
            case ']':
                bracketDepth = Math.max(0, bracketDepth - 1);
                return single(TokenType.RBRACKET, pos);
            case '_':
                if (isIdentContinue(peekChar())) {
                    return readIdentifier(pos);
                }
                return single(TokenType.UNDERSCORE, pos);
            case '"':
                return readDelimited(TokenType.STRING, '"', pos);
            default:
                if (isDigit(current)) {
                    return readNumber(pos);
                }
                if (isIdentStart(current)) {
                    return readIdentifier(pos);
                }
                return single(TokenType.ILLEGAL, pos);
        }
    }

    private Token single(TokenType type, Position pos) {
        String literal = String.valueOf(current);
        readChar();
        return new Token(type, literal, pos);
    }

    private Token twoCharOperator(char second, TokenType type, Position pos) {
        if (peekChar() == second) {
            String literal = "" + current + second;
            readChar();
            readChar();
            return new Token(type, literal, pos);
        }
        return single(TokenType.ILLEGAL, pos);
    }

    private Token readIdentifier(Position pos) {
        int start = position;
        readChar();
        while (true) {
            if (isAlphaNumUnderscore(current)) {
                readChar();
            } else if (current == '-' && isAlphaNum(peekChar())) {
                readChar();
                readChar();
            } else {
                break;
            }
        }
        String literal = input.substring(start, position);
        return new Token(TokenType.lookupIdent(literal), literal, pos);
    }

    private Token readNumber(Position pos) {
        int start = position;
        while (isDigit(current)) {
            readChar();
        }
        return new Token(TokenType.INT, input.substring(start, position), pos);
    }

    /**
     * Reads a string or regex literal. The delimiters are not part of the literal; escape
     * sequences are kept verbatim. An unterminated literal stops at the end of the line.
     */
    private Token readDelimited(TokenType type, char delimiter, Position pos) {
        readChar();
        int start = position;
        while (current != delimiter && !atLineEnd()) {
            if (current == '\\') {
                readChar();
                if (atLineEnd()) {
                    break;
                }
            }
            readChar();
        }
        String literal = input.substring(start, position);
        if (current == delimiter) {
            readChar();
        }
        return new Token(type, literal, pos);
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            while (current == ' ' || current == '\t' || current == '\r') {
                readChar();
            }
            if (current == '#') {
                while (current != '\n' && current != END) {
                    readChar();
                }
                continue;
            }
            return;
        }
    }

    private void readChar() {
        current = readPosition >= input.length() ? END : input.charAt(readPosition);
        position = readPosition;
        readPosition++;
        column++;
    }

    private char peekChar() {
        return readPosition >= input.length() ? END : input.charAt(readPosition);
    }

    private boolean atLineEnd() {
        return current == '\n' || (current == END && position >= input.length());
    }

    private Position currentPosition() {
        return new Position(file, line, column);
    }

    private boolean insideBrackets() {
        return parenDepth > 0 || braceDepth > 0 || bracketDepth > 0;
    }

    private static boolean isIdentStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentContinue(char ch) {
        return isAlphaNumUnderscore(ch) || ch == '-';
    }

    private static boolean isAlphaNumUnderscore(char ch) {
        return isAlphaNum(ch) || ch == '_';
    }

    private static boolean isAlphaNum(char ch) {
        return Character.isLetterOrDigit(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
