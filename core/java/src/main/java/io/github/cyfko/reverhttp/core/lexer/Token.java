package io.github.cyfko.reverhttp.core.lexer;

import java.util.Objects;

/**
 * A typed, positioned lexical token.
 *
 * @param type     token kind
 * @param literal  source text of the token (string and regex literals without their delimiters)
 * @param position location of the first character of the token
 * @author Frank KOSSI
 * @since 0.1.0
 */
public record Token(TokenType type, String literal, Position position) {

    public Token {
        Objects.requireNonNull(type, "token type cannot be null");
        Objects.requireNonNull(literal, "token literal cannot be null");
        Objects.requireNonNull(position, "token position cannot be null");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
