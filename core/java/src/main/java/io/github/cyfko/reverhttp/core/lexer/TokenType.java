package io.github.cyfko.reverhttp.core.lexer;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Vocabulary of token kinds produced by the {@link Lexer}.
 * <p>
 * Every constant carries the label used in diagnostics: symbolic tokens display their
 * symbol ({@code |>}, {@code ~>}, ...), literal classes their upper-case class name
 * ({@code IDENT}, {@code INT}, ...) and keywords their source spelling.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public enum TokenType {

    // Special
    ILLEGAL("ILLEGAL"),
    EOF("EOF"),
    NEWLINE("NEWLINE"),

    // Literals
    IDENT("IDENT"),
    INT("INT"),
    STRING("STRING"),
    REGEX("REGEX"),

    // Operators and delimiters
    PIPE("|>"),
    ERROR("~>"),
    AMPERSAND("&"),
    RANGE(".."),
    COLON(":"),
    COMMA(","),
    DOT("."),
    BANG("!"),
    ASSIGN("="),
    AT("@"),
    SLASH("/"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    UNDERSCORE("_"),

    // Keywords
    IMPORT("import"),
    TYPE("type"),
    DEFAULTS("defaults"),
    AS("as"),
    MATCH("match"),
    GUARD("guard"),
    RESPOND("respond"),
    INPUT("input"),
    VALIDATE("validate"),
    TRANSFORM("transform"),
    WITH("with"),
    HEADERS("headers"),
    CACHE("cache"),
    CORS("cors"),
    AUTH("auth"),
    NONE("none"),

    // HTTP methods
    GET("GET"),
    POST("POST"),
    PUT("PUT"),
    DELETE("DELETE"),
    PATCH("PATCH"),
    HEAD("HEAD"),
    OPTIONS("OPTIONS");

    private static final Set<TokenType> HTTP_METHODS = EnumSet.of(GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS);

    private static final Set<TokenType> DIRECTIVES = EnumSet.of(CACHE, CORS, AUTH);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : EnumSet.range(IMPORT, OPTIONS)) {
            KEYWORDS.put(type.label, type);
        }
    }

    private final String label;

    TokenType(String label) {
        this.label = label;
    }

    /**
     * Resolves identifier text to its keyword type.
     * <p>
     * Hyphenated identifiers never match since no keyword contains a hyphen.
     * </p>
     *
     * @param identifier identifier text as read from source
     * @return the keyword type, or {@link #IDENT} when the text is not reserved
     */
    public static TokenType lookupIdent(String identifier) {
        return KEYWORDS.getOrDefault(identifier, IDENT);
    }

    public boolean isHttpMethod() {
        return HTTP_METHODS.contains(this);
    }

    public boolean isDirective() {
        return DIRECTIVES.contains(this);
    }

    public boolean isKeyword() {
        return compareTo(IMPORT) >= 0;
    }

    /**
     * @return whether the token reads as a name: a plain identifier or a reserved word
     */
    public boolean isWord() {
        return this == IDENT || isKeyword();
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
