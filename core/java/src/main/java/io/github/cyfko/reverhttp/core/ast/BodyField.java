package io.github.cyfko.reverhttp.core.ast;

/**
 * {@code key: value} entry of a response body, response headers or error body. The value is a
 * string literal or a dotted path such as {@code user.id}.
 */
public record BodyField(String key, String value) {
}
