package io.github.cyfko.reverhttp.core.ast;

import java.util.List;

/**
 * Pattern of a match arm.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface MatchPattern
        permits MatchPattern.Literal, MatchPattern.Multi, MatchPattern.Range, MatchPattern.Regex, MatchPattern.Wildcard {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over pattern variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitMulti(Multi multi);

        R visitRange(Range range);

        R visitRegex(Regex regex);

        R visitWildcard(Wildcard wildcard);
    }

    /** Single string, integer or bare identifier ({@code true}, {@code null}, ...), kept as text. */
    record Literal(String value) implements MatchPattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /** {@code "user", "member"}: any of the listed strings. */
    record Multi(List<String> values) implements MatchPattern {
        public Multi {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMulti(this);
        }
    }

    /** {@code 200..299}, bounds inclusive, kept as digit runs. */
    record Range(String min, String max) implements MatchPattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    /** {@code /^admin-/}, source without its slashes. */
    record Regex(String source) implements MatchPattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegex(this);
        }
    }

    /** {@code _}: the default arm. */
    record Wildcard() implements MatchPattern {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWildcard(this);
        }
    }
}
