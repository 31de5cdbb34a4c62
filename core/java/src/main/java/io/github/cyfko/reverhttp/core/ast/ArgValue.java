package io.github.cyfko.reverhttp.core.ast;

import java.util.List;

/**
 * Value of a directive argument or of a validation constraint argument.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface ArgValue
        permits ArgValue.Text, ArgValue.Int, ArgValue.Ident, ArgValue.StringList, ArgValue.Call, ArgValue.Flag, ArgValue.Missing {

    /**
     * Scalar rendering of the value: the text of strings, digits of integers, the dotted path of
     * identifiers, {@code fn(arg)} for calls and an empty string for lists and missing values.
     *
     * @return the scalar text, never {@code null}
     */
    String text();

    /** Double-quoted string literal, without its quotes. */
    record Text(String value) implements ArgValue {
        @Override
        public String text() {
            return value;
        }
    }

    /** Integer literal, kept as its digit run. */
    record Int(String digits) implements ArgValue {
        @Override
        public String text() {
            return digits;
        }
    }

    /** Bare identifier or dotted path such as {@code public} or {@code user.updated_at}. */
    record Ident(String path) implements ArgValue {
        @Override
        public String text() {
            return path;
        }
    }

    /** Bracketed list such as {@code ["GET", "POST"]}. */
    record StringList(List<String> items) implements ArgValue {
        public StringList {
            items = List.copyOf(items);
        }

        @Override
        public String text() {
            return "";
        }
    }

    /** Single-argument function call such as {@code hash(user)}. */
    record Call(String function, String argument) implements ArgValue {
        @Override
        public String text() {
            return function + "(" + argument + ")";
        }
    }

    /** Flag set by a bare keyword, used by the {@code none} sentinel. */
    record Flag(boolean value) implements ArgValue {
        @Override
        public String text() {
            return String.valueOf(value);
        }
    }

    /** Placeholder for a value the parser could not read. */
    record Missing() implements ArgValue {
        @Override
        public String text() {
            return "";
        }
    }
}
