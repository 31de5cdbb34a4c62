package io.github.cyfko.reverhttp.core.ast;

/**
 * Directive argument, named ({@code max-age: 60}) or positional ({@code public}).
 *
 * @param name  argument name, {@code null} for positional arguments
 * @param value argument value
 */
public record DirectiveArg(String name, ArgValue value) {

    public static final String NONE = "none";

    /**
     * @return the {@code none} sentinel argument
     */
    public static DirectiveArg none() {
        return new DirectiveArg(NONE, new ArgValue.Flag(true));
    }

    public boolean isPositional() {
        return name == null;
    }

    public boolean isNone() {
        return NONE.equals(name);
    }
}
