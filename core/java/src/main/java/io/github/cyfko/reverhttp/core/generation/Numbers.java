package io.github.cyfko.reverhttp.core.generation;

/**
 * Lenient integer parsing for lowering.
 */
final class Numbers {

    private Numbers() {
    }

    /**
     * @return the parsed value, or {@code null} when the text is not a valid {@code int}
     */
    static Integer parseInt(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static int parseIntOrZero(String text) {
        Integer value = parseInt(text);
        return value == null ? 0 : value;
    }
}
