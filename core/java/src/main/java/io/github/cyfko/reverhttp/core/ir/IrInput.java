package io.github.cyfko.reverhttp.core.ir;

/**
 * Extraction of one request variable.
 *
 * @param from source expression, e.g. {@code path.id} or {@code header.x-role}
 */
public record IrInput(String from) {
}
