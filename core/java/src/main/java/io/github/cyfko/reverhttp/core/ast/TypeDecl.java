package io.github.cyfko.reverhttp.core.ast;

import io.github.cyfko.reverhttp.core.lexer.Position;

import java.util.List;

/**
 * {@code type User { id: int, name: string }}
 *
 * @param position location of the {@code type} keyword
 * @param name     type name
 * @param fields   fields in declaration order
 */
public record TypeDecl(Position position, String name, List<Field> fields) {

    public TypeDecl {
        fields = List.copyOf(fields);
    }

    /**
     * A field of a type declaration. Field types are plain names, not checked structurally.
     *
     * @param name     field name
     * @param typeName declared type name
     */
    public record Field(String name, String typeName) {
    }
}
