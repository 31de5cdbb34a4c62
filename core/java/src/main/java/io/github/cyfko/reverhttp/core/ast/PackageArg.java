package io.github.cyfko.reverhttp.core.ast;

import java.util.List;

/**
 * Argument of a package call.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface PackageArg
        permits PackageArg.Named, PackageArg.TypeRef, PackageArg.Positional, PackageArg.ObjectShorthand {

    /**
     * Discriminator for exhaustive {@code switch} over argument kinds.
     */
    enum Kind { NAMED, TYPE_REF, POSITIONAL, OBJECT_SHORTHAND }

    Kind kind();

    /** {@code key: value} */
    record Named(String name, String value) implements PackageArg {
        @Override
        public Kind kind() {
            return Kind.NAMED;
        }
    }

    /** Positional identifier starting with an upper-case letter, e.g. {@code User}. */
    record TypeRef(String typeName) implements PackageArg {
        @Override
        public Kind kind() {
            return Kind.TYPE_REF;
        }
    }

    /** Any other positional value: identifier, integer or string. */
    record Positional(String value) implements PackageArg {
        @Override
        public Kind kind() {
            return Kind.POSITIONAL;
        }
    }

    /** {@code { name, email }} */
    record ObjectShorthand(List<String> fields) implements PackageArg {
        public ObjectShorthand {
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT_SHORTHAND;
        }
    }
}
