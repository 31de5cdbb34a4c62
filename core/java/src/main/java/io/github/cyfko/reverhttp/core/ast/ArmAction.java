package io.github.cyfko.reverhttp.core.ast;

/**
 * Action of a match arm.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface ArmAction permits ArmAction.Invoke, ArmAction.Reference, ArmAction.ErrorOnly, ArmAction.Empty {

    enum Kind { INVOKE, REFERENCE, ERROR_ONLY, EMPTY }

    Kind kind();

    /** The arm calls a package: {@code "admin": fetch(Admin, id)}. */
    record Invoke(PackageCall call) implements ArmAction {
        @Override
        public Kind kind() {
            return Kind.INVOKE;
        }
    }

    /** The arm yields an existing variable: {@code true: cached}. */
    record Reference(String variable) implements ArmAction {
        @Override
        public Kind kind() {
            return Kind.REFERENCE;
        }
    }

    /** The arm only fails: {@code _: ~> 403}. The error flow sits on the arm. */
    record ErrorOnly() implements ArmAction {
        @Override
        public Kind kind() {
            return Kind.ERROR_ONLY;
        }
    }

    /** Nothing could be read after the colon. */
    record Empty() implements ArmAction {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }
    }
}
