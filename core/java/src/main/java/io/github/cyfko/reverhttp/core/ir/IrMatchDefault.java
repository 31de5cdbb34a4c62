package io.github.cyfko.reverhttp.core.ir;

/**
 * The three shapes of a default arm: {@code {"error": ...}}, {@code {"ref": ...}}, or a full
 * {@link IrMatchArm} without pattern.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface IrMatchDefault permits IrMatchDefault.ErrorOnly, IrMatchDefault.Reference, IrMatchArm {

    record ErrorOnly(IrErrorResponse error) implements IrMatchDefault {
    }

    record Reference(String ref) implements IrMatchDefault {
    }
}
