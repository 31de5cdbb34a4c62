package io.github.cyfko.reverhttp.core.ir;

/**
 * A step of the {@code process} section: package call, guard or match.
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface IrProcessStep permits IrPackageStep, IrGuardStep, IrMatchStep {

    /**
     * @return the response sent when the step fails, or {@code null}
     */
    IrErrorResponse error();
}
