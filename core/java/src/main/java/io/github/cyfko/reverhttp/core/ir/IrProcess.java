package io.github.cyfko.reverhttp.core.ir;

import java.util.List;

/**
 * Ordered processing steps of a route.
 */
public record IrProcess(List<IrProcessStep> steps) {

    public IrProcess {
        steps = Copies.list(steps);
    }
}
