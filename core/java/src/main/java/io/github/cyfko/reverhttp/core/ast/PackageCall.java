package io.github.cyfko.reverhttp.core.ast;

import java.util.List;

/**
 * Call of an imported package, as a pipeline step or as a match arm action:
 * {@code fetch(User, id)}, {@code create(User, { name, email })},
 * {@code redis-cache(key: "user:{id}")}.
 *
 * @param packageAlias import alias of the called package
 * @param args         arguments in source order
 */
public record PackageCall(String packageAlias, List<PackageArg> args) implements StepBody {

    public PackageCall {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPackageCall(this);
    }
}
