package io.github.cyfko.reverhttp.core.ast;

import java.util.List;

/**
 * Closed set of pipeline step variants.
 * <p>
 * Dispatch goes through {@link Visitor}: adding a variant breaks every visitor at compile time
 * instead of being silently dropped by a lowering pass.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface StepBody
        permits StepBody.Input, StepBody.Validate, StepBody.Transform, StepBody.Guard,
                StepBody.Match, PackageCall, StepBody.Respond {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over step variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitInput(Input input);

        R visitValidate(Validate validate);

        R visitTransform(Transform transform);

        R visitGuard(Guard guard);

        R visitMatch(Match match);

        R visitPackageCall(PackageCall call);

        R visitRespond(Respond respond);
    }

    /** {@code input(id: path.id, name: body.name)} */
    record Input(List<Field> fields) implements StepBody {
        public Input {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInput(this);
        }

        /**
         * @param name   variable receiving the value
         * @param source source expression such as {@code path.id} or {@code header.x-role}
         */
        public record Field(String name, String source) {
        }
    }

    /** {@code validate(id: int & min(1), email: string & format(email))} */
    record Validate(List<Rule> rules) implements StepBody {
        public Validate {
            rules = List.copyOf(rules);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitValidate(this);
        }

        /**
         * Constraints of one field, logically ANDed.
         */
        public record Rule(String field, List<Constraint> constraints) {
            public Rule {
                constraints = List.copyOf(constraints);
            }
        }

        /**
         * {@code min(1)}, {@code format(email)} or a bare type name such as {@code int}.
         */
        public record Constraint(String name, List<ArgValue> args) {
            public Constraint {
                args = List.copyOf(args);
            }
        }
    }

    /** {@code transform(id: int(id), name: trim(name))} */
    record Transform(List<Field> fields) implements StepBody {
        public Transform {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTransform(this);
        }

        /**
         * @param name     variable receiving the result
         * @param function cast or function name
         * @param source   source variable, {@code null} when no argument list was written
         */
        public record Field(String name, String function, String source) {
        }
    }

    /** {@code guard !user.banned} */
    record Guard(boolean negated, String expression) implements StepBody {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGuard(this);
        }
    }

    /** {@code match user.role { "admin": ..., _: ~> 403 }} */
    record Match(String scrutinee, List<MatchArm> arms) implements StepBody {
        public Match {
            arms = List.copyOf(arms);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    /** {@code respond 200 { id: user.id } with headers { x-total: count }} */
    record Respond(String status, List<BodyField> body, List<BodyField> headers) implements StepBody {
        public Respond {
            body = List.copyOf(body);
            headers = List.copyOf(headers);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRespond(this);
        }
    }
}
