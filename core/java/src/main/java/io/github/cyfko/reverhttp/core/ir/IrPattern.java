package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Lowered match patterns.
 * <ul>
 *   <li>{@link Value}: {@code {"value": v}} where {@code v} is an integer, boolean, string or {@code null}</li>
 *   <li>{@link In}: {@code {"in": [...]}}, values kept as strings</li>
 *   <li>{@link Range}: {@code {"range": {"min": a, "max": b}}}, bounds inclusive</li>
 *   <li>{@link Regex}: {@code {"regex": source}}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public sealed interface IrPattern permits IrPattern.Value, IrPattern.In, IrPattern.Range, IrPattern.Regex {

    record Value(@JsonInclude(JsonInclude.Include.ALWAYS) Object value) implements IrPattern {
    }

    record In(List<String> in) implements IrPattern {
        public In {
            in = Copies.list(in);
        }
    }

    record Range(Bounds range) implements IrPattern {

        public static Range of(int min, int max) {
            return new Range(new Bounds(min, max));
        }

        @JsonPropertyOrder({"min", "max"})
        public record Bounds(int min, int max) {
        }
    }

    record Regex(String regex) implements IrPattern {
    }
}
