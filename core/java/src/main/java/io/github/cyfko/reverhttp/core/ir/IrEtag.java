package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entity tag source: a dotted path written as a plain string, or a function applied to a variable
 * written as {@code {"fn": ..., "from": ...}}.
 */
public sealed interface IrEtag permits IrEtag.Path, IrEtag.Function {

    record Path(String path) implements IrEtag {
        @Override
        @JsonValue
        public String path() {
            return path;
        }
    }

    @JsonPropertyOrder({"fn", "from"})
    record Function(@JsonProperty("fn") String function, @JsonProperty("from") String source) implements IrEtag {
    }
}
