package io.github.cyfko.reverhttp.core.ir;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Three-state CORS field of a route.
 * <ul>
 *   <li>{@link #INHERIT}: no {@code cors} directive on the route; the field is omitted.</li>
 *   <li>{@link #DISABLED}: {@code cors(none)}; the field is written as a literal {@code null}.</li>
 *   <li>{@link #of(IrCors)}: an explicit configuration; the field is written as an object.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class CorsSetting {

    public static final CorsSetting INHERIT = new CorsSetting(State.INHERIT, null);
    public static final CorsSetting DISABLED = new CorsSetting(State.DISABLED, null);

    public enum State { INHERIT, DISABLED, CONFIGURED }

    private final State state;
    private final IrCors config;

    private CorsSetting(State state, IrCors config) {
        this.state = state;
        this.config = config;
    }

    public static CorsSetting of(IrCors config) {
        return new CorsSetting(State.CONFIGURED, Objects.requireNonNull(config, "cors config cannot be null"));
    }

    public State state() {
        return state;
    }

    /**
     * @return the configuration, {@code null} unless {@link State#CONFIGURED}
     */
    @JsonValue
    public IrCors config() {
        return config;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorsSetting)) return false;
        CorsSetting that = (CorsSetting) o;
        return state == that.state && Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, config);
    }

    @Override
    public String toString() {
        return state == State.CONFIGURED ? "CorsSetting[" + config + "]" : "CorsSetting[" + state + "]";
    }

    /**
     * Serialization filter excluding the {@link #INHERIT} state.
     */
    public static final class InheritFilter {

        @Override
        public boolean equals(Object other) {
            return other == null || INHERIT.equals(other);
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }
}
