package org.pragmatica.wikitext.preprocess;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pipeline configuration options.
 *
 * @param typography apply typographic quote and ellipsis substitutions
 * @param macros     values for {@code {$name}} macros, overriding the built-in date and time macros
 * @param clock      source of the current date and time for the built-in macros
 */
public record PipelineConfig(
    boolean typography,
    Map<String, String> macros,
    Clock clock
) {
    public static final PipelineConfig DEFAULT = new PipelineConfig(
        true,
        Map.of(),
        Clock.systemDefaultZone()
    );

    public PipelineConfig {
        macros = Map.copyOf(macros);
        Objects.requireNonNull(clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean typography = DEFAULT.typography();
        private final Map<String, String> macros = new LinkedHashMap<>();
        private Clock clock = DEFAULT.clock();

        private Builder() {}

        public Builder typography(boolean enabled) {
            this.typography = enabled;
            return this;
        }

        public Builder macro(String name, String value) {
            macros.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder macros(Map<String, String> values) {
            values.forEach(this::macro);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(typography, macros, clock);
        }
    }
}
