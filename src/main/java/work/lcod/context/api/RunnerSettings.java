package work.lcod.context.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings applied to every run of a {@link Runner}.
 */
public record RunnerSettings(Optional<Duration> timeout) {
    public RunnerSettings {
        Objects.requireNonNull(timeout, "timeout");
        timeout = timeout.filter(value -> !value.isZero() && !value.isNegative());
    }

    public static RunnerSettings defaults() {
        return new RunnerSettings(Optional.empty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Optional<Duration> timeout = Optional.empty();

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout == null ? Optional.empty() : timeout;
            return this;
        }

        public Builder timeout(Duration timeout) {
            return timeout(Optional.ofNullable(timeout));
        }

        public RunnerSettings build() {
            return new RunnerSettings(timeout);
        }
    }
}
