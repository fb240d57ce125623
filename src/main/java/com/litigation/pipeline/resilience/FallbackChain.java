package com.litigation.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Ordered list of named strategies tried one after another until one produces a value.
 *
 * <p>A strategy declines by returning an empty {@link Optional}. A strategy that throws a
 * {@link RuntimeException} is recorded as failed and the chain moves on, unless its type was
 * registered with {@link Builder#propagate(Class)}. The order of the strategies is the
 * fallback order.</p>
 *
 * @param <T> result type
 */
public final class FallbackChain<T> {
    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final String name;
    private final List<Strategy<T>> strategies;
    private final List<Class<? extends RuntimeException>> propagated;

    private FallbackChain(Builder<T> builder) {
        this.name = builder.name;
        this.strategies = List.copyOf(builder.strategies);
        this.propagated = List.copyOf(builder.propagated);
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(Strategy::name).collect(Collectors.toList());
    }

    /**
     * Runs the strategies in order.
     *
     * @return the first value produced, with the name of the strategy that produced it and
     *         the attempts made before it
     */
    public Outcome<T> execute() {
        List<Attempt> attempts = new ArrayList<>();
        for (Strategy<T> strategy : strategies) {
            try {
                Optional<T> value = strategy.body().get();
                if (value.isPresent()) {
                    attempts.add(new Attempt(strategy.name(), true, null));
                    return new Outcome<>(value.get(), strategy.name(), attempts);
                }
                attempts.add(new Attempt(strategy.name(), false, "declined"));
            } catch (RuntimeException e) {
                if (isPropagated(e)) {
                    throw e;
                }
                log.warn("fallback.strategy.failed chain={} strategy={} error={}", name, strategy.name(),
                        e.toString());
                attempts.add(new Attempt(strategy.name(), false, e.toString()));
            }
        }
        return new Outcome<>(null, null, attempts);
    }

    private boolean isPropagated(RuntimeException e) {
        for (Class<? extends RuntimeException> type : propagated) {
            if (type.isInstance(e)) {
                return true;
            }
        }
        return false;
    }

    public record Strategy<T>(String name, Supplier<Optional<T>> body) {
        public Strategy {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(body, "body is required");
        }
    }

    /**
     * @param succeeded whether this strategy produced the value
     * @param detail    why the strategy did not produce a value, null on success
     */
    public record Attempt(String strategy, boolean succeeded, String detail) {
    }

    /**
     * @param value    the produced value, null when every strategy declined or failed
     * @param strategy name of the producing strategy, null when none produced a value
     */
    public record Outcome<T>(T value, String strategy, List<Attempt> attempts) {
        public Outcome {
            attempts = List.copyOf(attempts);
        }

        public boolean isPresent() {
            return value != null;
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Strategy<T>> strategies = new ArrayList<>();
        private final List<Class<? extends RuntimeException>> propagated = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> then(String strategyName, Supplier<Optional<T>> body) {
            strategies.add(new Strategy<>(strategyName, body));
            return this;
        }

        /**
         * Exceptions of this type abort the chain instead of moving on to the next strategy.
         */
        public Builder<T> propagate(Class<? extends RuntimeException> type) {
            propagated.add(type);
            return this;
        }

        public FallbackChain<T> build() {
            if (strategies.isEmpty()) {
                throw new IllegalStateException("Fallback chain '" + name + "' has no strategies");
            }
            return new FallbackChain<>(this);
        }
    }
}
