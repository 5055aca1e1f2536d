package com.nodeflow.engine;

import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Immutable engine settings.
 *
 * Settings can be built in code with {@link #builder()} or read from a
 * {@link Properties} source with {@link #fromProperties(Properties)}:
 *
 * - nodeflow.controlflow.maxSteps: maximum node evaluations per control-flow
 * run (default 10000).
 * - nodeflow.controlflow.failOnStepLimit: report hitting the bound as a
 * failure instead of a truncated run (default false).
 * - nodeflow.dataflow.requireMainNode: refuse data-flow runs without a
 * confirmed sink main node (default false).
 */
public final class EngineConfig {

    public static final String MAX_STEPS = "nodeflow.controlflow.maxSteps";
    public static final String FAIL_ON_STEP_LIMIT = "nodeflow.controlflow.failOnStepLimit";
    public static final String REQUIRE_MAIN_NODE = "nodeflow.dataflow.requireMainNode";

    public static final int DEFAULT_MAX_STEPS = 10_000;

    private static final EngineConfig DEFAULTS = builder().build();

    private final int maxSteps;
    private final boolean failOnStepLimit;
    private final boolean requireMainNode;
    private final Executor executor;

    private EngineConfig(Builder b) {
        this.maxSteps = b.maxSteps;
        this.failOnStepLimit = b.failOnStepLimit;
        this.requireMainNode = b.requireMainNode;
        this.executor = b.executor;
    }

    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads settings from {@code props}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range.
     */
    public static EngineConfig fromProperties(Properties props) {
        Builder b = builder();
        String maxSteps = props.getProperty(MAX_STEPS);
        if (maxSteps != null) {
            try {
                b.maxSteps(Integer.parseInt(maxSteps.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + MAX_STEPS + ": " + maxSteps, e);
            }
        }
        String failOnLimit = props.getProperty(FAIL_ON_STEP_LIMIT);
        if (failOnLimit != null) {
            b.failOnStepLimit(parseBoolean(FAIL_ON_STEP_LIMIT, failOnLimit));
        }
        String requireMain = props.getProperty(REQUIRE_MAIN_NODE);
        if (requireMain != null) {
            b.requireMainNode(parseBoolean(REQUIRE_MAIN_NODE, requireMain));
        }
        return b.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Invalid " + key + ": " + value);
    }

    public int maxSteps() {
        return maxSteps;
    }

    public boolean failOnStepLimit() {
        return failOnStepLimit;
    }

    public boolean requireMainNode() {
        return requireMainNode;
    }

    /** Executor used by the asynchronous entry points. */
    public Executor executor() {
        return executor;
    }

    public Builder toBuilder() {
        return builder()
                .maxSteps(maxSteps)
                .failOnStepLimit(failOnStepLimit)
                .requireMainNode(requireMainNode)
                .executor(executor);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EngineConfig[maxSteps=" + maxSteps + ", failOnStepLimit=" + failOnStepLimit
                + ", requireMainNode=" + requireMainNode + "]";
    }

    public static final class Builder {
        private int maxSteps = DEFAULT_MAX_STEPS;
        private boolean failOnStepLimit;
        private boolean requireMainNode;
        private Executor executor = ForkJoinPool.commonPool();

        public Builder maxSteps(int maxSteps) {
            if (maxSteps < 1)
                throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder failOnStepLimit(boolean failOnStepLimit) {
            this.failOnStepLimit = failOnStepLimit;
            return this;
        }

        public Builder requireMainNode(boolean requireMainNode) {
            this.requireMainNode = requireMainNode;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
