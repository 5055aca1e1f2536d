package com.nodeflow;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

import java.util.List;

/** Small node types shared by the tests. */
public final class TestNodes {
    private TestNodes() {
    }

    /** No pins, no behaviour. */
    public static class Plain extends Node {
        public Plain() {
        }

        public Plain(String name) {
            super(name);
        }
    }

    /** Data source: output {@code y} set to a fixed value on each run. */
    public static class Source extends Node {
        public final Pin y;
        private final Object value;
        public int runs;

        public Source(String name, Object value) {
            super(name);
            this.value = value;
            this.y = addOutputPin("y", Integer.class);
        }

        @Override
        protected void onExecute() {
            runs++;
            y.setValue(value);
        }
    }

    /** {@code y = x + 1}; x defaults to 0. */
    public static class PlusOne extends Node {
        public final Pin x;
        public final Pin y;
        public int runs;

        public PlusOne(String name) {
            super(name);
            this.x = addInputPin("x", Integer.class, 0);
            this.y = addOutputPin("y", Integer.class);
        }

        @Override
        protected void onExecute() {
            runs++;
            Object v = x.getValue();
            y.setValue((v == null ? 0 : (Integer) v) + 1);
        }
    }

    /** Flow step appending its name to a shared log. Optionally throws. */
    public static class Step extends Node {
        public final Pin in;
        public final Pin out;
        private final List<String> log;
        private final boolean fail;

        public Step(String name, List<String> log) {
            this(name, log, false);
        }

        public Step(String name, List<String> log, boolean fail) {
            super(name);
            this.log = log;
            this.fail = fail;
            this.in = addFlowInput("In");
            this.out = addFlowOutput("Out");
        }

        @Override
        protected void onExecute() {
            log.add(getName());
            if (fail)
                throw new IllegalStateException("boom in " + getName());
        }
    }

    /** Flow entry with two outputs fired in declaration order. */
    public static class Fork extends Node {
        public final Pin first;
        public final Pin second;
        private final List<String> log;

        public Fork(String name, List<String> log) {
            super(name);
            this.log = log;
            this.first = addFlowOutput("First");
            this.second = addFlowOutput("Second");
        }

        @Override
        protected void onExecute() {
            log.add(getName());
        }
    }
}
