package org.rtlgraph.graph;

import java.util.List;

/**
 * Label of a control-flow or architecture edge.
 *
 * <p>Either nothing, a single text (branch tag, case value or signal name) or a bus: the list of
 * signal names carried between the same pair of architecture nodes.</p>
 */
public sealed interface EdgeLabel permits EdgeLabel.None, EdgeLabel.Text, EdgeLabel.Bus {

    EdgeLabel NONE = new None();

    static EdgeLabel none() {
        return NONE;
    }

    static EdgeLabel of(String text) {
        return text == null || text.isEmpty() ? NONE : new Text(text);
    }

    static EdgeLabel bus(List<String> signals) {
        return new Bus(signals);
    }

    /**
     * The names carried by this label: empty, one entry, or the bus members.
     */
    List<String> values();

    record None() implements EdgeLabel {
        @Override
        public List<String> values() {
            return List.of();
        }
    }

    record Text(String text) implements EdgeLabel {
        @Override
        public List<String> values() {
            return List.of(text);
        }
    }

    record Bus(List<String> signals) implements EdgeLabel {
        public Bus {
            signals = List.copyOf(signals);
        }

        @Override
        public List<String> values() {
            return signals;
        }
    }
}
