package org.rtlgraph.builder;

import org.rtlgraph.graph.EdgeLabel;

import java.util.List;

/**
 * A resolved architecture-level connection between two nodes.
 *
 * @param source  The driving node.
 * @param target  The receiving node.
 * @param signals The signals carried, in first-seen order; more than one makes a bus.
 */
public record Connection(int source, int target, List<String> signals) {

    public Connection {
        signals = List.copyOf(signals);
    }

    /**
     * The edge label: the signal name, or a bus label when several signals share the node pair.
     */
    public EdgeLabel label() {
        return signals.size() == 1 ? EdgeLabel.of(signals.get(0)) : EdgeLabel.bus(signals);
    }
}
