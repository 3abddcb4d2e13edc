package org.rtlgraph.builder;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.rtlgraph.graph.GraphModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a module's signal registry into architecture edges.
 *
 * <p>A signal with at least one driver yields one edge per (driver, receiver) pair, inout
 * bindings counting as receivers; self-loops are dropped. A signal used by several nodes
 * without any driver is chained through its distinct node ids in ascending order, which is a
 * best guess rather than a resolved direction. Signals matching the ignore patterns (clocks and
 * resets by default) are never wired. Signals sharing the same ordered node pair are merged into
 * one bus connection.</p>
 */
public final class ConnectionResolver {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");

    private final List<String> ignoredPatterns;

    public ConnectionResolver(List<String> ignoredPatterns) {
        this.ignoredPatterns = ignoredPatterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Resolves all connections of a registry.
     *
     * @param registry The module's signal registry.
     * @return The connections in the order their first signal was registered.
     */
    public List<Connection> resolve(SignalRegistry registry) {
        Map<Long, List<String>> byPair = new LinkedHashMap<>();
        for (String signal : registry.signals()) {
            if (isIgnored(signal)) {
                continue;
            }
            List<SignalBinding> bindings = registry.bindingsOf(signal);
            List<SignalBinding> drivers = new ArrayList<>();
            List<SignalBinding> receivers = new ArrayList<>();
            for (SignalBinding binding : bindings) {
                if (binding.direction() == BindingDirection.DRIVER) {
                    drivers.add(binding);
                } else {
                    receivers.add(binding);
                }
            }

            if (!drivers.isEmpty()) {
                for (SignalBinding driver : drivers) {
                    for (SignalBinding receiver : receivers) {
                        if (driver.nodeId() != receiver.nodeId()) {
                            addSignal(byPair, driver.nodeId(), receiver.nodeId(), signal);
                        }
                    }
                }
            } else if (bindings.size() >= 2) {
                IntSortedSet nodeIds = new IntAVLTreeSet();
                for (SignalBinding binding : bindings) {
                    nodeIds.add(binding.nodeId());
                }
                IntIterator it = nodeIds.iterator();
                int previous = it.nextInt();
                while (it.hasNext()) {
                    int next = it.nextInt();
                    addSignal(byPair, previous, next, signal);
                    previous = next;
                }
            }
        }

        List<Connection> connections = new ArrayList<>(byPair.size());
        for (Map.Entry<Long, List<String>> entry : byPair.entrySet()) {
            long key = entry.getKey();
            connections.add(new Connection((int) (key >>> 32), (int) key, entry.getValue()));
        }
        return connections;
    }

    /**
     * Resolves the registry and adds one control edge per connection to the architecture graph.
     *
     * @return The number of edges added.
     */
    public int apply(SignalRegistry registry, GraphModel architecture) {
        List<Connection> connections = resolve(registry);
        for (Connection connection : connections) {
            architecture.addCfgEdge(connection.source(), connection.target(), connection.label());
        }
        return connections.size();
    }

    /**
     * Whether a signal is excluded from wiring.
     *
     * <p>The name is split into tokens at non-alphanumeric characters. A token matches a pattern
     * when it starts with it ({@code clk_i}, {@code rstn}) or is the pattern behind a single
     * prefix letter ({@code nrst}, {@code aclk}). Longer words that merely contain a pattern, like
     * {@code first} or {@code burst}, do not match.</p>
     */
    public boolean isIgnored(String signal) {
        for (String token : TOKEN_SEPARATOR.split(signal.toLowerCase(Locale.ROOT))) {
            for (String pattern : ignoredPatterns) {
                if (token.startsWith(pattern)
                        || (token.endsWith(pattern) && token.length() <= pattern.length() + 1)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void addSignal(Map<Long, List<String>> byPair, int source, int target, String signal) {
        long key = ((long) source << 32) | (target & 0xFFFFFFFFL);
        List<String> signals = byPair.computeIfAbsent(key, k -> new ArrayList<>());
        if (!signals.contains(signal)) {
            signals.add(signal);
        }
    }
}
