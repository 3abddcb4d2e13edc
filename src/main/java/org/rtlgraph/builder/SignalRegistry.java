package org.rtlgraph.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-module index from signal name to the architecture nodes that use it.
 *
 * <p>Signals keep the order in which they were first registered; bindings of a signal keep
 * their registration order and are deduplicated.</p>
 */
public final class SignalRegistry {

    private final Map<String, List<SignalBinding>> bySignal = new LinkedHashMap<>();

    /**
     * Records that a node uses a signal in the given direction. Registering the same binding
     * twice has no effect.
     */
    public void register(String signal, int nodeId, BindingDirection direction) {
        if (signal == null || signal.isEmpty()) {
            return;
        }
        List<SignalBinding> bindings = bySignal.computeIfAbsent(signal, k -> new ArrayList<>());
        SignalBinding binding = new SignalBinding(nodeId, direction);
        if (!bindings.contains(binding)) {
            bindings.add(binding);
        }
    }

    public Set<String> signals() {
        return Collections.unmodifiableSet(bySignal.keySet());
    }

    public List<SignalBinding> bindingsOf(String signal) {
        return Collections.unmodifiableList(bySignal.getOrDefault(signal, List.of()));
    }
}
