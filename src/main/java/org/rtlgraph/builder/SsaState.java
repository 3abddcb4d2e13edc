package org.rtlgraph.builder;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.HashMap;
import java.util.Map;

/**
 * Static-single-assignment versioning for the variables of one module.
 *
 * <p>Each write to a variable gets the next version, named {@code <var>_<n>}. A variable that
 * was never written reads as its bare name, which is how module inputs and other free
 * variables appear in the data-flow graph.</p>
 */
public final class SsaState {

    private final Object2IntOpenHashMap<String> versions = new Object2IntOpenHashMap<>();
    private final Map<String, String> latest = new HashMap<>();

    /**
     * Allocates the next version of a variable and records it as the latest.
     *
     * @param variable The bare variable name.
     * @return The qualified name, e.g. {@code count_2}.
     */
    public String newVersion(String variable) {
        int version = versions.addTo(variable, 1) + 1;
        String qualified = variable + "_" + version;
        latest.put(variable, qualified);
        return qualified;
    }

    /**
     * Returns the latest qualified name of a variable, or the bare name if it was never written.
     */
    public String latest(String variable) {
        return latest.getOrDefault(variable, variable);
    }

    /**
     * Returns the current version of a variable, 0 if it was never written.
     */
    public int version(String variable) {
        return versions.getInt(variable);
    }

    public void reset() {
        versions.clear();
        latest.clear();
    }
}
