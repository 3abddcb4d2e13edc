package org.rtlgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All graphs built for one module: the architecture graph and the detail graphs it links to.
 */
public class DesignHierarchy {

    private final String moduleName;
    private final GraphModel architecture;
    private final Map<String, GraphModel> detailGraphs = new LinkedHashMap<>();

    public DesignHierarchy(String moduleName, GraphModel architecture) {
        this.moduleName = moduleName;
        this.architecture = architecture;
    }

    public String getModuleName() {
        return moduleName;
    }

    public GraphModel getArchitecture() {
        return architecture;
    }

    /**
     * Registers a detail graph under its sub-graph key.
     *
     * @throws IllegalArgumentException if the key is already taken.
     */
    public void addDetailGraph(String key, GraphModel graph) {
        if (detailGraphs.putIfAbsent(key, graph) != null) {
            throw new IllegalArgumentException("Duplicate sub-graph key: " + key);
        }
    }

    public GraphModel getDetailGraph(String key) {
        return detailGraphs.get(key);
    }

    /**
     * Detail graphs keyed by sub-graph key, in creation order.
     */
    public Map<String, GraphModel> getDetailGraphs() {
        return Collections.unmodifiableMap(detailGraphs);
    }
}
