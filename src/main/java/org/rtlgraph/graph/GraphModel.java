package org.rtlgraph.graph;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Container for one graph unit: the architecture graph of a module or the detail graph of a
 * single procedural block.
 *
 * <p>Nodes live in dense, append-only tables and are referenced by index. The model holds
 * control-flow nodes and edges, clusters, per-node annotations and the data-flow graph. It is
 * populated once by a single builder and read afterwards; it is not thread-safe.</p>
 */
public class GraphModel {

    private static final int NO_CLUSTER = -1;

    private final String name;

    // --- Control flow ---
    private final List<String> cfgLabels = new ArrayList<>();
    private final List<CfgEdge> cfgEdges = new ArrayList<>();
    private final Int2IntOpenHashMap nodeToCluster = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap lineNumbers = new Int2IntOpenHashMap();
    private final Map<Integer, String> sourceTexts = new LinkedHashMap<>();
    private final Map<Integer, String> moduleLinks = new LinkedHashMap<>();
    private final Map<Integer, String> nodeDefs = new LinkedHashMap<>();
    private final Map<Integer, Set<String>> nodeUses = new LinkedHashMap<>();

    // --- Clusters ---
    private final List<Cluster> clusters = new ArrayList<>();

    // --- Data flow ---
    private final List<String> dfgNodes = new ArrayList<>();
    private final Object2IntOpenHashMap<String> dfgIndex = new Object2IntOpenHashMap<>();
    private final Set<DfgEdge> dfgEdges = new LinkedHashSet<>();

    public GraphModel(String name) {
        this.name = name;
        this.nodeToCluster.defaultReturnValue(NO_CLUSTER);
        this.dfgIndex.defaultReturnValue(-1);
    }

    public String getName() {
        return name;
    }

    // === Clusters ===

    /**
     * Adds a cluster.
     *
     * @param name  Display name of the cluster.
     * @param color Fill colour understood by the renderer.
     * @return The new cluster id.
     */
    public int addCluster(String name, String color) {
        int id = clusters.size();
        clusters.add(new Cluster(id, name, color));
        return id;
    }

    public Cluster getCluster(int clusterId) {
        return clusters.get(clusterId);
    }

    public List<Cluster> getClusters() {
        return Collections.unmodifiableList(clusters);
    }

    /**
     * Links a member of a cluster to a detail sub-graph.
     */
    public void addDrillDownLink(int clusterId, int nodeId, String subGraphKey) {
        clusters.get(clusterId).putDrillDownLink(nodeId, subGraphKey);
    }

    // === Control-flow nodes and edges ===

    public int addCfgNode(String label) {
        return addCfgNode(label, null);
    }

    /**
     * Appends a control-flow node and, if a cluster is given, registers it as a member.
     *
     * @param label     Display label.
     * @param clusterId Owning cluster, or null.
     * @return The new node id.
     */
    public int addCfgNode(String label, Integer clusterId) {
        int id = cfgLabels.size();
        cfgLabels.add(label);
        if (clusterId != null) {
            clusters.get(clusterId).addMember(id);
            nodeToCluster.put(id, clusterId.intValue());
        }
        return id;
    }

    /**
     * Appends an edge. Endpoints are not validated; callers only pass ids they allocated.
     */
    public void addCfgEdge(int source, int target, EdgeLabel label) {
        cfgEdges.add(new CfgEdge(source, target, label));
    }

    public void addCfgEdge(int source, int target) {
        addCfgEdge(source, target, EdgeLabel.none());
    }

    public void addCfgEdge(int source, int target, String label) {
        addCfgEdge(source, target, EdgeLabel.of(label));
    }

    public int getNodeCount() {
        return cfgLabels.size();
    }

    public String getNodeLabel(int nodeId) {
        return cfgLabels.get(nodeId);
    }

    /**
     * Node labels indexed by node id.
     */
    public List<String> getNodeLabels() {
        return Collections.unmodifiableList(cfgLabels);
    }

    public List<CfgEdge> getCfgEdges() {
        return Collections.unmodifiableList(cfgEdges);
    }

    /**
     * Returns a view of one node with its cluster and line annotations.
     */
    public CfgNode getNode(int nodeId) {
        int cluster = nodeToCluster.get(nodeId);
        return new CfgNode(nodeId, cfgLabels.get(nodeId),
                cluster == NO_CLUSTER ? null : cluster,
                lineNumbers.containsKey(nodeId) ? lineNumbers.get(nodeId) : null);
    }

    public List<CfgNode> getNodes() {
        List<CfgNode> nodes = new ArrayList<>(cfgLabels.size());
        for (int i = 0; i < cfgLabels.size(); i++) {
            nodes.add(getNode(i));
        }
        return nodes;
    }

    /**
     * Returns the cluster owning a node, or null.
     */
    public Integer getClusterOf(int nodeId) {
        int cluster = nodeToCluster.get(nodeId);
        return cluster == NO_CLUSTER ? null : cluster;
    }

    // === Node annotations ===

    public void setLineNumber(int nodeId, int line) {
        lineNumbers.put(nodeId, line);
    }

    public Int2IntMap getLineNumbers() {
        return Int2IntMaps.unmodifiable(lineNumbers);
    }

    public void setSourceText(int nodeId, String text) {
        sourceTexts.put(nodeId, text);
    }

    public Map<Integer, String> getSourceTexts() {
        return Collections.unmodifiableMap(sourceTexts);
    }

    /**
     * Records that a node stands for an instance of another module, so a viewer can navigate there.
     */
    public void setModuleLink(int nodeId, String moduleName) {
        moduleLinks.put(nodeId, moduleName);
    }

    public Map<Integer, String> getModuleLinks() {
        return Collections.unmodifiableMap(moduleLinks);
    }

    public void setDef(int nodeId, String ssaName) {
        nodeDefs.put(nodeId, ssaName);
    }

    public void setUses(int nodeId, Set<String> ssaNames) {
        nodeUses.put(nodeId, Collections.unmodifiableSet(new LinkedHashSet<>(ssaNames)));
    }

    public Map<Integer, String> getDefs() {
        return Collections.unmodifiableMap(nodeDefs);
    }

    public Map<Integer, Set<String>> getUses() {
        return Collections.unmodifiableMap(nodeUses);
    }

    // === Data flow ===

    /**
     * Returns the id of the data-flow node with the given name, creating it on first use.
     *
     * @param ssaName SSA-qualified or synthetic name.
     * @return The node id; identical names always yield the same id.
     */
    public int dfgNode(String ssaName) {
        int existing = dfgIndex.getInt(ssaName);
        if (existing >= 0) {
            return existing;
        }
        int id = dfgNodes.size();
        dfgNodes.add(ssaName);
        dfgIndex.put(ssaName, id);
        return id;
    }

    /**
     * Returns the id the next new data-flow node will get.
     */
    public int nextDfgNodeId() {
        return dfgNodes.size();
    }

    /**
     * Adds a data-flow edge. Adding the same edge again has no effect.
     */
    public void dfgEdge(int source, int target) {
        dfgEdges.add(new DfgEdge(source, target));
    }

    public boolean hasDfgNode(String ssaName) {
        return dfgIndex.containsKey(ssaName);
    }

    public String getDfgNodeName(int dfgId) {
        return dfgNodes.get(dfgId);
    }

    public List<String> getDfgNodeNames() {
        return Collections.unmodifiableList(dfgNodes);
    }

    public List<DfgNode> getDfgNodes() {
        List<DfgNode> nodes = new ArrayList<>(dfgNodes.size());
        for (int i = 0; i < dfgNodes.size(); i++) {
            nodes.add(new DfgNode(i, dfgNodes.get(i)));
        }
        return nodes;
    }

    public List<DfgEdge> getDfgEdges() {
        return List.copyOf(dfgEdges);
    }

    /**
     * Names of the data-flow nodes with an edge into the named node, in edge insertion order.
     */
    public List<String> dfgPredecessors(String ssaName) {
        int target = dfgIndex.getInt(ssaName);
        List<String> result = new ArrayList<>();
        if (target < 0) {
            return result;
        }
        for (DfgEdge edge : dfgEdges) {
            if (edge.target() == target) {
                result.add(dfgNodes.get(edge.source()));
            }
        }
        return result;
    }
}
