package org.rtlgraph.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named group of nodes, drawn as a box around its members.
 */
public final class Cluster {

    private final int id;
    private final String name;
    private final String color;
    private final IntArrayList memberIds = new IntArrayList();
    private final Map<Integer, String> drillDownLinks = new LinkedHashMap<>();

    Cluster(int id, String name, String color) {
        this.id = id;
        this.name = name;
        this.color = color;
    }

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String color() {
        return color;
    }

    /**
     * Member node ids in insertion order.
     */
    public IntList memberIds() {
        return IntLists.unmodifiable(memberIds);
    }

    /**
     * Node id to sub-graph key, for members that open a detail graph.
     */
    public Map<Integer, String> drillDownLinks() {
        return Collections.unmodifiableMap(drillDownLinks);
    }

    void addMember(int nodeId) {
        memberIds.add(nodeId);
    }

    void putDrillDownLink(int nodeId, String subGraphKey) {
        drillDownLinks.put(nodeId, subGraphKey);
    }
}
