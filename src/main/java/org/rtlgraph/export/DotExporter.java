package org.rtlgraph.export;

import it.unimi.dsi.fastutil.ints.IntList;
import org.rtlgraph.graph.CfgEdge;
import org.rtlgraph.graph.Cluster;
import org.rtlgraph.graph.DesignHierarchy;
import org.rtlgraph.graph.EdgeLabel;
import org.rtlgraph.graph.GraphModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes graph hierarchies as Graphviz DOT, one file per graph.
 *
 * <p>Per module the architecture graph goes to {@code <base>_<module>_arch.dot} and each detail
 * graph to {@code <base>_<module>_<key>.dot}. Architecture nodes link to their detail graph and
 * instance nodes to the instantiated module's architecture graph, both through the viewer page.
 * Layout and rendering are left to Graphviz.</p>
 */
public class DotExporter {

    private static final Logger log = LoggerFactory.getLogger(DotExporter.class);

    private record Style(Pattern pattern, String attributes) {}

    private static final List<Style> STYLES = List.of(
            new Style(Pattern.compile("FSM Controller"), "shape=Mdiamond, style=\"filled\", fillcolor=\"skyblue\""),
            new Style(Pattern.compile("Counter"), "shape=doubleoctagon, style=\"filled\", fillcolor=\"lightgreen\""),
            new Style(Pattern.compile("Datapath"), "shape=octagon, style=\"filled\", fillcolor=\"lightcoral\""),
            new Style(Pattern.compile("Sequential Logic"), "shape=box, style=\"filled,rounded\", fillcolor=\"darkseagreen1\""),
            new Style(Pattern.compile("Combinational Logic"), "shape=box, style=\"filled,rounded\", fillcolor=\"lightgoldenrod\""),
            new Style(Pattern.compile("^if "), "shape=diamond, style=\"filled\", fillcolor=\"lightcyan\", color=\"teal\""),
            new Style(Pattern.compile("<="), "shape=box3d, style=\"filled\", fillcolor=\"lightcoral\", color=\"darkred\""),
            new Style(Pattern.compile("="), "shape=box3d, style=\"filled\", fillcolor=\"lightsalmon\", color=\"darkorange\""));

    private final ExportOptions options;

    public DotExporter(ExportOptions options) {
        this.options = options;
    }

    /**
     * Renders all graphs of a design.
     *
     * @param hierarchies One hierarchy per module.
     * @param baseName    File name prefix.
     * @return File name to DOT text, in module order.
     */
    public Map<String, String> render(List<DesignHierarchy> hierarchies, String baseName) {
        Map<String, String> files = new LinkedHashMap<>();
        for (DesignHierarchy hierarchy : hierarchies) {
            String moduleBase = baseName + "_" + hierarchy.getModuleName();
            files.put(moduleBase + "_arch.dot", renderGraph(hierarchy.getArchitecture(), moduleBase, baseName, true));
            for (Map.Entry<String, GraphModel> detail : hierarchy.getDetailGraphs().entrySet()) {
                files.put(moduleBase + "_" + detail.getKey() + ".dot",
                        renderGraph(detail.getValue(), moduleBase, baseName, false));
            }
        }
        return files;
    }

    /**
     * Renders and writes all graphs of a design.
     *
     * @return The written files.
     * @throws ExportException if a file cannot be written.
     */
    public List<Path> write(List<DesignHierarchy> hierarchies, Path outputDir, String baseName) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            for (Map.Entry<String, String> file : render(hierarchies, baseName).entrySet()) {
                Path path = outputDir.resolve(file.getKey());
                Files.writeString(path, file.getValue(), StandardCharsets.UTF_8);
                written.add(path);
            }
        } catch (IOException e) {
            throw new ExportException("Cannot write DOT files to " + outputDir + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} DOT file(s) to {}", written.size(), outputDir);
        return written;
    }

    /**
     * Renders one graph.
     *
     * @param graph        The graph.
     * @param moduleBase   {@code <base>_<module>}, prefix of drill-down targets.
     * @param baseName     Prefix of module-navigation targets.
     * @param architecture Whether drill-down links are emitted.
     * @return The DOT text.
     */
    public String renderGraph(GraphModel graph, String moduleBase, String baseName, boolean architecture) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(graph.getName())).append("\" {\n");
        sb.append("  rankdir=TB; splines=ortho;\n");
        sb.append("  graph [ranksep=2.0, nodesep=1.5];\n");
        sb.append("  node [shape=box, style=filled, fillcolor=white, fontsize=12, fontname=\"Arial\"];\n");
        sb.append("  edge [fontname=\"Arial\", fontsize=10, color=\"#555555\"];\n");

        BitSet placed = new BitSet(graph.getNodeCount());
        for (Cluster cluster : graph.getClusters()) {
            sb.append("  subgraph cluster_").append(cluster.id()).append(" {\n");
            sb.append("    label=\"").append(escape(cluster.name())).append("\"; style=filled; color=\"")
                    .append(escape(cluster.color())).append("\";\n");
            IntList members = cluster.memberIds();
            for (int i = 0; i < members.size(); i++) {
                int nodeId = members.getInt(i);
                String drillDown = architecture ? cluster.drillDownLinks().get(nodeId) : null;
                sb.append("    ").append(node(graph, nodeId, drillDown, moduleBase, baseName)).append('\n');
                placed.set(nodeId);
            }
            sb.append("  }\n");
        }
        for (int nodeId = 0; nodeId < graph.getNodeCount(); nodeId++) {
            if (!placed.get(nodeId)) {
                sb.append("  ").append(node(graph, nodeId, null, moduleBase, baseName)).append('\n');
            }
        }

        for (CfgEdge edge : graph.getCfgEdges()) {
            sb.append("  n").append(edge.source()).append(" -> n").append(edge.target())
                    .append(edgeAttributes(edge.label())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private String node(GraphModel graph, int nodeId, String drillDown, String moduleBase, String baseName) {
        String label = graph.getNodeLabel(nodeId);
        StringBuilder attrs = new StringBuilder("label=\"").append(escape(label)).append('"');
        for (Style style : STYLES) {
            if (style.pattern().matcher(label).find()) {
                attrs.append(", ").append(style.attributes());
                break;
            }
        }
        if (drillDown != null) {
            attrs.append(", URL=\"").append(link(moduleBase + "_" + drillDown)).append('"')
                    .append(", target=\"_top\", tooltip=\"Click to see details\"");
        }
        String module = graph.getModuleLinks().get(nodeId);
        if (module != null) {
            attrs.append(", URL=\"").append(link(baseName + "_" + module + "_arch")).append('"')
                    .append(", target=\"_top\", style=\"filled,bold\", fillcolor=\"#e6f3ff\"")
                    .append(", tooltip=\"Go to module: ").append(escape(module)).append('"');
        }
        return "n" + nodeId + " [" + attrs + "];";
    }

    private String edgeAttributes(EdgeLabel label) {
        if (label instanceof EdgeLabel.Text text) {
            String safe = escape(text.text());
            return " [xlabel=\"" + safe + "\", fontcolor=\"#00000000\", tooltip=\"" + safe
                    + "\", penwidth=2.0, arrowsize=1.0]";
        }
        if (label instanceof EdgeLabel.Bus bus) {
            String all = escape(String.join("\n", bus.signals()));
            String shown = bus.signals().size() > options.busLabelThreshold()
                    ? "Bus: " + bus.signals().size() + " signals" : all;
            return " [xlabel=\"" + shown + "\", fontcolor=\"#00000000\", tooltip=\"" + all
                    + "\", penwidth=4.0, arrowsize=1.5, color=\"#333333\"]";
        }
        return "";
    }

    private String link(String target) {
        return options.viewerPage() + "?file=" + target + "." + options.linkExtension();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
