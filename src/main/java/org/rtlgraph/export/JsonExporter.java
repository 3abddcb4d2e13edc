package org.rtlgraph.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import it.unimi.dsi.fastutil.ints.IntList;
import org.rtlgraph.graph.CfgEdge;
import org.rtlgraph.graph.Cluster;
import org.rtlgraph.graph.DesignHierarchy;
import org.rtlgraph.graph.DfgEdge;
import org.rtlgraph.graph.EdgeLabel;
import org.rtlgraph.graph.GraphModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes graph hierarchies as a single JSON document.
 *
 * <p>Each graph lists its node labels with their annotations, its edges with a label that is
 * null, a string or an array of signal names, its clusters, and its data-flow nodes and edges.</p>
 */
public class JsonExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonExporter.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

    /**
     * Renders all hierarchies as a JSON string.
     */
    public String render(List<DesignHierarchy> hierarchies) {
        JsonArray modules = new JsonArray();
        for (DesignHierarchy hierarchy : hierarchies) {
            JsonObject module = new JsonObject();
            module.addProperty("name", hierarchy.getModuleName());
            module.add("architecture", toJson(hierarchy.getArchitecture()));
            JsonObject details = new JsonObject();
            for (Map.Entry<String, GraphModel> detail : hierarchy.getDetailGraphs().entrySet()) {
                details.add(detail.getKey(), toJson(detail.getValue()));
            }
            module.add("details", details);
            modules.add(module);
        }
        JsonObject root = new JsonObject();
        root.add("modules", modules);
        return gson.toJson(root);
    }

    /**
     * Writes {@code <base>.json} into the output directory.
     *
     * @return The written file.
     * @throws ExportException if the file cannot be written.
     */
    public Path write(List<DesignHierarchy> hierarchies, Path outputDir, String baseName) {
        Path path = outputDir.resolve(baseName + ".json");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(path, render(hierarchies), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExportException("Cannot write " + path + ": " + e.getMessage(), e);
        }
        log.info("Wrote {}", path);
        return path;
    }

    JsonObject toJson(GraphModel graph) {
        JsonObject json = new JsonObject();
        json.addProperty("name", graph.getName());

        JsonArray nodes = new JsonArray();
        for (int id = 0; id < graph.getNodeCount(); id++) {
            JsonObject node = new JsonObject();
            node.addProperty("id", id);
            node.addProperty("label", graph.getNodeLabel(id));
            Integer cluster = graph.getClusterOf(id);
            if (cluster != null) {
                node.addProperty("cluster", cluster);
            }
            if (graph.getLineNumbers().containsKey(id)) {
                node.addProperty("line", graph.getLineNumbers().get(id));
            }
            String text = graph.getSourceTexts().get(id);
            if (text != null) {
                node.addProperty("source", text);
            }
            String def = graph.getDefs().get(id);
            if (def != null) {
                node.addProperty("def", def);
            }
            Set<String> uses = graph.getUses().get(id);
            if (uses != null) {
                node.add("uses", strings(uses));
            }
            String module = graph.getModuleLinks().get(id);
            if (module != null) {
                node.addProperty("module", module);
            }
            nodes.add(node);
        }
        json.add("nodes", nodes);

        JsonArray edges = new JsonArray();
        for (CfgEdge edge : graph.getCfgEdges()) {
            JsonObject e = new JsonObject();
            e.addProperty("source", edge.source());
            e.addProperty("target", edge.target());
            e.add("label", label(edge.label()));
            edges.add(e);
        }
        json.add("edges", edges);

        JsonArray clusters = new JsonArray();
        for (Cluster cluster : graph.getClusters()) {
            JsonObject c = new JsonObject();
            c.addProperty("id", cluster.id());
            c.addProperty("name", cluster.name());
            c.addProperty("color", cluster.color());
            JsonArray members = new JsonArray();
            IntList ids = cluster.memberIds();
            for (int i = 0; i < ids.size(); i++) {
                members.add(ids.getInt(i));
            }
            c.add("members", members);
            JsonObject links = new JsonObject();
            for (Map.Entry<Integer, String> link : cluster.drillDownLinks().entrySet()) {
                links.addProperty(String.valueOf(link.getKey()), link.getValue());
            }
            c.add("drillDown", links);
            clusters.add(c);
        }
        json.add("clusters", clusters);

        JsonObject dfg = new JsonObject();
        dfg.add("nodes", strings(graph.getDfgNodeNames()));
        JsonArray dfgEdges = new JsonArray();
        for (DfgEdge edge : graph.getDfgEdges()) {
            JsonArray pair = new JsonArray();
            pair.add(edge.source());
            pair.add(edge.target());
            dfgEdges.add(pair);
        }
        dfg.add("edges", dfgEdges);
        json.add("dfg", dfg);
        return json;
    }

    private static JsonElement label(EdgeLabel label) {
        if (label instanceof EdgeLabel.Text text) {
            return new JsonPrimitive(text.text());
        }
        if (label instanceof EdgeLabel.Bus bus) {
            return strings(bus.signals());
        }
        return JsonNull.INSTANCE;
    }

    private static JsonArray strings(Iterable<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
