package org.rtlgraph.export;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class JsonExporterTest {

    @TempDir
    Path tempDir;

    private final JsonExporter exporter = new JsonExporter();

    @Test
    void rendersModulesWithArchitectureAndDetails() {
        JsonObject root = JsonParser.parseString(exporter.render(List.of(ExportFixtures.top()))).getAsJsonObject();

        JsonObject module = root.getAsJsonArray("modules").get(0).getAsJsonObject();
        assertThat(module.get("name").getAsString()).isEqualTo("top");

        JsonObject arch = module.getAsJsonObject("architecture");
        JsonObject counter = arch.getAsJsonArray("nodes").get(0).getAsJsonObject();
        assertThat(counter.get("label").getAsString()).isEqualTo("Counter\ncount <= (count + 1)");
        assertThat(counter.get("cluster").getAsInt()).isZero();
        assertThat(counter.get("line").getAsInt()).isEqualTo(6);
        assertThat(counter.get("source").getAsString()).isEqualTo("always @(posedge clk)");
        assertThat(arch.getAsJsonArray("nodes").get(1).getAsJsonObject().get("module").getAsString()).isEqualTo("child");

        JsonObject cluster = arch.getAsJsonArray("clusters").get(0).getAsJsonObject();
        assertThat(cluster.get("name").getAsString()).isEqualTo("Module: top");
        assertThat(cluster.getAsJsonArray("members")).hasSize(3);
        assertThat(cluster.getAsJsonObject("drillDown").get("0").getAsString()).isEqualTo("always_0");

        assertThat(module.getAsJsonObject("details").has("always_0")).isTrue();
    }

    @Test
    void edgeLabelsAreNullStringOrArray() {
        JsonObject root = JsonParser.parseString(exporter.render(List.of(ExportFixtures.top()))).getAsJsonObject();
        JsonObject module = root.getAsJsonArray("modules").get(0).getAsJsonObject();

        JsonArray archEdges = module.getAsJsonObject("architecture").getAsJsonArray("edges");
        assertThat(archEdges.get(0).getAsJsonObject().get("label").isJsonArray()).isTrue();
        assertThat(archEdges.get(0).getAsJsonObject().getAsJsonArray("label")).hasSize(4);
        assertThat(archEdges.get(2).getAsJsonObject().get("label").getAsString()).isEqualTo("count");

        JsonArray detailEdges = module.getAsJsonObject("details").getAsJsonObject("always_0").getAsJsonArray("edges");
        assertThat(detailEdges.get(0).getAsJsonObject().get("label").isJsonNull()).isTrue();
        assertThat(detailEdges.get(1).getAsJsonObject().get("label").getAsString()).isEqualTo("True");
    }

    @Test
    void detailGraphsCarryDataFlowAndDefUse() {
        JsonObject detail = exporter.toJson(ExportFixtures.top().getDetailGraph("always_0"));

        JsonObject dfg = detail.getAsJsonObject("dfg");
        assertThat(dfg.getAsJsonArray("nodes").get(1).getAsString()).isEqualTo("count_1");
        assertThat(dfg.getAsJsonArray("edges").get(0).getAsJsonArray().get(1).getAsInt()).isEqualTo(1);

        JsonArray nodes = detail.getAsJsonArray("nodes");
        assertThat(nodes.get(2).getAsJsonObject().get("def").getAsString()).isEqualTo("count_1");
        assertThat(nodes.get(1).getAsJsonObject().getAsJsonArray("uses").get(0).getAsString()).isEqualTo("rst");
        assertThat(nodes.get(0).getAsJsonObject().has("def")).isFalse();
    }

    @Test
    void writesOneDocument() throws IOException {
        Path file = exporter.write(List.of(ExportFixtures.top()), tempDir, "design");

        assertThat(file.getFileName().toString()).isEqualTo("design.json");
        assertThat(Files.readString(file)).contains("\"modules\"");
    }
}
