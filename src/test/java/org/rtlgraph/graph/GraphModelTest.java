package org.rtlgraph.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GraphModelTest {

    @Test
    void nodeIdsAreDenseAndClusterMembershipIsRecorded() {
        GraphModel graph = new GraphModel("g");
        int cluster = graph.addCluster("Module: top", "lightgrey");

        int a = graph.addCfgNode("a", cluster);
        int b = graph.addCfgNode("b");
        int c = graph.addCfgNode("c", cluster);

        assertThat(List.of(a, b, c)).containsExactly(0, 1, 2);
        assertThat(graph.getNodeCount()).isEqualTo(3);
        assertThat(graph.getCluster(cluster).memberIds().toIntArray()).containsExactly(0, 2);
        assertThat(graph.getClusterOf(a)).isEqualTo(cluster);
        assertThat(graph.getClusterOf(b)).isNull();
        assertThat(graph.getNode(c).clusterId()).isEqualTo(cluster);
    }

    @Test
    void edgesKeepTheirLabels() {
        GraphModel graph = new GraphModel("g");
        int a = graph.addCfgNode("a");
        int b = graph.addCfgNode("b");

        graph.addCfgEdge(a, b);
        graph.addCfgEdge(a, b, "True");
        graph.addCfgEdge(b, a, EdgeLabel.bus(List.of("x", "y")));
        graph.addCfgEdge(b, a, "");

        assertThat(graph.getCfgEdges()).extracting(CfgEdge::label).containsExactly(
                EdgeLabel.none(), new EdgeLabel.Text("True"), new EdgeLabel.Bus(List.of("x", "y")), EdgeLabel.none());
    }

    @Test
    void dfgNodeIsIdempotent() {
        GraphModel graph = new GraphModel("g");

        int first = graph.dfgNode("count_1");
        int other = graph.dfgNode("count_2");
        int again = graph.dfgNode("count_1");

        assertThat(again).isEqualTo(first);
        assertThat(other).isEqualTo(1);
        assertThat(graph.getDfgNodeNames()).containsExactly("count_1", "count_2");
        assertThat(graph.nextDfgNodeId()).isEqualTo(2);
        assertThat(graph.hasDfgNode("count_3")).isFalse();
    }

    @Test
    void duplicateDfgEdgesAreIgnored() {
        GraphModel graph = new GraphModel("g");
        int a = graph.dfgNode("a");
        int b = graph.dfgNode("b");
        int y = graph.dfgNode("y_1");

        graph.dfgEdge(a, y);
        graph.dfgEdge(b, y);
        graph.dfgEdge(a, y);

        assertThat(graph.getDfgEdges()).containsExactly(new DfgEdge(a, y), new DfgEdge(b, y));
        assertThat(graph.dfgPredecessors("y_1")).containsExactly("a", "b");
        assertThat(graph.dfgPredecessors("missing")).isEmpty();
    }

    @Test
    void annotations() {
        GraphModel graph = new GraphModel("g");
        int id = graph.addCfgNode("y = a");
        graph.setLineNumber(id, 12);
        graph.setSourceText(id, "assign y = a;");
        graph.setDef(id, "y_1");
        graph.setUses(id, Set.of("a"));
        graph.setModuleLink(id, "child");

        assertThat(graph.getNode(id).lineNumber()).isEqualTo(12);
        assertThat(graph.getLineNumbers().get(id)).isEqualTo(12);
        assertThat(graph.getSourceTexts()).containsEntry(id, "assign y = a;");
        assertThat(graph.getDefs()).containsEntry(id, "y_1");
        assertThat(graph.getUses().get(id)).containsExactly("a");
        assertThat(graph.getModuleLinks()).containsEntry(id, "child");
        assertThat(graph.getNode(graph.addCfgNode("other")).lineNumber()).isNull();
    }

    @Test
    void drillDownLinksLiveOnTheCluster() {
        GraphModel graph = new GraphModel("g");
        int cluster = graph.addCluster("Module: top", "lightgrey");
        int id = graph.addCfgNode("Counter", cluster);

        graph.addDrillDownLink(cluster, id, "always_0");

        assertThat(graph.getCluster(cluster).drillDownLinks()).containsEntry(id, "always_0");
        assertThatThrownBy(() -> graph.getClusters().add(null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
