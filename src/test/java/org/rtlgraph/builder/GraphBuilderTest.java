package org.rtlgraph.builder;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rtlgraph.diagnostics.DiagnosticCategory;
import org.rtlgraph.diagnostics.DiagnosticsEngine;
import org.rtlgraph.frontend.ast.DesignNode;
import org.rtlgraph.frontend.ast.InstanceNode;
import org.rtlgraph.frontend.ast.ModuleNode;
import org.rtlgraph.frontend.ast.Operator;
import org.rtlgraph.frontend.ast.PortDirection;
import org.rtlgraph.frontend.ast.ProcessKind;
import org.rtlgraph.frontend.ast.UnknownNode;
import org.rtlgraph.graph.CfgEdge;
import org.rtlgraph.graph.DesignHierarchy;
import org.rtlgraph.graph.EdgeLabel;
import org.rtlgraph.graph.GraphModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.rtlgraph.TestAst.always;
import static org.rtlgraph.TestAst.begin;
import static org.rtlgraph.TestAst.blocking;
import static org.rtlgraph.TestAst.caseOf;
import static org.rtlgraph.TestAst.continuous;
import static org.rtlgraph.TestAst.instance;
import static org.rtlgraph.TestAst.item;
import static org.rtlgraph.TestAst.level;
import static org.rtlgraph.TestAst.module;
import static org.rtlgraph.TestAst.nonBlocking;
import static org.rtlgraph.TestAst.num;
import static org.rtlgraph.TestAst.op;
import static org.rtlgraph.TestAst.pin;
import static org.rtlgraph.TestAst.port;
import static org.rtlgraph.TestAst.posedge;
import static org.rtlgraph.TestAst.process;
import static org.rtlgraph.TestAst.var;

@Tag("unit")
class GraphBuilderTest {

    private DiagnosticsEngine diagnostics;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        builder = new GraphBuilder(BuilderOptions.defaults(), diagnostics);
    }

    @Test
    @DisplayName("assign y = a & b: one architecture node wired from the inputs and to the outputs")
    void continuousAssignment() {
        DesignHierarchy hierarchy = builder.buildModule(module("gate",
                port("a", PortDirection.IN),
                port("b", PortDirection.IN),
                port("y", PortDirection.OUT),
                continuous("y", op(Operator.AND, var("a"), var("b")), 5)));
        GraphModel arch = hierarchy.getArchitecture();

        assertThat(arch.getNodeLabels()).containsExactly(
                "Continuous Assignment\ny = ab", "Inputs\n a, b", "Outputs\n y");
        assertThat(arch.getCfgEdges()).containsExactly(
                new CfgEdge(1, 0, EdgeLabel.bus(List.of("a", "b"))),
                new CfgEdge(0, 2, EdgeLabel.of("y")));
        assertThat(arch.getCluster(0).name()).isEqualTo("Module: gate");
        assertThat(arch.getCluster(0).memberIds().toIntArray()).containsExactly(0, 1, 2);
        assertThat(arch.getCluster(0).drillDownLinks()).containsExactly(entry(0, "assign_0"));
        assertThat(arch.getLineNumbers().get(0)).isEqualTo(5);

        GraphModel detail = hierarchy.getDetailGraph("assign_0");
        assertThat(detail.hasDfgNode("y_1")).isTrue();
    }

    @Test
    @DisplayName("u1 drives w, u2 and u3 receive it: u1 -> u2 and u1 -> u3 but no u2 -> u3")
    void instancesConnectedByAWire() {
        ModuleNode top = module("top",
                instance("u1", "source", pin("o", "out", "w")),
                instance("u2", "sink", pin("i", "in", "w")),
                instance("u3", "sink", pin("i", "input", "w")));

        GraphModel arch = builder.buildModule(top).getArchitecture();

        assertThat(arch.getNodeLabels()).containsExactly("u1\n(source)", "u2\n(sink)", "u3\n(sink)");
        assertThat(arch.getCfgEdges()).containsExactly(
                new CfgEdge(0, 1, EdgeLabel.of("w")),
                new CfgEdge(0, 2, EdgeLabel.of("w")));
        assertThat(arch.getModuleLinks()).containsEntry(0, "source").containsEntry(2, "sink");
    }

    @Test
    void blocksGetSmartLabelsAndDetailGraphs() {
        DesignHierarchy hierarchy = builder.buildModule(module("counter",
                port("clk", PortDirection.IN),
                always(posedge("clk"), nonBlocking("count", op(Operator.ADD, var("count"), num("1")))),
                always(posedge("clk"), caseOf(var("state"),
                        item(num("S0"), nonBlocking("next_state", num("S1"))),
                        item(num("S1"), nonBlocking("next_state", num("S0")))))));
        GraphModel arch = hierarchy.getArchitecture();

        assertThat(arch.getNodeLabel(0)).isEqualTo("Counter\ncount <= (count + 1)");
        assertThat(arch.getNodeLabel(1)).isEqualTo("FSM Controller");
        assertThat(hierarchy.getDetailGraphs().keySet()).containsExactly("always_0", "always_1");
        assertThat(arch.getCfgEdges()).as("clock is never wired").isEmpty();
    }

    @Test
    void initialBlockWithOneConstantIsAnInit() {
        GraphModel arch = builder.buildModule(module("m",
                process(ProcessKind.INITIAL, blocking("mem", num("0"))))).getArchitecture();

        assertThat(arch.getNodeLabel(0)).isEqualTo("Init\nmem = 0");
    }

    @Test
    @DisplayName("SSA versions restart in every module")
    void ssaStateIsPerModule() {
        List<DesignHierarchy> hierarchies = builder.build(new DesignNode(List.of(
                module("first", always(level("a"), blocking("x", var("a")))),
                module("second", always(level("b"), blocking("x", var("b")))))));

        assertThat(hierarchies).extracting(DesignHierarchy::getModuleName).containsExactly("first", "second");
        assertThat(hierarchies.get(0).getDetailGraph("always_0").getDefs().values()).containsExactly("x_1");
        assertThat(hierarchies.get(1).getDetailGraph("always_0").getDefs().values()).containsExactly("x_1");
    }

    @Test
    void blocksInsideGenerateRegionsAreVisited() {
        GraphModel arch = builder.buildModule(module("g",
                begin(continuous("y", var("a"), 3), continuous("z", var("y"), 4)))).getArchitecture();

        assertThat(arch.getNodeCount()).isEqualTo(2);
        assertThat(arch.getCfgEdges()).containsExactly(new CfgEdge(0, 1, EdgeLabel.of("y")));
    }

    @Test
    void sourceLinesAnnotateNodes() {
        GraphBuilder withSource = new GraphBuilder(BuilderOptions.defaults(), diagnostics, "gate.v",
                List.of("module gate(input a, output y);", "  assign y = a;", "endmodule"));

        GraphModel arch = withSource.buildModule(module("gate", continuous("y", var("a"), 2))).getArchitecture();

        assertThat(arch.getSourceTexts()).containsEntry(0, "assign y = a;");
    }

    @Test
    void inputProblemsAreReportedNotThrown() {
        builder.buildModule(module("m",
                always(level("a"), blocking("x", var("a"))),
                new UnknownNode("typetable", List.of()),
                new InstanceNode("u0", null, List.of(), null)));

        assertThat(diagnostics.byCategory(DiagnosticCategory.CLASSIFICATION_AMBIGUITY)).hasSize(1);
        assertThat(diagnostics.byCategory(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT)).hasSize(1);
        assertThat(diagnostics.byCategory(DiagnosticCategory.MALFORMED_INPUT)).hasSize(1);
        assertThat(diagnostics.byCategory(DiagnosticCategory.MALFORMED_INPUT).get(0).message()).startsWith("m: ");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void optionsFromConfigFallBackToDefaults() {
        BuilderOptions options = BuilderOptions.fromConfig(ConfigFactory.parseString(
                "rtlgraph.builder.clock-patterns = [\"ck\"]"));

        assertThat(options.clockPatterns()).containsExactly("ck");
        assertThat(options.ignoredSignalPatterns()).containsExactly("clk", "clock", "reset", "rst");
        assertThat(options.blockClusterColor()).isEqualTo("lightyellow");
    }
}
