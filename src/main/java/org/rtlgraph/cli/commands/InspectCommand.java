package org.rtlgraph.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.rtlgraph.builder.BuilderOptions;
import org.rtlgraph.builder.GraphBuilder;
import org.rtlgraph.cli.CommandLineInterface;
import org.rtlgraph.diagnostics.Diagnostic;
import org.rtlgraph.diagnostics.DiagnosticsEngine;
import org.rtlgraph.frontend.verilator.VerilatorException;
import org.rtlgraph.frontend.xml.AstReadException;
import org.rtlgraph.graph.CfgEdge;
import org.rtlgraph.graph.DesignHierarchy;
import org.rtlgraph.graph.GraphModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints a textual summary of a design's graphs: block classifications,
 * detail graph sizes, resolved connections and diagnostics.
 */
@Command(
    name = "inspect",
    description = "Print block classifications, graph sizes, connections and diagnostics"
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @ArgGroup(exclusive = true, multiplicity = "1")
    InputOptions input;

    @Option(
        names = {"--top"},
        description = "Top module passed to Verilator (with --verilog)"
    )
    private String topModule;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            DesignLoader.LoadedDesign loaded = DesignLoader.load(input, topModule, config);
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            List<DesignHierarchy> hierarchies = new GraphBuilder(BuilderOptions.fromConfig(config), diagnostics,
                    loaded.sourceName(), loaded.sourceLines()).build(loaded.design());

            for (DesignHierarchy hierarchy : hierarchies) {
                printModule(hierarchy, out);
            }
            out.println("=== Diagnostics (" + diagnostics.summary() + ") ===");
            for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
                out.println("  " + diagnostic);
            }
            return 0;
        } catch (AstReadException | VerilatorException e) {
            log.error("inspect failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration or option: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printModule(DesignHierarchy hierarchy, PrintWriter out) {
        GraphModel architecture = hierarchy.getArchitecture();
        out.println("=== Module " + hierarchy.getModuleName() + " ===");

        out.println("Blocks:");
        for (int id = 0; id < architecture.getNodeCount(); id++) {
            String link = drillDownOf(architecture, id);
            String module = architecture.getModuleLinks().get(id);
            StringBuilder line = new StringBuilder("  [").append(id).append("] ").append(firstLine(architecture.getNodeLabel(id)));
            if (link != null) {
                GraphModel detail = hierarchy.getDetailGraph(link);
                line.append("  -> ").append(link).append(" (").append(detail.getNodeCount()).append(" nodes, ")
                        .append(detail.getCfgEdges().size()).append(" edges, ")
                        .append(detail.getDfgNodeNames().size()).append(" values)");
            }
            if (module != null) {
                line.append("  => module ").append(module);
            }
            out.println(line);
        }

        out.println("Connections:");
        for (CfgEdge edge : architecture.getCfgEdges()) {
            out.printf("  %s -> %s : %s%n", firstLine(architecture.getNodeLabel(edge.source())),
                    firstLine(architecture.getNodeLabel(edge.target())), String.join(", ", edge.label().values()));
        }
    }

    private static String drillDownOf(GraphModel architecture, int nodeId) {
        Integer cluster = architecture.getClusterOf(nodeId);
        if (cluster == null) {
            return null;
        }
        Map<Integer, String> links = architecture.getCluster(cluster).drillDownLinks();
        return links.get(nodeId);
    }

    private static String firstLine(String label) {
        int newline = label.indexOf('\n');
        return newline < 0 ? label : label.substring(0, newline);
    }
}
