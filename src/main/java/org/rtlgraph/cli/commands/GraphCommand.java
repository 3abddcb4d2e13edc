package org.rtlgraph.cli.commands;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.rtlgraph.builder.BuilderOptions;
import org.rtlgraph.builder.GraphBuilder;
import org.rtlgraph.cli.CommandLineInterface;
import org.rtlgraph.diagnostics.Diagnostic;
import org.rtlgraph.diagnostics.DiagnosticsEngine;
import org.rtlgraph.diagnostics.Severity;
import org.rtlgraph.export.DotExporter;
import org.rtlgraph.export.ExportException;
import org.rtlgraph.export.ExportFormat;
import org.rtlgraph.export.ExportOptions;
import org.rtlgraph.export.JsonExporter;
import org.rtlgraph.frontend.verilator.VerilatorException;
import org.rtlgraph.frontend.xml.AstReadException;
import org.rtlgraph.graph.DesignHierarchy;
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
 * CLI command that builds the graphs of a design and writes them as DOT or JSON files.
 */
@Command(
    name = "graph",
    description = "Build architecture and detail graphs and write them as DOT or JSON"
)
public class GraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GraphCommand.class);

    @ArgGroup(exclusive = true, multiplicity = "1")
    InputOptions input;

    @Option(
        names = {"--top"},
        description = "Top module passed to Verilator (with --verilog)"
    )
    private String topModule;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: ${DEFAULT-VALUE})",
        defaultValue = "out"
    )
    private Path outputDir;

    @Option(
        names = {"--basename"},
        description = "File name prefix (default: input file name without extension)"
    )
    private String baseName;

    @Option(
        names = {"--format"},
        description = "Output format: dot or json (default: rtlgraph.export.format)"
    )
    private String format;

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
            ExportOptions exportOptions = ExportOptions.fromConfig(config);
            if (format != null) {
                exportOptions = exportOptions.withFormat(ExportFormat.parse(format));
            }

            DesignLoader.LoadedDesign loaded = DesignLoader.load(input, topModule, config);
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            GraphBuilder builder = new GraphBuilder(BuilderOptions.fromConfig(config), diagnostics,
                    loaded.sourceName(), loaded.sourceLines());
            List<DesignHierarchy> hierarchies = builder.build(loaded.design());

            String base = baseName != null ? baseName : defaultBaseName(input.inputFile());
            List<Path> written = switch (exportOptions.format()) {
                case DOT -> new DotExporter(exportOptions).write(hierarchies, outputDir, base);
                case JSON -> List.of(new JsonExporter().write(hierarchies, outputDir, base));
            };

            for (Path path : written) {
                out.println(path);
            }
            for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
                if (diagnostic.severity() != Severity.INFO) {
                    err.println(diagnostic);
                }
            }
            out.printf("%d module(s), %d file(s) written (%s)%n", hierarchies.size(), written.size(), diagnostics.summary());
            return 0;
        } catch (AstReadException | VerilatorException | ExportException e) {
            log.error("graph failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration or option: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static String defaultBaseName(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
