package org.rtlgraph.builder;

import org.rtlgraph.analysis.BlockClassifier;
import org.rtlgraph.builder.lowering.DetailPass;
import org.rtlgraph.builder.lowering.LoweringRegistry;
import org.rtlgraph.diagnostics.DiagnosticsEngine;
import org.rtlgraph.frontend.ast.DesignNode;
import org.rtlgraph.frontend.ast.ModuleNode;
import org.rtlgraph.graph.DesignHierarchy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the graph hierarchy of a design, one module at a time.
 *
 * <p>For every module a fresh {@link ModuleTraversalContext} is created, so SSA versions, the
 * signal registry and the cluster scope never leak from one module into the next. Malformed or
 * unrecognized input is reported to the {@link DiagnosticsEngine} and degrades the affected
 * graph locally; building never aborts.</p>
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final BuilderOptions options;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private final List<String> sourceLines;
    private final BlockClassifier classifier;
    private final ArchitecturePass architecturePass;

    public GraphBuilder(BuilderOptions options, DiagnosticsEngine diagnostics) {
        this(options, diagnostics, "<design>", List.of());
    }

    /**
     * @param options     Builder tunables.
     * @param diagnostics Receives findings about the input.
     * @param sourceName  Name of the HDL source, used in diagnostics.
     * @param sourceLines The HDL source lines, used to annotate nodes with their text; may be empty.
     */
    public GraphBuilder(BuilderOptions options, DiagnosticsEngine diagnostics, String sourceName, List<String> sourceLines) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
        this.sourceLines = List.copyOf(sourceLines);
        this.classifier = new BlockClassifier(options.clockPatterns());
        this.architecturePass = new ArchitecturePass(new DetailPass(LoweringRegistry.initializeWithDefaults()));
    }

    /**
     * Builds the hierarchy of every module of a design, in document order.
     *
     * @param design The design root.
     * @return One hierarchy per module.
     */
    public List<DesignHierarchy> build(DesignNode design) {
        List<DesignHierarchy> result = new ArrayList<>(design.modules().size());
        for (ModuleNode module : design.modules()) {
            result.add(buildModule(module));
        }
        log.info("Built graphs for {} module(s): {}", result.size(), diagnostics.summary());
        return result;
    }

    /**
     * Builds the hierarchy of a single module.
     */
    public DesignHierarchy buildModule(ModuleNode module) {
        log.debug("Building module '{}'", module.name());
        ModuleTraversalContext ctx = new ModuleTraversalContext(
                module.name(), options, classifier, diagnostics, sourceName, sourceLines);
        architecturePass.run(module, ctx);
        DesignHierarchy hierarchy = ctx.hierarchy();
        log.debug("Module '{}' done: {} detail graph(s)", module.name(), hierarchy.getDetailGraphs().size());
        return hierarchy;
    }

    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
