package org.rtlgraph.builder;

import org.rtlgraph.analysis.BlockClassifier;
import org.rtlgraph.diagnostics.DiagnosticCategory;
import org.rtlgraph.diagnostics.DiagnosticsEngine;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.SourceLocation;
import org.rtlgraph.graph.DesignHierarchy;
import org.rtlgraph.graph.GraphModel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * All state of one module's traversal: SSA versions, the signal registry, the cluster scope
 * stack and the hierarchy being populated.
 *
 * <p>A fresh context is created for every module, so nothing carries over from one module to
 * the next. The context has a single writer, the pass that currently runs.</p>
 */
public final class ModuleTraversalContext {

    private final String moduleName;
    private final BuilderOptions options;
    private final BlockClassifier classifier;
    private final DiagnosticsEngine diagnostics;
    private final String sourceName;
    private final List<String> sourceLines;

    private final SsaState ssa = new SsaState();
    private final SignalRegistry signals = new SignalRegistry();
    private final Deque<Integer> clusterStack = new ArrayDeque<>();
    private final DesignHierarchy hierarchy;

    public ModuleTraversalContext(String moduleName, BuilderOptions options, BlockClassifier classifier,
                                  DiagnosticsEngine diagnostics, String sourceName, List<String> sourceLines) {
        this.moduleName = moduleName;
        this.options = options;
        this.classifier = classifier;
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
        this.sourceLines = sourceLines;
        this.hierarchy = new DesignHierarchy(moduleName, new GraphModel(moduleName));
    }

    public BuilderOptions options() {
        return options;
    }

    public BlockClassifier classifier() {
        return classifier;
    }

    public SsaState ssa() {
        return ssa;
    }

    public SignalRegistry signals() {
        return signals;
    }

    public DesignHierarchy hierarchy() {
        return hierarchy;
    }

    public GraphModel architecture() {
        return hierarchy.getArchitecture();
    }

    // --- Cluster scope ---

    public void pushCluster(int clusterId) {
        clusterStack.push(clusterId);
    }

    public void popCluster() {
        if (!clusterStack.isEmpty()) {
            clusterStack.pop();
        }
    }

    /**
     * Returns the innermost open cluster, or null outside any cluster.
     */
    public Integer currentCluster() {
        return clusterStack.peek();
    }

    // --- Source access ---

    /**
     * Returns the trimmed source text of a 1-based line, or null if the source is unavailable.
     */
    public String sourceLine(int line) {
        if (line < 1 || line > sourceLines.size()) {
            return null;
        }
        return sourceLines.get(line - 1).trim();
    }

    /**
     * Returns the line of a node, or -1 if the frontend gave no location.
     */
    public static int lineOf(AstNode node) {
        SourceLocation location = node == null ? null : node.location();
        return location == null ? -1 : location.line();
    }

    // --- Diagnostics ---

    public void reportMalformed(String message, AstNode node) {
        diagnostics.reportWarning(DiagnosticCategory.MALFORMED_INPUT, moduleName + ": " + message, sourceName, lineOf(node));
    }

    public void reportUnrecognized(String message, AstNode node) {
        diagnostics.reportInfo(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT, moduleName + ": " + message, sourceName, lineOf(node));
    }

    public void reportAmbiguous(String message, AstNode node) {
        diagnostics.reportInfo(DiagnosticCategory.CLASSIFICATION_AMBIGUITY, moduleName + ": " + message, sourceName, lineOf(node));
    }
}
