package org.rtlgraph.builder;

import org.rtlgraph.analysis.BlockKind;
import org.rtlgraph.analysis.Classification;
import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.analysis.VariableCollector;
import org.rtlgraph.builder.lowering.AssignLowering;
import org.rtlgraph.builder.lowering.DetailPass;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.AstNodes;
import org.rtlgraph.frontend.ast.BeginNode;
import org.rtlgraph.frontend.ast.CaseNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.DeclarationNode;
import org.rtlgraph.frontend.ast.IfNode;
import org.rtlgraph.frontend.ast.InstanceNode;
import org.rtlgraph.frontend.ast.LoopNode;
import org.rtlgraph.frontend.ast.ModuleNode;
import org.rtlgraph.frontend.ast.PortConnectionNode;
import org.rtlgraph.frontend.ast.PortDeclNode;
import org.rtlgraph.frontend.ast.PortDirection;
import org.rtlgraph.frontend.ast.ProcessKind;
import org.rtlgraph.frontend.ast.ProcessNode;
import org.rtlgraph.frontend.ast.UnknownNode;
import org.rtlgraph.graph.GraphModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a module's architecture graph: one node per procedural block, continuous assignment
 * and instance, plus one aggregated node per port direction, wired by connection resolution.
 */
public final class ArchitecturePass {

    private static final Logger log = LoggerFactory.getLogger(ArchitecturePass.class);

    private static final Map<PortDirection, String> PORT_NODE_TITLES = new EnumMap<>(Map.of(
            PortDirection.IN, "Inputs",
            PortDirection.OUT, "Outputs",
            PortDirection.INOUT, "Inouts"));

    private final DetailPass detailPass;

    public ArchitecturePass(DetailPass detailPass) {
        this.detailPass = detailPass;
    }

    /**
     * Visits the module's items in document order, then materializes the port nodes and resolves
     * connections.
     *
     * @param module The module.
     * @param ctx    A fresh traversal context for this module.
     */
    public void run(ModuleNode module, ModuleTraversalContext ctx) {
        GraphModel architecture = ctx.architecture();
        int moduleCluster = architecture.addCluster("Module: " + module.name(), ctx.options().moduleClusterColor());
        ctx.pushCluster(moduleCluster);
        try {
            Map<PortDirection, List<String>> ports = new EnumMap<>(PortDirection.class);
            for (AstNode item : module.items()) {
                visitItem(item, ctx, ports);
            }
            materializePorts(ports, ctx);

            int edges = new ConnectionResolver(ctx.options().ignoredSignalPatterns()).apply(ctx.signals(), architecture);
            log.debug("Module '{}': {} architecture nodes, {} connections", module.name(), architecture.getNodeCount(), edges);
        } finally {
            ctx.popCluster();
        }
    }

    private void visitItem(AstNode item, ModuleTraversalContext ctx, Map<PortDirection, List<String>> ports) {
        if (item instanceof ProcessNode || item instanceof AssignNode) {
            visitBlock(item, ctx);
        } else if (item instanceof InstanceNode instance) {
            visitInstance(instance, ctx);
        } else if (item instanceof PortDeclNode port) {
            ports.computeIfAbsent(port.direction(), d -> new ArrayList<>()).add(port.name());
        } else if (item instanceof BeginNode begin) {
            // generate blocks arrive as named begin blocks
            for (AstNode child : begin.statements()) {
                visitItem(child, ctx, ports);
            }
        } else if (item instanceof UnknownNode unknown) {
            ctx.reportUnrecognized("module item <" + unknown.tag() + "> has no architecture rule", unknown);
            for (AstNode child : unknown.children()) {
                visitItem(child, ctx, ports);
            }
        } else if (!(item instanceof DeclarationNode)) {
            log.trace("Skipping module item {}", item.getClass().getSimpleName());
        }
    }

    private void visitBlock(AstNode block, ModuleTraversalContext ctx) {
        GraphModel architecture = ctx.architecture();
        Classification classification = ctx.classifier().classify(block);
        String label = smartLabel(block, classification);
        if (classification.kind().isFallback()) {
            ctx.reportAmbiguous("no specific role for block, labelled '" + classification.label() + "'", block);
        }

        int nodeId = architecture.addCfgNode(label, ctx.currentCluster());
        int line = ModuleTraversalContext.lineOf(block);
        if (line > 0) {
            architecture.setLineNumber(nodeId, line);
            String text = ctx.sourceLine(line);
            if (text != null) {
                architecture.setSourceText(nodeId, text);
            }
        }
        registerReadsAndWrites(block, nodeId, ctx.signals());

        String key = subGraphKey(block, nodeId);
        ctx.hierarchy().addDetailGraph(key, detailPass.build(key, block, ctx));
        architecture.addDrillDownLink(ctx.currentCluster(), nodeId, key);
    }

    private void visitInstance(InstanceNode instance, ModuleTraversalContext ctx) {
        GraphModel architecture = ctx.architecture();
        String name = instance.name() == null ? "?" : instance.name();
        if (instance.moduleType() == null) {
            ctx.reportMalformed("instance '" + name + "' without a module type", instance);
        }
        String type = instance.moduleType() == null ? "?" : instance.moduleType();

        int nodeId = architecture.addCfgNode(name + "\n(" + type + ")", ctx.currentCluster());
        int line = ModuleTraversalContext.lineOf(instance);
        if (line > 0) {
            architecture.setLineNumber(nodeId, line);
        }
        if (instance.moduleType() != null) {
            architecture.setModuleLink(nodeId, instance.moduleType());
        }

        for (PortConnectionNode port : instance.ports()) {
            BindingDirection direction = BindingDirection.ofInstancePin(PortDirection.normalize(port.direction()));
            for (String signal : VariableCollector.collect(port.expression())) {
                ctx.signals().register(signal, nodeId, direction);
            }
        }
    }

    private static void materializePorts(Map<PortDirection, List<String>> ports, ModuleTraversalContext ctx) {
        for (Map.Entry<PortDirection, List<String>> entry : ports.entrySet()) {
            List<String> names = entry.getValue();
            int nodeId = ctx.architecture().addCfgNode(
                    PORT_NODE_TITLES.get(entry.getKey()) + "\n " + String.join(", ", names), ctx.currentCluster());
            BindingDirection direction = BindingDirection.ofModulePort(entry.getKey());
            for (String name : names) {
                ctx.signals().register(name, nodeId, direction);
            }
        }
    }

    /**
     * Registers the signals a block writes as driven by it and the signals it reads as received.
     * The write target of an assignment is the first variable of its last child; everything else
     * in the assignment, and every control condition, is a read.
     */
    static void registerReadsAndWrites(AstNode block, int nodeId, SignalRegistry signals) {
        for (AstNode node : AstNodes.preorder(block)) {
            if (node instanceof AssignNode assign) {
                for (AstNode source : assign.sources()) {
                    registerAll(VariableCollector.collect(source), nodeId, BindingDirection.RECEIVER, signals);
                }
                String target = VariableCollector.firstVariable(assign.target());
                for (String variable : VariableCollector.collect(assign.target())) {
                    signals.register(variable, nodeId,
                            variable.equals(target) ? BindingDirection.DRIVER : BindingDirection.RECEIVER);
                }
            } else if (node instanceof IfNode conditional) {
                registerAll(VariableCollector.collect(conditional.condition()), nodeId, BindingDirection.RECEIVER, signals);
            } else if (node instanceof CaseNode dispatch) {
                registerAll(VariableCollector.collect(dispatch.selector()), nodeId, BindingDirection.RECEIVER, signals);
            } else if (node instanceof LoopNode loop) {
                registerAll(VariableCollector.collect(loop.condition()), nodeId, BindingDirection.RECEIVER, signals);
            }
        }
    }

    private static void registerAll(Iterable<String> names, int nodeId, BindingDirection direction, SignalRegistry signals) {
        for (String name : names) {
            signals.register(name, nodeId, direction);
        }
    }

    /**
     * Label of a block's architecture node: the classification, followed by the assignment when
     * the block holds exactly one. A single constant assignment in an initial block is an "Init".
     */
    static String smartLabel(AstNode block, Classification classification) {
        List<AssignNode> assigns = AstNodes.findAll(block, AssignNode.class);
        if (assigns.size() != 1) {
            return classification.label();
        }
        AssignNode assign = assigns.get(0);
        String lhs = VariableCollector.firstVariable(assign.target());
        if (lhs == null) {
            lhs = AssignLowering.UNNAMED;
        }
        if (block instanceof ProcessNode process && process.kind() == ProcessKind.INITIAL
                && assign.rhs() instanceof ConstNode constant) {
            return BlockKind.INIT.label() + "\n" + lhs + " = " + constant.value();
        }
        return classification.label() + "\n" + lhs + " " + assign.kind().operator() + " "
                + ExpressionFormatter.format(assign.rhs());
    }

    static String subGraphKey(AstNode block, int nodeId) {
        String kind = block instanceof ProcessNode process ? process.kind().keyword() : "assign";
        return kind + "_" + nodeId;
    }
}
