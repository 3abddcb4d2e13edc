package org.rtlgraph.analysis;

import org.rtlgraph.frontend.ast.AssignKind;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.AstNodes;
import org.rtlgraph.frontend.ast.CaseNode;
import org.rtlgraph.frontend.ast.Operator;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.ProcessNode;
import org.rtlgraph.frontend.ast.SensitivityNode;
import org.rtlgraph.frontend.ast.UnknownNode;

import java.util.List;
import java.util.Locale;

/**
 * Labels procedural blocks and assignments with a heuristic role.
 *
 * <p>Rules, in priority order:
 * <ol>
 *   <li>assignments are continuous assignments;</li>
 *   <li>clock-sensitive blocks containing a case statement are FSM controllers;</li>
 *   <li>clock-sensitive blocks with {@code x <= x + ...} are counters;</li>
 *   <li>other blocks with a case statement or more than three arithmetic/bitwise operators are
 *       combinational datapaths;</li>
 *   <li>everything else is sequential or combinational logic depending on the clock.</li>
 * </ol>
 * The labels are hints for the reader of the graph, not verified properties of the design.</p>
 */
public class BlockClassifier {

    private static final int DATAPATH_OPERATOR_THRESHOLD = 3;

    private final List<String> clockPatterns;

    /**
     * @param clockPatterns Lower-case substrings that mark a sensitivity-list signal as a clock or
     *                      reset when the frontend reports no explicit edge.
     */
    public BlockClassifier(List<String> clockPatterns) {
        this.clockPatterns = clockPatterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Classifies a module item.
     *
     * @param block A {@link ProcessNode}, an {@link AssignNode} or any other module item.
     * @return The classification, never null.
     */
    public Classification classify(AstNode block) {
        if (block instanceof AssignNode) {
            return Classification.of(BlockKind.CONTINUOUS_ASSIGNMENT);
        }
        if (!(block instanceof ProcessNode process)) {
            return Classification.other(tagOf(block));
        }
        if (!process.kind().isAlwaysOrInitial()) {
            return Classification.other(process.kind().keyword());
        }

        boolean sequential = isClockSensitive(process);
        boolean hasCase = AstNodes.findFirst(process, CaseNode.class) != null;

        if (sequential && hasCase) {
            return Classification.of(BlockKind.FSM_CONTROLLER);
        }
        if (sequential && hasSelfIncrement(process)) {
            return Classification.of(BlockKind.COUNTER);
        }
        if (!sequential && (hasCase || countDatapathOperators(process) > DATAPATH_OPERATOR_THRESHOLD)) {
            return Classification.of(BlockKind.COMBINATIONAL_DATAPATH);
        }
        return Classification.of(sequential ? BlockKind.SEQUENTIAL_LOGIC : BlockKind.COMBINATIONAL_LOGIC);
    }

    /**
     * Whether a block is triggered by a clock: an explicit edge in its sensitivity list, or a
     * sensitivity signal whose name looks like a clock or reset.
     */
    public boolean isClockSensitive(ProcessNode process) {
        SensitivityNode sensitivity = process.sensitivity();
        if (sensitivity == null) {
            return false;
        }
        for (SensitivityNode.SenItem item : sensitivity.items()) {
            if (item.isEdgeTriggered()) {
                return true;
            }
        }
        for (SensitivityNode.SenItem item : sensitivity.items()) {
            for (String name : VariableCollector.collect(item.signal())) {
                if (matchesClockPattern(name)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Whether a signal name looks like a clock or reset.
     */
    public boolean matchesClockPattern(String signalName) {
        String lower = signalName.toLowerCase(Locale.ROOT);
        for (String pattern : clockPatterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasSelfIncrement(ProcessNode process) {
        for (AssignNode assign : AstNodes.findAll(process, AssignNode.class)) {
            if (assign.kind() != AssignKind.NON_BLOCKING) {
                continue;
            }
            String target = VariableCollector.firstVariable(assign.target());
            if (target == null) {
                continue;
            }
            for (AstNode source : assign.sources()) {
                for (OperatorNode op : AstNodes.findAll(source, OperatorNode.class)) {
                    if (op.operator() == Operator.ADD && VariableCollector.collect(op).contains(target)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static int countDatapathOperators(AstNode block) {
        int count = 0;
        for (OperatorNode op : AstNodes.findAll(block, OperatorNode.class)) {
            if (op.operator().isDatapathOperator()) {
                count++;
            }
        }
        return count;
    }

    private static String tagOf(AstNode node) {
        if (node instanceof UnknownNode unknown) {
            return unknown.tag();
        }
        return node == null ? "null" : node.getClass().getSimpleName();
    }
}
