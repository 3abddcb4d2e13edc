package org.rtlgraph.analysis;

import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.TernaryNode;
import org.rtlgraph.frontend.ast.VarRefNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an expression subtree as display text for node labels.
 *
 * <p>Total and side-effect free: a null input yields the empty string and unexpected shapes fall
 * back to concatenating the children's renderings.</p>
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {}

    /**
     * Formats an expression.
     *
     * @param node The expression, may be null.
     * @return The display text, never null.
     */
    public static String format(AstNode node) {
        if (node == null) {
            return "";
        }
        if (node instanceof VarRefNode ref) {
            return nullToEmpty(ref.name());
        }
        if (node instanceof ConstNode constant) {
            return nullToEmpty(constant.value());
        }
        if (node instanceof OperatorNode op) {
            return formatOperator(op);
        }
        if (node instanceof TernaryNode ternary
                && ternary.condition() != null && ternary.whenTrue() != null && ternary.whenFalse() != null) {
            return format(ternary.condition()) + " ? " + format(ternary.whenTrue()) + " : " + format(ternary.whenFalse());
        }
        return concat(node.getChildren());
    }

    private static String formatOperator(OperatorNode node) {
        List<AstNode> operands = node.operands();
        String symbol = node.operator().symbol();
        switch (node.operator().category()) {
            case COMPARISON, ARITHMETIC -> {
                // only the first two operands are rendered
                if (operands.size() >= 2) {
                    return "(" + format(operands.get(0)) + " " + symbol + " " + format(operands.get(1)) + ")";
                }
            }
            case LOGICAL -> {
                return "(" + operands.stream().map(ExpressionFormatter::format).collect(Collectors.joining(symbol)) + ")";
            }
            case UNARY -> {
                return operands.isEmpty() ? "" : symbol + "(" + format(operands.get(0)) + ")";
            }
            default -> {
                // bitwise operators, selects and concatenations render their parts back to back
            }
        }
        return concat(operands);
    }

    private static String concat(List<AstNode> children) {
        StringBuilder sb = new StringBuilder();
        for (AstNode child : children) {
            sb.append(format(child));
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
