package org.rtlgraph.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.Operator;
import org.rtlgraph.frontend.ast.TernaryNode;
import org.rtlgraph.frontend.ast.UnknownNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.rtlgraph.TestAst.num;
import static org.rtlgraph.TestAst.op;
import static org.rtlgraph.TestAst.var;

@Tag("unit")
class ExpressionFormatterTest {

    @Test
    void nullAndLeaves() {
        assertThat(ExpressionFormatter.format(null)).isEmpty();
        assertThat(ExpressionFormatter.format(var("count"))).isEqualTo("count");
        assertThat(ExpressionFormatter.format(num("8'h1"))).isEqualTo("8'h1");
    }

    @Test
    void binaryOperatorsAreParenthesized() {
        assertThat(ExpressionFormatter.format(op(Operator.LT, var("i"), num("4")))).isEqualTo("(i < 4)");
        assertThat(ExpressionFormatter.format(
                op(Operator.ADD, var("a"), op(Operator.MUL, var("b"), var("c")))))
                .isEqualTo("(a + (b * c))");
    }

    @Test
    @DisplayName("Arithmetic operators render only their first two operands")
    void extraOperandsAreDropped() {
        assertThat(ExpressionFormatter.format(op(Operator.ADD, var("a"), var("b"), var("c")))).isEqualTo("(a + b)");
    }

    @Test
    void logicalOperatorsJoinAllOperands() {
        assertThat(ExpressionFormatter.format(op(Operator.LAND, var("a"), var("b"), var("c")))).isEqualTo("(a&&b&&c)");
    }

    @Test
    void unaryAndTernary() {
        assertThat(ExpressionFormatter.format(op(Operator.NOT, var("a")))).isEqualTo("~(a)");
        assertThat(ExpressionFormatter.format(new TernaryNode(var("sel"), var("a"), var("b")))).isEqualTo("sel ? a : b");
    }

    @Test
    void unknownShapesConcatenateChildren() {
        AstNode unknown = new UnknownNode("replicate", List.of(num("2"), var("x")));
        assertThat(ExpressionFormatter.format(unknown)).isEqualTo("2x");
        assertThat(ExpressionFormatter.format(op(Operator.CONCAT, var("hi"), var("lo")))).isEqualTo("hilo");
    }

    @Test
    @DisplayName("Bitwise operators have no infix rendering and concatenate their operands")
    void bitwiseOperatorsConcatenate() {
        assertThat(ExpressionFormatter.format(op(Operator.AND, var("a"), var("b")))).isEqualTo("ab");
        assertThat(ExpressionFormatter.format(op(Operator.XOR, var("a"), op(Operator.ADD, var("b"), num("1")))))
                .isEqualTo("a(b + 1)");
    }

    @Test
    void formattingIsRepeatable() {
        AstNode expression = op(Operator.SUB, var("a"), num("1"));
        String first = ExpressionFormatter.format(expression);
        assertThat(ExpressionFormatter.format(expression)).isEqualTo(first);
    }
}
