package org.rtlgraph.analysis;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.Operator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.rtlgraph.TestAst.num;
import static org.rtlgraph.TestAst.op;
import static org.rtlgraph.TestAst.var;

@Tag("unit")
class VariableCollectorTest {

    @Test
    void collectsDistinctNamesInPreorder() {
        AstNode expression = op(Operator.ADD, var("a"), op(Operator.MUL, var("b"), var("a")));

        assertThat(VariableCollector.collect(expression)).containsExactly("a", "b");
    }

    @Test
    void rootReferenceIsIncluded() {
        assertThat(VariableCollector.collect(var("x"))).containsExactly("x");
    }

    @Test
    void emptyForNullAndConstants() {
        assertThat(VariableCollector.collect(null)).isEmpty();
        assertThat(VariableCollector.collect(num("1"))).isEmpty();
        assertThat(VariableCollector.firstVariable(num("1"))).isNull();
    }

    @Test
    void firstVariable() {
        assertThat(VariableCollector.firstVariable(op(Operator.BIT_SELECT, var("mem"), var("idx")))).isEqualTo("mem");
    }
}
