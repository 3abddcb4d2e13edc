package org.rtlgraph;

import org.rtlgraph.frontend.ast.AssignKind;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.BeginNode;
import org.rtlgraph.frontend.ast.CaseItemNode;
import org.rtlgraph.frontend.ast.CaseNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.IfNode;
import org.rtlgraph.frontend.ast.InstanceNode;
import org.rtlgraph.frontend.ast.LoopKind;
import org.rtlgraph.frontend.ast.LoopNode;
import org.rtlgraph.frontend.ast.ModuleNode;
import org.rtlgraph.frontend.ast.Operator;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.PortConnectionNode;
import org.rtlgraph.frontend.ast.PortDeclNode;
import org.rtlgraph.frontend.ast.PortDirection;
import org.rtlgraph.frontend.ast.ProcessKind;
import org.rtlgraph.frontend.ast.ProcessNode;
import org.rtlgraph.frontend.ast.SensitivityNode;
import org.rtlgraph.frontend.ast.SourceLocation;
import org.rtlgraph.frontend.ast.VarRefNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthands for building syntax trees in tests.
 */
public final class TestAst {

    private TestAst() {}

    public static VarRefNode var(String name) {
        return new VarRefNode(name);
    }

    public static ConstNode num(String value) {
        return new ConstNode(value);
    }

    public static OperatorNode op(Operator operator, AstNode... operands) {
        return new OperatorNode(operator, operands);
    }

    public static AssignNode blocking(String target, AstNode rhs) {
        return new AssignNode(AssignKind.BLOCKING, List.of(rhs), var(target), null);
    }

    public static AssignNode nonBlocking(String target, AstNode rhs) {
        return new AssignNode(AssignKind.NON_BLOCKING, List.of(rhs), var(target), null);
    }

    public static AssignNode continuous(String target, AstNode rhs, int line) {
        return new AssignNode(AssignKind.CONTINUOUS, List.of(rhs), var(target), at(line));
    }

    public static IfNode ifThen(AstNode condition, AstNode then) {
        return new IfNode(condition, then, null, null);
    }

    public static IfNode ifThenElse(AstNode condition, AstNode then, AstNode otherwise) {
        return new IfNode(condition, then, otherwise, null);
    }

    public static BeginNode begin(AstNode... statements) {
        return new BeginNode(null, List.of(statements), null);
    }

    public static CaseItemNode item(AstNode value, AstNode... statements) {
        return new CaseItemNode(value == null ? List.of() : List.of(value), List.of(statements), null);
    }

    public static CaseNode caseOf(AstNode selector, CaseItemNode... items) {
        return new CaseNode(selector, List.of(items), null);
    }

    public static LoopNode loop(LoopKind kind, List<AstNode> init, AstNode condition, AstNode... body) {
        return new LoopNode(kind, init, condition, List.of(body), null);
    }

    public static SensitivityNode posedge(String signal) {
        return new SensitivityNode(List.of(new SensitivityNode.SenItem("posedge", var(signal))));
    }

    public static SensitivityNode level(String... signals) {
        List<SensitivityNode.SenItem> items = new ArrayList<>();
        for (String signal : signals) {
            items.add(new SensitivityNode.SenItem(null, var(signal)));
        }
        return new SensitivityNode(items);
    }

    public static ProcessNode always(SensitivityNode sensitivity, AstNode... body) {
        return new ProcessNode(ProcessKind.ALWAYS, null, sensitivity, List.of(body), null);
    }

    public static ProcessNode process(ProcessKind kind, AstNode... body) {
        return new ProcessNode(kind, null, null, List.of(body), null);
    }

    public static PortDeclNode port(String name, PortDirection direction) {
        return new PortDeclNode(name, direction, null);
    }

    public static InstanceNode instance(String name, String type, PortConnectionNode... pins) {
        return new InstanceNode(name, type, List.of(pins), null);
    }

    public static PortConnectionNode pin(String name, String direction, String signal) {
        return new PortConnectionNode(name, direction, var(signal));
    }

    public static ModuleNode module(String name, AstNode... items) {
        return new ModuleNode(name, Arrays.asList(items), null);
    }

    public static SourceLocation at(int line) {
        return new SourceLocation("d", line, 1);
    }
}
