package org.rtlgraph.frontend.ast;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Expression operators the graph builder lowers into dedicated data-flow nodes.
 *
 * <p>Each operator knows its display symbol, its category and the kind name used for the
 * synthetic result node in the data-flow graph.</p>
 */
public enum Operator {
    ADD("+", OperatorCategory.ARITHMETIC, "ADD", "add"),
    SUB("-", OperatorCategory.ARITHMETIC, "SUB", "sub"),
    MUL("*", OperatorCategory.ARITHMETIC, "MUL", "mul", "muls"),
    DIV("/", OperatorCategory.ARITHMETIC, "DIV", "div", "divs"),
    MOD("%", OperatorCategory.ARITHMETIC, "MOD", "mod", "moddiv", "moddivs"),
    SHL("<<", OperatorCategory.ARITHMETIC, "SLL", "shl", "sll", "shiftl"),
    SHR(">>", OperatorCategory.ARITHMETIC, "SRL", "shr", "srl", "shiftr"),
    ASHR(">>>", OperatorCategory.ARITHMETIC, "SRA", "ashr", "sra", "shiftrs"),
    AND("&", OperatorCategory.BITWISE, "AND", "and"),
    OR("|", OperatorCategory.BITWISE, "OR", "or"),
    XOR("^", OperatorCategory.BITWISE, "XOR", "xor"),
    LT("<", OperatorCategory.COMPARISON, "LT", "lt", "lts"),
    LTE("<=", OperatorCategory.COMPARISON, "LTE", "lte", "ltes"),
    GT(">", OperatorCategory.COMPARISON, "GT", "gt", "gts"),
    GTE(">=", OperatorCategory.COMPARISON, "GTE", "gte", "gtes"),
    EQ("==", OperatorCategory.COMPARISON, "EQ", "eq", "eqcase"),
    NEQ("!=", OperatorCategory.COMPARISON, "NEQ", "neq", "neqcase"),
    LAND("&&", OperatorCategory.LOGICAL, "LAND", "land", "logand"),
    LOR("||", OperatorCategory.LOGICAL, "LOR", "lor", "logor"),
    NEG("-", OperatorCategory.UNARY, "NEG", "neg", "negate"),
    NOT("~", OperatorCategory.UNARY, "NOT", "not"),
    LNOT("!", OperatorCategory.UNARY, "LNOT", "lnot", "lognot"),
    CONCAT("", OperatorCategory.CONCAT, "CONCAT", "concat"),
    BIT_SELECT("", OperatorCategory.SELECT, "BITSEL", "bitselect", "sel", "arraysel"),
    PART_SELECT("", OperatorCategory.SELECT, "PARTSEL", "partselect");

    private static final Map<String, Operator> BY_TAG = new HashMap<>();

    static {
        for (Operator op : values()) {
            for (String tag : op.tags) {
                BY_TAG.put(tag, op);
            }
        }
    }

    private final String symbol;
    private final OperatorCategory category;
    private final String dfgKind;
    private final String[] tags;

    Operator(String symbol, OperatorCategory category, String dfgKind, String... tags) {
        this.symbol = symbol;
        this.category = category;
        this.dfgKind = dfgKind;
        this.tags = tags;
    }

    public String symbol() {
        return symbol;
    }

    public OperatorCategory category() {
        return category;
    }

    /**
     * Kind name used when naming the operator's result in the data-flow graph, e.g. "ADD".
     */
    public String dfgKind() {
        return dfgKind;
    }

    /**
     * Whether this operator counts towards the datapath heuristic (add, sub, mul, and, or, xor).
     */
    public boolean isDatapathOperator() {
        return this == ADD || this == SUB || this == MUL || this == AND || this == OR || this == XOR;
    }

    /**
     * Resolves a frontend tag (case-insensitive) to an operator.
     *
     * @param tag e.g. "add", "lts", "logand"
     * @return the operator, or null if the tag is not an operator the builder knows
     */
    public static Operator fromTag(String tag) {
        return tag == null ? null : BY_TAG.get(tag.toLowerCase(Locale.ROOT));
    }
}
