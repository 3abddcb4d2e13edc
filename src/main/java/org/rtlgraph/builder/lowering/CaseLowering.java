package org.rtlgraph.builder.lowering;

import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.frontend.ast.CaseItemNode;
import org.rtlgraph.frontend.ast.CaseNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers a case statement into a dispatch node, one node per distinct item value and a single
 * end node all items converge on.
 */
public final class CaseLowering implements StatementLowering<CaseNode> {

    static final String DEFAULT = "default";

    @Override
    public Fragment lower(CaseNode node, DetailContext ctx) {
        if (node.selector() == null) {
            ctx.module().reportMalformed("case statement without a selector", node);
        }
        Set<String> uses = ctx.expressions().latestReads(node.selector());
        ctx.expressions().lower(node.selector());

        String selector = node.selector() == null ? "?" : ExpressionFormatter.format(node.selector());
        int dispatch = ctx.addNode("case (" + selector + ")\nUSE: " + DetailContext.formatUses(uses), node);
        ctx.graph().setUses(dispatch, uses);
        int end = ctx.addNode("EndCase", null);

        Map<String, Integer> itemNodes = new LinkedHashMap<>();
        for (CaseItemNode item : node.items()) {
            String value = valueLabel(item);
            Integer itemNode = itemNodes.get(value);
            boolean created = itemNode == null;
            if (created) {
                itemNode = ctx.addNode(value, item);
                itemNodes.put(value, itemNode);
                ctx.edge(dispatch, itemNode, value);
            }

            Fragment body = ctx.lowerSequence(item.statements());
            if (body.isEmpty()) {
                if (created) {
                    ctx.edge(itemNode, end);
                }
            } else {
                ctx.edge(itemNode, body.entry());
                ctx.connect(body, end);
            }
        }
        if (itemNodes.isEmpty()) {
            ctx.edge(dispatch, end);
        }
        return new Fragment(dispatch, end);
    }

    private static String valueLabel(CaseItemNode item) {
        if (item.isDefault()) {
            return DEFAULT;
        }
        String label = item.values().stream().map(ExpressionFormatter::format).collect(Collectors.joining(", "));
        return label.isEmpty() ? DEFAULT : label;
    }
}
