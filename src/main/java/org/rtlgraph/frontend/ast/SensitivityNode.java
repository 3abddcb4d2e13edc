package org.rtlgraph.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * The sensitivity list of a procedural block ({@code @(posedge clk or negedge rst_n)}).
 *
 * @param items The individual triggers.
 */
public record SensitivityNode(List<SenItem> items) implements AstNode {

    public SensitivityNode {
        items = List.copyOf(items);
    }

    /**
     * One trigger of a sensitivity list.
     *
     * @param edge   "posedge", "negedge", "bothedge" or null for a level trigger.
     * @param signal The triggering expression, usually a {@link VarRefNode}; may be null.
     */
    public record SenItem(String edge, AstNode signal) {

        public boolean isEdgeTriggered() {
            return edge != null;
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return items.stream().map(SenItem::signal).filter(Objects::nonNull).toList();
    }
}
