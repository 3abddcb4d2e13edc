package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * An instantiation of another module.
 *
 * @param name       The instance name, e.g. {@code u_alu}.
 * @param moduleType The instantiated module's name.
 * @param ports      The port bindings in order.
 * @param location   Where the instance appears.
 */
public record InstanceNode(String name, String moduleType, List<PortConnectionNode> ports, SourceLocation location)
        implements AstNode {

    public InstanceNode {
        ports = List.copyOf(ports);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(ports);
    }
}
