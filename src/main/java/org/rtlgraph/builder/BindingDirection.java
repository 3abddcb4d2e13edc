package org.rtlgraph.builder;

import org.rtlgraph.frontend.ast.PortDirection;

/**
 * Role of an architecture node with respect to one signal.
 */
public enum BindingDirection {
    DRIVER,
    RECEIVER,
    INOUT;

    /**
     * Direction of an instance pin as seen from the enclosing module: the instance drives the
     * signals bound to its outputs and receives those bound to its inputs.
     */
    public static BindingDirection ofInstancePin(PortDirection direction) {
        return switch (direction) {
            case IN -> RECEIVER;
            case OUT -> DRIVER;
            case INOUT -> INOUT;
        };
    }

    /**
     * Direction of a module port as seen from the module's internal logic: an input port drives
     * internal logic and an output port receives from it.
     */
    public static BindingDirection ofModulePort(PortDirection direction) {
        return switch (direction) {
            case IN -> DRIVER;
            case OUT -> RECEIVER;
            case INOUT -> INOUT;
        };
    }
}
