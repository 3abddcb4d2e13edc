package org.rtlgraph.builder;

/**
 * One architecture node's use of a signal.
 *
 * @param nodeId    The architecture node id.
 * @param direction Whether the node drives, receives or does both.
 */
public record SignalBinding(int nodeId, BindingDirection direction) {
}
