package org.rtlgraph.builder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rtlgraph.graph.CfgEdge;
import org.rtlgraph.graph.EdgeLabel;
import org.rtlgraph.graph.GraphModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConnectionResolverTest {

    private ConnectionResolver resolver;
    private SignalRegistry registry;

    @BeforeEach
    void setUp() {
        resolver = new ConnectionResolver(List.of("clk", "rst"));
        registry = new SignalRegistry();
    }

    @Test
    @DisplayName("One driver fans out to every receiver; receivers are not wired to each other")
    void driverFansOut() {
        registry.register("w", 0, BindingDirection.DRIVER);
        registry.register("w", 1, BindingDirection.RECEIVER);
        registry.register("w", 2, BindingDirection.RECEIVER);

        assertThat(resolver.resolve(registry)).containsExactly(
                new Connection(0, 1, List.of("w")),
                new Connection(0, 2, List.of("w")));
    }

    @Test
    void noSelfLoops() {
        registry.register("count", 0, BindingDirection.RECEIVER);
        registry.register("count", 0, BindingDirection.DRIVER);
        registry.register("count", 2, BindingDirection.RECEIVER);

        assertThat(resolver.resolve(registry)).containsExactly(new Connection(0, 2, List.of("count")));
    }

    @Test
    void inoutCountsAsReceiverWhenADriverExists() {
        registry.register("bus", 4, BindingDirection.DRIVER);
        registry.register("bus", 1, BindingDirection.INOUT);

        assertThat(resolver.resolve(registry)).containsExactly(new Connection(4, 1, List.of("bus")));
    }

    @Test
    @DisplayName("Without a driver the users are chained in ascending node order")
    void chainWithoutDriver() {
        registry.register("s", 3, BindingDirection.RECEIVER);
        registry.register("s", 1, BindingDirection.RECEIVER);
        registry.register("s", 2, BindingDirection.INOUT);
        registry.register("lonely", 5, BindingDirection.RECEIVER);

        assertThat(resolver.resolve(registry)).containsExactly(
                new Connection(1, 2, List.of("s")),
                new Connection(2, 3, List.of("s")));
    }

    @Test
    void signalsBetweenTheSamePairFormABus() {
        registry.register("a", 0, BindingDirection.DRIVER);
        registry.register("b", 0, BindingDirection.DRIVER);
        registry.register("a", 1, BindingDirection.RECEIVER);
        registry.register("b", 1, BindingDirection.RECEIVER);
        registry.register("c", 0, BindingDirection.DRIVER);
        registry.register("c", 2, BindingDirection.RECEIVER);

        List<Connection> connections = resolver.resolve(registry);

        assertThat(connections).hasSize(2);
        assertThat(connections.get(0).label()).isEqualTo(EdgeLabel.bus(List.of("a", "b")));
        assertThat(connections.get(1).label()).isEqualTo(EdgeLabel.of("c"));
    }

    @Test
    void ignoredSignalsAreNeverWired() {
        registry.register("CLK_in", 0, BindingDirection.DRIVER);
        registry.register("CLK_in", 1, BindingDirection.RECEIVER);
        registry.register("rst_n", 0, BindingDirection.DRIVER);
        registry.register("rst_n", 1, BindingDirection.RECEIVER);

        assertThat(resolver.resolve(registry)).isEmpty();
        assertThat(resolver.isIgnored("data")).isFalse();
    }

    @Test
    @DisplayName("Clock and reset patterns match name tokens, not arbitrary substrings")
    void ignorePatternsMatchTokens() {
        assertThat(resolver.isIgnored("sys_clk")).isTrue();
        assertThat(resolver.isIgnored("clk2x")).isTrue();
        assertThat(resolver.isIgnored("nrst")).isTrue();
        assertThat(resolver.isIgnored("first_valid")).isFalse();
        assertThat(resolver.isIgnored("burst_len")).isFalse();

        registry.register("first_valid", 0, BindingDirection.DRIVER);
        registry.register("first_valid", 1, BindingDirection.RECEIVER);
        assertThat(resolver.resolve(registry)).extracting(Connection::signals)
                .containsExactly(List.of("first_valid"));
    }

    @Test
    void applyAddsOneEdgePerConnection() {
        GraphModel architecture = new GraphModel("top");
        architecture.addCfgNode("u1\n(source)");
        architecture.addCfgNode("u2\n(sink)");
        registry.register("w", 0, BindingDirection.DRIVER);
        registry.register("w", 1, BindingDirection.RECEIVER);

        int added = resolver.apply(registry, architecture);

        assertThat(added).isEqualTo(1);
        assertThat(architecture.getCfgEdges()).containsExactly(new CfgEdge(0, 1, EdgeLabel.of("w")));
    }
}
