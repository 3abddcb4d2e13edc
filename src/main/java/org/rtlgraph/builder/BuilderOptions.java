package org.rtlgraph.builder;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Tunables of the graph builder.
 *
 * @param clockPatterns         Lower-case substrings marking a sensitivity signal as clock or reset.
 * @param ignoredSignalPatterns Lower-case substrings of signals never wired by connection resolution.
 * @param moduleClusterColor    Fill colour of the module cluster in the architecture graph.
 * @param blockClusterColor     Fill colour of the block cluster in detail graphs.
 */
public record BuilderOptions(
        List<String> clockPatterns,
        List<String> ignoredSignalPatterns,
        String moduleClusterColor,
        String blockClusterColor
) {

    private static final List<String> DEFAULT_PATTERNS = List.of("clk", "clock", "reset", "rst");

    public BuilderOptions {
        clockPatterns = List.copyOf(clockPatterns);
        ignoredSignalPatterns = List.copyOf(ignoredSignalPatterns);
    }

    /**
     * Options matching the shipped {@code reference.conf}.
     */
    public static BuilderOptions defaults() {
        return new BuilderOptions(DEFAULT_PATTERNS, DEFAULT_PATTERNS, "lightgrey", "lightyellow");
    }

    /**
     * Reads the options from the {@code rtlgraph.builder} section. Missing keys keep their defaults.
     *
     * @param config The resolved application configuration.
     * @return The options.
     */
    public static BuilderOptions fromConfig(Config config) {
        BuilderOptions defaults = defaults();
        if (!config.hasPath("rtlgraph.builder")) {
            return defaults;
        }
        Config builder = config.getConfig("rtlgraph.builder");
        return new BuilderOptions(
                builder.hasPath("clock-patterns") ? builder.getStringList("clock-patterns") : defaults.clockPatterns(),
                builder.hasPath("ignored-signal-patterns")
                        ? builder.getStringList("ignored-signal-patterns") : defaults.ignoredSignalPatterns(),
                builder.hasPath("module-cluster-color")
                        ? builder.getString("module-cluster-color") : defaults.moduleClusterColor(),
                builder.hasPath("block-cluster-color")
                        ? builder.getString("block-cluster-color") : defaults.blockClusterColor());
    }
}
