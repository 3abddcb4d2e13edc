package org.rtlgraph.export;

import com.typesafe.config.Config;

/**
 * Settings of the output adapters.
 *
 * @param format             Default output format.
 * @param busLabelThreshold  Bus edges with more signals than this show a count instead of the names.
 * @param viewerPage         Page that drill-down links point to.
 * @param linkExtension      Extension of the rendered files the links name, e.g. {@code svg}.
 */
public record ExportOptions(ExportFormat format, int busLabelThreshold, String viewerPage, String linkExtension) {

    public static ExportOptions defaults() {
        return new ExportOptions(ExportFormat.DOT, 3, "viewer.html", "svg");
    }

    /**
     * Reads the {@code rtlgraph.export} section. Missing keys keep their defaults.
     */
    public static ExportOptions fromConfig(Config config) {
        ExportOptions defaults = defaults();
        if (!config.hasPath("rtlgraph.export")) {
            return defaults;
        }
        Config export = config.getConfig("rtlgraph.export");
        return new ExportOptions(
                export.hasPath("format") ? ExportFormat.parse(export.getString("format")) : defaults.format(),
                export.hasPath("bus-label-threshold") ? export.getInt("bus-label-threshold") : defaults.busLabelThreshold(),
                export.hasPath("viewer-page") ? export.getString("viewer-page") : defaults.viewerPage(),
                export.hasPath("link-extension") ? export.getString("link-extension") : defaults.linkExtension());
    }

    public ExportOptions withFormat(ExportFormat newFormat) {
        return new ExportOptions(newFormat, busLabelThreshold, viewerPage, linkExtension);
    }
}
