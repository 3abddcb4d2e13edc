package org.rtlgraph.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects findings produced while reading a design and building its graphs.
 *
 * <p>Graph construction never aborts on bad input; it degrades locally and reports here so
 * callers can decide what to surface. Only adapters outside the core report errors.</p>
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportInfo(DiagnosticCategory category, String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Severity.INFO, category, message, sourceName, lineNumber));
    }

    public void reportWarning(DiagnosticCategory category, String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Severity.WARNING, category, message, sourceName, lineNumber));
    }

    public void reportError(String message, String sourceName, int lineNumber) {
        diagnostics.add(new Diagnostic(Severity.ERROR, DiagnosticCategory.IO, message, sourceName, lineNumber));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.WARNING);
    }

    /**
     * Returns all findings in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the findings of one category, in report order.
     */
    public List<Diagnostic> byCategory(DiagnosticCategory category) {
        return diagnostics.stream().filter(d -> d.category() == category).toList();
    }

    /**
     * One-line summary, e.g. {@code "0 errors, 2 warnings, 5 infos"}.
     */
    public String summary() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Diagnostic d : diagnostics) {
            counts.merge(d.severity(), 1, Integer::sum);
        }
        return counts.getOrDefault(Severity.ERROR, 0) + " errors, "
                + counts.getOrDefault(Severity.WARNING, 0) + " warnings, "
                + counts.getOrDefault(Severity.INFO, 0) + " infos";
    }
}
