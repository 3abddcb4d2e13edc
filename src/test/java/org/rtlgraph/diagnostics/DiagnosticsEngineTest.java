package org.rtlgraph.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void summaryCountsBySeverity() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportWarning(DiagnosticCategory.MALFORMED_INPUT, "if without condition", "top", 7);
        diagnostics.reportInfo(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT, "typetable", "top", 0);

        assertThat(diagnostics.summary()).isEqualTo("0 errors, 1 warnings, 1 infos");
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void filtersByCategoryInReportOrder() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportInfo(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT, "first", null, 0);
        diagnostics.reportError("disk full", "out", 0);
        diagnostics.reportInfo(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT, "second", null, 0);

        assertThat(diagnostics.byCategory(DiagnosticCategory.UNRECOGNIZED_CONSTRUCT))
                .extracting(Diagnostic::message).containsExactly("first", "second");
        assertThat(diagnostics.byCategory(DiagnosticCategory.IO)).singleElement()
                .extracting(Diagnostic::severity).isEqualTo(Severity.ERROR);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void toStringNamesSourceAndLineWhenKnown() {
        assertThat(new Diagnostic(Severity.WARNING, DiagnosticCategory.MALFORMED_INPUT, "missing target", "fsm", 12))
                .hasToString("WARNING [MALFORMED_INPUT] fsm:12: missing target");
        assertThat(new Diagnostic(Severity.INFO, DiagnosticCategory.CLASSIFICATION_AMBIGUITY, "default label", "fsm", 0))
                .hasToString("INFO [CLASSIFICATION_AMBIGUITY] fsm: default label");
        assertThat(new Diagnostic(Severity.ERROR, DiagnosticCategory.IO, "boom", null, 3))
                .hasToString("ERROR [IO]: boom");
    }
}
