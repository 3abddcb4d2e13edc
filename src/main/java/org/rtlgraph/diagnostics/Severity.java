package org.rtlgraph.diagnostics;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
