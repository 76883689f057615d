package com.tyron.markj.api.diagnostics;

/**
 * Severity of a diagnostic produced by a markup checker.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
