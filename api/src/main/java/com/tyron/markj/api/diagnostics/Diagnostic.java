package com.tyron.markj.api.diagnostics;

import java.util.Objects;

/**
 * A single diagnostic (error/warning/info) produced for a specific text snapshot.
 *
 * Offsets are 0-based character offsets into the checked text, range [startOffset, endOffset).
 */
public final class Diagnostic {

    private final DiagnosticSeverity severity;
    private final int startOffset;
    private final int endOffset;
    private final String message;

    // Optional metadata
    private final String code;
    private final String source;

    public Diagnostic(
            DiagnosticSeverity severity,
            int startOffset,
            int endOffset,
            String message,
            String code,
            String source
    ) {
        this.severity = Objects.requireNonNull(severity, "severity");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid range [" + startOffset + ", " + endOffset + ")");
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.message = message != null ? message : "";
        this.code = code;
        this.source = source;
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Stable rule id, e.g. {@code "img-alt"}.
     */
    public String getCode() {
        return code;
    }

    /**
     * Id of the checker that produced this diagnostic (e.g. "a11y").
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return severity + " " + code + " [" + startOffset + ", " + endOffset + "): " + message;
    }
}
