package com.herzen.learnpath.domain;

public class DomainModels {
    /**
     * Non-fatal finding of one run. {@code rowIndex} is the 1-based data row (header excluded)
     * and is null for findings that are not tied to an input row.
     */
    public record Diagnostic(DiagnosticKind kind,
                             Integer rowIndex,
                             String rawContent,
                             String studentId,
                             String message) {

        public static Diagnostic row(DiagnosticKind kind, int rowIndex, String raw, String message) {
            return new Diagnostic(kind, rowIndex, raw, null, message);
        }

        public static Diagnostic student(DiagnosticKind kind, String studentId, String message) {
            return new Diagnostic(kind, null, null, studentId, message);
        }

        public static Diagnostic run(DiagnosticKind kind, String message) {
            return new Diagnostic(kind, null, null, null, message);
        }
    }

    public enum DiagnosticKind {
        ROW_REJECTED,
        ROW_CORRECTED,
        DUPLICATE_ROW,
        INSUFFICIENT_DATA,
        NUMERIC_DEGENERACY,
        PARAMETER_ADJUSTED
    }
}
