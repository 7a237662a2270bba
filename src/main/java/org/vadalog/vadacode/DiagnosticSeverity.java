package org.vadalog.vadacode;

/**
 * Diagnostic severities, numbered as editors expect them.
 */
public enum DiagnosticSeverity {
    ERROR(1),
    WARNING(2),
    INFORMATION(3),
    HINT(4);

    private final int value;

    DiagnosticSeverity(int value) {
        this.value = value;
    }

    public int getValue() { return value; }
}
