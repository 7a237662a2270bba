package org.vadalog.vadacode;

import java.util.*;

/**
 * A positioned message about a Vadalog program.
 */
public class VadalogDiagnostic {
    private final VadalogRange range;
    private final DiagnosticSeverity severity;
    private final String code;
    private final String message;
    private final String href;
    private final String relatedInformation;
    private final Fragment fragmentViolation;

    public VadalogDiagnostic(VadalogRange range, DiagnosticSeverity severity, String code, String message,
                             String href, String relatedInformation, Fragment fragmentViolation) {
        this.range = range;
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.href = href;
        this.relatedInformation = relatedInformation;
        this.fragmentViolation = fragmentViolation;
    }

    // =====================================================================
    // FACTORY METHODS
    // =====================================================================

    public static VadalogDiagnostic of(VadalogToken token, DiagnosticCode code) {
        return of(token, code, Collections.emptyMap(), null);
    }

    public static VadalogDiagnostic of(VadalogToken token, DiagnosticCode code, Map<String, String> parameters) {
        return of(token, code, parameters, null);
    }

    public static VadalogDiagnostic of(VadalogToken token, DiagnosticCode code, Map<String, String> parameters,
                                       Fragment fragmentViolation) {
        return of(token.getRange(), token.getUri(), code, parameters, fragmentViolation);
    }

    public static VadalogDiagnostic of(VadalogRange range, String uri, DiagnosticCode code,
                                       Map<String, String> parameters, Fragment fragmentViolation) {
        String related = uri != null ? code.getDescription() : null;
        return new VadalogDiagnostic(range, code.getSeverity(), code.getCode(), code.format(parameters),
                code.getHref(), related, fragmentViolation);
    }

    public VadalogRange getRange() { return range; }
    public DiagnosticSeverity getSeverity() { return severity; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public String getHref() { return href; }
    public String getRelatedInformation() { return relatedInformation; }
    public Fragment getFragmentViolation() { return fragmentViolation; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VadalogDiagnostic)) return false;
        VadalogDiagnostic that = (VadalogDiagnostic) o;
        return Objects.equals(range, that.range) && severity == that.severity
                && Objects.equals(code, that.code) && Objects.equals(message, that.message)
                && Objects.equals(relatedInformation, that.relatedInformation)
                && fragmentViolation == that.fragmentViolation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(range, severity, code, message, relatedInformation, fragmentViolation);
    }

    @Override
    public String toString() {
        return "[" + severity + " " + code + "] " + range + " " + message
                + (fragmentViolation != null ? " (" + fragmentViolation.getLabel() + ")" : "");
    }
}
