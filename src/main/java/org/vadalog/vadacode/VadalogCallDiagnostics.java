package org.vadalog.vadacode;

import java.util.*;

/**
 * Arity checks of annotation and atom calls against their signatures.
 */
public final class VadalogCallDiagnostics {

    private VadalogCallDiagnostics() {
    }

    /**
     * Builtin annotations called with too few or too many terms. Unknown
     * annotations are not checked.
     */
    public static List<VadalogDiagnostic> checkAnnotations(Collection<AnnotationCall> calls) {
        List<VadalogDiagnostic> diagnostics = new ArrayList<>();
        for (AnnotationCall call : calls) {
            if (call.getAtom() == null) {
                continue;
            }
            SignatureHelp builtin = VadalogBuiltins.getAnnotation(call.getAtom().getText());
            if (builtin == null) {
                continue;
            }
            int required = builtin.getRequiredTermCount();
            int total = builtin.getTerms().size();
            int received = call.getTerms().size();
            if (received < required) {
                diagnostics.add(VadalogDiagnostic.of(call.getAtom(), DiagnosticCode.ANNOTATION_PARAMETERS,
                        Map.of("expected", String.valueOf(required), "received", String.valueOf(received))));
            } else if (received > total) {
                for (VadalogToken extra : call.getTerms().subList(total, received)) {
                    diagnostics.add(VadalogDiagnostic.of(extra, DiagnosticCode.ANNOTATION_PARAMETERS,
                            Map.of("expected", String.valueOf(total), "received", String.valueOf(received))));
                }
            }
        }
        return diagnostics;
    }

    /**
     * Atom calls whose number of terms differs from the signature of the atom.
     */
    public static List<VadalogDiagnostic> checkAtoms(Collection<AtomCall> calls, Map<String, SignatureHelp> signatures) {
        List<VadalogDiagnostic> diagnostics = new ArrayList<>();
        for (AtomCall call : calls) {
            if (call.getCallType() == AtomCallType.INPUT || call.getCallType() == AtomCallType.OUTPUT) {
                continue;
            }
            SignatureHelp signature = signatures.get(call.getName());
            if (signature == null) {
                continue;
            }
            int expected = signature.getTerms().size();
            int received = call.getTerms().size();
            Map<String, String> parameters =
                    Map.of("expected", String.valueOf(expected), "received", String.valueOf(received));
            if (received < expected) {
                diagnostics.add(VadalogDiagnostic.of(call.getAtom(), DiagnosticCode.ATOM_SIGNATURE_TERMS, parameters));
            } else if (received > expected) {
                for (VadalogToken extra : call.getTerms().subList(expected, received)) {
                    diagnostics.add(VadalogDiagnostic.of(extra, DiagnosticCode.ATOM_SIGNATURE_TERMS, parameters));
                }
            }
        }
        return diagnostics;
    }
}
