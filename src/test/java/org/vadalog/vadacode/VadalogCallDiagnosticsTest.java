package org.vadalog.vadacode;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;
import static org.vadalog.vadacode.VadalogFixtures.*;

public class VadalogCallDiagnosticsTest {

    private static List<VadalogDiagnostic> annotationDiagnostics(String text) {
        return VadalogCallDiagnostics.checkAnnotations(analyse(text).getAnnotationCalls());
    }

    private static List<VadalogDiagnostic> atomDiagnostics(String text) {
        VadalogTreeWalker walker = analyse(text);
        Map<String, SignatureHelp> signatures = new VadalogSignatureHelpBuilder().buildFrom(walker);
        return VadalogCallDiagnostics.checkAtoms(walker.getAtomCalls(), signatures);
    }

    // =====================================================================
    // ANNOTATIONS
    // =====================================================================

    @Test
    public void tooFewAnnotationTerms() {
        List<VadalogDiagnostic> diagnostics = annotationDiagnostics("@bind(\"a\").");

        assertEquals(1, diagnostics.size());
        assertEquals("1024", diagnostics.get(0).getCode());
        assertEquals("Expected 4 arguments, but got 1.", diagnostics.get(0).getMessage());
        assertEquals(new VadalogRange(0, 1, 0, 5), diagnostics.get(0).getRange());
    }

    @Test
    public void tooManyAnnotationTermsFlagsEachExtraTerm() {
        List<VadalogDiagnostic> diagnostics = annotationDiagnostics("a(1).\n@output(\"a\", \"b\", \"c\").");

        assertEquals(2, diagnostics.size());
        assertEquals("Expected 1 arguments, but got 3.", diagnostics.get(0).getMessage());
        assertEquals(new VadalogRange(1, 13, 1, 16), diagnostics.get(0).getRange());
        assertEquals(new VadalogRange(1, 18, 1, 21), diagnostics.get(1).getRange());
    }

    @Test
    public void optionalAnnotationTerms() {
        assertTrue(annotationDiagnostics("@library(\"h\", \"hash\").").isEmpty());
        assertTrue(annotationDiagnostics("@library(\"h\", \"hash\", \"md5\", \"\").").isEmpty());
        assertEquals(1, annotationDiagnostics("@library(\"h\").").size());
    }

    @Test
    public void emptyDefinitionIsAlsoAnArityError() {
        List<VadalogDiagnostic> diagnostics = annotationDiagnostics("@input().");

        assertEquals(1, diagnostics.size());
        assertEquals("Expected 1 arguments, but got 0.", diagnostics.get(0).getMessage());
    }

    @Test
    public void unknownAnnotationsAreNotChecked() {
        assertTrue(annotationDiagnostics("@custom(1, 2, 3).").isEmpty());
        assertTrue(annotationDiagnostics("@relaxedSafety().").isEmpty());
    }

    // =====================================================================
    // ATOMS
    // =====================================================================

    @Test
    public void tooFewAtomTerms() {
        List<VadalogDiagnostic> diagnostics = atomDiagnostics("a(1, 2).\nb(X) :- a(X).\n@output(\"b\").");

        assertEquals(1, diagnostics.size());
        assertEquals("1026", diagnostics.get(0).getCode());
        assertEquals("Expected 2 terms, but got 1.", diagnostics.get(0).getMessage());
        assertEquals(new VadalogRange(1, 8, 1, 9), diagnostics.get(0).getRange());
    }

    @Test
    public void tooManyAtomTermsFlagsEachExtraTerm() {
        List<VadalogDiagnostic> diagnostics = atomDiagnostics("a(1).\nb(X) :- a(X, Y).\n@output(\"b\").");

        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 13, 1, 14), diagnostics.get(0).getRange());
    }

    @Test
    public void headUsageDefinesTheSignature() {
        List<VadalogDiagnostic> diagnostics = atomDiagnostics(
                "e(1, 2).\np(X, Y) :- e(X, Y).\nq(X) :- p(X).\n@output(\"q\").");

        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(2, 8, 2, 9), diagnostics.get(0).getRange());
    }

    @Test
    public void outputsAreNotChecked() {
        assertTrue(atomDiagnostics("a(1).\nb(X) :- a(X).\n@output(\"b\").").isEmpty());
    }

    // =====================================================================
    // SIGNATURES
    // =====================================================================

    @Test
    public void signatureFromHeadUsage() {
        Map<String, SignatureHelp> signatures = new VadalogSignatureHelpBuilder()
                .buildFrom(analyse("a(1, 2).\nb(X, Y) :- a(X, Y).\n@output(\"b\")."));

        assertEquals("b(X, Y).", signatures.get("b").getSignature());
        assertEquals(SignatureSource.USAGE, signatures.get("b").getSource());
        assertEquals("a(Term1, Term2).", signatures.get("a").getSignature());
        assertEquals(SignatureSource.FACT, signatures.get("a").getSource());
        assertEquals(TokenKind.INT, signatures.get("a").getTerms().get(0).getType());
    }

    @Test
    public void signatureFromInputMappings() {
        Map<String, SignatureHelp> signatures = new VadalogSignatureHelpBuilder().buildFrom(analyse(
                "@input(\"t\").\n"
                        + "@bind(\"t\", \"csv\", \"d\", \"t.csv\").\n"
                        + "@mapping(\"t\", 1, \"name\", \"string\").\n"
                        + "@mapping(\"t\", 0, \"id\", \"int\").\n"
                        + "r(X) :- t(X, _).\n"
                        + "@output(\"r\")."));

        SignatureHelp t = signatures.get("t");
        assertEquals("t(id, name).", t.getSignature());
        assertEquals(SignatureSource.INPUT, t.getSource());
        assertEquals(TokenKind.INT, t.getTerms().get(0).getType());
        assertEquals(TokenKind.STRING, t.getTerms().get(1).getType());
    }

    @Test
    public void signatureFromVadoc() {
        Map<String, SignatureHelp> signatures = new VadalogSignatureHelpBuilder().buildFrom(analyse(
                "%% Edges of the graph.\n"
                        + "%% @term {string} from source node\n"
                        + "%% @term {string} to\n"
                        + "edge(\"a\", \"b\")."));

        SignatureHelp edge = signatures.get("edge");
        assertEquals("edge(from, to).", edge.getSignature());
        assertEquals("Edges of the graph.", edge.getDocumentation());
        assertEquals("source node", edge.getTerms().get(0).getDocumentation());
        assertEquals(TokenKind.STRING, edge.getTerms().get(1).getType());
    }

    @Test
    public void vadocCreatesMissingSignatures() {
        Map<String, SignatureHelp> signatures = new VadalogSignatureHelpBuilder().buildFrom(analyse(
                "%% Read from the warehouse.\n%% @term {int} id\n@input(\"w\")."));

        SignatureHelp w = signatures.get("w");
        assertEquals(SignatureSource.DOCUMENTATION, w.getSource());
        assertEquals("w(id).", w.getSignature());
    }

    @Test
    public void builtinSignatures() {
        SignatureHelp bind = VadalogBuiltins.getAnnotation("bind");

        assertEquals(4, bind.getTerms().size());
        assertEquals(4, bind.getRequiredTermCount());
        assertEquals(SignatureSource.BUILTIN, bind.getSource());
        assertEquals(2, VadalogBuiltins.getAnnotation("library").getRequiredTermCount());
        assertNull(VadalogBuiltins.getAnnotation("custom"));
    }
}
