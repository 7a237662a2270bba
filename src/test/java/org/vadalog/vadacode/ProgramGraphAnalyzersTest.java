package org.vadalog.vadacode;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;
import static org.vadalog.vadacode.VadalogFixtures.*;

/**
 * Analyzers which report program errors rather than fragment violations.
 */
public class ProgramGraphAnalyzersTest {

    @Test
    public void extensionalAtomAsOutput() {
        List<VadalogDiagnostic> diagnostics = withCode(analyse("a(1).\n@output(\"a\").").getDiagnostics(), "1039");

        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 9, 1, 10), diagnostics.get(0).getRange());
        assertNull(diagnostics.get(0).getFragmentViolation());
    }

    @Test
    public void intensionalAtomAsOutput() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X) :- a(X).\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1039").isEmpty());
    }

    @Test
    public void bindingOnUnknownAtom() {
        VadalogTreeWalker walker = analyse("a(1).\n@bind(\"a\", \"csv\", \"dir\", \"a.csv\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1040");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 7, 1, 8), diagnostics.get(0).getRange());
    }

    @Test
    public void bindingOnInput() {
        VadalogTreeWalker walker = analyse("@input(\"a\").\n@bind(\"a\", \"csv\", \"dir\", \"a.csv\").\n"
                + "b(X) :- a(X).\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1040").isEmpty());
    }

    @Test
    public void variablesInFact() {
        List<VadalogDiagnostic> diagnostics = withCode(analyse("a(X).").getDiagnostics(), "1041");

        assertEquals(1, diagnostics.size());
    }

    @Test
    public void anonymousVariable() {
        VadalogTreeWalker walker = analyse("a(1, 2).\nb(X) :- a(X, Y).\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1025");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 13, 1, 14), diagnostics.get(0).getRange());
        assertEquals(DiagnosticSeverity.WARNING, diagnostics.get(0).getSeverity());
    }

    @Test
    public void variableUsedInConditionIsNotAnonymous() {
        VadalogTreeWalker walker = analyse("a(1, 2).\nb(X) :- a(X, Y), Y > 1.\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1025").isEmpty());
    }

    @Test
    public void negatedHeadVariableNeedsPositiveBinding() {
        VadalogTreeWalker walker = analyse("a(1).\nc(2).\nb(X) :- a(Y), not c(X).\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1023");
        assertEquals(2, diagnostics.size());
        assertEquals(new VadalogRange(2, 2, 2, 3), diagnostics.get(0).getRange());
        assertEquals(new VadalogRange(2, 20, 2, 21), diagnostics.get(1).getRange());
    }

    @Test
    public void safeNegation() {
        VadalogTreeWalker walker = analyse("a(1).\nc(2).\nb(X) :- a(X), not c(X).\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1023").isEmpty());
    }

    @Test
    public void keywordsAsAtomNames() {
        VadalogTreeWalker walker = analyse("sum(1).\ncount(X) :- sum(X).\n@output(\"count\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1043");
        assertEquals(4, diagnostics.size());
        assertEquals("Atom name contains reserved keyword sum.", diagnostics.get(0).getMessage());
    }

    @Test
    public void assignedVariableReadInSameCondition() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y, Z) :- a(X), Y = f(Y), Z = Y + 1.\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1044");
        assertEquals(2, diagnostics.size());
        assertEquals(new VadalogRange(1, 20, 1, 21), diagnostics.get(0).getRange());
        assertEquals(new VadalogRange(1, 26, 1, 27), diagnostics.get(1).getRange());
    }

    @Test
    public void cyclicAssignments() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y, Z) :- a(X), Y = Z + 1, Z = Y + 1.\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1047");
        assertFalse(diagnostics.isEmpty());
        assertTrue(diagnostics.get(0).getMessage().contains("Y"));
        assertTrue(diagnostics.get(0).getMessage().contains("Z"));
    }

    @Test
    public void acyclicAssignments() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y, Z) :- a(X), Y = X + 1, Z = Y + 1.\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1047").isEmpty());
        assertTrue(withCode(walker.getDiagnostics(), "1044").isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void diagnosticsRequireAnalysis() {
        new NegationAnalyzer().getDiagnostics();
    }

    @Test
    public void analyzersCanBeRerun() {
        VadalogTreeWalker walker = analyse("a(X).");
        NoVariablesInFactAnalyzer analyzer = new NoVariablesInFactAnalyzer();

        analyzer.analyze(walker.getProgramGraph());
        analyzer.analyze(walker.getProgramGraph());

        assertEquals(1, analyzer.getDiagnostics().size());
    }
}
