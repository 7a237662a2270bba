package org.vadalog.vadacode;

import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;
import static org.vadalog.vadacode.VadalogFixtures.*;

public class FragmentAnalyzersTest {

    private static final String TRANSITIVE_JOIN =
            "e(1, 2).\np(X, Z) :- e(X, Y), e(Y, Z).\n@output(\"p\").";

    private static final String UNWARDED =
            "e(1).\nq(X, Z) :- e(X).\nr(X, Z) :- q(X, Z).\ns(Z) :- r(X, Z), q(Y, Z).\n@output(\"s\").";

    private static void assertFragment(List<VadalogDiagnostic> diagnostics, Fragment fragment) {
        for (VadalogDiagnostic diagnostic : diagnostics) {
            assertEquals(fragment, diagnostic.getFragmentViolation());
        }
    }

    // =====================================================================
    // DATALOG FRAGMENTS
    // =====================================================================

    @Test
    public void existentialVariableInPlainDatalog() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y) :- a(X).\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1029");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 5, 1, 6), diagnostics.get(0).getRange());
        assertFragment(diagnostics, Fragment.PLAIN_DATALOG);
    }

    @Test
    public void nonLinearRuleSpansTheRule() {
        VadalogTreeWalker walker = analyse(TRANSITIVE_JOIN);

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1032");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 0, 1, 28), diagnostics.get(0).getRange());
        assertFragment(diagnostics, Fragment.LINEAR);
    }

    @Test
    public void extensionalJoinIsAfratiLinear() {
        VadalogTreeWalker walker = analyse(TRANSITIVE_JOIN);

        assertTrue(withCode(walker.getDiagnostics(), "1028").isEmpty());
    }

    @Test
    public void intensionalJoinIsNotAfratiLinear() {
        VadalogTreeWalker walker = analyse(
                "e(1, 2).\np(X, Y) :- e(X, Y).\nq(X, Z) :- p(X, Y), p(Y, Z).\n@output(\"q\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1028");
        assertEquals(2, diagnostics.size());
        assertFragment(diagnostics, Fragment.AFRATI_LINEAR);
    }

    // =====================================================================
    // GUARDS
    // =====================================================================

    @Test
    public void unguardedJoin() {
        VadalogTreeWalker walker = analyse(TRANSITIVE_JOIN);

        List<VadalogDiagnostic> guarded = withCode(walker.getDiagnostics(), "1030");
        assertEquals(1, guarded.size());
        assertFragment(guarded, Fragment.GUARDED);

        List<VadalogDiagnostic> frontierGuarded = withCode(walker.getDiagnostics(), "1031");
        assertEquals(1, frontierGuarded.size());
        assertFragment(frontierGuarded, Fragment.FRONTIER_GUARDED);

        assertTrue(withCode(walker.getDiagnostics(), "1033").isEmpty());
        assertTrue(withCode(walker.getDiagnostics(), "1034").isEmpty());
    }

    @Test
    public void guardAtomIsMarked() {
        VadalogTreeWalker walker = analyse("e(1, 2).\nf(1).\np(X, Y) :- e(X, Y), f(X).\n@output(\"p\").");

        assertTrue(tokenAt(walker.getTokens(), VadalogAtomToken.class, 2, 11).isGuard());
        assertFalse(tokenAt(walker.getTokens(), VadalogAtomToken.class, 2, 20).isGuard());
        assertTrue(withCode(walker.getDiagnostics(), "1030").isEmpty());
    }

    // =====================================================================
    // WARDEDNESS
    // =====================================================================

    @Test
    public void dangerousVariableInJoin() {
        VadalogTreeWalker walker = analyse(UNWARDED);

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1016");
        assertEquals(2, diagnostics.size());
        assertEquals(new VadalogRange(3, 13, 3, 14), diagnostics.get(0).getRange());
        assertEquals(new VadalogRange(3, 22, 3, 23), diagnostics.get(1).getRange());
        assertFragment(diagnostics, Fragment.WARDED);
    }

    @Test
    public void affectedPositions() {
        VadalogTreeWalker walker = analyse(UNWARDED);
        WardedFragmentAnalyzer warded = null;
        for (ProgramGraphAnalyzer analyzer : walker.getAnalyzers()) {
            if (analyzer instanceof WardedFragmentAnalyzer) {
                warded = (WardedFragmentAnalyzer) analyzer;
            }
        }

        assertNotNull(warded);
        assertEquals(new LinkedHashSet<>(List.of("q[1]", "r[1]", "s[0]")), new LinkedHashSet<>(warded.getAffectedPositions()));
        assertTrue(warded.getTaintedPositions().isEmpty());
    }

    @Test
    public void taintedVariableInFilter() {
        VadalogTreeWalker walker = analyse(
                "p(X,Y,Z) :- arc(X,Y).\nY = Z :- p(_,Y,Z).\nf(X,Y) :- p(X,Y,Z), Z = 7.\n@output(\"f\").\narc(3,5).");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1045");
        assertEquals(2, diagnostics.size());
        assertEquals(new VadalogRange(2, 16, 2, 17), diagnostics.get(0).getRange());
        assertEquals(new VadalogRange(2, 20, 2, 21), diagnostics.get(1).getRange());
        assertFragment(diagnostics, Fragment.WARDED);
    }

    @Test
    public void taintedVariableInJoin() {
        VadalogTreeWalker walker = analyse("arc(1, 2).\np(X, Y, Z) :- arc(X, Y).\nY = Z :- p(_, Y, Z).\n"
                + "f(Z) :- p(X, Y, Z), p(W, V, Z).\n@output(\"f\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1019");
        assertEquals(2, diagnostics.size());
        assertEquals(3, diagnostics.get(0).getRange().getStartLine());
        assertFragment(diagnostics, Fragment.WARDED);
    }

    @Test
    public void literalsInTaintedPositions() {
        VadalogTreeWalker walker = analyse("arc(1, 2).\np(X, Y, Z) :- arc(X, Y).\n"
                + "Y = Z :- p(X, Y, Z), p(X, Y, 5).\nf(X) :- p(X, Y, 7).\n@output(\"f\").");

        List<VadalogDiagnostic> literals = withCode(walker.getDiagnostics(), "1046");
        assertEquals(2, literals.size());
        assertEquals("Literal '5' is used in a tainted position.", literals.get(0).getMessage());
        assertEquals("Literal '7' is used in a tainted position.", literals.get(1).getMessage());

        List<VadalogDiagnostic> constants = withCode(walker.getDiagnostics(), "1037");
        assertEquals(1, constants.size());
        assertEquals(2, constants.get(0).getRange().getStartLine());
        assertFragment(constants, Fragment.WARDED);
    }

    // =====================================================================
    // SHYNESS
    // =====================================================================

    @Test
    public void attackedVariableInTwoBodyAtoms() {
        VadalogTreeWalker walker = analyse(UNWARDED);

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1035");
        assertEquals(3, diagnostics.size());
        assertFragment(diagnostics, Fragment.SHY);

        VadalogVariableToken z = tokenAt(walker.getTokens(), VadalogVariableToken.class, 3, 13);
        assertFalse(z.isProtected());
        assertEquals(List.of("Z_R2"), z.getAttackedBy());
        assertTrue(tokenAt(walker.getTokens(), VadalogVariableToken.class, 3, 19).isProtected());
    }

    @Test
    public void variablesAttackedBySameInvader() {
        VadalogTreeWalker walker = analyse("e(1).\nq(X, Z) :- e(X).\nr(Y, W) :- q(X, Y), q(X, W).\n@output(\"r\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1036");
        assertEquals(4, diagnostics.size());
        assertFragment(diagnostics, Fragment.SHY);
        assertTrue(withCode(walker.getDiagnostics(), "1035").isEmpty());
    }

    @Test
    public void datalogProgramIsShy() {
        VadalogTreeWalker walker = analyse(TRANSITIVE_JOIN);

        assertTrue(withCode(walker.getDiagnostics(), "1035").isEmpty());
        assertTrue(withCode(walker.getDiagnostics(), "1036").isEmpty());
        for (VadalogToken token : walker.getTokens()) {
            if (token instanceof VadalogVariableToken) {
                assertTrue(((VadalogVariableToken) token).getAttackedBy().isEmpty());
            }
        }
    }
}
