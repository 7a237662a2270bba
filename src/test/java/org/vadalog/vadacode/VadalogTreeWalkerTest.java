package org.vadalog.vadacode;

import org.junit.Test;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.Assert.*;
import static org.vadalog.vadacode.VadalogFixtures.*;

public class VadalogTreeWalkerTest {

    // =====================================================================
    // PROGRAM-LEVEL DIAGNOSTICS
    // =====================================================================

    @Test
    public void unusedAtomsAreReportedPerToken() {
        VadalogTreeWalker walker = analyse("a(1).\na(2).");

        List<VadalogDiagnostic> unused = withCode(walker.getDiagnostics(), "1000");
        assertEquals(2, unused.size());
        assertEquals(0, unused.get(0).getRange().getStartLine());
        assertEquals(1, unused.get(1).getRange().getStartLine());
        assertEquals("Unused atom 'a'.", unused.get(0).getMessage());
        assertEquals(DiagnosticSeverity.WARNING, unused.get(0).getSeverity());
    }

    @Test
    public void unusedAtomsAreReportedInDocumentOrder() {
        VadalogTreeWalker walker = analyse("a(1).\nb(1).\na(2).");

        List<VadalogDiagnostic> unused = withCode(walker.getDiagnostics(), "1000");
        assertEquals(List.of(0, 1, 2), unused.stream()
                .map(d -> d.getRange().getStartLine()).collect(Collectors.toList()));
        assertEquals("Unused atom 'b'.", unused.get(1).getMessage());
    }

    @Test
    public void exportedAtomsAreNotUnused() {
        VadalogTreeWalker walker = analyse("%% @exports lonely\nlonely(1).");

        assertTrue(withCode(walker.getDiagnostics(), "1000").isEmpty());
        assertEquals(Collections.singleton("lonely"), walker.getExportedAtoms());
        assertFalse(walker.getVadocBlocks().containsKey("lonely"));
    }

    @Test
    public void undeclaredAtom() {
        VadalogTreeWalker walker = analyse("a(X) :- b(X).\n@output(\"a\").");

        List<VadalogDiagnostic> undeclared = withCode(walker.getDiagnostics(), "1011");
        assertEquals(1, undeclared.size());
        assertEquals("Undeclared atom: b.", undeclared.get(0).getMessage());
        assertEquals(new VadalogRange(0, 8, 0, 9), undeclared.get(0).getRange());
    }

    @Test
    public void inputAtomInHead() {
        VadalogTreeWalker walker = analyse(
                "@input(\"a\").\n@bind(\"a\", \"csv\", \"d\", \"a.csv\").\na(X) :- b(X).\nb(1).");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1012");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(2, 0, 2, 1), diagnostics.get(0).getRange());
    }

    @Test
    public void outputDeclarations() {
        VadalogTreeWalker walker = analyse(
                "a(1).\nb(X) :- a(X).\n@output(\"b\").\n@output(\"b\").\n@output(\"zz\").");

        List<VadalogDiagnostic> duplicates = withCode(walker.getDiagnostics(), "1014");
        assertEquals(1, duplicates.size());
        assertEquals(new VadalogRange(3, 9, 3, 10), duplicates.get(0).getRange());

        List<VadalogDiagnostic> missing = withCode(walker.getDiagnostics(), "1015");
        assertEquals(1, missing.size());
        assertEquals(new VadalogRange(4, 9, 4, 11), missing.get(0).getRange());

        List<VadalogDiagnostic> unbound = withCode(walker.getDiagnostics(), "1018");
        assertEquals(3, unbound.size());
        assertEquals(DiagnosticSeverity.HINT, unbound.get(0).getSeverity());
        assertEquals(new LinkedHashSet<>(List.of("b", "zz")), walker.getOutputAtomNames());
    }

    @Test
    public void inputWithoutBindings() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\nr(X) :- t(X).\n@output(\"r\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1017");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(0, 8, 0, 9), diagnostics.get(0).getRange());
        assertTrue(withCode(walker.getDiagnostics(), "1011").isEmpty());
    }

    @Test
    public void emptyDefinition() {
        VadalogTreeWalker walker = analyse("@input().");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1021");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(0, 1, 0, 6), diagnostics.get(0).getRange());
    }

    @Test
    public void unboundConditionVariable() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X) :- a(X), Y > 1.\n@output(\"b\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1022");
        assertEquals(1, diagnostics.size());
        assertEquals("Variable 'Y' is not bound. Bind it either in a positive atom or in an assignment.",
                diagnostics.get(0).getMessage());
    }

    @Test
    public void assignedConditionVariableIsBound() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y) :- a(X), Y = X * 2.\n@output(\"b\").");

        assertTrue(withCode(walker.getDiagnostics(), "1022").isEmpty());
        assertTrue(withCode(walker.getDiagnostics(), "1029").isEmpty());
    }

    @Test
    public void mappingPositionMustBeAnIndex() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\n@mapping(\"t\", \"x\", \"c\", \"string\").");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1027");
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).getMessage().contains("\"x\""));
        assertFalse(walker.getMappings().containsKey("t"));
    }

    @Test
    public void mappingPositionOutOfIntegerRange() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\n@mapping(\"t\", 99999999999, \"c\", \"string\").\nsum(1).");

        List<VadalogDiagnostic> diagnostics = withCode(walker.getDiagnostics(), "1027");
        assertEquals(1, diagnostics.size());
        assertEquals(new VadalogRange(1, 14, 1, 25), diagnostics.get(0).getRange());
        assertFalse(walker.getMappings().containsKey("t"));
        // The rest of the program is still analysed
        assertEquals(1, withCode(walker.getDiagnostics(), "1043").size());
    }

    @Test
    public void unknownMappingColumnType() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\n@mapping(\"t\", 0, \"c\", \"blob\").");

        assertEquals(1, withCode(walker.getDiagnostics(), "1042").size());
        assertFalse(walker.getMappings().containsKey("t"));
    }

    @Test
    public void egdHint() {
        VadalogTreeWalker walker = analyse("p(1, 2).\nX = Y :- p(X, Y).");

        List<VadalogDiagnostic> hints = withCode(walker.getDiagnostics(), "1020");
        assertEquals(1, hints.size());
        assertEquals(new VadalogRange(1, 2, 1, 3), hints.get(0).getRange());
    }

    // =====================================================================
    // DECLARATIONS AND CALLS
    // =====================================================================

    @Test
    public void bindingsAreLinkedToInputs() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\n"
                + "@qbind(\"t\", \"pg\", \"db\", \"select * from t\").\n"
                + "r(X) :- t(X).\n"
                + "@output(\"r\").\n"
                + "@bind(\"r\", \"csv\", \"out\", \"r.csv\").");

        VadalogGenericBinding input = walker.getBindings().get("t");
        assertTrue(input instanceof VadalogQueryBinding);
        assertTrue(input.isInput());
        assertEquals("t", input.getInputToken().getText());
        assertEquals("pg", input.getDataSource());
        assertEquals("select * from t", ((VadalogQueryBinding) input).getQuery());

        VadalogGenericBinding output = walker.getBindings().get("r");
        assertTrue(output instanceof VadalogBinding);
        assertFalse(output.isInput());
        assertNull(output.getInputToken());
        assertEquals("out", output.getOutermostContainer());
        assertEquals("r.csv", ((VadalogBinding) output).getInnermostContainer());

        assertTrue(withCode(walker.getDiagnostics(), "1017").isEmpty());
        assertTrue(withCode(walker.getDiagnostics(), "1018").isEmpty());
    }

    @Test
    public void mappings() {
        VadalogTreeWalker walker = analyse("@input(\"t\").\n@mapping(\"t\", 0, \"id\", \"int\").");

        List<VadalogMapping> mappings = walker.getMappings().get("t");
        assertEquals(1, mappings.size());
        assertEquals(0, mappings.get(0).getPosition());
        assertEquals("id", mappings.get(0).getColumnName());
        assertEquals(TokenKind.INT, mappings.get(0).getColumnType());
    }

    @Test
    public void atomCallsInSourceOrder() {
        VadalogTreeWalker walker = analyse("a(1, 2).\nb(X) :- a(X, _), not c(X).\nc(3).\n@output(\"b\").");

        List<AtomCallType> types = walker.getAtomCalls().stream()
                .map(AtomCall::getCallType)
                .collect(Collectors.toList());
        assertEquals(List.of(AtomCallType.FACT, AtomCallType.HEAD, AtomCallType.BODY, AtomCallType.BODY,
                AtomCallType.FACT, AtomCallType.OUTPUT), types);

        AtomCall bodyA = walker.getAtomCalls().get(2);
        assertEquals("a", bodyA.getName());
        assertEquals(2, bodyA.getTerms().size());
        assertEquals(TokenKind.ANON_VAR, bodyA.getTerms().get(1).getKind());
    }

    @Test
    public void collectionTermsGetOneToken() {
        VadalogTreeWalker walker = analyse("a([1, 2], {\"x\"}).");

        List<VadalogToken> terms = walker.getAtomCalls().get(0).getTerms();
        assertEquals(2, terms.size());
        assertEquals(TokenKind.LIST, terms.get(0).getKind());
        assertEquals(6, terms.get(0).getLength());
        assertEquals(TokenKind.SET, terms.get(1).getKind());
    }

    @Test
    public void annotationCalls() {
        VadalogTreeWalker walker = analyse("@output(\"b\", \"extra\").\n@library(\"h\", \"hash\").");

        List<AnnotationCall> calls = walker.getAnnotationCalls();
        assertEquals(2, calls.size());
        assertEquals("output", calls.get(0).getAtom().getText());
        assertEquals(2, calls.get(0).getTerms().size());
        assertEquals("library", calls.get(1).getAtom().getText());
    }

    // =====================================================================
    // TOKENS
    // =====================================================================

    @Test
    public void groundAndIntensionalAtoms() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X) :- a(X).\n@output(\"b\").");

        VadalogAtomToken fact = tokenAt(walker.getTokens(), VadalogAtomToken.class, 0, 0);
        assertTrue(fact.isEDB());
        assertTrue(fact.hasModifier(TokenModifier.GROUND));
        assertTrue(fact.hasTag(TokenTag.DEFINITION));

        VadalogAtomToken head = tokenAt(walker.getTokens(), VadalogAtomToken.class, 1, 0);
        assertTrue(head.isIDB());
        assertFalse(head.hasModifier(TokenModifier.GROUND));
        assertTrue(head.hasTag(TokenTag.HEAD));

        VadalogAtomToken body = tokenAt(walker.getTokens(), VadalogAtomToken.class, 1, 8);
        assertTrue(body.hasModifier(TokenModifier.GROUND));
        assertTrue(body.hasTag(TokenTag.BODY));
    }

    @Test
    public void annotationTokens() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X) :- a(X).\n@output(\"b\").");
        List<VadalogToken> tokens = walker.getTokens();

        assertEquals(TokenKind.ANNOTATION, tokenAt(tokens, VadalogToken.class, 2, 0).getKind());
        assertEquals(TokenKind.ANNOTATION, tokenAt(tokens, VadalogToken.class, 2, 1).getKind());
        VadalogAtomToken output = tokenAt(tokens, VadalogAtomToken.class, 2, 9);
        assertEquals("b", output.getText());
        assertTrue(tokens.stream().noneMatch(token -> token.getLine() == 2 && token.getColumn() == 8));
    }

    @Test
    public void tokensAreSortedByPosition() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X) :- a(X).\n@output(\"b\").");

        List<VadalogToken> tokens = walker.getTokens();
        List<VadalogToken> sorted = new ArrayList<>(tokens);
        sorted.sort(VadalogToken.BY_POSITION);
        assertEquals(sorted, tokens);
    }

    @Test
    public void anonymousCandidateIsMarkedUnused() {
        VadalogTreeWalker walker = analyse("a(1, 2).\nb(X) :- a(X, Y).\n@output(\"b\").");

        VadalogVariableToken y = tokenAt(walker.getTokens(), VadalogVariableToken.class, 1, 13);
        assertTrue(y.hasModifier(TokenModifier.UNUSED));
        assertEquals("Y", y.getName());
        assertEquals("R2", y.getRule());
        assertFalse(tokenAt(walker.getTokens(), VadalogVariableToken.class, 1, 10)
                .hasModifier(TokenModifier.UNUSED));
    }

    @Test
    public void existentialAndMarkedNullVariables() {
        VadalogTreeWalker walker = analyse("a(1).\nb(X, Y) :- a(X).\nc(Y) :- b(X, Y).\n@output(\"c\").");

        VadalogVariableToken existential = tokenAt(walker.getTokens(), VadalogVariableToken.class, 1, 5);
        assertTrue(existential.isExistential());
        assertTrue(existential.hasModifier(TokenModifier.EXISTENTIAL));

        VadalogVariableToken propagated = tokenAt(walker.getTokens(), VadalogVariableToken.class, 2, 2);
        assertFalse(propagated.isExistential());
        assertTrue(propagated.hasModifier(TokenModifier.EXISTENTIAL));
        assertTrue(propagated.isHarmful());
        assertTrue(propagated.isDangerous());
    }

    @Test
    public void temporalAtomsPropagateToDependents() {
        VadalogTreeWalker walker = analyse("a(1)@[1, 2].\nb(X) :- a(X).\nc(X) :- d(X).\nd(1).\n"
                + "@output(\"b\").\n@output(\"c\").");

        assertTrue(tokenAt(walker.getTokens(), VadalogAtomToken.class, 0, 0).hasModifier(TokenModifier.TEMPORAL));
        assertTrue(tokenAt(walker.getTokens(), VadalogAtomToken.class, 1, 0).hasModifier(TokenModifier.TEMPORAL));
        assertFalse(tokenAt(walker.getTokens(), VadalogAtomToken.class, 2, 0).hasModifier(TokenModifier.TEMPORAL));
        assertEquals(Set.of("a", "b"), walker.getDependencyGraph().getTemporalNodes());
    }

    @Test
    public void variablesOfTemporalAnnotations() {
        VadalogTreeWalker walker = analyse("e(1, 2).\np(X) :- e(X, Y)@[Y, 5].\n@output(\"p\").");

        VadalogVariableToken interval = tokenAt(walker.getTokens(), VadalogVariableToken.class, 1, 17);
        assertEquals("Y", interval.getText());
        assertEquals("R2", interval.getRule());
        assertTrue(withCode(walker.getDiagnostics(), "1025").isEmpty());
        assertFalse(tokenAt(walker.getTokens(), VadalogVariableToken.class, 1, 13).hasModifier(TokenModifier.UNUSED));
    }

    @Test
    public void kindsAreFrozenAfterAnalysis() {
        VadalogTreeWalker walker = analyse("a(1).");
        VadalogToken dot = tokenAt(walker.getTokens(), VadalogToken.class, 0, 4);

        try {
            dot.reclassify(TokenKind.ATOM);
            fail("Frozen token changed kind");
        } catch (IllegalStateException e) {
            assertEquals(TokenKind.DOT, dot.getKind());
        }
    }

    @Test
    public void vadocAttachesToTheFollowingDefinition() {
        VadalogTreeWalker walker = analyse("%% Edges of the graph.\n%% @term {string} from source\n"
                + "edge(\"a\", \"b\").\n% plain comment\npath(X) :- edge(X, _).");

        List<VadocBlock> blocks = walker.getVadocBlocks().get("edge");
        assertEquals(1, blocks.size());
        assertEquals("Edges of the graph.", blocks.get(0).getDescription());
        assertEquals("from", blocks.get(0).findTag(VadocParser.TERM).getName());
        assertFalse(walker.getVadocBlocks().containsKey("path"));
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    @Test(expected = IllegalStateException.class)
    public void tokensRequireAnalysis() {
        walk("a(1).").getTokens();
    }

    @Test(expected = IllegalStateException.class)
    public void diagnosticsRequireAnalysis() {
        walk("a(1).").getDiagnostics();
    }

    @Test
    public void analysisRunsOnce() {
        VadalogTreeWalker walker = analyse("a(1, 2).\nb(X) :- a(X, Y).");
        List<VadalogDiagnostic> first = new ArrayList<>(walker.getDiagnostics());

        walker.analyseProgram();

        assertEquals(first, walker.getDiagnostics());
    }

    @Test
    public void pipelineOrder() {
        List<ProgramGraphAnalyzer> analyzers = VadalogTreeWalker.defaultAnalyzers();

        assertEquals(18, analyzers.size());
        assertTrue(analyzers.get(0) instanceof GroundSemanticTagger);
        assertTrue(analyzers.get(analyzers.size() - 1) instanceof ShyFragmentAnalyzer);
    }
}
