package org.vadalog.vadacode;

import org.junit.Before;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Builds the graph of {@code p(X, Y) :- q(X), Z > 1.} by hand.
 */
public class ProgramGraphTest {
    private static final String URI = VadalogFixtures.URI;

    private ProgramGraph graph;
    private VadalogToken headX;
    private VadalogToken headY;
    private VadalogToken bodyX;
    private VadalogToken conditionZ;

    private static VadalogToken token(int column, String text, TokenKind kind) {
        return new VadalogToken(0, column, text.length(), URI, text, kind);
    }

    @Before
    public void buildGraph() {
        graph = new ProgramGraph();
        graph.addRule("R1", new VadalogRange(0, 0, 0, 25), URI);

        VadalogToken p = token(0, "p", TokenKind.ATOM);
        headX = token(2, "X", TokenKind.VARIABLE);
        headY = token(5, "Y", TokenKind.VARIABLE);
        VadalogToken q = token(11, "q", TokenKind.ATOM);
        bodyX = token(13, "X", TokenKind.VARIABLE);
        conditionZ = token(17, "Z", TokenKind.VARIABLE);

        graph.addAtomToken("p", p, -1, "R1", ProgramGraph.AtomLocation.HEAD, false);
        graph.addVariableToken(headX, "R1", p, -1, 0, true, false);
        graph.addVariableToken(headY, "R1", p, -1, 1, true, false);
        graph.addAtomToken("q", q, 0, "R1", ProgramGraph.AtomLocation.BODY, false);
        graph.addVariableToken(bodyX, "R1", q, 0, 0, false, false);
        graph.addCondition("Z>1", "R1", 0, false);
        graph.addConditionVariableToken(conditionZ, "R1", 0, false);
    }

    @Test
    public void identifiers() {
        assertEquals("X_R1", ProgramGraph.variableId("X", "R1"));
        assertEquals("q[0]", ProgramGraph.positionId("q", 0));
        assertTrue(graph.hasNode("X_R1"));
        assertTrue(graph.hasNode("p[1]"));
        assertEquals(ProgramGraph.NodeType.POSITION, graph.getNode("q[0]").getType());
    }

    @Test
    public void existentialVariables() {
        assertEquals(Collections.singleton("Y_R1"), graph.getExistentialVariableNodes());

        graph.analyze();

        assertEquals(List.of(headY), graph.getExistentialVariableTokens());
        assertTrue(graph.getNode("Y_R1").getBoolean(ProgramGraph.EXISTENTIAL));
        assertFalse(graph.getNode("X_R1").getBoolean(ProgramGraph.EXISTENTIAL));
    }

    @Test
    public void unboundConditionVariablesAreUndeclared() {
        graph.analyze();

        assertEquals(List.of(conditionZ), graph.getUndeclaredVariableTokens());
    }

    @Test(expected = IllegalStateException.class)
    public void resultsRequireAnalysis() {
        graph.getUndeclaredVariableTokens();
    }

    @Test
    public void tokensOfVariablesByRulePart() {
        Map<String, List<VadalogToken>> body =
                graph.getTokensOfVariables(List.of("X_R1"), ProgramGraph.RulePart.BODY);
        Map<String, List<VadalogToken>> head =
                graph.getTokensOfVariables(List.of("X_R1"), ProgramGraph.RulePart.HEAD);

        assertEquals(List.of(bodyX), body.get("X_R1"));
        assertEquals(List.of(headX), head.get("X_R1"));
        assertEquals(2, graph.getTokensOfVariables(List.of("X_R1")).get("X_R1").size());
    }

    @Test
    public void positionsOfVariables() {
        assertEquals(new LinkedHashSet<>(List.of("p[0]", "q[0]")), graph.getPositionsOfVariables(List.of("X_R1")));
        assertTrue(graph.getPositionsOfVariables(List.of("Z_R1")).isEmpty());
    }

    @Test
    public void tokenNodesOfAtoms() {
        Map<String, List<ProgramGraphNode>> nodes =
                graph.getTokenNodesOfAtoms(List.of("p", "q"), ProgramGraph.RulePart.BODY);

        assertFalse(nodes.containsKey("p"));
        assertEquals(1, nodes.get("q").size());
        assertEquals(ProgramGraph.AtomLocation.BODY, nodes.get("q").get(0).getLocation());
    }

    @Test
    public void egdVariableWithoutEgdIsIgnored() {
        int nodes = graph.getNodeCount();

        graph.addEGDVariableToken(token(30, "W", TokenKind.VARIABLE), "R1", 0);

        assertEquals(nodes, graph.getNodeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void updatingAMissingNodeFails() {
        graph.updateNode("missing", node -> node.setAttribute(ProgramGraph.AFFECTED, true));
    }

    @Test
    public void annotationAtomTokenDropsQuotes() {
        VadalogToken quoted = token(8, "\"p\"", TokenKind.STRING);
        graph.addRule("R2", new VadalogRange(0, 0, 0, 13), URI);

        VadalogToken atom = graph.addOutputAtomToken(quoted, "R2");

        assertEquals("p", atom.getText());
        assertEquals(9, atom.getColumn());
        assertEquals(1, atom.getLength());
        assertEquals(TokenKind.ATOM, atom.getKind());
    }

    @Test
    public void atomNamedLikeARuleIsNotMerged() {
        graph.addAtomToken("R1", token(20, "R1", TokenKind.ATOM), 0, "R1", ProgramGraph.AtomLocation.BODY, false);

        assertEquals(ProgramGraph.NodeType.RULE, graph.getNode("R1").getType());
        assertTrue(graph.edgesTo("R1", ProgramGraph.EdgeType.TOKEN_OF).isEmpty());
    }

    @Test
    public void annotationNamesOutsideTheAtomSyntaxStayOutOfTheGraph() {
        VadalogTreeWalker walker = VadalogFixtures.analyse(
                "a(1).\nb(X) :- a(X).\n@output(\"b\").\n@output(\"R1\").");
        ProgramGraph programGraph = walker.getProgramGraph();

        assertEquals(ProgramGraph.NodeType.RULE, programGraph.getNode("R1").getType());
        assertTrue(programGraph.edgesTo("R1", ProgramGraph.EdgeType.TOKEN_OF).isEmpty());
        assertEquals(1, VadalogFixtures.withCode(walker.getDiagnostics(), "1015").size());
    }
}
