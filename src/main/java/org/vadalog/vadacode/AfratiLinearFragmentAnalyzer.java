package org.vadalog.vadacode;

import java.util.*;

/**
 * Afrati linear rules join at most one intensional atom, i.e. an atom which
 * is the head of some rule.
 */
public class AfratiLinearFragmentAnalyzer extends AbstractProgramGraphAnalyzer {
    static final String INTENSIONAL = "intensional";

    @Override
    protected void doAnalyze() {
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == ProgramGraph.NodeType.ATOM && edge.getLocation() == ProgramGraph.AtomLocation.HEAD) {
                atom.setAttribute(INTENSIONAL, true);
            }
        });

        Map<String, List<VadalogToken>> intensionalBodyTokens = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == ProgramGraph.NodeType.ATOM
                    && atom.getBoolean(INTENSIONAL)
                    && edge.getLocation() == ProgramGraph.AtomLocation.BODY) {
                intensionalBodyTokens.computeIfAbsent(tokenNode.getString(ProgramGraph.RULE), k -> new ArrayList<>())
                        .add(tokenNode.getToken());
            }
        });

        intensionalBodyTokens.forEach((ruleId, tokens) -> {
            if (tokens.size() > 1) {
                for (VadalogToken token : tokens) {
                    report(VadalogDiagnostic.of(token, DiagnosticCode.NON_AFRATI_LINEAR_JOIN,
                            Map.of("atom", token.getText()), Fragment.AFRATI_LINEAR));
                }
            }
        });
    }
}
