package org.vadalog.vadacode;

import java.util.*;

/**
 * Finds variables which occur in a single body atom and nowhere else in the
 * rule, and could therefore be written as {@code _}. Their tokens are marked
 * {@code unused}.
 */
public class AnonymousVariablesAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Map<String, Integer> bodyOccurrences = new LinkedHashMap<>();
        Set<String> inHeadAtom = new HashSet<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            bodyOccurrences.putIfAbsent(variable.getId(), 0);
            if (atomToken.getLocation() == ProgramGraph.AtomLocation.HEAD) {
                inHeadAtom.add(variable.getId());
            } else if (atomToken.getLocation() == ProgramGraph.AtomLocation.BODY) {
                bodyOccurrences.merge(variable.getId(), 1, Integer::sum);
            }
        });

        List<String> anonymous = new ArrayList<>();
        bodyOccurrences.forEach((variableId, count) -> {
            if (count == 1 && !inHeadAtom.contains(variableId) && !usedElsewhere(variableId)) {
                anonymous.add(variableId);
            }
        });

        Map<String, List<VadalogToken>> tokens = programGraph.getTokensOfVariables(anonymous);
        tokens.forEach((variableId, variableTokens) -> {
            for (VadalogToken token : variableTokens) {
                token.addModifier(TokenModifier.UNUSED);
                report(VadalogDiagnostic.of(token, DiagnosticCode.ANONYMOUS_VARIABLE,
                        Map.of("variable", token.getText())));
            }
        });
    }

    private boolean usedElsewhere(String variableId) {
        return !programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_CONDITION).isEmpty()
                || !programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_EGD).isEmpty()
                || !programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_TEMPORAL_ANNOTATION).isEmpty()
                || !programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.CONTRIBUTOR_OF_AGGREGATION).isEmpty()
                || programGraph.edgesFrom(variableId, ProgramGraph.EdgeType.VARIABLE_AT_POSITION).stream()
                        .anyMatch(ProgramGraphEdge::isHead);
    }
}
