package org.vadalog.vadacode;

import java.util.*;

/**
 * A head variable bound only inside negated body atoms is unsafe.
 */
public class NegationAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Map<String, boolean[]> occurrences = new LinkedHashMap<>();
        // [head, negated body, positive body]
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            boolean[] flags = occurrences.computeIfAbsent(variable.getId(), k -> new boolean[3]);
            if (edge.isHead()) {
                flags[0] = true;
            } else if (edge.isNegated()) {
                flags[1] = true;
            } else {
                flags[2] = true;
            }
        });

        List<String> unsafe = new ArrayList<>();
        occurrences.forEach((variableId, flags) -> {
            if (flags[0] && flags[1] && !flags[2]) {
                unsafe.add(variableId);
            }
        });

        programGraph.getTokensOfVariables(unsafe).forEach((variableId, tokens) -> {
            for (VadalogToken token : tokens) {
                report(VadalogDiagnostic.of(token, DiagnosticCode.INVALID_NEGATION_POSITIVE_BODY_0,
                        Map.of("variable", token.getText())));
            }
        });
    }
}
