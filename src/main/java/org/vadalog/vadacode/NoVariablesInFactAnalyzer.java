package org.vadalog.vadacode;

import java.util.*;

/**
 * Facts must be ground.
 */
public class NoVariablesInFactAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Set<String> variablesInFacts = new LinkedHashSet<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.VARIABLE_AT_ATOM_TOKEN, (edge, variable, atomToken) -> {
            if (atomToken.getLocation() == ProgramGraph.AtomLocation.FACT) {
                variablesInFacts.add(variable.getId());
            }
        });
        List<VadalogToken> tokens = ProgramGraph.flatten(programGraph.getTokensOfVariables(variablesInFacts));
        reportAll(tokens, DiagnosticCode.ERR_NO_VARIABLES_IN_FACT, Collections.emptyMap(), null);
    }
}
