package org.vadalog.vadacode;

import java.util.*;

/**
 * Plain Datalog has no existential variables.
 */
public class PlainDatalogFragmentAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Set<String> existential = programGraph.getExistentialVariableNodes();
        for (VadalogToken token : ProgramGraph.flatten(programGraph.getTokensOfVariables(existential))) {
            report(VadalogDiagnostic.of(token, DiagnosticCode.EXISTENTIAL_VARIABLE_IN_DATALOG,
                    Map.of("variable", token.getText()), Fragment.PLAIN_DATALOG));
        }
    }
}
