package org.vadalog.vadacode;

import java.util.Collections;

/**
 * Extensional atoms cannot be declared as {@code @output}.
 */
public class NoFactOutputAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == ProgramGraph.NodeType.ATOM
                    && atom.getBoolean(ProgramGraph.IS_EDB)
                    && tokenNode.getLocation() == ProgramGraph.AtomLocation.OUTPUT) {
                report(VadalogDiagnostic.of(tokenNode.getToken(), DiagnosticCode.ERR_NO_EXTENSIONAL_ATOM_AS_OUTPUT,
                        Collections.emptyMap()));
            }
        });
    }
}
