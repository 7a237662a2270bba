package org.vadalog.vadacode;

import java.util.*;

/**
 * Bindings and mappings only make sense on {@code @input} or {@code @output} atoms.
 */
public class BindOnUnknownAnalyzer extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        Map<String, List<ProgramGraphNode>> tokensByAtom = new LinkedHashMap<>();
        programGraph.forEachEdge(ProgramGraph.EdgeType.TOKEN_OF, (edge, tokenNode, atom) -> {
            if (atom.getType() == ProgramGraph.NodeType.ATOM) {
                tokensByAtom.computeIfAbsent(atom.getId(), k -> new ArrayList<>()).add(tokenNode);
            }
        });

        tokensByAtom.forEach((atom, tokenNodes) -> {
            boolean declared = tokenNodes.stream().anyMatch(node ->
                    node.getLocation() == ProgramGraph.AtomLocation.INPUT
                            || node.getLocation() == ProgramGraph.AtomLocation.OUTPUT);
            if (declared) {
                return;
            }
            for (ProgramGraphNode tokenNode : tokenNodes) {
                if (tokenNode.getLocation() == ProgramGraph.AtomLocation.BINDING
                        || tokenNode.getLocation() == ProgramGraph.AtomLocation.MAPPING) {
                    report(VadalogDiagnostic.of(tokenNode.getToken(), DiagnosticCode.ERR_BINDING_ON_UNKNOWN_ATOM));
                }
            }
        });
    }
}
