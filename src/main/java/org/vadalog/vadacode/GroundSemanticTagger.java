package org.vadalog.vadacode;

import java.util.*;

/**
 * Tags atoms as extensional (facts and inputs) or intensional (rule heads).
 * Every token of an extensional atom gets the {@code ground} modifier. This
 * pass reports nothing and must run before anything reading the tags.
 */
public class GroundSemanticTagger extends AbstractProgramGraphAnalyzer {

    @Override
    protected void doAnalyze() {
        List<ProgramGraphNode> atoms = programGraph.filterNodes(node -> node.getType() == ProgramGraph.NodeType.ATOM);
        for (ProgramGraphNode atom : atoms) {
            boolean edb = false;
            boolean idb = false;
            List<ProgramGraphNode> tokenNodes = new ArrayList<>();
            for (ProgramGraphEdge edge : programGraph.edgesTo(atom.getId(), ProgramGraph.EdgeType.TOKEN_OF)) {
                ProgramGraphNode tokenNode = programGraph.getNode(edge.getSource());
                tokenNodes.add(tokenNode);
                ProgramGraph.AtomLocation location = tokenNode.getLocation();
                if (location == ProgramGraph.AtomLocation.FACT || location == ProgramGraph.AtomLocation.INPUT) {
                    edb = true;
                } else if (location == ProgramGraph.AtomLocation.HEAD) {
                    idb = true;
                }
            }
            if (edb) {
                tokenNodes.forEach(tokenNode -> tokenNode.getToken().addModifier(TokenModifier.GROUND));
            }
            boolean isEDB = edb;
            boolean isIDB = idb;
            programGraph.updateNode(atom.getId(), node -> {
                node.setAttribute(ProgramGraph.IS_EDB, isEDB);
                node.setAttribute(ProgramGraph.IS_IDB, isIDB);
            });
        }
    }
}
