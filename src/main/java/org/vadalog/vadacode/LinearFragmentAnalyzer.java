package org.vadalog.vadacode;

import java.util.*;

/**
 * Linear rules have at most one body atom.
 */
public class LinearFragmentAnalyzer extends AbstractProgramGraphAnalyzer {
    static final String NON_LINEAR = "nonLinear";

    @Override
    protected void doAnalyze() {
        Map<String, List<ProgramGraphNode>> bodyAtoms = atomTokensByRule(ProgramGraph.AtomLocation.BODY);
        bodyAtoms.forEach((ruleId, tokens) -> {
            if (tokens.size() > 1 && programGraph.hasNode(ruleId)) {
                programGraph.updateNode(ruleId, rule -> rule.setAttribute(NON_LINEAR, true));
                reportRule(programGraph.getNode(ruleId), DiagnosticCode.NON_LINEAR_RULE, Fragment.LINEAR);
            }
        });
    }
}
